package nudge.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NudgePropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(NudgeProperties.class);
            assertEquals("nudge_", props.getTablePrefix());
            assertFalse(props.isInitializeSchema());
            assertEquals(50, props.getDelivery().getBatchSize());
            assertEquals(10000, props.getDelivery().getIntervalMs());
            assertEquals(4, props.getTrigger().getWorkerCount());
            assertFalse(props.getTrigger().isRegisterDefaultRules());
            assertTrue(props.getLifecycle().isEnabled());
            assertEquals(300000, props.getLifecycle().getSweepIntervalMs());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("nudge", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "nudge.table-prefix=app_",
                "nudge.initialize-schema=true",
                "nudge.delivery.batch-size=200",
                "nudge.delivery.interval-ms=2000",
                "nudge.trigger.worker-count=8",
                "nudge.trigger.register-default-rules=true",
                "nudge.lifecycle.enabled=false",
                "nudge.lifecycle.sweep-interval-ms=60000",
                "nudge.metrics.enabled=false",
                "nudge.metrics.name-prefix=tenant_a.nudge"
        ).run(ctx -> {
            var props = ctx.getBean(NudgeProperties.class);
            assertEquals("app_", props.getTablePrefix());
            assertTrue(props.isInitializeSchema());
            assertEquals(200, props.getDelivery().getBatchSize());
            assertEquals(2000, props.getDelivery().getIntervalMs());
            assertEquals(8, props.getTrigger().getWorkerCount());
            assertTrue(props.getTrigger().isRegisterDefaultRules());
            assertFalse(props.getLifecycle().isEnabled());
            assertEquals(60000, props.getLifecycle().getSweepIntervalMs());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("tenant_a.nudge", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(NudgeProperties.class)
    static class PropsConfig {
    }
}
