package nudge.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the notification engine.
 *
 * @see NudgeAutoConfiguration
 */
@ConfigurationProperties(prefix = "nudge")
public class NudgeProperties {

    /**
     * Prefix prepended to every table name.
     */
    private String tablePrefix = "nudge_";

    /**
     * Create the tables on startup if they do not exist.
     */
    private boolean initializeSchema = false;

    private final Delivery delivery = new Delivery();
    private final Trigger trigger = new Trigger();
    private final Lifecycle lifecycle = new Lifecycle();
    private final Metrics metrics = new Metrics();

    public String getTablePrefix() {
        return tablePrefix;
    }

    public void setTablePrefix(String tablePrefix) {
        this.tablePrefix = tablePrefix;
    }

    public boolean isInitializeSchema() {
        return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
        this.initializeSchema = initializeSchema;
    }

    public Delivery getDelivery() {
        return delivery;
    }

    public Trigger getTrigger() {
        return trigger;
    }

    public Lifecycle getLifecycle() {
        return lifecycle;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Delivery {
        private int batchSize = 50;
        private long intervalMs = 10000;

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }
    }

    public static class Trigger {
        private int workerCount = 4;

        /**
         * Insert the built-in rule set on startup where the slugs are absent.
         */
        private boolean registerDefaultRules = false;

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public boolean isRegisterDefaultRules() {
            return registerDefaultRules;
        }

        public void setRegisterDefaultRules(boolean registerDefaultRules) {
            this.registerDefaultRules = registerDefaultRules;
        }
    }

    public static class Lifecycle {
        private boolean enabled = true;
        private long sweepIntervalMs = 300000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getSweepIntervalMs() {
            return sweepIntervalMs;
        }

        public void setSweepIntervalMs(long sweepIntervalMs) {
            this.sweepIntervalMs = sweepIntervalMs;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "nudge";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
