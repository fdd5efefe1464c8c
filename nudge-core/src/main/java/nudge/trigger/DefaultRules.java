package nudge.trigger;

import nudge.condition.ConditionSet;
import nudge.condition.Operator;
import nudge.condition.TriggerCondition;
import nudge.model.Channel;
import nudge.model.TimeWindow;
import nudge.model.TriggerRule;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Set;

/**
 * Common rules seeded by {@link TriggerEngine#registerRules}: signup welcome, quiz
 * abandonment reminder, lead-capture follow-up and the Monday-morning weekly digest.
 */
public final class DefaultRules {

    private DefaultRules() {
    }

    public static List<TriggerRule> common() {
        return List.of(
            TriggerRule.builder()
                .id("user_signup")
                .slug("user_signup")
                .name("User Signup Welcome")
                .eventName("user_signup")
                .channelPriority(List.of(Channel.EMAIL, Channel.PUSH))
                .build(),
            TriggerRule.builder()
                .id("quiz_abandoned")
                .slug("quiz_abandoned")
                .name("Quiz Abandonment Reminder")
                .eventName("quiz_abandoned")
                .conditions(ConditionSet.all(
                    TriggerCondition.of("data.completion_percentage", Operator.LESS_THAN, 100)))
                .channelPriority(List.of(Channel.EMAIL, Channel.PUSH, Channel.IN_APP))
                .delayMinutes(60)
                .build(),
            TriggerRule.builder()
                .id("lead_capture")
                .slug("lead_capture")
                .name("Lead Capture Follow-up")
                .eventName("lead_captured")
                .channelPriority(List.of(Channel.EMAIL))
                .delayMinutes(5)
                .build(),
            TriggerRule.builder()
                .id("weekly_digest")
                .slug("weekly_digest")
                .name("Weekly Content Digest")
                .eventName("weekly_digest")
                .timeWindow(new TimeWindow(Set.of(9, 10, 11), Set.of(DayOfWeek.MONDAY), null, null))
                .channelPriority(List.of(Channel.EMAIL))
                .build());
    }
}
