package nudge.lifecycle;

import nudge.condition.ConditionSet;
import nudge.condition.Operator;
import nudge.condition.TriggerCondition;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Built-in journey templates, keyed by journey type.
 */
public final class JourneyCatalog {

    public static final String ONBOARDING = "onboarding";
    public static final String LEAD_NURTURING = "lead_nurturing";
    public static final String RE_ENGAGEMENT = "re_engagement";
    public static final String RETENTION = "retention";
    public static final String CONVERSION = "conversion";

    private static final int DAY = 1440;

    private JourneyCatalog() {
    }

    public static Map<String, JourneyTemplate> defaults() {
        return of(List.of(onboarding(), leadNurturing(), quizAbandonment(), retention(), conversion()));
    }

    /**
     * Indexes templates by journey type; a later template replaces an earlier one of the same type.
     */
    public static Map<String, JourneyTemplate> of(Collection<JourneyTemplate> templates) {
        Map<String, JourneyTemplate> byType = new LinkedHashMap<>();
        for (JourneyTemplate template : templates) {
            byType.put(template.journeyType(), template);
        }
        return Collections.unmodifiableMap(byType);
    }

    static JourneyTemplate onboarding() {
        return new JourneyTemplate("user_onboarding", ONBOARDING, "User Onboarding Journey", List.of(
            JourneyStage.of("welcome", 0, "user_signup"),
            JourneyStage.of("profile_setup", 60, "profile_incomplete")
                .when(when("profile.completeness", Operator.LESS_THAN, 50)),
            JourneyStage.of("first_quiz", DAY, "quiz_reminder")
                .when(when("quiz.completed_count", Operator.EQUALS, 0)),
            JourneyStage.of("feature_discovery", 3 * DAY, "feature_showcase"),
            JourneyStage.of("engagement_check", 7 * DAY, "engagement_followup")
                .when(when("engagement.weekly_visits", Operator.LESS_THAN, 3))),
            Set.of("profile_completed", "first_quiz_completed", "premium_signup"), true);
    }

    static JourneyTemplate leadNurturing() {
        return new JourneyTemplate("lead_nurturing", LEAD_NURTURING, "Lead Nurturing Campaign", List.of(
            JourneyStage.of("lead_magnet_delivery", 5, "lead_captured"),
            JourneyStage.of("educational_content_1", DAY, "education_drip_1"),
            JourneyStage.of("social_proof", 2 * DAY, "social_proof_share"),
            JourneyStage.of("educational_content_2", 3 * DAY, "education_drip_2"),
            JourneyStage.of("soft_pitch", 5 * DAY, "soft_pitch_intro"),
            JourneyStage.of("special_offer", 7 * DAY, "special_offer_launch")
                .when(when("engagement.open_rate", Operator.GREATER_THAN, 0.25))),
            Set.of("premium_signup", "high_engagement_achieved"), true);
    }

    static JourneyTemplate quizAbandonment() {
        return new JourneyTemplate("quiz_abandonment", RE_ENGAGEMENT, "Quiz Abandonment Recovery", List.of(
            JourneyStage.of("immediate_reminder", 60, "quiz_abandoned"),
            JourneyStage.of("value_reminder", DAY, "quiz_value_reminder")
                .when(when("quiz.completion_percentage", Operator.GREATER_THAN, 25)),
            JourneyStage.of("alternative_content", 3 * DAY, "alternative_content_offer")),
            Set.of("quiz_completed", "premium_signup"), true);
    }

    static JourneyTemplate retention() {
        return new JourneyTemplate("retention_reengagement", RETENTION, "User Retention & Re-engagement", List.of(
            JourneyStage.of("inactivity_check", 7 * DAY, "inactivity_detected")
                .when(when("last_active", Operator.LESS_THAN, "7_days_ago")),
            JourneyStage.of("we_miss_you", 14 * DAY, "we_miss_you"),
            JourneyStage.of("new_features", 21 * DAY, "new_features_showcase"),
            JourneyStage.of("win_back_offer", 30 * DAY, "win_back_offer")),
            Set.of("user_reactivated", "premium_signup"), true);
    }

    static JourneyTemplate conversion() {
        return new JourneyTemplate("premium_conversion", CONVERSION, "Premium Conversion Journey", List.of(
            JourneyStage.of("value_demonstration", 5 * DAY, "premium_value_demo")
                .when(when("engagement.session_count", Operator.GREATER_THAN, 3)),
            JourneyStage.of("limited_access", 10 * DAY, "limited_access_reminder"),
            JourneyStage.of("trial_offer", 15 * DAY, "free_trial_offer")
                .when(when("premium.trial_used", Operator.EQUALS, false)),
            JourneyStage.of("urgency_create", 20 * DAY, "urgency_offer")),
            Set.of("premium_signup", "trial_started"), true);
    }

    private static ConditionSet when(String field, Operator operator, Object value) {
        return ConditionSet.all(TriggerCondition.of(field, operator, value));
    }
}
