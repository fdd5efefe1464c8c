package nudge.trigger;

import nudge.model.TriggerRule;

/**
 * Result of running one rule's pipeline for one event.
 *
 * @param ruleId  the rule
 * @param ruleSlug the rule slug
 * @param status  what happened
 * @param gate    the gate that stopped the rule, or {@code null} when enqueued
 * @param entryId the queue entry written, or {@code null}
 * @param message rejection or failure detail, or {@code null}
 */
public record RuleOutcome(String ruleId, String ruleSlug, Status status, Gate gate, String entryId, String message) {

    public enum Status {
        ENQUEUED,
        REJECTED,
        FAILED
    }

    /**
     * Pipeline gates, in evaluation order.
     */
    public enum Gate {
        CONDITIONS,
        TARGETING,
        RATE_LIMIT,
        TIME_WINDOW,
        TEMPLATE,
        DELIVERY
    }

    static RuleOutcome enqueued(TriggerRule rule, String entryId) {
        return new RuleOutcome(rule.id(), rule.slug(), Status.ENQUEUED, null, entryId, null);
    }

    static RuleOutcome rejected(TriggerRule rule, Gate gate, String message) {
        return new RuleOutcome(rule.id(), rule.slug(), Status.REJECTED, gate, null, message);
    }

    static RuleOutcome failed(TriggerRule rule, Gate gate, String message) {
        return new RuleOutcome(rule.id(), rule.slug(), Status.FAILED, gate, null, message);
    }

    public boolean isEnqueued() {
        return status == Status.ENQUEUED;
    }
}
