package org.iceforge.governor.quota;

/**
 * Thrown by callers that turn a denied {@link QuotaDecision} into a failure.
 */
public class QuotaExceededException extends RuntimeException {
    private final QuotaDecision decision;

    public QuotaExceededException(QuotaDecision decision) {
        super(decision.reason());
        this.decision = decision;
    }

    public QuotaDecision decision() {
        return decision;
    }
}
