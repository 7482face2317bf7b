package ai.lodestar.strategy;

/** Running outcome tally for one intent. */
public record FeedbackStats(int sampleCount, int successCount) {
    public FeedbackStats withOutcome(boolean success) {
        return new FeedbackStats(sampleCount + 1, successCount + (success ? 1 : 0));
    }

    public double successRate() {
        return sampleCount == 0 ? 0.0 : (double) successCount / sampleCount;
    }
}
