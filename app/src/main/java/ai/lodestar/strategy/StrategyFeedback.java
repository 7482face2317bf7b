package ai.lodestar.strategy;

import org.jetbrains.annotations.Nullable;

/** Task outcome reported after retrieval; {@code adjustments} are applied to the live strategy immediately. */
public record StrategyFeedback(boolean success, @Nullable StrategyOverride adjustments) {
    public static StrategyFeedback succeeded() {
        return new StrategyFeedback(true, null);
    }

    public static StrategyFeedback failed() {
        return new StrategyFeedback(false, null);
    }
}
