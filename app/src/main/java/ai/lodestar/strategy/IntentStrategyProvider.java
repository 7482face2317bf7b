package ai.lodestar.strategy;

import ai.lodestar.intent.TaskIntent;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Maps a task intent to budget ratios, weight overrides and provider order, and tunes itself from reported outcomes.
 *
 * <p>Live strategies start as the built-in defaults with the constructor's custom overrides applied field by field.
 * Feedback adjustments replace fields of the live strategy for the rest of this instance's life. Per-intent state is
 * updated atomically, so concurrent readers always see a whole strategy.
 */
public class IntentStrategyProvider {
    private static final Logger logger = LogManager.getLogger(IntentStrategyProvider.class);

    private final Map<TaskIntent, StrategyOverride> customStrategies;
    private final ConcurrentHashMap<TaskIntent, IntentStrategy> strategies = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<TaskIntent, FeedbackStats> feedback = new ConcurrentHashMap<>();

    public IntentStrategyProvider() {
        this(Map.of());
    }

    public IntentStrategyProvider(Map<TaskIntent, StrategyOverride> customStrategies) {
        var copy = new EnumMap<TaskIntent, StrategyOverride>(TaskIntent.class);
        copy.putAll(customStrategies);
        this.customStrategies = Collections.unmodifiableMap(copy);
        loadInitialStrategies();
    }

    private void loadInitialStrategies() {
        for (var intent : TaskIntent.values()) {
            var base = DefaultStrategies.forIntent(intent);
            var custom = customStrategies.get(intent);
            strategies.put(intent, custom == null ? base : custom.applyTo(base));
        }
    }

    public IntentStrategy getStrategy(TaskIntent intent) {
        return strategies.get(Objects.requireNonNull(intent, "intent"));
    }

    public BudgetRatios getBudgetRatios(TaskIntent intent) {
        return getStrategy(intent).budgetRatios();
    }

    /** Returns {@code baseWeights} with every field this intent overrides replaced; the input is not modified. */
    public RerankerWeights applyWeightModifiers(RerankerWeights baseWeights, TaskIntent intent) {
        return getStrategy(intent).weightModifiers().apply(baseWeights);
    }

    public void updateStrategy(TaskIntent intent, StrategyFeedback outcome) {
        Objects.requireNonNull(intent, "intent");
        var stats = feedback.compute(
                intent,
                (k, old) -> (old == null ? new FeedbackStats(0, 0) : old).withOutcome(outcome.success()));
        var adjustments = outcome.adjustments();
        if (adjustments != null) {
            strategies.compute(intent, (k, current) -> adjustments.applyTo(current));
            logger.debug("Adjusted live strategy for {}", intent);
        }
        logger.debug(
                "Feedback for {}: {} samples, success rate {}", intent, stats.sampleCount(), stats.successRate());
    }

    /** Empty until the first {@link #updateStrategy} call for the intent. */
    public Optional<FeedbackStats> getFeedbackStats(TaskIntent intent) {
        return Optional.ofNullable(feedback.get(intent));
    }

    public void resetFeedback(TaskIntent intent) {
        feedback.remove(intent);
    }

    /** Drops all feedback and feedback adjustments, returning to defaults plus constructor overrides. */
    public void reset() {
        feedback.clear();
        loadInitialStrategies();
    }

    public Map<TaskIntent, IntentStrategy> snapshot() {
        var copy = new EnumMap<TaskIntent, IntentStrategy>(TaskIntent.class);
        copy.putAll(strategies);
        return Collections.unmodifiableMap(copy);
    }
}
