package ai.lodestar.strategy;

import static org.junit.jupiter.api.Assertions.*;

import ai.lodestar.evidence.ProviderType;
import ai.lodestar.exception.InvalidInputException;
import ai.lodestar.intent.TaskIntent;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class IntentStrategyProviderTest {
    private final IntentStrategyProvider provider = new IntentStrategyProvider();

    @Test
    void everyIntentHasRatiosSummingToOne() {
        for (var intent : TaskIntent.values()) {
            var ratios = provider.getBudgetRatios(intent);
            assertEquals(1.0, ratios.diff() + ratios.lsp() + ratios.search(), 0.1, intent.name());
        }
    }

    @Test
    void defaultsReflectEachIntent() {
        var debug = provider.getStrategy(TaskIntent.DEBUG);
        assertEquals(new BudgetRatios(0.5, 0.3, 0.2), debug.budgetRatios());
        assertEquals(List.of("error_logs", "recent_changes"), debug.additionalContext());

        assertEquals(ProviderType.LSP, provider.getStrategy(TaskIntent.IMPLEMENT).providerPriority().get(0));
        assertEquals(ProviderType.LSP, provider.getStrategy(TaskIntent.REFACTOR).providerPriority().get(0));
        assertEquals(ProviderType.SEARCH, provider.getStrategy(TaskIntent.EXPLORE).providerPriority().get(0));
        assertTrue(provider.getBudgetRatios(TaskIntent.REVIEW).diff() >= 0.5);

        var unknown = provider.getStrategy(TaskIntent.UNKNOWN);
        assertTrue(unknown.additionalContext().isEmpty());
        assertEquals(3, unknown.providerPriority().size());
    }

    @Test
    void debugModifiersReplaceOnlyNamedFields() {
        var base = RerankerWeights.DEFAULT;
        var applied = provider.applyWeightModifiers(base, TaskIntent.DEBUG);

        assertEquals(150, applied.diff());
        assertEquals(120, applied.stackFrame());
        assertEquals(base.definition(), applied.definition());
        assertEquals(base.reference(), applied.reference());
        assertEquals(base.keyword(), applied.keyword());
        assertEquals(base.workingSet(), applied.workingSet());
        assertEquals(base.stackDepthDecay(), applied.stackDepthDecay());
        assertEquals(100, base.diff(), "input is not modified");
    }

    @Test
    void unknownLeavesWeightsUntouched() {
        var base = new RerankerWeights(1, 2, 3, 4, 5, 6, 0.5);
        assertEquals(base, provider.applyWeightModifiers(base, TaskIntent.UNKNOWN));
    }

    @Test
    void customStrategiesMergeFieldByField() {
        var custom = new StrategyOverride(null, WeightModifiers.NONE.withKeyword(99), null, List.of("extra"));
        var customized = new IntentStrategyProvider(Map.of(TaskIntent.DEBUG, custom));

        var debug = customized.getStrategy(TaskIntent.DEBUG);
        assertEquals(new BudgetRatios(0.5, 0.3, 0.2), debug.budgetRatios(), "untouched key keeps the default");
        assertEquals(List.of("extra"), debug.additionalContext());

        var weights = customized.applyWeightModifiers(RerankerWeights.DEFAULT, TaskIntent.DEBUG);
        assertEquals(99, weights.keyword());
        assertEquals(RerankerWeights.DEFAULT.diff(), weights.diff(), "modifiers are replaced whole, not merged");
    }

    @Test
    void feedbackCanRetuneWeights() {
        var provider = new IntentStrategyProvider();
        provider.updateStrategy(
                TaskIntent.REVIEW,
                new StrategyFeedback(true, StrategyOverride.ofWeightModifiers(WeightModifiers.NONE.withReference(75))));

        var weights = provider.applyWeightModifiers(RerankerWeights.DEFAULT, TaskIntent.REVIEW);
        assertEquals(75, weights.reference());
        assertEquals(1, provider.getFeedbackStats(TaskIntent.REVIEW).orElseThrow().successCount());
    }

    @Test
    void feedbackIsAbsentUntilReported() {
        assertTrue(provider.getFeedbackStats(TaskIntent.DEBUG).isEmpty());
    }

    @Test
    void feedbackTracksSuccessRate() {
        provider.updateStrategy(TaskIntent.DEBUG, StrategyFeedback.succeeded());
        provider.updateStrategy(TaskIntent.DEBUG, StrategyFeedback.failed());
        provider.updateStrategy(TaskIntent.DEBUG, StrategyFeedback.succeeded());

        var stats = provider.getFeedbackStats(TaskIntent.DEBUG).orElseThrow();
        assertEquals(3, stats.sampleCount());
        assertEquals(2.0 / 3.0, stats.successRate(), 1e-9);
        assertTrue(provider.getFeedbackStats(TaskIntent.REVIEW).isEmpty());
    }

    @Test
    void adjustmentsPersistForLaterCalls() {
        var ratios = new BudgetRatios(0.8, 0.1, 0.1);
        provider.updateStrategy(
                TaskIntent.EXPLORE, new StrategyFeedback(false, StrategyOverride.ofBudgetRatios(ratios)));

        assertEquals(ratios, provider.getBudgetRatios(TaskIntent.EXPLORE));
        assertEquals(ProviderType.SEARCH, provider.getStrategy(TaskIntent.EXPLORE).providerPriority().get(0));
        assertEquals(ratios, provider.snapshot().get(TaskIntent.EXPLORE).budgetRatios());
    }

    @Test
    void resetRestoresDefaultsAndCustomizations() {
        var custom = StrategyOverride.ofProviderPriority(List.of(ProviderType.SEARCH));
        var customized = new IntentStrategyProvider(Map.of(TaskIntent.DEBUG, custom));
        customized.updateStrategy(
                TaskIntent.DEBUG,
                new StrategyFeedback(true, StrategyOverride.ofBudgetRatios(new BudgetRatios(0.1, 0.1, 0.8))));

        customized.reset();

        assertTrue(customized.getFeedbackStats(TaskIntent.DEBUG).isEmpty());
        assertEquals(new BudgetRatios(0.5, 0.3, 0.2), customized.getBudgetRatios(TaskIntent.DEBUG));
        assertEquals(List.of(ProviderType.SEARCH), customized.getStrategy(TaskIntent.DEBUG).providerPriority());
    }

    @Test
    void resetFeedbackKeepsAdjustments() {
        var ratios = new BudgetRatios(0.4, 0.4, 0.2);
        provider.updateStrategy(TaskIntent.TEST, new StrategyFeedback(true, StrategyOverride.ofBudgetRatios(ratios)));
        provider.resetFeedback(TaskIntent.TEST);

        assertTrue(provider.getFeedbackStats(TaskIntent.TEST).isEmpty());
        assertEquals(ratios, provider.getBudgetRatios(TaskIntent.TEST));
    }

    @Test
    void invalidRatiosAreRejected() {
        assertThrows(InvalidInputException.class, () -> new BudgetRatios(0.5, 0.5, 0.5));
        assertThrows(InvalidInputException.class, () -> new BudgetRatios(-0.1, 0.6, 0.5));
    }

    @Test
    void ratioSumsOnTheToleranceEdgeAreAccepted() {
        assertEquals(0.9, new BudgetRatios(0.3, 0.3, 0.3).sum(), 1e-9);
        assertEquals(1.1, new BudgetRatios(0.4, 0.4, 0.3).sum(), 1e-9);
        assertThrows(InvalidInputException.class, () -> new BudgetRatios(0.3, 0.3, 0.29));
    }

    @Test
    void concurrentFeedbackIsNotLost() throws Exception {
        var threads = new Thread[8];
        for (int i = 0; i < threads.length; i++) {
            threads[i] = new Thread(() -> {
                for (int j = 0; j < 250; j++) {
                    provider.updateStrategy(TaskIntent.IMPLEMENT, StrategyFeedback.succeeded());
                }
            });
            threads[i].start();
        }
        for (var t : threads) {
            t.join();
        }
        assertEquals(2000, provider.getFeedbackStats(TaskIntent.IMPLEMENT).orElseThrow().sampleCount());
    }
}
