package ai.lodestar.strategy;

import ai.lodestar.evidence.ProviderType;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * A partial {@link IntentStrategy}. Each non-null field replaces the corresponding field of the strategy it is
 * applied to as a whole; fields are never merged internally (a {@code weightModifiers} override drops the default's
 * modifiers entirely).
 */
public record StrategyOverride(
        @Nullable BudgetRatios budgetRatios,
        @Nullable WeightModifiers weightModifiers,
        @Nullable List<ProviderType> providerPriority,
        @Nullable List<String> additionalContext) {

    public static StrategyOverride ofBudgetRatios(BudgetRatios ratios) {
        return new StrategyOverride(ratios, null, null, null);
    }

    public static StrategyOverride ofWeightModifiers(WeightModifiers modifiers) {
        return new StrategyOverride(null, modifiers, null, null);
    }

    public static StrategyOverride ofProviderPriority(List<ProviderType> priority) {
        return new StrategyOverride(null, null, priority, null);
    }

    public IntentStrategy applyTo(IntentStrategy base) {
        return new IntentStrategy(
                budgetRatios != null ? budgetRatios : base.budgetRatios(),
                weightModifiers != null ? weightModifiers : base.weightModifiers(),
                providerPriority != null ? providerPriority : base.providerPriority(),
                additionalContext != null ? additionalContext : base.additionalContext());
    }
}
