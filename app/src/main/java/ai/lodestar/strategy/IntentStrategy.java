package ai.lodestar.strategy;

import ai.lodestar.evidence.ProviderType;
import ai.lodestar.exception.InvalidInputException;
import java.util.List;
import java.util.Objects;

/**
 * How retrieval is tuned for one intent.
 *
 * @param providerPriority query order; also receives any budget rounding remainder (first entry)
 * @param additionalContext hints for prompt assembly about extra context worth gathering; empty for none
 */
public record IntentStrategy(
        BudgetRatios budgetRatios,
        WeightModifiers weightModifiers,
        List<ProviderType> providerPriority,
        List<String> additionalContext) {

    public IntentStrategy {
        Objects.requireNonNull(budgetRatios, "budgetRatios");
        Objects.requireNonNull(weightModifiers, "weightModifiers");
        providerPriority = List.copyOf(providerPriority);
        InvalidInputException.check(
                providerPriority.stream().distinct().count() == providerPriority.size(),
                "providerPriority must not repeat a provider type: " + providerPriority);
        additionalContext = additionalContext == null ? List.of() : List.copyOf(additionalContext);
    }
}
