package ai.lodestar.rerank;

import ai.lodestar.evidence.ProviderType;
import ai.lodestar.exception.InvalidInputException;
import ai.lodestar.strategy.BudgetRatios;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Static split of a total token budget across provider types. Unused budget is not redistributed.
 */
public final class BudgetAllocator {
    private BudgetAllocator() {}

    /**
     * Each type gets {@code floor(total * ratio / sum(ratios))}; the rounding remainder goes to the first type in
     * {@code priority} (or {@link ProviderType#DIFF} when the priority list is empty). The parts always add up to
     * {@code total}.
     */
    public static Map<ProviderType, Integer> allocate(int total, BudgetRatios ratios, List<ProviderType> priority) {
        InvalidInputException.check(total >= 0, "total budget must be >= 0: " + total);
        var result = new EnumMap<ProviderType, Integer>(ProviderType.class);
        double sum = ratios.sum();
        int allocated = 0;
        for (var type : ProviderType.values()) {
            int share = sum <= 0 ? 0 : (int) Math.floor(total * ratios.ratioFor(type) / sum);
            result.put(type, share);
            allocated += share;
        }
        int remainder = total - allocated;
        if (remainder > 0) {
            var first = priority.isEmpty() ? ProviderType.DIFF : priority.get(0);
            result.merge(first, remainder, Integer::sum);
        }
        return Collections.unmodifiableMap(result);
    }
}
