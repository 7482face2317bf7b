package ai.lodestar.evidence;

import java.util.ArrayList;
import java.util.List;

/** Token estimation and the shared budget-trimming rule used by every provider and the orchestrator. */
public final class TokenBudget {
    public static final double TOKENS_PER_CHAR = 0.25;

    private TokenBudget() {}

    public static int estimateTokens(String content) {
        return (int) Math.ceil(content.length() * TOKENS_PER_CHAR);
    }

    /**
     * Keeps the longest prefix of {@code evidence} whose token total fits in {@code maxTokens}.
     *
     * <p>If the first item alone is over budget it is returned on its own, so a non-empty input with a positive budget
     * never yields an empty list. The rule is idempotent and a smaller budget never yields more tokens.
     */
    public static List<Evidence> apply(List<Evidence> evidence, int maxTokens) {
        if (maxTokens <= 0 || evidence.isEmpty()) {
            return List.of();
        }
        var result = new ArrayList<Evidence>();
        long total = 0;
        for (var item : evidence) {
            if (total + item.tokens() > maxTokens) {
                if (result.isEmpty()) {
                    result.add(item);
                }
                break;
            }
            result.add(item);
            total += item.tokens();
        }
        return List.copyOf(result);
    }

    public static long totalTokens(List<Evidence> evidence) {
        return evidence.stream().mapToLong(Evidence::tokens).sum();
    }
}
