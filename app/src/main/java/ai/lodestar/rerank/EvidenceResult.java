package ai.lodestar.rerank;

import ai.lodestar.evidence.Evidence;
import ai.lodestar.evidence.ProviderType;
import ai.lodestar.intent.ClassificationResult;
import ai.lodestar.strategy.IntentStrategy;
import ai.lodestar.strategy.RerankerWeights;
import java.util.List;
import java.util.Map;

/**
 * The outcome of one retrieval cycle: the ranked, budget-trimmed evidence plus everything that decided it.
 *
 * @param scored final evidence, highest composite score first
 */
public record EvidenceResult(
        ClassificationResult classification,
        IntentStrategy strategy,
        RerankerWeights weights,
        Map<ProviderType, Integer> subBudgets,
        List<ProviderOutcome> outcomes,
        List<ScoredEvidence> scored) {

    public EvidenceResult {
        subBudgets = Map.copyOf(subBudgets);
        outcomes = List.copyOf(outcomes);
        scored = List.copyOf(scored);
    }

    public List<Evidence> evidence() {
        return scored.stream().map(ScoredEvidence::evidence).toList();
    }

    public long totalTokens() {
        return scored.stream().mapToLong(s -> s.evidence().tokens()).sum();
    }
}
