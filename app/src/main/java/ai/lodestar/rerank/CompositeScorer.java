package ai.lodestar.rerank;

import ai.lodestar.evidence.Evidence;
import ai.lodestar.evidence.PathPatterns;
import ai.lodestar.evidence.Signal;
import ai.lodestar.evidence.SymbolKind;
import ai.lodestar.strategy.RerankerWeights;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Turns a provider's base score into a globally comparable composite score:
 *
 * <pre>score = baseScore * weight / 100 + SIGNAL_BONUS * matchedSignals</pre>
 *
 * <p>The weight comes from the provider type ({@code diff}, LSP {@code definition} or {@code reference}, search
 * {@code keyword}), is raised to {@code workingSet} for files in the working set, and for stack-trace evidence is
 * {@code stackFrame * (1 - stackDepthDecay)^depth}.
 */
public final class CompositeScorer {
    public static final double SIGNAL_BONUS = 2.0;

    private final RerankerWeights weights;
    private final Set<String> workingSet;

    /** @param workingSet normalized paths, see {@link PathPatterns#normalize} */
    public CompositeScorer(RerankerWeights weights, Set<String> workingSet) {
        this.weights = weights;
        this.workingSet = workingSet;
    }

    public ScoredEvidence score(Evidence evidence) {
        double weight = effectiveWeight(evidence);
        double score = evidence.baseScore() * weight / 100.0 + SIGNAL_BONUS * evidence.matchedSignals().size();
        return new ScoredEvidence(evidence, score, weight);
    }

    double effectiveWeight(Evidence evidence) {
        if (evidence.fromStackTrace()) {
            return weights.stackFrame() * Math.pow(1.0 - weights.stackDepthDecay(), stackDepth(evidence));
        }
        double weight =
                switch (evidence.provider()) {
                    case DIFF -> weights.diff();
                    case LSP -> evidence.metadata().symbolKind() == SymbolKind.REFERENCE
                            ? weights.reference()
                            : weights.definition();
                    case SEARCH -> weights.keyword();
                };
        if (workingSet.contains(PathPatterns.normalize(evidence.path()))) {
            weight = Math.max(weight, weights.workingSet());
        }
        return weight;
    }

    /** Shallowest frame the evidence was found through; 0 when no depth is recorded. */
    static int stackDepth(Evidence evidence) {
        var recorded = evidence.metadata().stackDepth();
        if (recorded != null) {
            return Math.max(0, recorded);
        }
        return evidence.matchedSignals().stream()
                .map(Signal::stackDepth)
                .filter(OptionalInt::isPresent)
                .mapToInt(OptionalInt::getAsInt)
                .min()
                .orElse(0);
    }
}
