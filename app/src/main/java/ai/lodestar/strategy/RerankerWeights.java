package ai.lodestar.strategy;

import ai.lodestar.exception.InvalidInputException;

/**
 * Per-dimension multipliers (in percent) used by the composite scorer, plus the per-frame decay applied to stack
 * trace evidence. Immutable; {@link WeightModifiers#apply} produces modified copies.
 */
public record RerankerWeights(
        double diff,
        double stackFrame,
        double definition,
        double reference,
        double keyword,
        double workingSet,
        double stackDepthDecay) {

    public static final RerankerWeights DEFAULT = new RerankerWeights(100, 80, 60, 30, 10, 50, 0.1);

    public RerankerWeights {
        InvalidInputException.check(
                diff >= 0 && stackFrame >= 0 && definition >= 0 && reference >= 0 && keyword >= 0 && workingSet >= 0,
                "reranker weights must be >= 0");
        InvalidInputException.check(
                stackDepthDecay >= 0.0 && stackDepthDecay <= 1.0,
                "stackDepthDecay must be within [0,1]: " + stackDepthDecay);
    }
}
