package ai.lodestar.rerank;

import ai.lodestar.evidence.Evidence;

/** An evidence item with its composite score and the weight that produced it. */
public record ScoredEvidence(Evidence evidence, double score, double effectiveWeight) {}
