package ai.lodestar.rerank;

import static org.junit.jupiter.api.Assertions.*;

import ai.lodestar.evidence.Evidence;
import ai.lodestar.evidence.EvidenceMetadata;
import ai.lodestar.evidence.LineRange;
import ai.lodestar.evidence.ProviderType;
import ai.lodestar.evidence.Signal;
import ai.lodestar.evidence.SignalSource;
import ai.lodestar.evidence.SignalType;
import ai.lodestar.evidence.SymbolKind;
import ai.lodestar.strategy.RerankerWeights;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CompositeScorerTest {
    private static final RerankerWeights WEIGHTS = RerankerWeights.DEFAULT;

    private static Evidence evidence(
            ProviderType provider, String path, double baseScore, List<Signal> signals, EvidenceMetadata metadata) {
        return new Evidence(
                Evidence.newId(), provider, path, new LineRange(1, 1), "x", 1, baseScore, signals, metadata);
    }

    private static Signal frame(String path, int depth) {
        return new Signal(SignalType.PATH, path, SignalSource.STACK_TRACE, 1.0, Map.of(Signal.META_DEPTH, depth));
    }

    @Test
    void providerTypeSelectsWeight() {
        var scorer = new CompositeScorer(WEIGHTS, Set.of());
        assertEquals(
                100, scorer.effectiveWeight(evidence(ProviderType.DIFF, "a", 100, List.of(), EvidenceMetadata.EMPTY)));
        assertEquals(
                60,
                scorer.effectiveWeight(evidence(
                        ProviderType.LSP, "a", 60, List.of(), EvidenceMetadata.forSymbol(SymbolKind.DEFINITION))));
        assertEquals(
                30,
                scorer.effectiveWeight(evidence(
                        ProviderType.LSP, "a", 30, List.of(), EvidenceMetadata.forSymbol(SymbolKind.REFERENCE))));
        assertEquals(
                10, scorer.effectiveWeight(evidence(ProviderType.SEARCH, "a", 10, List.of(), EvidenceMetadata.EMPTY)));
    }

    @Test
    void scoreCombinesWeightAndSignalBonus() {
        var scorer = new CompositeScorer(WEIGHTS, Set.of());
        var scored = scorer.score(evidence(
                ProviderType.DIFF, "a", 100, List.of(Signal.path("a"), Signal.symbol("b")), EvidenceMetadata.EMPTY));
        assertEquals(100.0 + 2 * CompositeScorer.SIGNAL_BONUS, scored.score(), 1e-9);
        assertEquals(100, scored.effectiveWeight());
    }

    @Test
    void workingSetRaisesButNeverLowersWeight() {
        var scorer = new CompositeScorer(WEIGHTS, Set.of("src/a.ts"));
        assertEquals(
                WEIGHTS.workingSet(),
                scorer.effectiveWeight(
                        evidence(ProviderType.SEARCH, "src/A.ts", 10, List.of(), EvidenceMetadata.EMPTY)));
        assertEquals(
                WEIGHTS.diff(),
                scorer.effectiveWeight(
                        evidence(ProviderType.DIFF, "src/a.ts", 100, List.of(), EvidenceMetadata.EMPTY)));
    }

    @Test
    void stackTraceEvidenceDecaysWithDepth() {
        var scorer = new CompositeScorer(WEIGHTS, Set.of());
        double previous = Double.MAX_VALUE;
        for (int depth = 0; depth < 5; depth++) {
            var item = evidence(ProviderType.DIFF, "a", 100, List.of(frame("a", depth)), EvidenceMetadata.EMPTY);
            double weight = scorer.effectiveWeight(item);
            assertEquals(WEIGHTS.stackFrame() * Math.pow(0.9, depth), weight, 1e-9);
            assertTrue(weight < previous);
            previous = weight;
        }
    }

    @Test
    void recordedDepthTakesPrecedenceOverSignals() {
        var item = evidence(
                ProviderType.LSP, "a", 60, List.of(frame("a", 0)), EvidenceMetadata.forSymbol(SymbolKind.DEFINITION)
                        .withStackDepth(2));
        assertEquals(2, CompositeScorer.stackDepth(item));
        var shallowest =
                evidence(ProviderType.DIFF, "a", 100, List.of(frame("a", 3), frame("b", 1)), EvidenceMetadata.EMPTY);
        assertEquals(1, CompositeScorer.stackDepth(shallowest));
    }

    @Test
    void scoreIsMonotoneInWeight() {
        var item = evidence(ProviderType.SEARCH, "a", 10, List.of(Signal.symbol("x")), EvidenceMetadata.EMPTY);
        var low = new CompositeScorer(WEIGHTS, Set.of()).score(item).score();
        var high = new CompositeScorer(new RerankerWeights(100, 80, 60, 30, 40, 50, 0.1), Set.of())
                .score(item)
                .score();
        assertTrue(high > low);
    }
}
