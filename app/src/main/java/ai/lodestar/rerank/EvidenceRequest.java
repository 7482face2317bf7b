package ai.lodestar.rerank;

import ai.lodestar.evidence.PathPatterns;
import ai.lodestar.evidence.Signal;
import ai.lodestar.exception.InvalidInputException;
import ai.lodestar.intent.ClassificationContext;
import ai.lodestar.strategy.RerankerWeights;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.jetbrains.annotations.Nullable;

/**
 * One retrieval cycle's input.
 *
 * @param signals explicit signals; when empty, signals are extracted from {@code taskText} and {@code errorOutput}
 * @param workingSet paths the user is actively editing; evidence from them is weighted up
 * @param errorOutput captured error or stack trace text, if any
 */
public record EvidenceRequest(
        String taskText,
        ClassificationContext context,
        List<Signal> signals,
        int totalTokenBudget,
        RerankerWeights baseWeights,
        Set<String> workingSet,
        @Nullable String errorOutput) {

    public EvidenceRequest {
        if (taskText == null) {
            throw new InvalidInputException("Task text must not be null");
        }
        InvalidInputException.check(totalTokenBudget >= 0, "totalTokenBudget must be >= 0: " + totalTokenBudget);
        context = Objects.requireNonNullElse(context, ClassificationContext.EMPTY);
        signals = signals == null ? List.of() : List.copyOf(signals);
        baseWeights = Objects.requireNonNullElse(baseWeights, RerankerWeights.DEFAULT);
        workingSet = workingSet == null
                ? Set.of()
                : workingSet.stream().map(PathPatterns::normalize).collect(Collectors.toUnmodifiableSet());
    }

    public static EvidenceRequest of(String taskText, int totalTokenBudget) {
        return new EvidenceRequest(
                taskText,
                ClassificationContext.EMPTY,
                List.of(),
                totalTokenBudget,
                RerankerWeights.DEFAULT,
                Set.of(),
                null);
    }

    public EvidenceRequest withSignals(List<Signal> newSignals) {
        return new EvidenceRequest(
                taskText, context, newSignals, totalTokenBudget, baseWeights, workingSet, errorOutput);
    }

    public EvidenceRequest withContext(ClassificationContext newContext) {
        return new EvidenceRequest(
                taskText, newContext, signals, totalTokenBudget, baseWeights, workingSet, errorOutput);
    }

    public EvidenceRequest withWorkingSet(Set<String> paths) {
        return new EvidenceRequest(taskText, context, signals, totalTokenBudget, baseWeights, paths, errorOutput);
    }

    public EvidenceRequest withErrorOutput(@Nullable String output) {
        return new EvidenceRequest(taskText, context, signals, totalTokenBudget, baseWeights, workingSet, output);
    }

    public EvidenceRequest withBaseWeights(RerankerWeights weights) {
        return new EvidenceRequest(taskText, context, signals, totalTokenBudget, weights, workingSet, errorOutput);
    }
}
