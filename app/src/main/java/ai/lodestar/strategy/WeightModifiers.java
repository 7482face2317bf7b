package ai.lodestar.strategy;

import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * Absolute overrides for {@link RerankerWeights}. A null field means "keep the caller's value", which is distinct
 * from a field explicitly set to the same number as the base.
 */
public record WeightModifiers(
        @Nullable Double diff,
        @Nullable Double stackFrame,
        @Nullable Double definition,
        @Nullable Double reference,
        @Nullable Double keyword,
        @Nullable Double workingSet,
        @Nullable Double stackDepthDecay) {

    public static final WeightModifiers NONE = new WeightModifiers(null, null, null, null, null, null, null);

    public WeightModifiers withDiff(double value) {
        return new WeightModifiers(value, stackFrame, definition, reference, keyword, workingSet, stackDepthDecay);
    }

    public WeightModifiers withStackFrame(double value) {
        return new WeightModifiers(diff, value, definition, reference, keyword, workingSet, stackDepthDecay);
    }

    public WeightModifiers withDefinition(double value) {
        return new WeightModifiers(diff, stackFrame, value, reference, keyword, workingSet, stackDepthDecay);
    }

    public WeightModifiers withReference(double value) {
        return new WeightModifiers(diff, stackFrame, definition, value, keyword, workingSet, stackDepthDecay);
    }

    public WeightModifiers withKeyword(double value) {
        return new WeightModifiers(diff, stackFrame, definition, reference, value, workingSet, stackDepthDecay);
    }

    public WeightModifiers withWorkingSet(double value) {
        return new WeightModifiers(diff, stackFrame, definition, reference, keyword, value, stackDepthDecay);
    }

    public WeightModifiers withStackDepthDecay(double value) {
        return new WeightModifiers(diff, stackFrame, definition, reference, keyword, workingSet, value);
    }

    /** A new weights record with every set field replaced; {@code base} is not modified. */
    public RerankerWeights apply(RerankerWeights base) {
        return new RerankerWeights(
                Objects.requireNonNullElse(diff, base.diff()),
                Objects.requireNonNullElse(stackFrame, base.stackFrame()),
                Objects.requireNonNullElse(definition, base.definition()),
                Objects.requireNonNullElse(reference, base.reference()),
                Objects.requireNonNullElse(keyword, base.keyword()),
                Objects.requireNonNullElse(workingSet, base.workingSet()),
                Objects.requireNonNullElse(stackDepthDecay, base.stackDepthDecay()));
    }
}
