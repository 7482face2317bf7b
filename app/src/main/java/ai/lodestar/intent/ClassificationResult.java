package ai.lodestar.intent;

import ai.lodestar.exception.InvalidInputException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * @param signals matched keywords (lower case) and {@code context:<flag>} labels for applied boosts
 * @param secondaryIntent the runner-up when the text is ambiguous
 */
public record ClassificationResult(
        TaskIntent intent, double confidence, List<String> signals, @Nullable TaskIntent secondaryIntent) {

    public ClassificationResult {
        Objects.requireNonNull(intent, "intent");
        InvalidInputException.check(
                confidence >= 0.0 && confidence <= 1.0, "confidence must be within [0,1]: " + confidence);
        signals = List.copyOf(signals);
    }

    public static ClassificationResult unknown() {
        return new ClassificationResult(TaskIntent.UNKNOWN, 0.0, List.of(), null);
    }

    public Optional<TaskIntent> secondary() {
        return Optional.ofNullable(secondaryIntent);
    }
}
