package ai.lodestar.evidence;

import ai.lodestar.exception.InvalidInputException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import org.jetbrains.annotations.Nullable;

/**
 * A typed fact extracted from the user's input or the environment (a path, a symbol name, an error token).
 *
 * <p>Signals are immutable and created once per retrieval cycle, so they can be read from any provider thread.
 * Well-known metadata keys: {@link #META_PATH}, {@link #META_LINE} (1-based), {@link #META_CHARACTER} (0-based) and
 * {@link #META_DEPTH} (stack frame index, 0 innermost).
 */
public record Signal(
        SignalType type, String value, SignalSource source, double confidence, Map<String, Object> metadata) {

    public static final String META_PATH = "path";
    public static final String META_LINE = "line";
    public static final String META_CHARACTER = "character";
    public static final String META_DEPTH = "depth";

    public Signal {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(source, "source");
        InvalidInputException.check(
                confidence >= 0.0 && confidence <= 1.0, "Signal confidence must be within [0,1]: " + confidence);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public Signal(SignalType type, String value, SignalSource source, double confidence) {
        this(type, value, source, confidence, Map.of());
    }

    public static Signal path(String value) {
        return new Signal(SignalType.PATH, value, SignalSource.USER_MESSAGE, 1.0);
    }

    public static Signal symbol(String value) {
        return new Signal(SignalType.SYMBOL, value, SignalSource.USER_MESSAGE, 1.0);
    }

    public static Signal errorToken(String value) {
        return new Signal(SignalType.ERROR_TOKEN, value, SignalSource.USER_MESSAGE, 1.0);
    }

    public boolean is(SignalType candidate) {
        return type == candidate;
    }

    /** Same kind of fact, regardless of provenance and confidence. */
    public boolean sameFact(Signal other) {
        return type == other.type && value.equals(other.value);
    }

    public boolean fromStackTrace() {
        return source == SignalSource.STACK_TRACE;
    }

    public Optional<String> metadataString(String key) {
        var v = metadata.get(key);
        return v == null ? Optional.empty() : Optional.of(v.toString());
    }

    public OptionalInt metadataInt(String key) {
        @Nullable Object v = metadata.get(key);
        if (v instanceof Number n) {
            return OptionalInt.of(n.intValue());
        }
        if (v instanceof String s) {
            try {
                return OptionalInt.of(Integer.parseInt(s.trim()));
            } catch (NumberFormatException e) {
                return OptionalInt.empty();
            }
        }
        return OptionalInt.empty();
    }

    /** Call-stack depth of a stack-trace signal; 0 for the innermost frame. */
    public OptionalInt stackDepth() {
        return fromStackTrace() ? metadataInt(META_DEPTH) : OptionalInt.empty();
    }
}
