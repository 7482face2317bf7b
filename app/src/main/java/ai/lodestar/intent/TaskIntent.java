package ai.lodestar.intent;

import java.util.Locale;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/** The purpose of a task. {@link #UNKNOWN} is a normal outcome, not an error. */
public enum TaskIntent {
    DEBUG,
    IMPLEMENT,
    REFACTOR,
    EXPLORE,
    TEST,
    REVIEW,
    UNKNOWN;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<TaskIntent> safeParse(@Nullable String value) {
        if (value == null) {
            return Optional.empty();
        }
        var s = value.trim();
        if (s.isEmpty()) {
            return Optional.empty();
        }
        for (var t : values()) {
            if (t.name().equalsIgnoreCase(s)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
