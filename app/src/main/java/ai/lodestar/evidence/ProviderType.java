package ai.lodestar.evidence;

import java.util.Locale;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

public enum ProviderType {
    DIFF,
    LSP,
    SEARCH;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ProviderType> safeParse(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        for (var t : values()) {
            if (t.name().equalsIgnoreCase(value.trim())) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
