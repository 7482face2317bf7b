package ai.lodestar.evidence;

import java.util.Locale;
import java.util.Optional;

public enum SignalType {
    PATH,
    SYMBOL,
    ERROR_TOKEN;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<SignalType> safeParse(String value) {
        for (var t : values()) {
            if (t.wireName().equalsIgnoreCase(value.trim()) || t.name().equalsIgnoreCase(value.trim())) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
