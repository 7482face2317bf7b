package ai.lodestar.evidence.providers;

import java.util.List;

/** One matching line reported by a {@link SearchBackend}. {@code line} is 1-based. */
public record SearchMatch(String file, int line, String content, List<String> before, List<String> after) {
    public SearchMatch {
        before = before == null ? List.of() : List.copyOf(before);
        after = after == null ? List.of() : List.copyOf(after);
    }

    public SearchMatch(String file, int line, String content) {
        this(file, line, content, List.of(), List.of());
    }
}
