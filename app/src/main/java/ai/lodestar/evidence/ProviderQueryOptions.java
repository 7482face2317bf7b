package ai.lodestar.evidence;

import ai.lodestar.exception.InvalidInputException;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** Per-call limits and filters for {@link EvidenceProvider#query}. Never stored by providers. */
public record ProviderQueryOptions(
        @Nullable Integer maxResults,
        @Nullable Integer maxTokens,
        List<String> includePatterns,
        List<String> excludePatterns,
        @Nullable Integer contextLines) {

    public static final ProviderQueryOptions DEFAULT = new ProviderQueryOptions(null, null, List.of(), List.of(), null);

    public ProviderQueryOptions {
        InvalidInputException.check(maxResults == null || maxResults >= 0, "maxResults must be >= 0");
        InvalidInputException.check(maxTokens == null || maxTokens >= 0, "maxTokens must be >= 0");
        InvalidInputException.check(contextLines == null || contextLines >= 0, "contextLines must be >= 0");
        includePatterns = includePatterns == null ? List.of() : List.copyOf(includePatterns);
        excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
    }

    public static ProviderQueryOptions ofMaxResults(int maxResults) {
        return DEFAULT.withMaxResults(maxResults);
    }

    public static ProviderQueryOptions ofMaxTokens(int maxTokens) {
        return DEFAULT.withMaxTokens(maxTokens);
    }

    public ProviderQueryOptions withMaxResults(@Nullable Integer value) {
        return new ProviderQueryOptions(value, maxTokens, includePatterns, excludePatterns, contextLines);
    }

    public ProviderQueryOptions withMaxTokens(@Nullable Integer value) {
        return new ProviderQueryOptions(maxResults, value, includePatterns, excludePatterns, contextLines);
    }

    public ProviderQueryOptions withIncludePatterns(List<String> patterns) {
        return new ProviderQueryOptions(maxResults, maxTokens, patterns, excludePatterns, contextLines);
    }

    public ProviderQueryOptions withExcludePatterns(List<String> patterns) {
        return new ProviderQueryOptions(maxResults, maxTokens, includePatterns, patterns, contextLines);
    }

    public ProviderQueryOptions withContextLines(@Nullable Integer value) {
        return new ProviderQueryOptions(maxResults, maxTokens, includePatterns, excludePatterns, value);
    }

    public int contextLinesOr(int fallback) {
        return contextLines == null ? fallback : contextLines;
    }

    /** True when the path passes the include filter (if any) and is not excluded. */
    public boolean accepts(String path) {
        if (!includePatterns.isEmpty() && !PathPatterns.matchesAny(path, includePatterns)) {
            return false;
        }
        return excludePatterns.isEmpty() || !PathPatterns.matchesAny(path, excludePatterns);
    }
}
