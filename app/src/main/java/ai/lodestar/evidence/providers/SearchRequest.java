package ai.lodestar.evidence.providers;

import java.util.List;

/**
 * A regex search over the workspace.
 *
 * @param pattern a Java regex
 * @param includePatterns path patterns in {@link ai.lodestar.evidence.PathPatterns} syntax; empty means all files
 * @param maxResults cap on the number of matching lines returned
 */
public record SearchRequest(
        String pattern,
        boolean caseSensitive,
        List<String> includePatterns,
        List<String> excludePatterns,
        int contextLines,
        int maxResults) {
    public SearchRequest {
        includePatterns = List.copyOf(includePatterns);
        excludePatterns = List.copyOf(excludePatterns);
    }
}
