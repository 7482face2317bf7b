package ai.lodestar.evidence.providers;

import java.util.List;
import org.jetbrains.annotations.Blocking;

/** A full-text search engine over the workspace (ripgrep, git grep, or an in-process walker). */
public interface SearchBackend {
    @Blocking
    boolean isAvailable();

    @Blocking
    List<SearchMatch> search(SearchRequest request) throws SearchBackendException, InterruptedException;
}
