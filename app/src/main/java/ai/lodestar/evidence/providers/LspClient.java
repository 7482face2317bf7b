package ai.lodestar.evidence.providers;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.eclipse.lsp4j.Location;

/** The slice of a language-server hub the LSP evidence provider needs. Positions are 0-based, as in LSP. */
public interface LspClient {
    default boolean isInitialized() {
        return true;
    }

    CompletableFuture<List<Location>> definition(String filePath, int line, int character);

    CompletableFuture<List<Location>> references(
            String filePath, int line, int character, boolean includeDeclaration);
}
