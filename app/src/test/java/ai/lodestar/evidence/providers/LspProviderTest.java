package ai.lodestar.evidence.providers;

import static org.junit.jupiter.api.Assertions.*;

import ai.lodestar.evidence.Evidence;
import ai.lodestar.evidence.ProviderQueryOptions;
import ai.lodestar.evidence.Signal;
import ai.lodestar.evidence.SignalSource;
import ai.lodestar.evidence.SignalType;
import ai.lodestar.evidence.SymbolKind;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LspProviderTest {
    @TempDir
    Path root;

    private Path source;

    /** Returns canned locations; a null list means "never completes". */
    static final class StubLspClient implements LspClient {
        List<Location> definitions = List.of();
        List<Location> references = List.of();
        boolean initialized = true;
        int lastLine = -1;

        @Override
        public boolean isInitialized() {
            return initialized;
        }

        @Override
        public CompletableFuture<List<Location>> definition(String filePath, int line, int character) {
            lastLine = line;
            return definitions == null ? new CompletableFuture<>() : CompletableFuture.completedFuture(definitions);
        }

        @Override
        public CompletableFuture<List<Location>> references(
                String filePath, int line, int character, boolean includeDeclaration) {
            return references == null ? new CompletableFuture<>() : CompletableFuture.completedFuture(references);
        }
    }

    private static Location at(String uri, int zeroBasedLine) {
        var pos = new Position(zeroBasedLine, 0);
        return new Location(uri, new Range(pos, pos));
    }

    private static Signal positioned(String symbol, String path, int line) {
        return new Signal(
                SignalType.SYMBOL,
                symbol,
                SignalSource.USER_MESSAGE,
                0.5,
                Map.of(Signal.META_PATH, path, Signal.META_LINE, line));
    }

    @BeforeEach
    void setUp() throws Exception {
        source = root.resolve("Service.java");
        var lines = new StringBuilder();
        for (int i = 1; i <= 30; i++) {
            lines.append("line ").append(i).append('\n');
        }
        Files.writeString(source, lines.toString());
    }

    @Test
    void unavailableWithoutClientUntilBound() {
        var provider = new LspProvider(root, null);
        assertFalse(provider.isAvailable());
        assertTrue(provider.query(List.of(positioned("run", "Service.java", 3))).isEmpty());

        var client = new StubLspClient();
        provider.setClient(client);
        assertTrue(provider.isAvailable());
        client.initialized = false;
        assertFalse(provider.isAvailable());
    }

    @Test
    void definitionsAndReferencesAreWeightedAndRead() {
        var client = new StubLspClient();
        client.definitions = List.of(at(source.toUri().toString(), 9));
        client.references = List.of(at(source.toUri().toString(), 24));
        var provider = new LspProvider(root, client, Duration.ofSeconds(1), Duration.ofSeconds(1), 2);

        var evidence = provider.query(List.of(positioned("run", "Service.java", 10)));

        assertEquals(9, client.lastLine, "signal lines are 1-based, LSP lines 0-based");
        assertEquals(2, evidence.size());
        Evidence definition = evidence.get(0);
        assertEquals(SymbolKind.DEFINITION, definition.metadata().symbolKind());
        assertEquals("Service.java", definition.path());
        assertEquals(LspProvider.DEFINITION_WEIGHT * 0.5, definition.baseScore());
        assertEquals(8, definition.range().start());
        assertEquals(12, definition.range().end());
        assertEquals("line 8\nline 9\nline 10\nline 11\nline 12", definition.content());

        Evidence reference = evidence.get(1);
        assertEquals(SymbolKind.REFERENCE, reference.metadata().symbolKind());
        assertEquals(LspProvider.REFERENCE_WEIGHT * 0.5, reference.baseScore());
    }

    @Test
    void unreadableTargetsGetPlaceholderContent() {
        var client = new StubLspClient();
        client.definitions = List.of(at("file:///elsewhere/Other.java", 0));
        var provider = new LspProvider(root, client);

        var evidence = provider.query(List.of(positioned("run", "Service.java", 1)));
        assertEquals(1, evidence.size());
        assertEquals("[LSP definition: run]", evidence.get(0).content());
    }

    @Test
    void signalsWithoutPositionAreIgnored() {
        var client = new StubLspClient();
        client.definitions = List.of(at(source.toUri().toString(), 0));
        var provider = new LspProvider(root, client);
        assertTrue(provider.query(List.of(Signal.symbol("run"), Signal.path("Service.java"))).isEmpty());
    }

    @Test
    void slowLookupsTimeOutWithoutFailingTheQuery() {
        var client = new StubLspClient();
        client.definitions = List.of(at(source.toUri().toString(), 4));
        client.references = null;
        var provider = new LspProvider(root, client, Duration.ofSeconds(1), Duration.ofMillis(50), 0);

        var evidence = provider.query(List.of(positioned("run", "Service.java", 5)));
        assertEquals(1, evidence.size());
        assertEquals(SymbolKind.DEFINITION, evidence.get(0).metadata().symbolKind());
    }

    @Test
    void duplicateLocationsAreMergedAndLimitsApplied() {
        var client = new StubLspClient();
        var uri = source.toUri().toString();
        client.definitions = List.of(at(uri, 4), at(uri, 4), at(uri, 20));
        var provider = new LspProvider(root, client, Duration.ofSeconds(1), Duration.ofSeconds(1), 0);

        assertEquals(2, provider.query(List.of(positioned("run", "Service.java", 5))).size());
        assertEquals(
                1,
                provider.query(List.of(positioned("run", "Service.java", 5)), ProviderQueryOptions.ofMaxResults(1))
                        .size());
    }

    @Test
    void fileUrisResolveToPathsAndMalformedOnesAreDropped() {
        var file = root.resolve("src/App.java");
        assertEquals(file.toString(), LspProvider.uriToPath(file.toUri().toString()).orElseThrow());
        assertEquals("src/App.java", LspProvider.uriToPath("src/App.java").orElseThrow());
        assertTrue(LspProvider.uriToPath("file://buildhost/src/App.java").isEmpty(), "authority is not a local path");
        assertTrue(LspProvider.uriToPath("file:///src/My App.java").isEmpty(), "unescaped space");
        assertTrue(LspProvider.uriToPath(null).isEmpty());
    }
}
