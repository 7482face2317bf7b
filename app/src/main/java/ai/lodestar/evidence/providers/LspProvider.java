package ai.lodestar.evidence.providers;

import ai.lodestar.evidence.Evidence;
import ai.lodestar.evidence.EvidenceMetadata;
import ai.lodestar.evidence.EvidenceProvider;
import ai.lodestar.evidence.LineRange;
import ai.lodestar.evidence.ProviderQueryOptions;
import ai.lodestar.evidence.ProviderType;
import ai.lodestar.evidence.Signal;
import ai.lodestar.evidence.SignalType;
import ai.lodestar.evidence.SymbolKind;
import ai.lodestar.evidence.TokenBudget;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.lsp4j.Location;
import org.jetbrains.annotations.Nullable;

/**
 * Evidence from a language server: where a symbol is defined (weight 60) and where it is used (weight 30).
 *
 * <p>Only symbol signals that carry a source position ({@code path}, {@code line}, optional {@code character}
 * metadata) can be resolved; a workspace-wide symbol search is too expensive to run per query. The client may be bound
 * after construction, and the provider reports itself unavailable until it is.
 */
public final class LspProvider implements EvidenceProvider {
    private static final Logger logger = LogManager.getLogger(LspProvider.class);

    public static final double DEFINITION_WEIGHT = 60;
    public static final double REFERENCE_WEIGHT = 30;
    public static final Duration DEFAULT_DEFINITION_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_REFERENCE_TIMEOUT = Duration.ofSeconds(10);
    public static final int DEFAULT_CONTEXT_LINES = 5;
    private static final int DEFAULT_MAX_RESULTS = 50;

    private final Path workspaceRoot;
    private final Duration definitionTimeout;
    private final Duration referenceTimeout;
    private final int defaultContextLines;
    private volatile @Nullable LspClient client;

    public LspProvider(Path workspaceRoot, @Nullable LspClient client) {
        this(workspaceRoot, client, DEFAULT_DEFINITION_TIMEOUT, DEFAULT_REFERENCE_TIMEOUT, DEFAULT_CONTEXT_LINES);
    }

    public LspProvider(
            Path workspaceRoot,
            @Nullable LspClient client,
            Duration definitionTimeout,
            Duration referenceTimeout,
            int defaultContextLines) {
        this.workspaceRoot = workspaceRoot.toAbsolutePath().normalize();
        this.client = client;
        this.definitionTimeout = definitionTimeout;
        this.referenceTimeout = referenceTimeout;
        this.defaultContextLines = defaultContextLines;
    }

    @Override
    public ProviderType type() {
        return ProviderType.LSP;
    }

    @Override
    public String name() {
        return "LSP Analysis";
    }

    @Override
    public double baseWeight() {
        return DEFINITION_WEIGHT;
    }

    /** Late binding for when the language server finishes starting. */
    public void setClient(@Nullable LspClient client) {
        this.client = client;
    }

    @Override
    public boolean isAvailable() {
        var c = client;
        if (c == null) {
            return false;
        }
        try {
            return c.isInitialized();
        } catch (RuntimeException e) {
            logger.debug("LSP initialization probe failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public List<Evidence> query(List<Signal> signals, ProviderQueryOptions options) {
        var c = client;
        if (c == null) {
            return List.of();
        }
        var positioned = signals.stream()
                .filter(s -> s.is(SignalType.SYMBOL))
                .filter(s -> s.metadataString(Signal.META_PATH).isPresent()
                        && s.metadataInt(Signal.META_LINE).isPresent())
                .toList();
        if (positioned.isEmpty()) {
            return List.of();
        }

        int maxResults = options.maxResults() == null ? DEFAULT_MAX_RESULTS : options.maxResults();
        var evidence = new ArrayList<Evidence>();
        for (var signal : positioned) {
            if (evidence.size() >= maxResults) {
                break;
            }
            if (Thread.currentThread().isInterrupted()) {
                logger.debug("LSP query interrupted after {} items", evidence.size());
                break;
            }
            var path = signal.metadataString(Signal.META_PATH).orElseThrow();
            int line = Math.max(0, signal.metadataInt(Signal.META_LINE).orElseThrow() - 1);
            int character = signal.metadataInt(Signal.META_CHARACTER).orElse(0);

            var definitions = await(c.definition(path, line, character), definitionTimeout, "definition", signal);
            evidence.addAll(toEvidence(definitions, signal, SymbolKind.DEFINITION, DEFINITION_WEIGHT, options));

            var references =
                    await(c.references(path, line, character, false), referenceTimeout, "references", signal);
            evidence.addAll(toEvidence(references, signal, SymbolKind.REFERENCE, REFERENCE_WEIGHT, options));
        }

        var deduped = new LinkedHashMap<String, Evidence>();
        for (var item : evidence) {
            deduped.putIfAbsent(item.locationKey(), item);
        }
        List<Evidence> result = new ArrayList<>(deduped.values());
        if (result.size() > maxResults) {
            result = result.subList(0, maxResults);
        }
        if (options.maxTokens() != null) {
            result = TokenBudget.apply(result, options.maxTokens());
        }
        logger.debug("LSP provider: {} positioned signals, {} evidence items", positioned.size(), result.size());
        return List.copyOf(result);
    }

    private List<Location> await(
            CompletableFuture<List<Location>> future, Duration timeout, String what, Signal signal) {
        try {
            var locations = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return locations == null ? List.of() : locations;
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("LSP {} lookup for '{}' timed out after {}", what, signal.value(), timeout);
            return List.of();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return List.of();
        } catch (ExecutionException | RuntimeException e) {
            logger.warn("LSP {} lookup for '{}' failed: {}", what, signal.value(), e.getMessage());
            return List.of();
        }
    }

    private List<Evidence> toEvidence(
            List<Location> locations, Signal signal, SymbolKind kind, double weight, ProviderQueryOptions options) {
        var result = new ArrayList<Evidence>();
        int contextLines = options.contextLinesOr(defaultContextLines);
        for (var location : locations) {
            var path = uriToPath(location.getUri()).map(this::relativeToWorkspace);
            if (path.isEmpty() || !options.accepts(path.get())) {
                continue;
            }
            int startLine = Math.max(1, location.getRange().getStart().getLine() + 1 - contextLines);
            int endLine = Math.max(startLine, location.getRange().getEnd().getLine() + 1 + contextLines);
            var range = new LineRange(startLine, endLine);
            var content = readRange(path.get(), range)
                    .orElse("[LSP " + kind.name().toLowerCase(Locale.ROOT) + ": " + signal.value() + "]");

            var metadata = EvidenceMetadata.forSymbol(kind);
            if (signal.stackDepth().isPresent()) {
                metadata = metadata.withStackDepth(signal.stackDepth().getAsInt());
            }
            result.add(new Evidence(
                    Evidence.newId(),
                    ProviderType.LSP,
                    path.get(),
                    range,
                    content,
                    TokenBudget.estimateTokens(content),
                    weight * signal.confidence(),
                    List.of(signal),
                    metadata));
        }
        return result;
    }

    static Optional<String> uriToPath(@Nullable String uri) {
        if (uri == null || uri.isBlank()) {
            return Optional.empty();
        }
        if (!uri.startsWith("file:")) {
            return Optional.of(uri);
        }
        try {
            return Optional.of(Path.of(URI.create(uri)).toString());
        } catch (IllegalArgumentException e) {
            logger.debug("Unparseable LSP uri {}", uri);
            return Optional.empty();
        }
    }

    private String relativeToWorkspace(String path) {
        try {
            var p = Path.of(path);
            if (p.isAbsolute() && p.normalize().startsWith(workspaceRoot)) {
                return workspaceRoot.relativize(p.normalize()).toString().replace('\\', '/');
            }
        } catch (InvalidPathException e) {
            logger.debug("Keeping unparseable LSP path {}", path);
        }
        return path;
    }

    /** The requested lines of a file under the workspace root, clamped to the file's length. */
    private Optional<String> readRange(String path, LineRange range) {
        try {
            var file = workspaceRoot.resolve(path).normalize();
            if (!file.startsWith(workspaceRoot) || !Files.isRegularFile(file)) {
                return Optional.empty();
            }
            var lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            if (range.start() > lines.size()) {
                return Optional.empty();
            }
            int end = Math.min(range.end(), lines.size());
            return Optional.of(String.join("\n", lines.subList(range.start() - 1, end)));
        } catch (IOException | InvalidPathException e) {
            logger.debug("Unable to read {} for LSP evidence: {}", path, e.getMessage());
            return Optional.empty();
        }
    }
}
