package ai.lodestar.config;

import ai.lodestar.evidence.providers.LspClient;
import ai.lodestar.evidence.providers.LspProvider;
import ai.lodestar.evidence.providers.SearchBackend;
import ai.lodestar.evidence.providers.SearchProvider;
import ai.lodestar.intent.TaskIntentClassifier;
import ai.lodestar.strategy.IntentStrategyProvider;
import ai.lodestar.strategy.StrategyOverrides;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Tunables for retrieval, read from {@code lodestar.properties} on the classpath and optionally overlaid by a user
 * file. Missing or malformed values fall back to the built-in defaults with a warning.
 */
public record EvidenceSettings(
        int totalTokenBudget,
        Duration providerTimeout,
        Duration deadline,
        int parallelism,
        double classifierMinConfidence,
        Duration lspDefinitionTimeout,
        Duration lspReferenceTimeout,
        int lspContextLines,
        int searchMaxResultsPerSignal,
        int searchContextLines,
        @Nullable Path strategyOverridesFile) {

    private static final Logger logger = LogManager.getLogger(EvidenceSettings.class);

    public static final String RESOURCE = "lodestar.properties";

    public static final String TOTAL_TOKEN_BUDGET = "evidence.totalTokenBudget";
    public static final String PROVIDER_TIMEOUT_MS = "evidence.providerTimeoutMs";
    public static final String DEADLINE_MS = "evidence.deadlineMs";
    public static final String PARALLELISM = "evidence.parallelism";
    public static final String MIN_CONFIDENCE = "classifier.minConfidence";
    public static final String LSP_DEFINITION_TIMEOUT_MS = "lsp.definitionTimeoutMs";
    public static final String LSP_REFERENCE_TIMEOUT_MS = "lsp.referenceTimeoutMs";
    public static final String LSP_CONTEXT_LINES = "lsp.contextLines";
    public static final String SEARCH_MAX_RESULTS_PER_SIGNAL = "search.maxResultsPerSignal";
    public static final String SEARCH_CONTEXT_LINES = "search.contextLines";
    public static final String STRATEGY_OVERRIDES_FILE = "strategy.overridesFile";

    public static final EvidenceSettings DEFAULTS = new EvidenceSettings(
            8000,
            Duration.ofMillis(5000),
            Duration.ofMillis(15000),
            3,
            TaskIntentClassifier.DEFAULT_MIN_CONFIDENCE,
            LspProvider.DEFAULT_DEFINITION_TIMEOUT,
            LspProvider.DEFAULT_REFERENCE_TIMEOUT,
            LspProvider.DEFAULT_CONTEXT_LINES,
            SearchProvider.DEFAULT_MAX_RESULTS_PER_SIGNAL,
            SearchProvider.DEFAULT_CONTEXT_LINES,
            null);

    /** Classpath defaults only. */
    public static EvidenceSettings load() {
        return fromProperties(classpathProperties());
    }

    /** Classpath defaults overlaid by {@code userFile}; an unreadable file is logged and ignored. */
    public static EvidenceSettings load(Path userFile) {
        var props = classpathProperties();
        if (Files.exists(userFile)) {
            try (var reader = Files.newBufferedReader(userFile)) {
                props.load(reader);
            } catch (IOException e) {
                logger.warn("Unable to read settings from {}, using defaults: {}", userFile, e.getMessage());
            }
        }
        return fromProperties(props);
    }

    public static EvidenceSettings fromProperties(Properties props) {
        return new EvidenceSettings(
                readInt(props, TOTAL_TOKEN_BUDGET, DEFAULTS.totalTokenBudget, 0),
                readMillis(props, PROVIDER_TIMEOUT_MS, DEFAULTS.providerTimeout),
                readMillis(props, DEADLINE_MS, DEFAULTS.deadline),
                readInt(props, PARALLELISM, DEFAULTS.parallelism, 1),
                readConfidence(props, MIN_CONFIDENCE, DEFAULTS.classifierMinConfidence),
                readMillis(props, LSP_DEFINITION_TIMEOUT_MS, DEFAULTS.lspDefinitionTimeout),
                readMillis(props, LSP_REFERENCE_TIMEOUT_MS, DEFAULTS.lspReferenceTimeout),
                readInt(props, LSP_CONTEXT_LINES, DEFAULTS.lspContextLines, 0),
                readInt(props, SEARCH_MAX_RESULTS_PER_SIGNAL, DEFAULTS.searchMaxResultsPerSignal, 1),
                readInt(props, SEARCH_CONTEXT_LINES, DEFAULTS.searchContextLines, 0),
                readPath(props, STRATEGY_OVERRIDES_FILE));
    }

    public TaskIntentClassifier newClassifier() {
        return new TaskIntentClassifier(classifierMinConfidence);
    }

    /** A strategy provider with the configured overrides file applied; a bad file is logged and skipped. */
    public IntentStrategyProvider newStrategyProvider() {
        var file = strategyOverridesFile;
        if (file == null) {
            return new IntentStrategyProvider();
        }
        try {
            return new IntentStrategyProvider(StrategyOverrides.load(file));
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("Ignoring strategy overrides in {}: {}", file, e.getMessage());
            return new IntentStrategyProvider();
        }
    }

    public LspProvider newLspProvider(Path workspaceRoot, @Nullable LspClient client) {
        return new LspProvider(workspaceRoot, client, lspDefinitionTimeout, lspReferenceTimeout, lspContextLines);
    }

    public SearchProvider newSearchProvider(SearchBackend backend, List<String> include, List<String> exclude) {
        return new SearchProvider(backend, include, exclude, searchMaxResultsPerSignal, searchContextLines);
    }

    private static Properties classpathProperties() {
        var props = new Properties();
        try (InputStream in = EvidenceSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                logger.warn("{} not found on classpath, using built-in defaults", RESOURCE);
            } else {
                props.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + RESOURCE, e);
        }
        return props;
    }

    private static int readInt(Properties props, String key, int fallback, int min) {
        var raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value >= min) {
                return value;
            }
        } catch (NumberFormatException e) {
            // fall through
        }
        logger.warn("Invalid value '{}' for {}, using {}", raw, key, fallback);
        return fallback;
    }

    private static Duration readMillis(Properties props, String key, Duration fallback) {
        int millis = readInt(props, key, (int) fallback.toMillis(), 1);
        return Duration.ofMillis(millis);
    }

    private static double readConfidence(Properties props, String key, double fallback) {
        var raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            if (value >= 0.0 && value <= 1.0) {
                return value;
            }
        } catch (NumberFormatException e) {
            // fall through
        }
        logger.warn("Invalid value '{}' for {}, using {}", raw, key, fallback);
        return fallback;
    }

    private static @Nullable Path readPath(Properties props, String key) {
        var raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Path.of(raw.trim());
        } catch (InvalidPathException e) {
            logger.warn("Invalid path '{}' for {}", raw, key);
            return null;
        }
    }
}
