package ai.lodestar.evidence.providers;

import ai.lodestar.evidence.Evidence;
import ai.lodestar.evidence.EvidenceMetadata;
import ai.lodestar.evidence.EvidenceProvider;
import ai.lodestar.evidence.LineRange;
import ai.lodestar.evidence.ProviderQueryOptions;
import ai.lodestar.evidence.ProviderType;
import ai.lodestar.evidence.Signal;
import ai.lodestar.evidence.SignalType;
import ai.lodestar.evidence.TokenBudget;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.TreeMap;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Evidence from full-text search: symbols are searched as whole words (case-sensitive), error tokens as literal
 * case-insensitive text. Path signals are ignored here; the diff and LSP providers resolve files directly.
 *
 * <p>Nearby matches in a file are merged into one excerpt, scored {@code baseWeight * log2(matches + 1)}.
 */
public final class SearchProvider implements EvidenceProvider {
    private static final Logger logger = LogManager.getLogger(SearchProvider.class);

    public static final double BASE_WEIGHT = 10;
    public static final int DEFAULT_MAX_RESULTS_PER_SIGNAL = 10;
    public static final int DEFAULT_CONTEXT_LINES = 3;

    private final SearchBackend backend;
    private final List<String> includePatterns;
    private final List<String> excludePatterns;
    private final int maxResultsPerSignal;
    private final int defaultContextLines;

    public SearchProvider(SearchBackend backend) {
        this(backend, List.of(), List.of(), DEFAULT_MAX_RESULTS_PER_SIGNAL, DEFAULT_CONTEXT_LINES);
    }

    public SearchProvider(
            SearchBackend backend,
            List<String> includePatterns,
            List<String> excludePatterns,
            int maxResultsPerSignal,
            int defaultContextLines) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.includePatterns = List.copyOf(includePatterns);
        this.excludePatterns = List.copyOf(excludePatterns);
        this.maxResultsPerSignal = maxResultsPerSignal;
        this.defaultContextLines = defaultContextLines;
    }

    @Override
    public ProviderType type() {
        return ProviderType.SEARCH;
    }

    @Override
    public String name() {
        return "Code Search";
    }

    @Override
    public double baseWeight() {
        return BASE_WEIGHT;
    }

    @Override
    public boolean isAvailable() {
        try {
            return backend.isAvailable();
        } catch (RuntimeException e) {
            logger.debug("Search backend probe failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public List<Evidence> query(List<Signal> signals, ProviderQueryOptions options) {
        var searchable = signals.stream().filter(SearchProvider::isSearchable).toList();
        if (searchable.isEmpty()) {
            return List.of();
        }
        var includes = merge(includePatterns, options.includePatterns());
        var excludes = merge(excludePatterns, options.excludePatterns());
        int contextLines = options.contextLinesOr(defaultContextLines);

        var byLocation = new LinkedHashMap<String, Evidence>();
        for (var signal : searchable) {
            var request = toRequest(signal, includes, excludes, contextLines);
            List<SearchMatch> matches;
            try {
                matches = backend.search(request);
            } catch (SearchBackendException | RuntimeException e) {
                logger.warn("Search for '{}' failed: {}", signal.value(), e.getMessage());
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.debug("Search interrupted at '{}'", signal.value());
                break;
            }
            for (var item : toEvidence(matches, signal, contextLines)) {
                byLocation.merge(item.locationKey(), item, SearchProvider::combine);
            }
        }

        List<Evidence> result = byLocation.values().stream()
                .sorted(Comparator.comparingDouble(Evidence::baseScore).reversed())
                .toList();
        if (options.maxResults() != null && result.size() > options.maxResults()) {
            result = result.subList(0, options.maxResults());
        }
        if (options.maxTokens() != null) {
            result = TokenBudget.apply(result, options.maxTokens());
        }
        logger.debug("Search provider: {} searchable signals, {} evidence items", searchable.size(), result.size());
        return List.copyOf(result);
    }

    static boolean isSearchable(Signal signal) {
        return switch (signal.type()) {
            case SYMBOL -> signal.value().length() >= 2;
            case ERROR_TOKEN -> signal.value().length() >= 3;
            case PATH -> false;
        };
    }

    private SearchRequest toRequest(Signal signal, List<String> includes, List<String> excludes, int contextLines) {
        boolean symbol = signal.is(SignalType.SYMBOL);
        var quoted = Pattern.quote(signal.value());
        var pattern = symbol ? "\\b" + quoted + "\\b" : quoted;
        return new SearchRequest(pattern, symbol, includes, excludes, contextLines, maxResultsPerSignal);
    }

    private static List<String> merge(List<String> first, List<String> second) {
        var merged = new LinkedHashSet<String>(first);
        merged.addAll(second);
        return List.copyOf(merged);
    }

    /** Same location found by two signals: keep the better score, union the signals and add up the matches. */
    static Evidence combine(Evidence existing, Evidence incoming) {
        var signals = new ArrayList<>(existing.matchedSignals());
        for (var s : incoming.matchedSignals()) {
            if (signals.stream().noneMatch(s::sameFact)) {
                signals.add(s);
            }
        }
        int count = Objects.requireNonNullElse(existing.metadata().matchCount(), 1)
                + Objects.requireNonNullElse(incoming.metadata().matchCount(), 1);
        return existing.withBaseScore(Math.max(existing.baseScore(), incoming.baseScore()))
                .withMatchedSignals(signals, existing.metadata().withMatchCount(count));
    }

    private static List<Evidence> toEvidence(List<SearchMatch> matches, Signal signal, int contextLines) {
        var byFile = new LinkedHashMap<String, List<SearchMatch>>();
        for (var match : matches) {
            byFile.computeIfAbsent(match.file(), k -> new ArrayList<>()).add(match);
        }
        var evidence = new ArrayList<Evidence>();
        for (var entry : byFile.entrySet()) {
            for (var group : groupNearby(entry.getValue(), contextLines)) {
                var content = renderGroup(group);
                var first = group.get(0).line();
                var last = group.get(group.size() - 1).line();
                var range = new LineRange(Math.max(1, first - contextLines), Math.max(1, last + contextLines));
                evidence.add(new Evidence(
                        Evidence.newId(),
                        ProviderType.SEARCH,
                        entry.getKey(),
                        range,
                        content,
                        TokenBudget.estimateTokens(content),
                        BASE_WEIGHT * log2(group.size() + 1),
                        List.of(signal),
                        EvidenceMetadata.forMatches(group.size())));
            }
        }
        return evidence;
    }

    /** Splits one file's matches into runs whose context windows overlap or touch. */
    static List<List<SearchMatch>> groupNearby(List<SearchMatch> matches, int contextLines) {
        var sorted = matches.stream().sorted(Comparator.comparingInt(SearchMatch::line)).toList();
        var groups = new ArrayList<List<SearchMatch>>();
        List<SearchMatch> current = new ArrayList<>();
        int currentEnd = Integer.MIN_VALUE;
        for (var match : sorted) {
            int start = Math.max(1, match.line() - contextLines);
            if (!current.isEmpty() && start > currentEnd + 1) {
                groups.add(current);
                current = new ArrayList<>();
            }
            current.add(match);
            currentEnd = Math.max(currentEnd, match.line() + contextLines);
        }
        if (!current.isEmpty()) {
            groups.add(current);
        }
        return groups;
    }

    /** Match lines plus their context, each source line once, in file order. */
    private static String renderGroup(List<SearchMatch> group) {
        var lines = new TreeMap<Integer, String>();
        for (var match : group) {
            for (int i = 0; i < match.before().size(); i++) {
                lines.putIfAbsent(match.line() - match.before().size() + i, match.before().get(i));
            }
            lines.put(match.line(), match.content());
            for (int i = 0; i < match.after().size(); i++) {
                lines.putIfAbsent(match.line() + 1 + i, match.after().get(i));
            }
        }
        return String.join("\n", lines.values());
    }

    private static double log2(int x) {
        return Math.log(x) / Math.log(2);
    }
}
