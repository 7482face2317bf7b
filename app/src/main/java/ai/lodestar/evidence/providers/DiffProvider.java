package ai.lodestar.evidence.providers;

import ai.lodestar.evidence.ChangeType;
import ai.lodestar.evidence.Evidence;
import ai.lodestar.evidence.EvidenceMetadata;
import ai.lodestar.evidence.EvidenceProvider;
import ai.lodestar.evidence.LineRange;
import ai.lodestar.evidence.PathPatterns;
import ai.lodestar.evidence.ProviderQueryOptions;
import ai.lodestar.evidence.ProviderType;
import ai.lodestar.evidence.Signal;
import ai.lodestar.evidence.TokenBudget;
import ai.lodestar.git.FileChangeType;
import ai.lodestar.git.FileDiff;
import ai.lodestar.git.SnapshotDiffException;
import ai.lodestar.git.SnapshotDiffService;
import ai.lodestar.util.ContentDiffUtils;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Surfaces files changed since a snapshot as evidence. Recent edits are the most trusted source, so this provider
 * carries the highest base weight.
 *
 * <p>Signals act as an optional filter: with no signals every changed file is returned, otherwise only files matched
 * by at least one signal.
 */
public final class DiffProvider implements EvidenceProvider {
    private static final Logger logger = LogManager.getLogger(DiffProvider.class);

    public static final double BASE_WEIGHT = 100;

    private final SnapshotDiffService diffService;
    private volatile @Nullable String snapshotHash;

    public DiffProvider(SnapshotDiffService diffService) {
        this(diffService, null);
    }

    public DiffProvider(SnapshotDiffService diffService, @Nullable String snapshotHash) {
        this.diffService = Objects.requireNonNull(diffService, "diffService");
        this.snapshotHash = snapshotHash;
    }

    @Override
    public ProviderType type() {
        return ProviderType.DIFF;
    }

    @Override
    public String name() {
        return "Git Diff";
    }

    @Override
    public double baseWeight() {
        return BASE_WEIGHT;
    }

    /** Changes the reference point for later queries. Not validated here; {@link #isAvailable()} is the check. */
    public void setSnapshotHash(@Nullable String hash) {
        this.snapshotHash = hash;
    }

    public @Nullable String getSnapshotHash() {
        return snapshotHash;
    }

    @Override
    public boolean isAvailable() {
        var hash = snapshotHash;
        if (hash == null) {
            return false;
        }
        try {
            diffService.patch(hash);
            return true;
        } catch (SnapshotDiffException | RuntimeException e) {
            logger.debug("Diff backend unavailable for snapshot {}: {}", hash, e.getMessage());
            return false;
        }
    }

    @Override
    public List<Evidence> query(List<Signal> signals, ProviderQueryOptions options) {
        var hash = snapshotHash;
        if (hash == null) {
            return List.of();
        }

        List<FileDiff> diffs;
        try {
            diffs = diffService.diffFull(hash);
        } catch (SnapshotDiffException | RuntimeException e) {
            logger.warn("Unable to diff against snapshot {}: {}", hash, e.getMessage());
            return List.of();
        }

        var evidence = new ArrayList<Evidence>();
        for (var diff : diffs) {
            if (!options.accepts(diff.path())) {
                logger.trace("Filtered out {}", diff.path());
                continue;
            }
            var content = Objects.requireNonNullElse(diff.currentContent(), "");
            var matched = matchSignals(diff, content, signals);
            if (!signals.isEmpty() && matched.isEmpty()) {
                continue;
            }
            evidence.add(toEvidence(diff, content, matched.isEmpty() ? signals : matched));
        }

        List<Evidence> result = evidence;
        if (options.maxResults() != null && result.size() > options.maxResults()) {
            result = result.subList(0, options.maxResults());
        }
        if (options.maxTokens() != null) {
            result = TokenBudget.apply(result, options.maxTokens());
        }
        logger.debug("Diff provider: {} changed files, {} evidence items", diffs.size(), result.size());
        return List.copyOf(result);
    }

    private Evidence toEvidence(FileDiff diff, String content, List<Signal> matchedSignals) {
        var changeType =
                switch (diff.type()) {
                    case ADDED -> ChangeType.ADDED;
                    case DELETED -> ChangeType.DELETED;
                    case MODIFIED, RENAMED -> ChangeType.MODIFIED;
                };
        var counts = ContentDiffUtils.countChanges(
                Objects.requireNonNullElse(diff.beforeContent(), ""),
                Objects.requireNonNullElse(diff.afterContent(), ""));
        return new Evidence(
                Evidence.newId(),
                ProviderType.DIFF,
                diff.path(),
                LineRange.wholeContent(content),
                content,
                TokenBudget.estimateTokens(content),
                BASE_WEIGHT,
                matchedSignals,
                EvidenceMetadata.forChange(changeType, counts.added(), counts.deleted()));
    }

    static List<Signal> matchSignals(FileDiff diff, String content, List<Signal> signals) {
        var matched = new ArrayList<Signal>();
        for (var signal : signals) {
            boolean hit =
                    switch (signal.type()) {
                        case PATH -> pathMatches(diff.path(), signal.value())
                                || (diff.type() == FileChangeType.RENAMED
                                        && diff.oldPath() != null
                                        && pathMatches(diff.oldPath(), signal.value()));
                        case SYMBOL -> containsWord(content, signal.value());
                        case ERROR_TOKEN -> content.toLowerCase(Locale.ROOT)
                                .contains(signal.value().toLowerCase(Locale.ROOT));
                    };
            if (hit) {
                matched.add(signal);
            }
        }
        return matched;
    }

    static boolean pathMatches(String filePath, String signalValue) {
        var path = PathPatterns.normalize(filePath);
        var wanted = PathPatterns.normalize(signalValue);
        if (wanted.isEmpty()) {
            return false;
        }
        return path.equals(wanted) || path.endsWith("/" + wanted) || path.contains(wanted);
    }

    static boolean containsWord(String content, String word) {
        if (word.isEmpty()) {
            return false;
        }
        return Pattern.compile("\\b" + Pattern.quote(word) + "\\b")
                .matcher(content)
                .find();
    }
}
