package ai.lodestar.evidence;

import ai.lodestar.exception.InvalidInputException;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A bounded excerpt of code or context that may be injected into a prompt.
 *
 * <p>Evidence is created fresh by a provider for each query and is owned by the orchestrator once returned.
 */
public record Evidence(
        String id,
        ProviderType provider,
        String path,
        LineRange range,
        String content,
        int tokens,
        double baseScore,
        List<Signal> matchedSignals,
        EvidenceMetadata metadata) {

    public Evidence {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(range, "range");
        Objects.requireNonNull(content, "content");
        InvalidInputException.check(tokens >= 0, "tokens must be >= 0: " + tokens);
        InvalidInputException.check(
                baseScore >= 0.0 && !Double.isNaN(baseScore), "baseScore must be >= 0: " + baseScore);
        matchedSignals = List.copyOf(matchedSignals);
        metadata = metadata == null ? EvidenceMetadata.EMPTY : metadata;
    }

    public static String newId() {
        return UUID.randomUUID().toString();
    }

    /** Key used to deduplicate evidence pointing at the same lines of the same file. */
    public String locationKey() {
        return path + ":" + range.key();
    }

    public boolean fromStackTrace() {
        return matchedSignals.stream().anyMatch(Signal::fromStackTrace);
    }

    public Evidence withBaseScore(double score) {
        return new Evidence(id, provider, path, range, content, tokens, score, matchedSignals, metadata);
    }

    public Evidence withMatchedSignals(List<Signal> signals, EvidenceMetadata newMetadata) {
        return new Evidence(id, provider, path, range, content, tokens, baseScore, signals, newMetadata);
    }
}
