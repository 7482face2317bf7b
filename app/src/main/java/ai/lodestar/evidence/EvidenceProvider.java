package ai.lodestar.evidence;

import java.util.List;
import org.jetbrains.annotations.Blocking;

/**
 * A source of evidence (recent diffs, language-server lookups, full-text search).
 *
 * <p>Implementations must not throw from {@link #isAvailable()} or {@link #query}: backend failures degrade to an empty
 * or partial result. Both methods may block; the orchestrator calls them off the caller's thread and interrupts them
 * when the retrieval cycle is cancelled or times out.
 */
public interface EvidenceProvider {
    ProviderType type();

    /** Human-readable name, used in logs. */
    String name();

    /** Static trust level; becomes the base score of the evidence this provider returns. */
    double baseWeight();

    @Blocking
    boolean isAvailable();

    @Blocking
    List<Evidence> query(List<Signal> signals, ProviderQueryOptions options);

    @Blocking
    default List<Evidence> query(List<Signal> signals) {
        return query(signals, ProviderQueryOptions.DEFAULT);
    }
}
