package ai.lodestar.rerank;

import ai.lodestar.evidence.ProviderType;
import java.util.Locale;
import org.jetbrains.annotations.Nullable;

/** What happened to one provider during a retrieval cycle. */
public record ProviderOutcome(
        ProviderType type, String name, int subBudget, Status status, int evidenceCount, @Nullable String detail) {

    public enum Status {
        OK,
        EMPTY,
        UNAVAILABLE,
        FAILED,
        TIMED_OUT,
        SKIPPED;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
