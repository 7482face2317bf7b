package ai.lodestar.evidence;

import org.jetbrains.annotations.Nullable;

/** Provider-specific annotations on an {@link Evidence}; absent fields are null. */
public record EvidenceMetadata(
        @Nullable ChangeType changeType,
        @Nullable SymbolKind symbolKind,
        @Nullable Integer matchCount,
        @Nullable Integer stackDepth,
        @Nullable Integer linesAdded,
        @Nullable Integer linesDeleted) {

    public static final EvidenceMetadata EMPTY = new EvidenceMetadata(null, null, null, null, null, null);

    public static EvidenceMetadata forChange(ChangeType changeType, int linesAdded, int linesDeleted) {
        return new EvidenceMetadata(changeType, null, null, null, linesAdded, linesDeleted);
    }

    public static EvidenceMetadata forSymbol(SymbolKind kind) {
        return new EvidenceMetadata(null, kind, null, null, null, null);
    }

    public static EvidenceMetadata forMatches(int matchCount) {
        return new EvidenceMetadata(null, null, matchCount, null, null, null);
    }

    public EvidenceMetadata withMatchCount(@Nullable Integer count) {
        return new EvidenceMetadata(changeType, symbolKind, count, stackDepth, linesAdded, linesDeleted);
    }

    public EvidenceMetadata withStackDepth(@Nullable Integer depth) {
        return new EvidenceMetadata(changeType, symbolKind, matchCount, depth, linesAdded, linesDeleted);
    }
}
