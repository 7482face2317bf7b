package ai.lodestar.git;

import java.util.List;

/** Lightweight summary of the paths changed since a snapshot. */
public record SnapshotPatch(String snapshotHash, List<String> files) {
    public SnapshotPatch {
        files = List.copyOf(files);
    }
}
