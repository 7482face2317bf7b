package ai.lodestar.git;

import java.util.List;
import org.jetbrains.annotations.Blocking;

/** Versioned-snapshot diff backend consumed by the diff evidence provider. */
public interface SnapshotDiffService {
    /** Full structured diff of the working state against {@code snapshotHash}. */
    @Blocking
    List<FileDiff> diffFull(String snapshotHash) throws SnapshotDiffException;

    /** Cheap summary of the same diff; used to probe availability. */
    @Blocking
    SnapshotPatch patch(String snapshotHash) throws SnapshotDiffException;
}
