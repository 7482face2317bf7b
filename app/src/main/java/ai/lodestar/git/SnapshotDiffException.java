package ai.lodestar.git;

public class SnapshotDiffException extends Exception {
    public SnapshotDiffException(String message) {
        super(message);
    }

    public SnapshotDiffException(String message, Throwable cause) {
        super(message, cause);
    }
}
