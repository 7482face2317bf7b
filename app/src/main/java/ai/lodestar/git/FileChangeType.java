package ai.lodestar.git;

public enum FileChangeType {
    ADDED,
    MODIFIED,
    DELETED,
    RENAMED
}
