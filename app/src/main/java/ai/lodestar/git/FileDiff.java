package ai.lodestar.git;

import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * One changed file between a snapshot and the current working tree.
 *
 * @param path repository-relative path after the change (the old path for deletions)
 * @param oldPath previous path, set for renames
 * @param beforeContent text at the snapshot, null for additions and binary files
 * @param afterContent text now, null for deletions and binary files
 */
public record FileDiff(
        String path,
        @Nullable String oldPath,
        FileChangeType type,
        @Nullable String beforeContent,
        @Nullable String afterContent) {

    public FileDiff {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(type, "type");
    }

    public static FileDiff added(String path, String afterContent) {
        return new FileDiff(path, null, FileChangeType.ADDED, null, afterContent);
    }

    public static FileDiff modified(String path, String beforeContent, String afterContent) {
        return new FileDiff(path, null, FileChangeType.MODIFIED, beforeContent, afterContent);
    }

    public static FileDiff deleted(String path, String beforeContent) {
        return new FileDiff(path, null, FileChangeType.DELETED, beforeContent, null);
    }

    public static FileDiff renamed(String oldPath, String path, @Nullable String beforeContent, String afterContent) {
        return new FileDiff(path, oldPath, FileChangeType.RENAMED, beforeContent, afterContent);
    }

    /** The content that best represents the file now: after-content, or before-content for deletions. */
    public @Nullable String currentContent() {
        return type == FileChangeType.DELETED ? beforeContent : afterContent;
    }
}
