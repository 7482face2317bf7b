package ai.lodestar.evidence;

/** Change classification reported on diff evidence; renames are folded into {@link #MODIFIED}. */
public enum ChangeType {
    ADDED,
    MODIFIED,
    DELETED
}
