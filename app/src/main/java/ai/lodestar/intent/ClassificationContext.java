package ai.lodestar.intent;

import java.util.List;

/**
 * Situational flags that sharpen classification beyond the task text.
 *
 * @param errorPresent the session has a failing command or error output in view
 * @param testFile the user is looking at a test file
 * @param recentFiles recently touched paths, most recent first
 */
public record ClassificationContext(boolean errorPresent, boolean testFile, List<String> recentFiles) {
    public static final ClassificationContext EMPTY = new ClassificationContext(false, false, List.of());

    public ClassificationContext {
        recentFiles = recentFiles == null ? List.of() : List.copyOf(recentFiles);
    }

    public static ClassificationContext withError() {
        return new ClassificationContext(true, false, List.of());
    }
}
