package ai.lodestar.util;

import com.github.difflib.DiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.ChangeDelta;
import com.github.difflib.patch.DeleteDelta;
import com.github.difflib.patch.InsertDelta;
import com.github.difflib.patch.Patch;
import java.util.Arrays;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public final class ContentDiffUtils {
    private static final Logger logger = LogManager.getLogger(ContentDiffUtils.class);

    private ContentDiffUtils() {}

    public record ChangeCounts(int added, int deleted) {
        public static final ChangeCounts NONE = new ChangeCounts(0, 0);
    }

    /**
     * Count added/deleted lines between two strings using java-diff-utils. A changed line counts once on each side.
     *
     * @param oldContent baseline content
     * @param newContent revised content
     */
    public static ChangeCounts countChanges(String oldContent, String newContent) {
        var oldLines = toLines(oldContent);
        var newLines = toLines(newContent);

        Patch<String> patch = DiffUtils.diff(oldLines, newLines);
        if (patch.getDeltas().isEmpty()) {
            return ChangeCounts.NONE;
        }

        int added = 0;
        int deleted = 0;
        for (AbstractDelta<String> delta : patch.getDeltas()) {
            if (delta instanceof InsertDelta<String> id) {
                added += id.getTarget().size();
            } else if (delta instanceof DeleteDelta<String> dd) {
                deleted += dd.getSource().size();
            } else if (delta instanceof ChangeDelta<String> cd) {
                added += cd.getTarget().size();
                deleted += cd.getSource().size();
            }
        }

        if (logger.isTraceEnabled()) {
            logger.trace(
                    "countChanges: deltas={} added={} deleted={} (oldLines={}, newLines={})",
                    patch.getDeltas().size(),
                    added,
                    deleted,
                    oldLines.size(),
                    newLines.size());
        }
        return new ChangeCounts(added, deleted);
    }

    private static List<String> toLines(String content) {
        if (content.isEmpty()) {
            return List.of();
        }
        // Split on any line break, preserving trailing empty strings
        // which indicate a final newline.
        return Arrays.asList(content.split("\\R", -1));
    }
}
