package ai.lodestar.evidence;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Case-insensitive include/exclude matching for repository paths.
 *
 * <p>A pattern containing {@code *} is a glob where each {@code *} matches any run of characters (including
 * separators) and must match the whole normalized path. Any other pattern matches when it occurs anywhere in the path.
 */
public final class PathPatterns {
    private static final ConcurrentHashMap<String, Pattern> GLOB_CACHE = new ConcurrentHashMap<>();

    private PathPatterns() {}

    /** Forward slashes, lower case. */
    public static String normalize(String path) {
        return path.replace('\\', '/').toLowerCase(Locale.ROOT);
    }

    public static boolean matches(String path, String pattern) {
        var normalizedPath = normalize(path);
        var normalizedPattern = normalize(pattern);
        if (normalizedPattern.isEmpty()) {
            return false;
        }
        if (normalizedPattern.indexOf('*') < 0) {
            return normalizedPath.contains(normalizedPattern);
        }
        return GLOB_CACHE
                .computeIfAbsent(normalizedPattern, PathPatterns::compileGlob)
                .matcher(normalizedPath)
                .matches();
    }

    public static boolean matchesAny(String path, List<String> patterns) {
        for (var pattern : patterns) {
            if (matches(path, pattern)) {
                return true;
            }
        }
        return false;
    }

    private static Pattern compileGlob(String glob) {
        var sb = new StringBuilder();
        int start = 0;
        int star;
        while ((star = glob.indexOf('*', start)) >= 0) {
            if (star > start) {
                sb.append(Pattern.quote(glob.substring(start, star)));
            }
            sb.append(".*");
            start = star + 1;
        }
        if (start < glob.length()) {
            sb.append(Pattern.quote(glob.substring(start)));
        }
        return Pattern.compile(sb.toString(), Pattern.DOTALL);
    }
}
