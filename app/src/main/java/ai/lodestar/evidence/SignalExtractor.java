package ai.lodestar.evidence;

import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Pulls {@link Signal}s out of a task description and, optionally, the error output that accompanied it.
 *
 * <p>Recognizes file paths, identifiers (backticked, camelCase, PascalCase, snake_case), error type names, and Java or
 * JavaScript stack frames. Frames yield a {@code path} signal plus a {@code symbol} signal for the called function,
 * both tagged with their depth (0 for the innermost frame). Results are deduplicated, first occurrence wins.
 */
public final class SignalExtractor {
    private static final Logger logger = LogManager.getLogger(SignalExtractor.class);

    public static final double PATH_CONFIDENCE = 0.9;
    public static final double SYMBOL_CONFIDENCE = 0.7;
    public static final double ERROR_TOKEN_CONFIDENCE = 0.8;
    public static final double STACK_FRAME_CONFIDENCE = 1.0;

    private static final Set<String> CODE_EXTENSIONS = Set.of(
            "java", "kt", "kts", "scala", "groovy", "ts", "tsx", "js", "jsx", "mjs", "cjs", "py", "rb", "go", "rs",
            "c", "h", "cc", "cpp", "hpp", "cs", "swift", "php", "json", "yaml", "yml", "xml", "toml", "md", "sql",
            "sh", "gradle", "properties", "html", "css", "scss", "vue", "svelte");

    // Group 1: path, group 2: extension
    private static final Pattern PATH_PATTERN =
            Pattern.compile("(?<![\\w./\\\\-])((?:[\\w.-]+[/\\\\])*[\\w-]+(?:\\.[\\w-]+)*\\.([A-Za-z][A-Za-z0-9]*))"
                    + "(?![\\w/\\\\])");
    private static final Pattern BACKTICK_PATTERN = Pattern.compile("`([A-Za-z_$][\\w$.]*)(?:\\(\\))?`");
    private static final Pattern IDENTIFIER_PATTERN = Pattern.compile(
            "\\b([a-z][a-z0-9]*[A-Z]\\w*|[A-Z][a-z0-9]+[A-Z]\\w*|[A-Za-z][a-z0-9]*_[A-Za-z0-9_]*[A-Za-z0-9])\\b");
    private static final Pattern ERROR_TYPE_PATTERN = Pattern.compile("\\b([A-Z][A-Za-z0-9]*(?:Error|Exception))\\b");

    // at com.example.Foo.bar(Foo.java:12)
    private static final Pattern JAVA_FRAME =
            Pattern.compile("^\\s*at\\s+([\\w$./]+)\\.([\\w$<>]+)\\(([^:()]+):(\\d+)\\)");
    // at fn (src/file.ts:12:5)  |  at src/file.ts:12:5
    private static final Pattern JS_FRAME =
            Pattern.compile("^\\s*at\\s+(?:(?:async\\s+)?([^\\s(]+)\\s+\\()?"
                    + "(?:file://)?([^\\s()]+?):(\\d+):(\\d+)\\)?\\s*$");

    private static final Splitter LINE_SPLITTER = Splitter.onPattern("\r?\n");

    public List<Signal> extract(String taskText) {
        return extract(taskText, null);
    }

    public List<Signal> extract(String taskText, @Nullable String errorOutput) {
        var signals = new ArrayList<Signal>();
        if (errorOutput != null && !errorOutput.isBlank()) {
            extractStackFrames(errorOutput, signals);
        }
        extractFromText(taskText, SignalSource.USER_MESSAGE, signals);
        if (errorOutput != null && !errorOutput.isBlank()) {
            extractFromText(stripFrames(errorOutput), SignalSource.ERROR_OUTPUT, signals);
        }
        logger.debug("Extracted {} signals", signals.size());
        return List.copyOf(signals);
    }

    private static void extractFromText(String text, SignalSource source, List<Signal> out) {
        var remaining = new StringBuilder(text);

        var paths = PATH_PATTERN.matcher(text);
        while (paths.find()) {
            var path = paths.group(1);
            if (looksLikePath(path, paths.group(2))) {
                add(out, new Signal(SignalType.PATH, path.replace('\\', '/'), source, PATH_CONFIDENCE));
                blank(remaining, paths);
            }
        }

        var errors = ERROR_TYPE_PATTERN.matcher(remaining);
        while (errors.find()) {
            add(out, new Signal(SignalType.ERROR_TOKEN, errors.group(1), source, ERROR_TOKEN_CONFIDENCE));
            blank(remaining, errors);
        }

        var backticked = BACKTICK_PATTERN.matcher(remaining);
        while (backticked.find()) {
            add(out, new Signal(SignalType.SYMBOL, backticked.group(1), source, SYMBOL_CONFIDENCE));
            blank(remaining, backticked);
        }

        var identifiers = IDENTIFIER_PATTERN.matcher(remaining);
        while (identifiers.find()) {
            add(out, new Signal(SignalType.SYMBOL, identifiers.group(1), source, SYMBOL_CONFIDENCE));
        }
    }

    private static boolean looksLikePath(String candidate, String extension) {
        if (CODE_EXTENSIONS.contains(extension.toLowerCase(Locale.ROOT))) {
            return true;
        }
        // Dotted names like a.b.C are qualified identifiers, not paths, unless a separator is present
        return candidate.indexOf('/') >= 0 || candidate.indexOf('\\') >= 0;
    }

    private static void extractStackFrames(String errorOutput, List<Signal> out) {
        int depth = 0;
        for (var line : LINE_SPLITTER.split(errorOutput)) {
            var java = JAVA_FRAME.matcher(line);
            if (java.find()) {
                var qualifiedClass = java.group(1);
                int slash = qualifiedClass.indexOf('/');
                if (slash >= 0) {
                    // module prefix, e.g. java.base/java.util.HashMap
                    qualifiedClass = qualifiedClass.substring(slash + 1);
                }
                int lastDot = qualifiedClass.lastIndexOf('.');
                var packagePath = lastDot < 0 ? "" : qualifiedClass.substring(0, lastDot).replace('.', '/') + "/";
                int lineNumber = parsePosition(java.group(4));
                if (lineNumber < 0) {
                    depth++;
                    continue;
                }
                addFrame(out, packagePath + java.group(3), java.group(2), lineNumber, 0, depth++);
                continue;
            }
            var js = JS_FRAME.matcher(line);
            if (js.find()) {
                var file = js.group(2);
                if (file.startsWith("node:") || file.contains("node_modules/")) {
                    depth++;
                    continue;
                }
                var function = js.group(1);
                if (function != null) {
                    int dot = function.lastIndexOf('.');
                    function = dot >= 0 ? function.substring(dot + 1) : function;
                }
                int lineNumber = parsePosition(js.group(3));
                int column = parsePosition(js.group(4));
                if (lineNumber < 0 || column < 0) {
                    depth++;
                    continue;
                }
                addFrame(out, file, function, lineNumber, Math.max(0, column - 1), depth++);
            }
        }
    }

    /** Line or column number of a frame, or -1 when it does not fit an int. */
    private static int parsePosition(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            logger.debug("Ignoring stack frame with out-of-range position {}", digits);
            return -1;
        }
    }

    private static void addFrame(
            List<Signal> out, String path, @Nullable String function, int line, int character, int depth) {
        add(out, new Signal(
                SignalType.PATH,
                path,
                SignalSource.STACK_TRACE,
                STACK_FRAME_CONFIDENCE,
                Map.of(Signal.META_LINE, line, Signal.META_DEPTH, depth)));
        if (function != null && !function.startsWith("<") && !function.equals("Object")) {
            add(out, new Signal(
                    SignalType.SYMBOL,
                    function,
                    SignalSource.STACK_TRACE,
                    STACK_FRAME_CONFIDENCE,
                    Map.of(
                            Signal.META_PATH, path,
                            Signal.META_LINE, line,
                            Signal.META_CHARACTER, Math.max(0, character),
                            Signal.META_DEPTH, depth)));
        }
    }

    private static String stripFrames(String errorOutput) {
        var kept = new StringBuilder();
        for (var line : LINE_SPLITTER.split(errorOutput)) {
            if (!JAVA_FRAME.matcher(line).find() && !JS_FRAME.matcher(line).find()) {
                kept.append(line).append('\n');
            }
        }
        return kept.toString();
    }

    private static void blank(StringBuilder text, Matcher matcher) {
        for (int i = matcher.start(); i < matcher.end(); i++) {
            text.setCharAt(i, ' ');
        }
    }

    private static void add(List<Signal> out, Signal signal) {
        if (out.stream().noneMatch(signal::sameFact)) {
            out.add(signal);
        }
    }
}
