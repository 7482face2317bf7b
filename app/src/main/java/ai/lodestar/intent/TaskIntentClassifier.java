package ai.lodestar.intent;

import ai.lodestar.exception.InvalidInputException;
import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Keyword-driven task intent classifier.
 *
 * <p>Each token of the lower-cased text scores 1 for an exact keyword hit and 0.5 when it merely contains a keyword
 * ("crashes" contains "crash"); a token counts at most once per intent. Confidence is {@code score / sqrt(tokens)},
 * capped at 1, so short focused requests score higher than long rambling ones. Context flags add fixed points to the
 * raw score before that normalization, so a flag weighs less in a longer text. Ties go to the intent listed first in
 * {@link #KEYWORDS}.
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class TaskIntentClassifier {
    private static final Logger logger = LogManager.getLogger(TaskIntentClassifier.class);

    public static final double DEFAULT_MIN_CONFIDENCE = 0.15;
    static final double ERROR_PRESENT_BOOST = 0.3;
    static final double TEST_FILE_BOOST = 0.3;
    static final double RECENT_TEST_FILES_BOOST = 0.2;
    static final double SECONDARY_RATIO = 0.75;

    // Declaration order is the tie-break order
    static final Map<TaskIntent, List<String>> KEYWORDS = keywords();

    private static final List<String> TEST_FILE_MARKERS =
            List.of(".test.", ".spec.", "_test.", "test.java", "tests.java", "/test/", "/tests/", "__tests__");

    private static final Splitter TOKENIZER = Splitter.onPattern("[^a-z0-9_]+").omitEmptyStrings();

    private final double minConfidence;

    public TaskIntentClassifier() {
        this(DEFAULT_MIN_CONFIDENCE);
    }

    public TaskIntentClassifier(double minConfidence) {
        InvalidInputException.check(
                minConfidence >= 0.0 && minConfidence <= 1.0, "minConfidence must be within [0,1]: " + minConfidence);
        this.minConfidence = minConfidence;
    }

    public double minConfidence() {
        return minConfidence;
    }

    public ClassificationResult classify(@Nullable String text) {
        return classifyWithContext(text, ClassificationContext.EMPTY);
    }

    public ClassificationResult classifyWithContext(@Nullable String text, ClassificationContext context) {
        if (text == null) {
            throw new InvalidInputException("Task text must not be null");
        }
        var tokens = TOKENIZER.splitToList(text.toLowerCase(Locale.ROOT));
        if (tokens.isEmpty()) {
            return ClassificationResult.unknown();
        }

        var signals = new LinkedHashSet<String>();
        var scores = new EnumMap<TaskIntent, Double>(TaskIntent.class);
        for (var entry : KEYWORDS.entrySet()) {
            scores.put(entry.getKey(), score(tokens, entry.getValue(), signals));
        }

        if (context.errorPresent()) {
            scores.merge(TaskIntent.DEBUG, ERROR_PRESENT_BOOST, Double::sum);
            signals.add("context:errorPresent");
        }
        if (context.testFile()) {
            scores.merge(TaskIntent.TEST, TEST_FILE_BOOST, Double::sum);
            signals.add("context:testFile");
        }
        if (context.recentFiles().stream().anyMatch(TaskIntentClassifier::isTestPath)) {
            scores.merge(TaskIntent.TEST, RECENT_TEST_FILES_BOOST, Double::sum);
            signals.add("context:recentTestFiles");
        }

        var confidences = new EnumMap<TaskIntent, Double>(TaskIntent.class);
        double norm = Math.sqrt(tokens.size());
        scores.forEach((intent, score) -> confidences.put(intent, score / norm));

        @Nullable TaskIntent winner = null;
        @Nullable TaskIntent runnerUp = null;
        for (var intent : KEYWORDS.keySet()) {
            double c = confidences.get(intent);
            if (c <= 0) {
                continue;
            }
            if (winner == null || c > confidences.get(winner)) {
                runnerUp = winner;
                winner = intent;
            } else if (runnerUp == null || c > confidences.get(runnerUp)) {
                runnerUp = intent;
            }
        }

        if (winner == null) {
            logger.debug("No intent keywords in {} tokens", tokens.size());
            return new ClassificationResult(TaskIntent.UNKNOWN, 0.0, List.copyOf(signals), null);
        }
        double confidence = Math.min(1.0, confidences.get(winner));
        if (confidence < minConfidence) {
            logger.debug("Best intent {} at {} is below threshold {}", winner, confidence, minConfidence);
            return new ClassificationResult(TaskIntent.UNKNOWN, confidence, List.copyOf(signals), null);
        }
        @Nullable TaskIntent secondary = null;
        if (runnerUp != null && confidences.get(runnerUp) >= SECONDARY_RATIO * confidences.get(winner)) {
            secondary = runnerUp;
        }
        logger.debug("Classified as {} ({}), secondary {}", winner, confidence, secondary);
        return new ClassificationResult(winner, confidence, new ArrayList<>(signals), secondary);
    }

    private static double score(List<String> tokens, List<String> keywords, LinkedHashSet<String> signals) {
        double total = 0;
        for (var token : tokens) {
            double best = 0;
            @Nullable String hit = null;
            for (var keyword : keywords) {
                if (token.equals(keyword)) {
                    best = 1.0;
                    hit = keyword;
                    break;
                }
                if (best == 0 && token.contains(keyword)) {
                    best = 0.5;
                    hit = keyword;
                }
            }
            if (hit != null) {
                total += best;
                signals.add(hit);
            }
        }
        return total;
    }

    static boolean isTestPath(String path) {
        var p = path.replace('\\', '/').toLowerCase(Locale.ROOT);
        return TEST_FILE_MARKERS.stream().anyMatch(p::contains);
    }

    private static Map<TaskIntent, List<String>> keywords() {
        var map = new LinkedHashMap<TaskIntent, List<String>>();
        map.put(TaskIntent.DEBUG, List.of(
                "fix", "bug", "error", "crash", "broken", "fail", "failing", "exception", "debug", "typeerror",
                "referenceerror", "syntaxerror", "undefined", "null", "issue", "problem", "wrong", "trace", "stack",
                "regression", "segfault", "panic", "hang"));
        map.put(TaskIntent.IMPLEMENT, List.of(
                "implement", "add", "create", "build", "new", "feature", "write", "make", "support", "introduce",
                "generate", "develop"));
        map.put(TaskIntent.TEST, List.of(
                "test", "tests", "testing", "spec", "coverage", "unit", "integration", "e2e", "mock", "assert",
                "jest", "vitest", "junit"));
        map.put(TaskIntent.REFACTOR, List.of(
                "refactor", "restructure", "reorganize", "rename", "extract", "cleanup", "clean", "simplify",
                "optimize", "improve", "move", "split", "decouple", "modernize"));
        map.put(TaskIntent.EXPLORE, List.of(
                "explain", "understand", "what", "how", "where", "why", "find", "show", "describe", "explore",
                "overview", "learn", "locate", "search"));
        map.put(TaskIntent.REVIEW, List.of(
                "review", "check", "audit", "inspect", "feedback", "pull", "diff", "changes", "approve", "critique"));
        return Collections.unmodifiableMap(map);
    }
}
