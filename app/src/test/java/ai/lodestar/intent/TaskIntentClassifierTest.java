package ai.lodestar.intent;

import static org.junit.jupiter.api.Assertions.*;

import ai.lodestar.exception.InvalidInputException;
import java.util.List;
import org.junit.jupiter.api.Test;

class TaskIntentClassifierTest {
    private final TaskIntentClassifier classifier = new TaskIntentClassifier();

    @Test
    void emptyTextIsUnknownWithZeroConfidence() {
        var result = classifier.classify("");
        assertEquals(TaskIntent.UNKNOWN, result.intent());
        assertEquals(0.0, result.confidence());

        var blank = classifier.classifyWithContext("   \n\t", ClassificationContext.withError());
        assertEquals(TaskIntent.UNKNOWN, blank.intent());
        assertEquals(0.0, blank.confidence());
    }

    @Test
    void nullTextIsRejected() {
        assertThrows(InvalidInputException.class, () -> classifier.classify(null));
    }

    @Test
    void fixTypeErrorIsDebug() {
        var result = classifier.classify("fix the TypeError in auth.ts");
        assertEquals(TaskIntent.DEBUG, result.intent());
        assertTrue(result.signals().containsAll(List.of("fix", "typeerror")), result.signals().toString());
        assertTrue(result.confidence() > 0 && result.confidence() <= 1);
    }

    @Test
    void implementIsImplement() {
        assertEquals(TaskIntent.IMPLEMENT, classifier.classify("implement user authentication").intent());
    }

    @Test
    void classificationIgnoresCase() {
        assertEquals(
                classifier.classify("fix the typeerror"),
                classifier.classify("FIX THE TYPEERROR"));
        assertEquals(TaskIntent.DEBUG, classifier.classify("FIX THE TYPEERROR").intent());
    }

    @Test
    void otherIntentsAreRecognized() {
        assertEquals(TaskIntent.REFACTOR, classifier.classify("refactor and simplify the parser").intent());
        assertEquals(TaskIntent.EXPLORE, classifier.classify("explain how routing works").intent());
        assertEquals(TaskIntent.TEST, classifier.classify("write unit tests with junit").intent());
        assertEquals(TaskIntent.REVIEW, classifier.classify("review my changes").intent());
    }

    @Test
    void keywordInsideLongerWordScoresHalf() {
        var result = classifier.classify("the app crashes");
        assertEquals(TaskIntent.DEBUG, result.intent());
        assertTrue(result.signals().contains("crash"));
        assertEquals(0.5 / Math.sqrt(3), result.confidence(), 1e-9);
    }

    @Test
    void tiesFollowDeclarationOrderAndReportSecondary() {
        var result = classifier.classify("fix and test the login");
        assertEquals(TaskIntent.DEBUG, result.intent());
        assertEquals(TaskIntent.TEST, result.secondaryIntent());
    }

    @Test
    void clearWinnerHasNoSecondary() {
        var result = classifier.classify("fix the crash bug error");
        assertTrue(result.secondary().isEmpty());
    }

    @Test
    void lowConfidenceFallsBackToUnknown() {
        var strict = new TaskIntentClassifier(0.5);
        var result = strict.classify("could you maybe fix a thing for me please today");
        assertEquals(TaskIntent.UNKNOWN, result.intent());
        assertTrue(result.confidence() > 0 && result.confidence() < 0.5);
        assertTrue(result.signals().contains("fix"));
    }

    @Test
    void noKeywordsIsUnknown() {
        var result = classifier.classify("hello there");
        assertEquals(TaskIntent.UNKNOWN, result.intent());
        assertEquals(0.0, result.confidence());
        assertTrue(result.signals().isEmpty());
    }

    @Test
    void errorContextBoostsDebug() {
        var lenient = new TaskIntentClassifier(0.1);
        var result = lenient.classifyWithContext("help me", ClassificationContext.withError());
        assertEquals(TaskIntent.DEBUG, result.intent());
        assertTrue(result.signals().contains("context:errorPresent"));
    }

    @Test
    void testContextBoostsStack() {
        var context = new ClassificationContext(false, true, List.of("src/auth.test.ts", "src/auth.ts"));
        var result = classifier.classifyWithContext("update the module", context);
        assertEquals(TaskIntent.TEST, result.intent());
        assertEquals(0.5 / Math.sqrt(3), result.confidence(), 1e-9);
        assertTrue(result.signals().containsAll(List.of("context:testFile", "context:recentTestFiles")));
    }

    @Test
    void contextBoostIsSpreadOverTheText() {
        var lenient = new TaskIntentClassifier(0.05);
        var shortText = lenient.classifyWithContext("help me", ClassificationContext.withError());
        var longText = lenient.classifyWithContext(
                "please help me with this thing over here in the other place", ClassificationContext.withError());

        assertEquals(TaskIntent.DEBUG, shortText.intent());
        assertEquals(TaskIntent.DEBUG, longText.intent());
        assertEquals(0.3 / Math.sqrt(2), shortText.confidence(), 1e-9);
        assertEquals(0.3 / Math.sqrt(12), longText.confidence(), 1e-9);
        assertTrue(longText.confidence() < shortText.confidence());
    }

    @Test
    void recognizesTestPaths() {
        assertTrue(TaskIntentClassifier.isTestPath("src/__tests__/a.ts"));
        assertTrue(TaskIntentClassifier.isTestPath("app/src/test/java/FooTest.java"));
        assertTrue(TaskIntentClassifier.isTestPath("pkg/foo_test.go"));
        assertFalse(TaskIntentClassifier.isTestPath("src/main/java/Foo.java"));
    }

    @Test
    void wireNamesRoundTrip() {
        for (var intent : TaskIntent.values()) {
            assertEquals(intent, TaskIntent.safeParse(intent.wireName()).orElseThrow());
        }
        assertTrue(TaskIntent.safeParse("nonsense").isEmpty());
    }
}
