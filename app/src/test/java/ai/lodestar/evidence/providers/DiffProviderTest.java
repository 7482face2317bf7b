package ai.lodestar.evidence.providers;

import static org.junit.jupiter.api.Assertions.*;

import ai.lodestar.evidence.ChangeType;
import ai.lodestar.evidence.Evidence;
import ai.lodestar.evidence.ProviderQueryOptions;
import ai.lodestar.evidence.Signal;
import ai.lodestar.git.FileDiff;
import ai.lodestar.git.SnapshotDiffException;
import ai.lodestar.git.SnapshotDiffService;
import ai.lodestar.git.SnapshotPatch;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class DiffProviderTest {
    /** Serves a fixed diff, or fails when {@code failure} is set. */
    static final class StubDiffService implements SnapshotDiffService {
        final List<FileDiff> diffs;
        SnapshotDiffException failure;
        final List<String> requestedHashes = new ArrayList<>();

        StubDiffService(List<FileDiff> diffs) {
            this.diffs = diffs;
        }

        @Override
        public List<FileDiff> diffFull(String snapshotHash) throws SnapshotDiffException {
            requestedHashes.add(snapshotHash);
            if (failure != null) {
                throw failure;
            }
            return diffs;
        }

        @Override
        public SnapshotPatch patch(String snapshotHash) throws SnapshotDiffException {
            if (failure != null) {
                throw failure;
            }
            return new SnapshotPatch(snapshotHash, diffs.stream().map(FileDiff::path).toList());
        }
    }

    private static final List<FileDiff> SAMPLE = List.of(
            FileDiff.modified(
                    "src/auth.ts",
                    "export function login() {}\n",
                    "export function login(user) {\n  validateUser(user);\n}\n"),
            FileDiff.added("src/utils/helpers.ts", "export const helper = () => 'TypeError: oops';\n"),
            FileDiff.deleted("src/legacy.ts", "export function oldLogin() {}\n"),
            FileDiff.renamed("src/oldName.ts", "src/newName.ts", "export const x = 1;\n", "export const x = 2;\n"));

    private static List<String> paths(List<Evidence> evidence) {
        return evidence.stream().map(Evidence::path).toList();
    }

    @Test
    void noSnapshotMeansNoEvidenceAndUnavailable() {
        var service = new StubDiffService(SAMPLE);
        var provider = new DiffProvider(service);

        assertFalse(provider.isAvailable());
        assertTrue(provider.query(List.of(Signal.path("auth.ts"))).isEmpty());
        assertTrue(service.requestedHashes.isEmpty());
    }

    @Test
    void providerDescribesItself() {
        var provider = new DiffProvider(new StubDiffService(SAMPLE));
        assertEquals("diff", provider.type().wireName());
        assertEquals("Git Diff", provider.name());
        assertEquals(100, provider.baseWeight());
    }

    @Test
    void availabilityFollowsTheBackend() {
        var service = new StubDiffService(SAMPLE);
        var provider = new DiffProvider(service, "abc123");
        assertTrue(provider.isAvailable());

        service.failure = new SnapshotDiffException("backend down");
        assertFalse(provider.isAvailable());
    }

    @Test
    void noSignalsReturnsEveryChangedFile() {
        var provider = new DiffProvider(new StubDiffService(SAMPLE), "abc123");
        var evidence = provider.query(List.of());
        assertEquals(
                List.of("src/auth.ts", "src/utils/helpers.ts", "src/legacy.ts", "src/newName.ts"), paths(evidence));
        for (var item : evidence) {
            assertTrue(item.tokens() >= 0);
            assertEquals(DiffProvider.BASE_WEIGHT, item.baseScore());
            assertEquals(1, item.range().start());
        }
    }

    @Test
    void pathSignalMatchesBySuffix() {
        var provider = new DiffProvider(new StubDiffService(SAMPLE), "abc123");
        var evidence = provider.query(List.of(Signal.path("auth.ts")));
        assertEquals(List.of("src/auth.ts"), paths(evidence));
        assertEquals(List.of(Signal.path("auth.ts")), evidence.get(0).matchedSignals());
    }

    @Test
    void renameMatchesOldPathAndReportsNewPath() {
        var provider = new DiffProvider(new StubDiffService(SAMPLE), "abc123");
        var evidence = provider.query(List.of(Signal.path("oldName.ts")));
        assertEquals(1, evidence.size());
        assertEquals("src/newName.ts", evidence.get(0).path());
        assertEquals(ChangeType.MODIFIED, evidence.get(0).metadata().changeType());
    }

    @Test
    void symbolSignalNeedsWholeWord() {
        var provider = new DiffProvider(new StubDiffService(SAMPLE), "abc123");
        assertEquals(List.of("src/auth.ts"), paths(provider.query(List.of(Signal.symbol("validateUser")))));
        assertTrue(provider.query(List.of(Signal.symbol("validate"))).isEmpty());
    }

    @Test
    void deletedFilesAreSearchedInBeforeContent() {
        var provider = new DiffProvider(new StubDiffService(SAMPLE), "abc123");
        var evidence = provider.query(List.of(Signal.symbol("oldLogin")));
        assertEquals(List.of("src/legacy.ts"), paths(evidence));
        assertEquals(ChangeType.DELETED, evidence.get(0).metadata().changeType());
        assertEquals("export function oldLogin() {}\n", evidence.get(0).content());
    }

    @Test
    void errorTokenIsCaseInsensitiveSubstring() {
        var provider = new DiffProvider(new StubDiffService(SAMPLE), "abc123");
        assertEquals(List.of("src/utils/helpers.ts"), paths(provider.query(List.of(Signal.errorToken("typeerror")))));
    }

    @Test
    void filesMatchingNoSignalAreSkipped() {
        var provider = new DiffProvider(new StubDiffService(SAMPLE), "abc123");
        assertTrue(provider.query(List.of(Signal.path("nothing-here.ts"))).isEmpty());
    }

    @Test
    void addedFileRecordsLineCounts() {
        var provider = new DiffProvider(new StubDiffService(SAMPLE), "abc123");
        var evidence = provider.query(List.of(Signal.path("helpers.ts"))).get(0);
        assertEquals(ChangeType.ADDED, evidence.metadata().changeType());
        assertEquals(0, evidence.metadata().linesDeleted());
        assertTrue(evidence.metadata().linesAdded() >= 1);
    }

    @Test
    void includeAndExcludePatternsFilterFiles() {
        var provider = new DiffProvider(new StubDiffService(SAMPLE), "abc123");
        var options = ProviderQueryOptions.DEFAULT
                .withIncludePatterns(List.of("src/*"))
                .withExcludePatterns(List.of("utils"));
        assertFalse(paths(provider.query(List.of(), options)).contains("src/utils/helpers.ts"));
    }

    @Test
    void maxResultsAndMaxTokensAreApplied() {
        var provider = new DiffProvider(new StubDiffService(SAMPLE), "abc123");
        assertEquals(2, provider.query(List.of(), ProviderQueryOptions.ofMaxResults(2)).size());

        var trimmed = provider.query(List.of(), ProviderQueryOptions.ofMaxTokens(1));
        assertEquals(List.of("src/auth.ts"), paths(trimmed));
    }

    @Test
    void backendFailureDegradesToEmpty() {
        var service = new StubDiffService(SAMPLE);
        service.failure = new SnapshotDiffException("boom");
        var provider = new DiffProvider(service, "abc123");
        assertTrue(provider.query(List.of(Signal.path("auth.ts"))).isEmpty());
    }

    @Test
    void snapshotHashCanBeChanged() {
        var service = new StubDiffService(SAMPLE);
        var provider = new DiffProvider(service);
        provider.setSnapshotHash("first");
        provider.query(List.of());
        provider.setSnapshotHash("second");
        provider.query(List.of());
        assertEquals(List.of("first", "second"), service.requestedHashes);
    }
}
