package ai.lodestar.git;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.diff.DiffFormatter;
import org.eclipse.jgit.diff.RawText;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectReader;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.treewalk.CanonicalTreeParser;
import org.eclipse.jgit.treewalk.FileTreeIterator;
import org.eclipse.jgit.treewalk.filter.NotIgnoredFilter;
import org.eclipse.jgit.util.io.DisabledOutputStream;
import org.jetbrains.annotations.Nullable;

/**
 * {@link SnapshotDiffService} backed by a local git repository: a snapshot is any commit-ish, and diffs compare its
 * tree to the current working tree (staged and unstaged changes, plus untracked files that are not ignored).
 */
public final class GitSnapshotDiffService implements SnapshotDiffService, AutoCloseable {
    private static final Logger logger = LogManager.getLogger(GitSnapshotDiffService.class);

    private final Git git;
    private final Repository repository;
    private final Path workTree;

    public GitSnapshotDiffService(Path repoRoot) throws SnapshotDiffException {
        try {
            this.git = Git.open(repoRoot.toFile());
        } catch (IOException e) {
            throw new SnapshotDiffException("Unable to open git repository at " + repoRoot, e);
        }
        this.repository = git.getRepository();
        this.workTree = repository.getWorkTree().toPath().toAbsolutePath().normalize();
    }

    /** Commit id of HEAD, suitable as a snapshot reference. */
    public String headHash() throws SnapshotDiffException {
        return resolveCommit("HEAD").getName();
    }

    @Override
    public synchronized List<FileDiff> diffFull(String snapshotHash) throws SnapshotDiffException {
        var entries = scan(snapshotHash);
        var result = new ArrayList<FileDiff>(entries.size());
        try (var reader = repository.newObjectReader()) {
            for (var entry : entries) {
                result.add(toFileDiff(entry, reader));
            }
        } catch (IOException e) {
            throw new SnapshotDiffException("Unable to read diff content against " + snapshotHash, e);
        }
        result.sort(Comparator.comparing(FileDiff::path));
        logger.debug("diffFull({}) -> {} files", snapshotHash, result.size());
        return result;
    }

    @Override
    public synchronized SnapshotPatch patch(String snapshotHash) throws SnapshotDiffException {
        var files = scan(snapshotHash).stream()
                .map(e -> e.getChangeType() == DiffEntry.ChangeType.DELETE ? e.getOldPath() : e.getNewPath())
                .sorted()
                .toList();
        return new SnapshotPatch(snapshotHash, files);
    }

    private List<DiffEntry> scan(String snapshotHash) throws SnapshotDiffException {
        var commitId = resolveCommit(snapshotHash);
        try (var revWalk = new RevWalk(repository);
                var reader = repository.newObjectReader();
                var formatter = new DiffFormatter(DisabledOutputStream.INSTANCE)) {
            var commit = revWalk.parseCommit(commitId);
            var oldTree = new CanonicalTreeParser(null, reader, commit.getTree().getId());
            var newTree = new FileTreeIterator(repository);

            formatter.setRepository(repository);
            formatter.setDetectRenames(true);
            formatter.setPathFilter(new NotIgnoredFilter(1));
            return formatter.scan(oldTree, newTree);
        } catch (IOException e) {
            throw new SnapshotDiffException("Unable to diff working tree against " + snapshotHash, e);
        }
    }

    private ObjectId resolveCommit(String revstr) throws SnapshotDiffException {
        try {
            var id = repository.resolve(revstr + "^{commit}");
            if (id == null) {
                throw new SnapshotDiffException("Unable to resolve snapshot " + revstr);
            }
            return id;
        } catch (IOException e) {
            throw new SnapshotDiffException("Unable to resolve snapshot " + revstr, e);
        }
    }

    private FileDiff toFileDiff(DiffEntry entry, ObjectReader reader) throws IOException {
        return switch (entry.getChangeType()) {
            case ADD, COPY -> new FileDiff(
                    entry.getNewPath(), null, FileChangeType.ADDED, null, readWorkTree(entry.getNewPath()));
            case MODIFY -> new FileDiff(
                    entry.getNewPath(),
                    null,
                    FileChangeType.MODIFIED,
                    readBlob(reader, entry.getOldId().toObjectId()),
                    readWorkTree(entry.getNewPath()));
            case DELETE -> new FileDiff(
                    entry.getOldPath(),
                    null,
                    FileChangeType.DELETED,
                    readBlob(reader, entry.getOldId().toObjectId()),
                    null);
            case RENAME -> new FileDiff(
                    entry.getNewPath(),
                    entry.getOldPath(),
                    FileChangeType.RENAMED,
                    readBlob(reader, entry.getOldId().toObjectId()),
                    readWorkTree(entry.getNewPath()));
        };
    }

    private static @Nullable String readBlob(ObjectReader reader, ObjectId blobId) throws IOException {
        var bytes = reader.open(blobId).getBytes();
        return RawText.isBinary(bytes) ? null : new String(bytes, StandardCharsets.UTF_8);
    }

    private @Nullable String readWorkTree(String repoRelativePath) throws IOException {
        var file = workTree.resolve(repoRelativePath);
        if (!Files.isRegularFile(file)) {
            return null;
        }
        var bytes = Files.readAllBytes(file);
        return RawText.isBinary(bytes) ? null : new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public void close() {
        git.close();
    }
}
