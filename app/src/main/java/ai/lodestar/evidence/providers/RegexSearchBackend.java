package ai.lodestar.evidence.providers;

import ai.lodestar.evidence.PathPatterns;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * In-process search backend that walks the workspace and scans text files line by line. Slower than an external
 * grep but always available.
 */
public final class RegexSearchBackend implements SearchBackend {
    private static final Logger logger = LogManager.getLogger(RegexSearchBackend.class);

    private static final Set<String> SKIPPED_DIRS = Set.of(".git", "node_modules", "target", "build", "dist", ".idea");
    static final long MAX_FILE_BYTES = 1024 * 1024;

    private final Path root;

    public RegexSearchBackend(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public boolean isAvailable() {
        return Files.isDirectory(root);
    }

    @Override
    public List<SearchMatch> search(SearchRequest request) throws SearchBackendException, InterruptedException {
        Pattern pattern;
        try {
            pattern = Pattern.compile(request.pattern(), request.caseSensitive() ? 0 : Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            throw new SearchBackendException("Invalid search pattern: " + request.pattern(), e);
        }

        var files = listFiles(request);
        var matches = new ArrayList<SearchMatch>();
        for (var file : files) {
            if (Thread.interrupted()) {
                throw new InterruptedException();
            }
            if (matches.size() >= request.maxResults()) {
                break;
            }
            scanFile(file, pattern, request, matches);
        }
        logger.trace("Pattern {} matched {} lines across {} files", request.pattern(), matches.size(), files.size());
        return matches;
    }

    private List<Path> listFiles(SearchRequest request) throws SearchBackendException {
        var files = new ArrayList<Path>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && SKIPPED_DIRS.contains(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && attrs.size() <= MAX_FILE_BYTES && accepts(relativize(file), request)) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    logger.debug("Skipping unreadable {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException | UncheckedIOException e) {
            throw new SearchBackendException("Unable to walk " + root, e);
        }
        files.sort(null);
        return files;
    }

    private static boolean accepts(String relativePath, SearchRequest request) {
        if (!request.includePatterns().isEmpty() && !PathPatterns.matchesAny(relativePath, request.includePatterns())) {
            return false;
        }
        return !PathPatterns.matchesAny(relativePath, request.excludePatterns());
    }

    private void scanFile(Path file, Pattern pattern, SearchRequest request, List<SearchMatch> out) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (MalformedInputException e) {
            logger.trace("Skipping non-UTF-8 file {}", file);
            return;
        } catch (IOException e) {
            logger.debug("Unable to read {}: {}", file, e.getMessage());
            return;
        }
        var relative = relativize(file);
        int context = request.contextLines();
        for (int i = 0; i < lines.size() && out.size() < request.maxResults(); i++) {
            var line = lines.get(i);
            if (line.indexOf('\0') >= 0) {
                return;
            }
            if (pattern.matcher(line).find()) {
                var before = lines.subList(Math.max(0, i - context), i);
                var after = lines.subList(i + 1, Math.min(lines.size(), i + 1 + context));
                out.add(new SearchMatch(relative, i + 1, line, before, after));
            }
        }
    }

    private String relativize(Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}
