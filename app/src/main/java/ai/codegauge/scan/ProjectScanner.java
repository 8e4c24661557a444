package ai.codegauge.scan;

import ai.codegauge.analyzer.MetricsAnalyzer;
import ai.codegauge.exception.ScanException;
import ai.codegauge.util.CodeGaugeSettings;
import ai.codegauge.util.ExecutorServiceUtil;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Walks a directory tree and runs a {@link MetricsAnalyzer} over every supported file.
 *
 * <p>Directories whose name is in the ignore list are pruned, relative to the scanned root. Files are analyzed on a
 * fixed worker pool; the analyzer keeps one parser per worker thread. Unreadable or non UTF-8 files are skipped with a
 * warning and counted in {@link ScanReport#skippedFiles()}.
 */
public final class ProjectScanner {
    private static final Logger logger = LogManager.getLogger(ProjectScanner.class);

    private final MetricsAnalyzer analyzer;
    private final CodeGaugeSettings settings;

    public ProjectScanner(MetricsAnalyzer analyzer, CodeGaugeSettings settings) {
        this.analyzer = analyzer;
        this.settings = settings;
    }

    public ScanReport scan(Path rootDir) {
        var root = rootDir.toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            logger.warn("Scan root {} does not exist or is not a directory", root);
            return ScanReport.empty(root.toString());
        }

        var files = collectFiles(root);
        logger.info("Scanning {} files under {} with {} threads", files.size(), root, settings.threads());

        var executor = ExecutorServiceUtil.newFixedThreadExecutor(settings.threads(), "codegauge-scan-");
        try {
            var futures = new ArrayList<Future<Optional<FileMetrics>>>(files.size());
            for (var file : files) {
                futures.add(executor.submit(() -> analyzeFile(file)));
            }

            var results = new ArrayList<FileMetrics>(files.size());
            int skipped = 0;
            for (var future : futures) {
                var result = future.get();
                if (result.isPresent()) {
                    results.add(result.get());
                } else {
                    skipped++;
                }
            }
            return ScanReport.of(root.toString(), results, skipped);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScanException(root, e);
        } catch (ExecutionException e) {
            throw new ScanException(root, e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    /** Supported files under {@code root}, ignored directories pruned, in path order. */
    List<ProjectFile> collectFiles(Path root) {
        var files = new ArrayList<ProjectFile>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && settings.ignoreDirs().contains(dir.getFileName().toString())) {
                        logger.trace("Skipping ignored directory {}", dir);
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()) {
                        var projectFile = new ProjectFile(root, root.relativize(file));
                        if (isSupported(projectFile)) {
                            files.add(projectFile);
                        }
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    logger.warn("Cannot access {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new ScanException(root, e);
        }
        files.sort(null);
        return files;
    }

    private boolean isSupported(ProjectFile file) {
        return settings.extensions().contains(file.extension()) && analyzer.supports(file);
    }

    private Optional<FileMetrics> analyzeFile(ProjectFile file) {
        String content;
        try {
            content = file.read();
        } catch (IOException e) {
            // includes MalformedInputException for files that are not valid UTF-8
            logger.warn("Skipping {}: {}", file, e.toString());
            return Optional.empty();
        }
        long start = System.nanoTime();
        var result = analyzer.analyze(content);
        logger.debug("Analyzed {} in {} ms", file, (System.nanoTime() - start) / 1_000_000);
        return Optional.of(new FileMetrics(file.toString(), result));
    }
}
