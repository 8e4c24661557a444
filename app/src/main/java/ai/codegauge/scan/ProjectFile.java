package ai.codegauge.scan;

import ai.codegauge.analyzer.SourceFile;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Abstraction for a filename relative to the scanned root. Keeps result keys stable and comparable regardless of how
 * the root was spelled on the command line.
 */
public final class ProjectFile implements SourceFile {
    private final Path root;
    private final Path relPath;

    /**
     * root must be pre-normalized; we will normalize relPath if it is not already
     */
    public ProjectFile(Path root, Path relPath) {
        if (!root.isAbsolute()) {
            throw new IllegalArgumentException("Root must be absolute, got " + root);
        }
        if (!root.equals(root.normalize())) {
            throw new IllegalArgumentException("Root must be normalized, got " + root);
        }
        if (relPath.isAbsolute()) {
            throw new IllegalArgumentException("RelPath must be relative, got " + relPath);
        }
        this.root = root;
        this.relPath = relPath.normalize();
    }

    @Override
    public Path absPath() {
        return root.resolve(relPath);
    }

    @Override
    public String toString() {
        // forward slashes keep report keys identical across platforms
        return relPath.toString().replace('\\', '/');
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProjectFile projectFile)) return false;
        return Objects.equals(root, projectFile.root) && Objects.equals(relPath, projectFile.relPath);
    }

    @Override
    public int hashCode() {
        return relPath.hashCode();
    }
}
