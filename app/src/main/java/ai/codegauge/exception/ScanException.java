package ai.codegauge.exception;

import java.nio.file.Path;

public class ScanException extends RuntimeException {
    public ScanException(Path root, Throwable error) {
        super("Failed to scan " + root, error);
    }
}
