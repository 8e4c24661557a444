package ai.codegauge.analyzer;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/** A file handed to a {@link MetricsAnalyzer} by a scanning collaborator. */
public interface SourceFile extends Comparable<SourceFile> {
    Path absPath();

    /** Reads the file as strict UTF-8; malformed input raises {@link java.nio.charset.MalformedInputException}. */
    default String read() throws IOException {
        return Files.readString(absPath(), StandardCharsets.UTF_8);
    }

    /**
     * Just the filename, no path at all
     */
    @JsonIgnore
    default String getFileName() {
        return absPath().getFileName().toString();
    }

    @Override
    default int compareTo(SourceFile o) {
        return absPath().compareTo(o.absPath());
    }

    /** return the (lowercased) extension [not including the dot] */
    @JsonIgnore
    default String extension() {
        var filename = getFileName();
        int lastDot = filename.lastIndexOf('.');
        // Ensure dot is not the first character and is not the last character
        if (lastDot > 0 && lastDot < filename.length() - 1) {
            return filename.substring(lastDot + 1).toLowerCase(Locale.ROOT);
        }
        return ""; // No extension found or invalid placement
    }
}
