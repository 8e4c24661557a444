package ai.codegauge.util;

public final class TextCanonicalizer {
    private TextCanonicalizer() {
        /* utility class – no instances */
    }

    /**
     * Strips a leading UTF-8 BOM (U+FEFF) from the provided String, if present. Returns the original string if no BOM
     * is present.
     */
    public static String stripUtf8Bom(String s) {
        if (!s.isEmpty() && s.charAt(0) == '\uFEFF') {
            return s.substring(1);
        }
        return s;
    }
}
