package ai.codegauge.analyzer;

import java.nio.charset.StandardCharsets;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSNode;
import org.treesitter.TSTree;

/**
 * One immutable parse of one source string. Node offsets reported by tree-sitter are UTF-8 byte offsets, so text is
 * always sliced from the encoded bytes rather than from the Java string.
 *
 * <p>Instances stay inside the engine; nothing that holds a tree handle is ever returned to callers.
 */
final class ParsedSource {
    private static final Logger logger = LogManager.getLogger(ParsedSource.class);

    private final TSTree tree;
    private final byte[] srcBytes;

    ParsedSource(TSTree tree, String source) {
        this.tree = tree;
        this.srcBytes = source.getBytes(StandardCharsets.UTF_8);
    }

    TSNode root() {
        return tree.getRootNode();
    }

    String textOf(TSNode node) {
        if (node.isNull()) return "";
        return textSlice(node.getStartByte(), node.getEndByte());
    }

    private String textSlice(int startByte, int endByte) {
        if (startByte < 0 || endByte > srcBytes.length || startByte > endByte) {
            logger.warn("Invalid byte range [{}, {}] for byte array of length {}", startByte, endByte, srcBytes.length);
            return "";
        }
        // Handle zero-width nodes (same start and end position) - valid case
        if (startByte == endByte) {
            return "";
        }
        return new String(srcBytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
    }
}
