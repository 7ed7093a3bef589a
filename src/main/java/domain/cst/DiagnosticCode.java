package domain.cst;

/**
 * Codes for non-fatal problems recorded while building a tree.
 *
 * <p>None of these stop tree construction; the leaves still cover the whole text.</p>
 */
public enum DiagnosticCode {

    /**
     * The grammar oracle could not tokenize the statement. Leaves keep classifier kinds.
     */
    SCAN_FAILED,

    /**
     * The grammar oracle could not parse the statement. Leaves are placed at the root level.
     */
    PARSE_FAILED,

    /**
     * An AST node skipped nesting levels or reported a depth below 1.
     */
    NODE_DEPTH_INCONSISTENT,

    /**
     * An AST node started after the end of the text and was never opened.
     */
    NODE_OUT_OF_RANGE
}
