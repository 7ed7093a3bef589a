package domain.model;

/**
 * One parsed statement as a report row.
 *
 * <p>Kept as a simple value object so writers for any format can consume it.</p>
 */
public final class StatementReport {

    public static final String STATUS_PARSED = "PARSED";
    public static final String STATUS_UNSUPPORTED = "UNSUPPORTED_INPUT";

    /**
     * PARSED / UNSUPPORTED_INPUT
     */
    private final String status;
    private final String sourceFile;
    private final int statementIndex;
    private final int start;
    private final int end;
    private final int leafCount;
    private final int nodeCount;
    private final int diagnosticCount;

    /**
     * kind of the single top-level node; blank when the statement has none
     */
    private final String rootKind;

    /**
     * unsupported-input message for UNSUPPORTED_INPUT rows
     */
    private final String message;

    public StatementReport(
            String status,
            String sourceFile,
            int statementIndex,
            int start,
            int end,
            int leafCount,
            int nodeCount,
            int diagnosticCount,
            String rootKind,
            String message
    ) {
        this.status = nullToEmpty(status);
        this.sourceFile = nullToEmpty(sourceFile);
        this.statementIndex = statementIndex;
        this.start = start;
        this.end = end;
        this.leafCount = leafCount;
        this.nodeCount = nodeCount;
        this.diagnosticCount = diagnosticCount;
        this.rootKind = nullToEmpty(rootKind);
        this.message = nullToEmpty(message);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public String getStatus() {
        return status;
    }

    public boolean isParsed() {
        return STATUS_PARSED.equals(status);
    }

    public String getSourceFile() {
        return sourceFile;
    }

    public int getStatementIndex() {
        return statementIndex;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int getLeafCount() {
        return leafCount;
    }

    public int getNodeCount() {
        return nodeCount;
    }

    public int getDiagnosticCount() {
        return diagnosticCount;
    }

    public String getRootKind() {
        return rootKind;
    }

    public String getMessage() {
        return message;
    }
}
