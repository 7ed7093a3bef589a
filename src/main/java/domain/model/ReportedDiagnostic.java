package domain.model;

import domain.cst.ParseDiagnostic;

/**
 * A diagnostic attributed to a statement of a source file.
 *
 * <p>{@code code} is a {@link domain.cst.DiagnosticCode} name, or
 * {@link #UNSUPPORTED_INPUT} for statements the classifier rejected.</p>
 */
public final class ReportedDiagnostic {

    public static final String UNSUPPORTED_INPUT = "UNSUPPORTED_INPUT";

    private final String code;
    private final String sourceFile;
    private final int statementIndex;
    private final int start;
    private final int end;
    private final String message;

    public ReportedDiagnostic(String code, String sourceFile, int statementIndex, int start, int end, String message) {
        this.code = nullToEmpty(code);
        this.sourceFile = nullToEmpty(sourceFile);
        this.statementIndex = statementIndex;
        this.start = start;
        this.end = end;
        this.message = nullToEmpty(message);
    }

    public static ReportedDiagnostic of(String sourceFile, int statementIndex, ParseDiagnostic d) {
        return new ReportedDiagnostic(
                d.getCode().name(),
                sourceFile,
                statementIndex,
                d.getSpan().getStart(),
                d.getSpan().getEnd(),
                d.getMessage());
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public String getCode() {
        return code;
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

    public String getMessage() {
        return message;
    }
}
