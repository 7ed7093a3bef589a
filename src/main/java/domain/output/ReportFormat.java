package domain.output;

/** Report output format selected on the command line. */
public enum ReportFormat {
    XLSX,
    CSV,
    NONE
}
