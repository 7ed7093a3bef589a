package app;

import domain.cst.StatementParser;
import domain.grammar.GrammarOracle;
import domain.grammar.GrammarOracleKind;
import domain.output.ReportFormat;
import domain.output.ReportWriter;
import domain.output.TreeOutputWriter;
import domain.source.SourceFileParser;
import infra.grammar.JSqlParserGrammarOracle;
import infra.output.CsvReportWriter;
import infra.output.FileTreeOutputWriter;
import infra.output.NullReportWriter;
import infra.output.NullTreeOutputWriter;
import infra.output.XlsxReportWriter;
import infra.sql.SqlSourceScanner;

/**
 * Object-assembly factory for {@link CstDumpCliApp}.
 * <p>
 * Keeps the CLI app focused on orchestration/logging and moves object creation here.
 */
final class CstDumpComponentsFactory {

    GrammarOracle createOracle(GrammarOracleKind kind) {
        if (kind == null) kind = GrammarOracleKind.JSQLPARSER;

        return switch (kind) {
            case JSQLPARSER -> new JSqlParserGrammarOracle();
            case NONE -> GrammarOracle.none();
        };
    }

    SourceFileParser createSourceFileParser(GrammarOracle oracle) {
        return new SourceFileParser(new StatementParser(oracle));
    }

    SqlSourceScanner createSourceScanner() {
        return new SqlSourceScanner();
    }

    TreeOutputWriter createTreeOutputWriter(boolean enable) {
        if (!enable) return new NullTreeOutputWriter();
        return new FileTreeOutputWriter();
    }

    ReportWriter createReportWriter(ReportFormat format) {
        if (format == null) format = ReportFormat.XLSX;

        return switch (format) {
            case XLSX -> new XlsxReportWriter();
            case CSV -> new CsvReportWriter();
            case NONE -> new NullReportWriter();
        };
    }
}
