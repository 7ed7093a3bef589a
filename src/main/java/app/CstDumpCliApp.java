package app;

import cli.CliArgParser;
import cli.CliPathResolver;
import cli.CliProgressMonitor;
import cli.CstDumpCli;
import domain.grammar.GrammarOracleKind;
import domain.model.DiagnosticSink;
import domain.model.ListDiagnosticSink;
import domain.model.ReportedDiagnostic;
import domain.model.StatementReport;
import domain.output.ReportFormat;
import domain.output.ReportWriter;
import domain.output.TreeOutputWriter;
import domain.source.SourceFileParseResult;
import domain.source.SourceFileParser;
import domain.source.SqlSource;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * CLI entry (invoked by {@link CstDumpCli}).
 *
 * <p>Parses every statement of the given {@code .sql} file(s), writes one tree dump per
 * source and a statement/diagnostic report.</p>
 *
 * <pre>
 * --in=&lt;file or dir&gt;            required
 * --out=&lt;dir&gt;                    tree dumps (default: &lt;input dir&gt;/cst-out)
 * --report=&lt;file&gt;                report (default: &lt;out&gt;/cst-report.xlsx)
 * --reportFormat=xlsx|csv|none    (default: from --report extension, else xlsx)
 * --oracle=jsqlparser|none        (default: jsqlparser)
 * --noTreeOut                     skip tree dumps
 * --failFast                      stop at the first unsupported statement
 * --logEvery=&lt;n&gt;                 progress line every n sources (default: 50)
 * --baseDir=&lt;dir&gt;                base for relative paths
 * </pre>
 */
public final class CstDumpCliApp {

    /** Exit code for bad arguments or I/O failures. */
    public static final int EXIT_ERROR = 2;

    /** Exit code when {@code --failFast} stopped on unsupported input. */
    public static final int EXIT_UNSUPPORTED = 3;

    private CstDumpCliApp() {}

    public static void main(String[] args) {
        int code = run(args);
        if (code != 0) System.exit(code);
    }

    public static int run(String[] args) {
        try {
            return doRun(args);
        } catch (IllegalArgumentException | IllegalStateException e) {
            System.out.println("[ERROR] " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private static int doRun(String[] args) {
        long t0 = System.nanoTime();
        Map<String, String> argv = CliArgParser.parseArgs(args);

        CliPathResolver.applyBaseDirPropertyIfPresent(argv);
        Path baseDir = CliPathResolver.resolveBaseDir();

        String inRaw = argv.get("in");
        if (inRaw == null || inRaw.isBlank()) throw new IllegalArgumentException("--in is required");
        Path input = CliPathResolver.resolvePath(baseDir, inRaw);
        CliPathResolver.validateExists(input, "input (--in)");

        Path outDir = argv.containsKey("out") && !argv.get("out").isBlank()
                ? CliPathResolver.resolvePath(baseDir, argv.get("out"))
                : CliPathResolver.defaultOutDir(input);

        ReportFormat format = CliArgParser.parseReportFormat(argv.get("reportFormat"), argv.get("report"));
        String defaultReport = (format == ReportFormat.CSV) ? "cst-report.csv" : "cst-report.xlsx";
        Path report = argv.containsKey("report") && !argv.get("report").isBlank()
                ? CliPathResolver.resolvePath(baseDir, argv.get("report"))
                : outDir.resolve(defaultReport);

        GrammarOracleKind oracleKind = CliArgParser.parseOracle(argv.get("oracle"));
        boolean noTreeOut = CliArgParser.flag(argv, "noTreeOut");
        boolean failFast = CliArgParser.flag(argv, "failFast");
        int logEvery = Math.max(1, CliArgParser.parseInt(argv.get("logEvery"), 50));

        System.out.println("==================================================");
        System.out.println("[START] CST dump");
        System.out.println("[CONF] baseDir      = " + baseDir);
        System.out.println("[CONF] in           = " + input);
        System.out.println("[CONF] out          = " + outDir + (noTreeOut ? " (disabled, --noTreeOut)" : ""));
        System.out.println("[CONF] report       = " + report + " (" + format + ")");
        System.out.println("[CONF] oracle       = " + oracleKind);
        System.out.println("[CONF] failFast     = " + failFast);
        System.out.println("==================================================");

        CstDumpComponentsFactory factory = new CstDumpComponentsFactory();
        SourceFileParser parser = factory.createSourceFileParser(factory.createOracle(oracleKind));
        TreeOutputWriter treeWriter = factory.createTreeOutputWriter(!noTreeOut);
        ReportWriter reportWriter = factory.createReportWriter(format);

        long tScan0 = System.nanoTime();
        List<SqlSource> sources = factory.createSourceScanner().scan(input);
        System.out.println("[STEP1] sources loaded. size=" + sources.size() + ", elapsed=" + ms(tScan0) + "ms");

        List<StatementReport> statements = new ArrayList<>(Math.max(16, sources.size() * 4));
        List<ReportedDiagnostic> diagnostics = new ArrayList<>(128);
        DiagnosticSink sink = new ListDiagnosticSink(diagnostics);

        long tLoop0 = System.nanoTime();
        int total = sources.size();
        int unsupported = 0;
        boolean stopped = false;

        for (int i = 0; i < total; i++) {
            SqlSource source = sources.get(i);
            SourceFileParseResult result = parser.parse(source.getText());

            statements.addAll(CstReportAssembler.toReports(source.getName(), result, sink));
            treeWriter.write(outDir, source.getName(), CstReportAssembler.toDump(result));
            unsupported += result.unsupportedCount();

            if ((i + 1) % logEvery == 0 || (i + 1) == total) {
                CliProgressMonitor.logProgress(i + 1, total, statements.size(), unsupported, tLoop0, source.getName());
            }

            if (failFast && result.unsupportedCount() > 0) {
                System.out.println("[FAILFAST] unsupported input in " + source.getName());
                stopped = true;
                break;
            }
        }

        reportWriter.write(report, statements, diagnostics);

        System.out.println("[DONE] sources=" + total
                + " statements=" + statements.size()
                + " unsupported=" + unsupported
                + " diagnostics=" + diagnostics.size()
                + " elapsed=" + ms(t0) + "ms");

        return stopped ? EXIT_UNSUPPORTED : 0;
    }

    private static long ms(long t0) {
        return (System.nanoTime() - t0) / 1_000_000L;
    }
}
