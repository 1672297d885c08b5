package app;

import cli.CliArgParser;
import cli.CliPathResolver;
import cli.CliProgressMonitor;
import cli.DialectConvertCli;
import domain.convert.ConversionOutput;
import domain.convert.ConverterOptions;
import domain.convert.SqlDialectConverter;
import domain.mapping.FunctionMappingRegistry;
import domain.mapping.TableauFabricMappings;
import domain.model.ConversionMetrics;
import domain.model.FileConversionResult;
import domain.output.ResultWriter;
import domain.output.SqlOutputWriter;
import domain.text.SqlSource;
import domain.text.SqlTextCleaner;
import domain.text.SqlTextProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;

/** CLI entry (invoked by {@link DialectConvertCli}). */
public final class DialectConvertCliApp {

    private static final Logger log = LoggerFactory.getLogger(DialectConvertCliApp.class);

    static final String DEFAULT_OUT = "output/fabric-sql";
    static final String DEFAULT_RESULT = "output/conversion-result.xlsx";

    static final String SQL_TEXT_EMPTY = "SQL_TEXT_EMPTY";

    private DialectConvertCliApp() {}

    public static void main(String[] args) {
        run(args);
    }

    /**
     * Runs one conversion batch.
     *
     * @return one result per processed input file, in input order
     */
    public static List<FileConversionResult> run(String[] args) {

        long t0 = System.nanoTime();
        Map<String, String> argv = CliArgParser.parseArgs(args);

        // ------------------------------------------------------------
        // baseDir / input / output
        // ------------------------------------------------------------
        CliPathResolver.applyBaseDirPropertyIfPresent(argv);
        Path baseDir = CliPathResolver.resolveBaseDir();

        Path inputPath = CliPathResolver.resolvePath(baseDir, CliArgParser.option(argv, "in", null));
        Path outputSqlDir = CliPathResolver.resolvePath(baseDir, CliArgParser.option(argv, "out", DEFAULT_OUT));
        Path resultXlsx = CliPathResolver.resolvePath(baseDir, CliArgParser.option(argv, "result", DEFAULT_RESULT));
        Path mappingCsv = CliPathResolver.resolvePath(baseDir, CliArgParser.option(argv, "mapping", null));

        int varcharLength = CliArgParser.parseInt(
                CliArgParser.option(argv, "varcharLen", null), TableauFabricMappings.DEFAULT_VARCHAR_LENGTH);
        boolean booleans = CliArgParser.parseBoolean(CliArgParser.option(argv, "booleans", null), true);
        int threads = Math.max(1, CliArgParser.parseInt(CliArgParser.option(argv, "threads", null), 1));
        int logEvery = Math.max(1, CliArgParser.parseInt(CliArgParser.option(argv, "logEvery", null), 50));
        long slowMs = CliArgParser.parseInt(CliArgParser.option(argv, "slowMs", null), 500);
        boolean failFast = CliArgParser.flag(argv, "failFast");

        // feature toggles (presence-style)
        boolean noSqlOut = CliArgParser.flag(argv, "noSqlOut");
        boolean noResult = CliArgParser.flag(argv, "noResult");

        System.out.println("==================================================");
        System.out.println("[START] Tableau -> Fabric SQL conversion");
        System.out.println("[CONF] baseDir        = " + baseDir);
        System.out.println("[CONF] in             = " + (inputPath == null ? "" : inputPath));
        System.out.println("[CONF] mapping        = " + (mappingCsv == null ? "(built-in)" : mappingCsv));
        System.out.println("[CONF] out            = " + outputSqlDir);
        System.out.println("[CONF] result         = " + resultXlsx);
        System.out.println("[CONF] varcharLen     = " + varcharLength);
        System.out.println("[CONF] booleans       = " + booleans + " (use --booleans=false)");
        System.out.println("[CONF] threads        = " + threads);
        System.out.println("[CONF] logEvery       = " + logEvery);
        System.out.println("[CONF] slowMs         = " + slowMs);
        System.out.println("[CONF] failFast       = " + failFast);
        System.out.println("[CONF] enableSqlOut   = " + (!noSqlOut) + " (use --noSqlOut)");
        System.out.println("[CONF] enableResult   = " + (!noResult) + " (use --noResult)");
        System.out.println("==================================================");

        CliPathResolver.validateFileExists(inputPath, "sql input (--in)");
        if (mappingCsv != null) CliPathResolver.validateFileExists(mappingCsv, "mapping csv (--mapping)");

        if (!noSqlOut) {
            CliPathResolver.mkdirs(outputSqlDir);
        }
        if (!noResult && resultXlsx.getParent() != null) {
            CliPathResolver.mkdirs(resultXlsx.getParent());
        }

        // ------------------------------------------------------------
        // assemble runtime components
        // ------------------------------------------------------------
        DialectConvertComponentsFactory factory = new DialectConvertComponentsFactory();

        long tMap0 = System.nanoTime();
        FunctionMappingRegistry registry = factory.createMappingRegistry(mappingCsv, varcharLength);
        System.out.println("[STEP1] FunctionMappingRegistry loaded. elapsed=" + ms(tMap0) + "ms");
        System.out.println("[INIT] Function mapping size = " + registry.size() + ", version = " + registry.getVersion());
        System.out.println("[INIT] Rules by kind = " + registry.countByKind());

        long tScan0 = System.nanoTime();
        System.out.println("[STEP2] scanning sql files...");
        List<SqlSource> sources = factory.createScanner().scan(inputPath);
        System.out.println("[STEP2] sql files found. size=" + sources.size() + ", elapsed=" + ms(tScan0) + "ms");

        ConverterOptions options = factory.createOptions(varcharLength, booleans);
        FileJob job = new FileJob(
                factory.createTextProvider(),
                factory.createCleaner(),
                factory.createConverter(registry, options),
                factory.createSqlOutputWriter(!noSqlOut),
                outputSqlDir
        );
        ResultWriter resultWriter = factory.createResultWriter(!noResult);

        // heartbeat thread: shows where a long run stalls
        Thread heartbeat = CliProgressMonitor.startHeartbeat(sources.size());

        long tLoop0 = System.nanoTime();
        int total = sources.size();
        System.out.println("[STEP3] converting start. total=" + total + ", threads=" + threads);

        List<FileConversionResult> results;
        try {
            results = (threads <= 1)
                    ? convertSequential(sources, job, failFast, logEvery, slowMs, tLoop0)
                    : convertParallel(sources, job, threads, failFast, logEvery, slowMs, tLoop0);
        } finally {
            heartbeat.interrupt();
        }

        ConversionMetrics totals = ConversionMetrics.empty();
        int success = 0;
        for (FileConversionResult r : results) {
            if (r.isSuccess()) success++;
            if (r.getMetrics() != null) totals = ConversionMetrics.merge(totals, r.getMetrics());
        }

        System.out.println("[STEP3] converting done. elapsed=" + ms(tLoop0) + "ms");
        System.out.println("[STAT] files success=" + success + ", skip=" + (results.size() - success));
        System.out.println("[STAT] statements total=" + totals.getTotal()
                + ", successful=" + totals.getSuccessful()
                + ", flagged=" + totals.getFlagged()
                + ", syntaxError=" + totals.getSyntaxError());
        System.out.printf("[STAT] successRate=%.1f%%, conversions=%d%n", totals.successRate(), totals.getTotalConversions());
        System.out.println("[STAT] unsupported functions=" + totals.getUnsupportedFunctions());

        if (!noResult) {
            long tXlsx0 = System.nanoTime();
            System.out.println("[STEP4] writing result xlsx... rows=" + results.size());
            resultWriter.write(resultXlsx, results, registry.getVersion());
            System.out.println("[STEP4] result xlsx written. elapsed=" + ms(tXlsx0) + "ms");
        } else {
            System.out.println("[STEP4] result xlsx skipped (--noResult). rows=" + results.size());
        }

        System.out.println("==================================================");
        System.out.println("[DONE] totalElapsed=" + ms(t0) + "ms");
        System.out.println("==================================================");
        return results;
    }

    private static List<FileConversionResult> convertSequential(
            List<SqlSource> sources,
            FileJob job,
            boolean failFast,
            int logEvery,
            long slowMs,
            long tLoop0
    ) {
        int total = sources.size();
        List<FileConversionResult> results = new ArrayList<>(Math.max(16, total));
        Tally tally = new Tally();

        for (int i = 0; i < total; i++) {
            SqlSource src = sources.get(i);
            CliProgressMonitor.setCurrent(src.getRelativePath(), i + 1);

            long one0 = System.nanoTime();
            FileConversionResult r = job.call(src);
            results.add(r);
            tally.count(r);

            reportSlow(src, one0, slowMs);
            if ((i + 1) % logEvery == 0 || (i + 1) == total) {
                CliProgressMonitor.logProgress(i + 1, total, tally.success, tally.skip,
                        tally.statements, tally.review, tLoop0, src.getRelativePath());
            }
            if (failFast && !r.isSuccess() && !SQL_TEXT_EMPTY.equals(r.getMessage())) {
                System.out.println("[FAILFAST] stop on first error.");
                break;
            }
        }
        return results;
    }

    /**
     * Converts files on a fixed pool; results are collected in input order, so the report is
     * identical to a sequential run.
     */
    private static List<FileConversionResult> convertParallel(
            List<SqlSource> sources,
            FileJob job,
            int threads,
            boolean failFast,
            int logEvery,
            long slowMs,
            long tLoop0
    ) {
        int total = sources.size();
        List<FileConversionResult> results = new ArrayList<>(Math.max(16, total));
        Tally tally = new Tally();

        ExecutorService pool = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "dialect-convert-worker");
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<FileConversionResult>> futures = new ArrayList<>(total);
            for (SqlSource src : sources) {
                futures.add(pool.submit(() -> {
                    long one0 = System.nanoTime();
                    FileConversionResult r = job.call(src);
                    reportSlow(src, one0, slowMs);
                    return r;
                }));
            }

            for (int i = 0; i < total; i++) {
                SqlSource src = sources.get(i);
                FileConversionResult r = await(futures.get(i), src);
                results.add(r);
                tally.count(r);
                CliProgressMonitor.setCurrent(src.getRelativePath(), i + 1);

                if ((i + 1) % logEvery == 0 || (i + 1) == total) {
                    CliProgressMonitor.logProgress(i + 1, total, tally.success, tally.skip,
                        tally.statements, tally.review, tLoop0, src.getRelativePath());
                }
                if (failFast && !r.isSuccess() && !SQL_TEXT_EMPTY.equals(r.getMessage())) {
                    System.out.println("[FAILFAST] stop on first error.");
                    for (int j = i + 1; j < total; j++) futures.get(j).cancel(true);
                    break;
                }
            }
        } finally {
            pool.shutdownNow();
        }
        return results;
    }

    private static FileConversionResult await(Future<FileConversionResult> f, SqlSource src) {
        try {
            return f.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while converting: " + src.getRelativePath(), e);
        } catch (ExecutionException e) {
            // FileJob maps every failure to SKIP, so this is an Error escaping the worker
            Throwable cause = (e.getCause() == null) ? e : e.getCause();
            log.error("Worker failed on {}", src.getRelativePath(), cause);
            return FileConversionResult.skip(src.getRelativePath(), cause.getClass().getSimpleName(), safe(cause.getMessage()));
        }
    }

    private static void reportSlow(SqlSource src, long one0, long slowMs) {
        long oneMs = ms(one0);
        if (oneMs >= slowMs) {
            System.out.println("[SLOW] " + oneMs + "ms : " + src.getRelativePath());
        }
    }

    private static long ms(long nanoStart) {
        return (System.nanoTime() - nanoStart) / 1_000_000L;
    }

    private static String safe(String s) {
        return (s == null) ? "" : s;
    }

    /** read, clean, convert and write one input file. */
    static final class FileJob {
        private final SqlTextProvider textProvider;
        private final SqlTextCleaner cleaner;
        private final SqlDialectConverter converter;
        private final SqlOutputWriter outputWriter;
        private final Path outputSqlDir;

        FileJob(
                SqlTextProvider textProvider,
                SqlTextCleaner cleaner,
                SqlDialectConverter converter,
                SqlOutputWriter outputWriter,
                Path outputSqlDir
        ) {
            this.textProvider = textProvider;
            this.cleaner = cleaner;
            this.converter = converter;
            this.outputWriter = outputWriter;
            this.outputSqlDir = outputSqlDir;
        }

        FileConversionResult call(SqlSource src) {
            String key = src.getRelativePath();
            try {
                String raw = textProvider.read(src);
                if (raw == null || raw.isBlank()) {
                    return FileConversionResult.skip(key, SQL_TEXT_EMPTY, "");
                }

                ConversionOutput out = converter.convert(cleaner.clean(raw));
                Path written = outputWriter.write(outputSqlDir, src, out.getText());

                return FileConversionResult.success(key, written == null ? "" : written.toString(), out.getMetrics());

            } catch (Exception e) {
                System.out.println("[ERROR] convert/write failed: " + key);
                System.out.println("        ex=" + e.getClass().getName() + ": " + safe(e.getMessage()));
                e.printStackTrace(System.out);
                return FileConversionResult.skip(key, e.getClass().getSimpleName(), safe(e.getMessage()));
            }
        }
    }

    private static final class Tally {
        int success;
        int skip;
        int statements;
        int review;

        void count(FileConversionResult r) {
            if (r.isSuccess()) success++;
            else skip++;

            ConversionMetrics m = r.getMetrics();
            if (m != null) {
                statements += m.getTotal();
                review += m.getFlagged() + m.getSyntaxError();
            }
        }
    }
}
