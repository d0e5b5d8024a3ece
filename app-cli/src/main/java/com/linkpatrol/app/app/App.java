package com.linkpatrol.app.app;

import com.linkpatrol.app.cli.CliOptions;
import com.linkpatrol.app.cli.ConsoleReport;
import com.linkpatrol.app.logging.LogSetup;
import com.linkpatrol.core.model.CheckRun;
import com.linkpatrol.core.model.LinkCheckConfig;
import com.linkpatrol.core.service.LinkCheckService;
import com.linkpatrol.core.service.export.CsvReportExporter;
import com.linkpatrol.core.service.export.IssueReport;
import com.linkpatrol.core.service.export.JsonReportExporter;
import com.linkpatrol.core.service.export.ReportExporter;
import com.linkpatrol.core.util.UrlListParser;
import com.linkpatrol.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

/** 명령행 진입점: 입력 → 검사 → 요약/표 출력 → CSV/JSON 저장 */
public final class App {
    private static final Logger LOG = LoggerFactory.getLogger(App.class);

    public static final int EXIT_CLEAN = 0;
    public static final int EXIT_ISSUES = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_CANCELLED = 130;

    private final PrintStream out;
    private final PrintStream err;
    private final boolean configureLogging;

    public App(PrintStream out, PrintStream err, boolean configureLogging) {
        this.out = out;
        this.err = err;
        this.configureLogging = configureLogging;
    }

    public static void main(String[] args) {
        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.error("==== Uncaught: {} ====", t.getName(), e));
        int code = new App(System.out, System.err, true).run(args);
        System.exit(code);
    }

    public int run(String... args) {
        final CliOptions opts;
        final LinkCheckConfig cfg;
        final List<String> pages;
        try {
            opts = CliOptions.parse(args);
            if (opts.help()) {
                out.println(CliOptions.usage());
                return EXIT_CLEAN;
            }
            cfg = loadConfig(opts);
            if (configureLogging) LogSetup.configure(cfg.getOutputDir());
            pages = collectUrls(opts, cfg);
        } catch (IllegalArgumentException | IOException e) {
            err.println("Error: " + e.getMessage());
            err.println(CliOptions.usage());
            return EXIT_USAGE;
        }

        final CheckRun run;
        // catch 출력까지 끝난 뒤 close: 훅은 그때까지 JVM 종료를 잡아 둔다
        CancelOnShutdown shutdown = CancelOnShutdown.install();
        try {
            run = new LinkCheckService(cfg).run(pages,
                    (done, total, last) -> err.printf("[%d/%d] %s%n", done, total, last),
                    shutdown.flag());
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (CancellationException e) {
            err.println("Cancelled.");
            err.flush();
            return EXIT_CANCELLED;
        } finally {
            shutdown.close();
        }

        IssueReport report = IssueReport.of(run.issues());
        ConsoleReport console = new ConsoleReport(out);
        console.summary(report, run.stats());
        console.table(report, opts.filter().orElse(null));
        console.breakdown(report);

        if (!report.isClean()) {
            export(cfg.getOutputDir(), report);
        }
        return report.isClean() ? EXIT_CLEAN : EXIT_ISSUES;
    }

    /** defaults → (--config 또는 ./linkcheck.yml) → 명령행 옵션 순으로 덮어쓴다. */
    static LinkCheckConfig loadConfig(CliOptions opts) throws IOException {
        LinkCheckConfig cfg;
        if (opts.config().isPresent()) {
            cfg = YamlConfigLoader.load(opts.config().get());
        } else if (Files.exists(Path.of(YamlConfigLoader.DEFAULT_FILE))) {
            cfg = YamlConfigLoader.loadDefault();
        } else {
            cfg = LinkCheckConfig.defaults();
        }
        opts.timeoutSeconds().ifPresent(cfg::setTimeoutSeconds);
        opts.outDir().ifPresent(cfg::setOutputDir);
        cfg.validate();
        return cfg;
    }

    /** 인자 URL + --file 내용. 둘 다 없으면 설정 파일의 urls. 상한 초과 시 앞에서부터 자른다. */
    List<String> collectUrls(CliOptions opts, LinkCheckConfig cfg) throws IOException {
        List<String> lines = new ArrayList<>(opts.urls());
        if (opts.file().isPresent()) {
            lines.addAll(Files.readAllLines(opts.file().get(), StandardCharsets.UTF_8));
        }
        if (lines.isEmpty()) lines.addAll(cfg.getUrls());

        UrlListParser.Parsed parsed = UrlListParser.parseLines(lines, cfg.getMaxUrls());
        if (parsed.urls().isEmpty()) {
            throw new IllegalArgumentException("No page URLs given");
        }
        if (parsed.truncated()) {
            err.printf("Warning: %d URLs given, only the first %d will be checked.%n",
                    parsed.requested(), parsed.urls().size());
            LOG.warn("URL list truncated: requested={}, kept={}", parsed.requested(), parsed.urls().size());
        }
        return parsed.urls();
    }

    private void export(Path outDir, IssueReport report) {
        Instant now = Instant.now();
        List<ReportExporter> exporters = List.of(new CsvReportExporter(), new JsonReportExporter());
        for (ReportExporter ex : exporters) {
            try {
                Path p = ex.export(outDir, report.issues(), now);
                out.println("Report written: " + p.toAbsolutePath());
            } catch (IOException e) {
                LOG.error("Report export failed ({}): {}", ex.getClass().getSimpleName(), e.toString(), e);
                err.println("Could not write report: " + e.getMessage());
            }
        }
    }
}
