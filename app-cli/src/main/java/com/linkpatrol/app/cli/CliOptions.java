package com.linkpatrol.app.cli;

import com.linkpatrol.core.model.IssueType;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 명령행 인자.
 * <pre>
 * linkpatrol [options] [url ...]
 *   --file &lt;path&gt;     한 줄에 URL 하나
 *   --config &lt;yml&gt;    linkcheck.yml 경로
 *   --timeout &lt;sec&gt;   요청 1회 타임아웃, [5,30]으로 보정
 *   --filter &lt;type&gt;   all | broken | redirect | error (표 출력에만 적용)
 *   --out &lt;dir&gt;       보고서/로그 루트 (기본 out)
 *   --help
 * </pre>
 */
public final class CliOptions {

    public static final int MIN_TIMEOUT_SECONDS = 5;
    public static final int MAX_TIMEOUT_SECONDS = 30;

    private final List<String> urls = new ArrayList<>();
    private Path file;
    private Path config;
    private Integer timeoutSeconds; // null = 설정값 유지
    private IssueType filter;       // null = 전체
    private Path outDir;
    private boolean help;

    private CliOptions() {}

    /** @throws IllegalArgumentException 알 수 없는 옵션, 값 누락, 잘못된 값 */
    public static CliOptions parse(String... args) {
        CliOptions o = new CliOptions();
        if (args == null) return o;
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-h", "--help" -> o.help = true;
                case "-f", "--file" -> o.file = Path.of(value(args, ++i, a));
                case "-c", "--config" -> o.config = Path.of(value(args, ++i, a));
                case "-t", "--timeout" -> o.timeoutSeconds = clampTimeout(parseSeconds(value(args, ++i, a)));
                case "--filter" -> o.filter = IssueType.parse(value(args, ++i, a)).orElse(null);
                case "-o", "--out" -> o.outDir = Path.of(value(args, ++i, a));
                default -> {
                    if (a.startsWith("-")) throw new IllegalArgumentException("Unknown option: " + a);
                    o.urls.add(a);
                }
            }
        }
        return o;
    }

    /** 타임아웃(초)을 [5,30]으로 보정 */
    public static int clampTimeout(int seconds) {
        return Math.max(MIN_TIMEOUT_SECONDS, Math.min(MAX_TIMEOUT_SECONDS, seconds));
    }

    private static int parseSeconds(String s) {
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--timeout expects whole seconds: " + s, e);
        }
    }

    private static String value(String[] args, int i, String opt) {
        if (i >= args.length || args[i].startsWith("--")) {
            throw new IllegalArgumentException("Missing value for " + opt);
        }
        return args[i];
    }

    public List<String> urls() { return List.copyOf(urls); }
    public Optional<Path> file() { return Optional.ofNullable(file); }
    public Optional<Path> config() { return Optional.ofNullable(config); }
    public Optional<Integer> timeoutSeconds() { return Optional.ofNullable(timeoutSeconds); }
    public Optional<IssueType> filter() { return Optional.ofNullable(filter); }
    public Optional<Path> outDir() { return Optional.ofNullable(outDir); }
    public boolean help() { return help; }

    public static String usage() {
        return String.join(System.lineSeparator(),
                "Usage: linkpatrol [options] [url ...]",
                "  --file <path>     read page URLs from a file (one per line)",
                "  --config <yml>    load settings from a linkcheck.yml file",
                "  --timeout <sec>   per-request timeout, clamped to [5,30] (default 10)",
                "  --filter <type>   all | broken | redirect | error (table only)",
                "  --out <dir>       output root for reports and logs (default out)",
                "  --help            show this help",
                "",
                "Exit codes: 0 no issues, 1 issues found, 2 usage error");
    }
}
