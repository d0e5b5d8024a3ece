package com.linkpatrol.app.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging 전역 설정 + 사이즈 롤링(기본 2MB x 5).
 * SLF4J는 slf4j-jdk14 바인딩으로 여기 설정된 핸들러를 그대로 탄다.
 * - configure(outRoot): outRoot/logs 기준 초기화
 * - init(logDir): logs 디렉터리를 직접 넘겨 초기화
 * - setLevel(Level): 루트/핸들러 레벨 즉시 변경
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false; // 재초기화 방지
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    /** outRoot/logs/app-%g.log 로 저장. System props:
     *  -Dlp.log.level=FINE|INFO|WARNING|SEVERE
     *  -Dlp.log.sizeMb=2
     *  -Dlp.log.files=5
     *  -Dlp.log.console=true|false (기본 true, 콘솔은 stderr)
     */
    public static synchronized void configure(Path outRoot) {
        init(outRoot.resolve("logs"));
    }

    public static synchronized void init(Path logDir) {
        if (initialized) return;
        initialized = true;

        Level level = levelOf(System.getProperty("lp.log.level", "INFO"));
        int sizeMb = parseInt(System.getProperty("lp.log.sizeMb"), 2);
        int fileCnt = parseInt(System.getProperty("lp.log.files"), 5);
        boolean toConsole = !"false".equalsIgnoreCase(System.getProperty("lp.log.console", "true"));

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");
        root.setLevel(level);

        if (toConsole) {
            ConsoleHandler console = new ConsoleHandler();
            console.setLevel(level);
            console.setFormatter(LINE_FORMATTER);
            root.addHandler(console);
        }

        try {
            Files.createDirectories(logDir);
            String pattern = logDir.resolve("app-%g.log").toString();
            FileHandler file = new FileHandler(pattern, sizeMb * 1024 * 1024, fileCnt, true);
            file.setLevel(level);
            file.setFormatter(LINE_FORMATTER);
            root.addHandler(file);

            Logger.getLogger(LogSetup.class.getName()).log(Level.FINE,
                    () -> "Log initialized. dir=" + logDir.toAbsolutePath() + ", level=" + level.getName());
        } catch (IOException e) {
            // 파일 핸들러 없이 콘솔만으로 진행
            Logger.getLogger(LogSetup.class.getName())
                    .log(Level.WARNING, "File logging disabled: " + e.getMessage(), e);
        }
    }

    /** 런타임에 로그 레벨 변경 (콘솔/파일 모두) */
    public static void setLevel(Level level) {
        Level l = (level == null) ? Level.INFO : level;
        Logger root = Logger.getLogger("");
        root.setLevel(l);
        for (Handler h : root.getHandlers()) {
            h.setLevel(l);
        }
    }

    /** 문자열을 Level로(실패 시 INFO) */
    public static Level levelOf(String name) {
        if (name == null || name.isBlank()) return Level.INFO;
        try {
            return Level.parse(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return Level.INFO;
        }
    }

    static int parseInt(String s, int def) {
        if (s == null || s.isBlank()) return def;
        try {
            int v = Integer.parseInt(s.trim());
            return v > 0 ? v : def;
        } catch (NumberFormatException e) {
            return def;
        }
    }

    /** 한 줄 포맷 + 스레드명 + 예외 스택 */
    static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String msg = formatMessage(r);
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    r.getLoggerName(), msg);

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw + System.lineSeparator();
        }
    }
}
