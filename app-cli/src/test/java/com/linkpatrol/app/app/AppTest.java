package com.linkpatrol.app.app;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class AppTest {
    static HttpServer s;
    static String base;

    @TempDir
    Path tmp;

    private final ByteArrayOutputStream outBuf = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBuf = new ByteArrayOutputStream();
    private final App app = new App(new PrintStream(outBuf, true, StandardCharsets.UTF_8),
            new PrintStream(errBuf, true, StandardCharsets.UTF_8), false);

    @BeforeAll
    static void up() throws Exception {
        s = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        s.createContext("/", ex -> respond(ex, 404, "nope"));
        s.createContext("/clean", ex -> respond(ex, 200, "<a href=\"/ok\">ok</a>"));
        s.createContext("/dirty", ex -> respond(ex, 200, "<a href=\"/ok\">ok</a><a href=\"/missing\">missing</a>"));
        s.createContext("/ok", ex -> respond(ex, 200, "ok"));
        s.start();
        base = "http://localhost:" + s.getAddress().getPort();
    }

    @AfterAll
    static void down() { if (s != null) s.stop(0); }

    @Test
    void clean_site_exits_zero_without_reports() {
        int code = app.run(base + "/clean", "--out", tmp.toString());

        assertThat(code).isEqualTo(App.EXIT_CLEAN);
        assertThat(outBuf.toString(StandardCharsets.UTF_8)).contains("Total issues      : 0");
        assertThat(tmp.resolve("reports")).doesNotExist();
        assertThat(errBuf.toString(StandardCharsets.UTF_8)).contains("[1/1]");
    }

    @Test
    void issues_exit_one_and_write_csv_and_json() throws IOException {
        Path list = tmp.resolve("pages.txt");
        Files.writeString(list, base + "/dirty\n\n" + base + "/clean\n");

        int code = app.run("--file", list.toString(), "--out", tmp.toString());

        assertThat(code).isEqualTo(App.EXIT_ISSUES);
        String out = outBuf.toString(StandardCharsets.UTF_8);
        assertThat(out).contains("/missing").contains("Report written");
        try (Stream<Path> files = Files.list(tmp.resolve("reports"))) {
            List<String> names = files.map(p -> p.getFileName().toString()).sorted().toList();
            assertThat(names).hasSize(2);
            assertThat(names.get(0)).startsWith("link_check_results_").endsWith(".csv");
            assertThat(names.get(1)).endsWith(".json");
        }
    }

    @Test
    void usage_errors_exit_two() {
        assertThat(app.run()).isEqualTo(App.EXIT_USAGE);
        assertThat(app.run("--nope")).isEqualTo(App.EXIT_USAGE);
        assertThat(app.run("ftp://files.test/")).isEqualTo(App.EXIT_USAGE);
        assertThat(errBuf.toString(StandardCharsets.UTF_8)).contains("Usage:");
    }

    @Test
    void help_exits_zero() {
        assertThat(app.run("--help")).isEqualTo(App.EXIT_CLEAN);
        assertThat(outBuf.toString(StandardCharsets.UTF_8)).contains("--timeout");
    }

    @Test
    void long_lists_are_truncated_with_warning() throws IOException {
        Path yml = tmp.resolve("lc.yml");
        Files.writeString(yml, "maxUrls: 1\npolitenessDelayMs: 0\n");

        int code = app.run("--config", yml.toString(), "--out", tmp.toString(), base + "/clean", base + "/dirty");

        assertThat(code).isEqualTo(App.EXIT_CLEAN);
        assertThat(errBuf.toString(StandardCharsets.UTF_8)).contains("only the first 1");
    }

    private static void respond(HttpExchange ex, int code, String body) throws IOException {
        if ("HEAD".equals(ex.getRequestMethod())) {
            ex.sendResponseHeaders(code, -1);
            ex.close();
            return;
        }
        byte[] b = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().set("Content-Type", "text/html; charset=utf-8");
        ex.sendResponseHeaders(code, b.length);
        try (OutputStream os = ex.getResponseBody()) { os.write(b); }
    }
}
