package dev;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.sun.net.httpserver.HttpsConfigurator;
import com.sun.net.httpserver.HttpsServer;

import javax.net.ssl.SSLContext;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Executors;

/**
 * 링크 검사기 수동 점검용 로컬 사이트.
 * 인덱스 페이지(/)의 링크가 정상/깨짐/리다이렉트/오류/제외 대상을 모두 한 번씩 밟는다.
 *
 * 실행: mvn -pl smoke-target exec:java  (HTTP 8080, HTTPS 8443)
 * 점검: mvn -pl app-cli exec:java -Dexec.args="http://localhost:8080/"
 */
public class SmokeTarget {

  static final int HTTP_PORT = 8080;
  static final int HTTPS_PORT = 8443;
  static final long SLOW_MS = 35_000; // CLI 최대 타임아웃(30s)보다 길게

  public static void main(String[] args) throws Exception {
    int closedPort = findClosedPort();

    // --- HTTP 8080
    HttpServer http = HttpServer.create(new InetSocketAddress(HTTP_PORT), 0);
    wireEndpoints(http, false, closedPort);
    http.setExecutor(Executors.newFixedThreadPool(8));
    http.start();
    System.out.println("[LP] HTTP  fixture on  http://localhost:" + HTTP_PORT + "/");

    // --- HTTPS 8443 (자가서명 p12 자동 생성/로드)
    try {
      HttpsServer https = HttpsServer.create(new InetSocketAddress(HTTPS_PORT), 0);
      SSLContext ssl = SelfSignedTls.buildOrLoad(new File("smoke-keystore.p12"), "changeit".toCharArray(), "smoke");
      https.setHttpsConfigurator(new HttpsConfigurator(ssl));
      wireEndpoints(https, true, closedPort);
      https.setExecutor(Executors.newFixedThreadPool(8));
      https.start();
      System.out.println("[LP] HTTPS fixture on https://localhost:" + HTTPS_PORT + "/ (self-signed)");
    } catch (Exception e) {
      System.out.println("[LP] HTTPS disabled (" + e.getClass().getSimpleName() + ": " + e.getMessage() + ")");
    }
  }

  /** 링크 결과 유형별 엔드포인트 배선 */
  static void wireEndpoints(HttpServer s, boolean isHttps, int closedPort) {
    s.createContext("/", ex -> {
      if (!"/".equals(ex.getRequestURI().getPath())) {
        resp(ex, 404, "text/html", "<h1>404 Not Found</h1>");
        return;
      }
      resp(ex, 200, "text/html", indexHtml(isHttps, closedPort));
    });

    s.createContext("/ok", ex -> resp(ex, 200, "text/html", "<p>fine</p>"));
    s.createContext("/docs/", ex -> resp(ex, 200, "text/html",
        "<a href=\"../ok\">up one level</a> <a href=\"intro.html\">intro</a>"));
    s.createContext("/docs/intro.html", ex -> resp(ex, 200, "text/html", "<p>intro</p>"));

    s.createContext("/gone", ex -> resp(ex, 410, "text/plain", "gone"));
    s.createContext("/boom", ex -> resp(ex, 500, "text/plain", "internal error"));
    s.createContext("/unavailable", ex -> resp(ex, 503, "text/plain", "try later"));

    s.createContext("/moved-301", ex -> redirect(ex, 301, "/ok"));
    s.createContext("/moved-302", ex -> redirect(ex, 302, "/ok"));
    s.createContext("/moved-307", ex -> redirect(ex, 307, "/ok"));
    s.createContext("/moved-308", ex -> redirect(ex, 308, "/ok"));
    s.createContext("/choices", ex -> resp(ex, 300, "text/plain", "multiple choices"));

    // HEAD 거부, GET 허용
    s.createContext("/head-blocked", ex -> {
      if ("HEAD".equalsIgnoreCase(ex.getRequestMethod())) {
        ex.getResponseHeaders().set("Allow", "GET");
        ex.sendResponseHeaders(405, -1);
        ex.close();
        return;
      }
      resp(ex, 200, "text/html", "<p>GET only</p>");
    });

    s.createContext("/slow", ex -> {
      try {
        Thread.sleep(SLOW_MS);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
      }
      resp(ex, 200, "text/plain", "finally");
    });
  }

  static String indexHtml(boolean isHttps, int closedPort) {
    return "<html><body>"
        + "<h3>LinkPatrol fixture (" + (isHttps ? "HTTPS" : "HTTP") + ")</h3>"
        + "<ul>"
        // 정상
        + "<li><a href=\"/ok\">ok</a></li>"
        + "<li><a href=\"docs/\">relative docs</a></li>"
        + "<li><a href=\"/head-blocked\">HEAD 405, GET 200</a></li>"
        + "<li><a href=\"/choices\">300 is not flagged</a></li>"
        // broken
        + "<li><a href=\"/missing\">404</a></li>"
        + "<li><a href=\"/gone\">410</a></li>"
        + "<li><a href=\"/boom\">500</a></li>"
        + "<li><a href=\"/unavailable\">503</a></li>"
        // redirect
        + "<li><a href=\"/moved-301\">301</a></li>"
        + "<li><a href=\"/moved-302\">302</a></li>"
        + "<li><a href=\"/moved-307\">307</a></li>"
        + "<li><a href=\"/moved-308\">308</a></li>"
        // error
        + "<li><a href=\"/slow\">timeout</a></li>"
        + "<li><a href=\"http://localhost:" + closedPort + "/\">connection refused</a></li>"
        // 앵커 텍스트 없음
        + "<li><a href=\"/missing-too\"><img src=\"/x.png\"></a></li>"
        // 제외 대상
        + "<li><a href=\"#top\">fragment</a></li>"
        + "<li><a href=\"javascript:void(0)\">script</a></li>"
        + "<li><a href=\"mailto:webmaster@localhost\">mail</a></li>"
        + "<li><a href=\"tel:+10000000000\">phone</a></li>"
        + "</ul>"
        + "</body></html>";
  }

  /** 바인드 후 바로 닫은 포트 → 연결 거부 대상 */
  static int findClosedPort() throws IOException {
    try (ServerSocket ss = new ServerSocket(0)) {
      return ss.getLocalPort();
    }
  }

  static void redirect(HttpExchange ex, int code, String location) throws IOException {
    ex.getResponseHeaders().set("Location", location);
    ex.sendResponseHeaders(code, -1);
    ex.close();
  }

  static void resp(HttpExchange ex, int code, String ct, String body) throws IOException {
    ex.getResponseHeaders().set("Content-Type", ct + "; charset=utf-8");
    if ("HEAD".equalsIgnoreCase(ex.getRequestMethod())) {
      ex.sendResponseHeaders(code, -1);
      ex.close();
      return;
    }
    byte[] b = body.getBytes(StandardCharsets.UTF_8);
    ex.sendResponseHeaders(code, b.length);
    try (OutputStream os = ex.getResponseBody()) { os.write(b); }
  }
}
