package dev;

import com.linkpatrol.core.model.CheckRun;
import com.linkpatrol.core.model.IssueType;
import com.linkpatrol.core.model.LinkCheckConfig;
import com.linkpatrol.core.model.LinkIssue;
import com.linkpatrol.core.service.LinkCheckService;
import com.linkpatrol.core.service.export.IssueReport;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

/** 픽스처 인덱스가 의도한 결과 유형을 그대로 만들어내는지 실제 검사기로 확인 */
class SmokeTargetFixtureTest {
  static HttpServer s;
  static ExecutorService pool;
  static String index;

  @BeforeAll
  static void up() throws Exception {
    s = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
    pool = Executors.newCachedThreadPool();
    s.setExecutor(pool);
    SmokeTarget.wireEndpoints(s, false, SmokeTarget.findClosedPort());
    s.start();
    index = "http://localhost:" + s.getAddress().getPort() + "/";
  }

  @AfterAll
  static void down() {
    if (s != null) s.stop(0);
    if (pool != null) pool.shutdownNow(); // /slow 대기 스레드 깨우기
  }

  @Test
  void index_exercises_every_outcome() {
    LinkCheckConfig cfg = LinkCheckConfig.defaults()
        .setTimeoutMs(1000)
        .setPolitenessDelay(Duration.ZERO);

    CheckRun run = new LinkCheckService(cfg).run(List.of(index), null, null);
    IssueReport report = IssueReport.of(run.issues());

    assertThat(run.stats().linksChecked).isEqualTo(15);
    assertThat(report.count(IssueType.BROKEN)).isEqualTo(5);
    assertThat(report.count(IssueType.REDIRECT)).isEqualTo(4);
    assertThat(report.count(IssueType.ERROR)).isEqualTo(2);

    assertThat(report.filter(IssueType.BROKEN)).extracting(LinkIssue::getLinkUrl)
        .containsExactly("/missing", "/gone", "/boom", "/unavailable", "/missing-too");
    assertThat(report.filter(IssueType.REDIRECT)).allSatisfy(i ->
        assertThat(i.getRedirectTarget()).contains("/ok"));
    assertThat(report.filter(null)).extracting(LinkIssue::getLinkUrl)
        .doesNotContain("/ok", "docs/", "/head-blocked", "/choices");
  }
}
