package dev;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.net.ssl.SSLContext;
import java.io.File;
import java.nio.file.Path;
import java.security.KeyStore;
import java.security.cert.X509Certificate;

import static org.assertj.core.api.Assertions.assertThat;

class SelfSignedTlsTest {

  @TempDir
  Path tmp;

  @Test
  void certificate_is_for_localhost() throws Exception {
    KeyStore ks = SelfSignedTls.createKeyStore("pw".toCharArray(), "smoke");
    X509Certificate cert = (X509Certificate) ks.getCertificate("smoke");

    assertThat(cert.getSubjectX500Principal().getName()).isEqualTo("CN=localhost");
    assertThat(cert.getSubjectAlternativeNames()).isNotEmpty();
    cert.checkValidity();
  }

  @Test
  void keystore_is_created_once_then_reused() throws Exception {
    File p12 = tmp.resolve("smoke.p12").toFile();

    SSLContext first = SelfSignedTls.buildOrLoad(p12, "changeit".toCharArray(), "smoke");
    long written = p12.lastModified();
    SSLContext second = SelfSignedTls.buildOrLoad(p12, "changeit".toCharArray(), "smoke");

    assertThat(first.getProtocol()).isEqualTo("TLS");
    assertThat(second).isNotNull();
    assertThat(p12).exists();
    assertThat(p12.lastModified()).isEqualTo(written);
  }
}
