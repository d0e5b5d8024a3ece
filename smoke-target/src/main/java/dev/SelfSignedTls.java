package dev;

import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;

import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.math.BigInteger;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.security.Security;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Date;

/** HTTPS 픽스처용 자가서명 인증서 (BouncyCastle). p12가 있으면 재사용. */
final class SelfSignedTls {
  private SelfSignedTls() {}

  static SSLContext buildOrLoad(File p12File, char[] password, String alias) throws Exception {
    KeyStore ks = KeyStore.getInstance("PKCS12");
    if (p12File.exists()) {
      try (InputStream in = new FileInputStream(p12File)) {
        ks.load(in, password);
      }
    } else {
      ks = createKeyStore(password, alias);
      try (OutputStream out = new FileOutputStream(p12File)) {
        ks.store(out, password);
      }
      // 소유자만 읽기/쓰기 (권한 변경이 안 되는 FS면 그대로 둔다)
      boolean restricted = p12File.setReadable(false, false) & p12File.setReadable(true, true)
          & p12File.setWritable(false, false) & p12File.setWritable(true, true);
      if (!restricted) {
        System.out.println("[LP] could not restrict permissions on " + p12File);
      }
    }

    KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
    kmf.init(ks, password);

    SSLContext ssl = SSLContext.getInstance("TLS");
    ssl.init(kmf.getKeyManagers(), null, new SecureRandom());
    return ssl;
  }

  static KeyStore createKeyStore(char[] password, String alias) throws Exception {
    KeyPairGenerator kpg = KeyPairGenerator.getInstance("RSA");
    kpg.initialize(2048);
    KeyPair kp = kpg.generateKeyPair();

    KeyStore ks = KeyStore.getInstance("PKCS12");
    ks.load(null, null);
    ks.setKeyEntry(alias, kp.getPrivate(), password, new Certificate[]{selfSigned("localhost", kp)});
    return ks;
  }

  static X509Certificate selfSigned(String cn, KeyPair kp) throws Exception {
    if (Security.getProvider("BC") == null) {
      Security.addProvider(new BouncyCastleProvider());
    }
    X500Name subject = new X500Name("CN=" + cn);
    BigInteger serial = new BigInteger(64, new SecureRandom());
    Date notBefore = Date.from(ZonedDateTime.now().minus(1, ChronoUnit.DAYS).toInstant());
    Date notAfter = Date.from(ZonedDateTime.now().plusYears(5).toInstant());

    // SAN: DNS:localhost, IP:127.0.0.1
    GeneralNames san = new GeneralNames(new GeneralName[]{
        new GeneralName(GeneralName.dNSName, "localhost"),
        new GeneralName(GeneralName.iPAddress, "127.0.0.1")
    });

    JcaX509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
        subject, serial, notBefore, notAfter, subject, kp.getPublic());
    builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(false));
    builder.addExtension(Extension.subjectAlternativeName, false, san);
    builder.addExtension(Extension.keyUsage, true,
        new KeyUsage(KeyUsage.digitalSignature | KeyUsage.keyEncipherment));

    ContentSigner signer = new JcaContentSignerBuilder("SHA256withRSA").build(kp.getPrivate());
    X509CertificateHolder holder = builder.build(signer);
    return new JcaX509CertificateConverter().setProvider("BC").getCertificate(holder);
  }
}
