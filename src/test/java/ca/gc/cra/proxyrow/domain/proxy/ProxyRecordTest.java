package ca.gc.cra.proxyrow.domain.proxy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ProxyRecordTest {

  @Test
  void urlJoinsProtocolIpAndPort() {
    assertEquals("https://178.22.148.122:3129", record("178.22.148.122", "https", "high").url());
  }

  @Test
  void validAcceptsDottedQuad() {
    assertTrue(record("1.2.3.4", "http", "low").valid());
  }

  @Test
  void validRejectsEmptySegment() {
    assertFalse(record("1..3.4", "http", "low").valid());
    assertFalse(record(".1.2.3", "http", "low").valid());
    assertFalse(record("1.2.3.", "http", "low").valid());
  }

  @Test
  void validRejectsWrongSegmentCount() {
    assertFalse(record("1.2.3", "http", "low").valid());
    assertFalse(record("1.2.3.4.5", "http", "low").valid());
    assertFalse(record("", "http", "low").valid());
  }

  @Test
  void validAcceptsOutOfRangeOctetsBecauseOnlyShapeIsChecked() {
    assertTrue(record("999.300.01.7", "http", "low").valid());
    assertTrue(record("a.b.c.d", "http", "low").valid());
  }

  @Test
  void httpsWithHighAnonymityIsSecure() {
    ProxyRecord record = record("1.2.3.4", "https", "high +ka");

    assertTrue(record.isHttps());
    assertFalse(record.isHttp());
    assertFalse(record.isSocks());
    assertTrue(record.supportsSsl());
    assertTrue(record.isAnonymous());
    assertTrue(record.isSecure());
  }

  @Test
  void httpsWithLowAnonymityIsNotSecure() {
    ProxyRecord record = record("1.2.3.4", "https", "low");

    assertTrue(record.supportsSsl());
    assertFalse(record.isAnonymous());
    assertFalse(record.isSecure());
  }

  @Test
  void socksSupportsSsl() {
    ProxyRecord record = record("1.2.3.4", "socks", "high");

    assertTrue(record.isSocks());
    assertTrue(record.supportsSsl());
    assertTrue(record.isSecure());
  }

  @Test
  void plainHttpIsNeverSecure() {
    ProxyRecord record = record("1.2.3.4", "http", "high");

    assertTrue(record.isHttp());
    assertFalse(record.supportsSsl());
    assertFalse(record.isSecure());
  }

  @Test
  void toStringShowsUrl() {
    assertEquals("<ProxyRecord http://1.2.3.4:80>", record("1.2.3.4", "http", "low").toString());
  }

  @Test
  void rejectsNegativeAge() {
    assertThrows(IllegalArgumentException.class,
        () -> new ProxyRecord(-1, "1.2.3.4", 80, "france", 0, 0, "http", "low"));
  }

  @Test
  void rejectsNegativePortAndLatencies() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> new ProxyRecord(0, "1.2.3.4", -80, "france", 0, 0, "http", "low"));
    assertEquals("port must not be negative (was -80)", ex.getMessage());
    assertThrows(IllegalArgumentException.class,
        () -> new ProxyRecord(0, "1.2.3.4", 80, "france", -5, 0, "http", "low"));
    assertThrows(IllegalArgumentException.class,
        () -> new ProxyRecord(0, "1.2.3.4", 80, "france", 0, -1, "http", "low"));
  }

  @Test
  void rejectsNullIp() {
    assertThrows(NullPointerException.class,
        () -> new ProxyRecord(0, null, 80, "france", 0, 0, "http", "low"));
  }

  private static ProxyRecord record(String ip, String protocol, String anonymity) {
    int port = protocol.equals("https") ? 3129 : 80;
    return new ProxyRecord(60, ip, port, "france", 100, 20, protocol, anonymity);
  }
}
