package ca.gc.cra.proxyrow.domain.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class DurationsTest {

  @Test
  void sumsMinutesAndSeconds() {
    assertEquals(90L, Durations.toSeconds("1 min 30 sec"));
  }

  @Test
  void acceptsMagnitudeAttachedToUnit() {
    assertEquals(90L, Durations.toSeconds("1min 30sec"));
  }

  @Test
  void convertsHours() {
    assertEquals(7_200L, Durations.toSeconds("2 h"));
  }

  @Test
  void convertsDays() {
    assertEquals(86_400L, Durations.toSeconds("1 d"));
  }

  @Test
  void matchesUnitsBySubstring() {
    assertEquals(5 * 86_400L + 3 * 3_600L, Durations.toSeconds("5 days 3 hours"));
    assertEquals(45L, Durations.toSeconds("45 seconds"));
    assertEquals(120L, Durations.toSeconds("2 minutes"));
  }

  @Test
  void tokensWithoutUnitContributeNothing() {
    assertEquals(180L, Durations.toSeconds("10 ago 3 min"));
    assertEquals(0L, Durations.toSeconds("1 2 3"));
  }

  @Test
  void unitWithoutMagnitudeCountsAsZero() {
    assertEquals(0L, Durations.toSeconds("sec"));
  }

  @Test
  void blankTextIsZero() {
    assertEquals(0L, Durations.toSeconds(null));
    assertEquals(0L, Durations.toSeconds(""));
    assertEquals(0L, Durations.toSeconds("   "));
  }

  @Test
  void hugeMagnitudesSaturate() {
    assertEquals(Long.MAX_VALUE, Durations.toSeconds("99999999999999999999 d"));
  }
}
