package io.intellixity.paginator.cursor;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class ArgsFingerprintTest {
  record Filter(String tenant, int minAge, String search) {}

  @Test
  void noArgsNoFingerprint() {
    assertNull(ArgsFingerprint.of(null, Set.of()));
  }

  @Test
  void isMd5OfCanonicalJson() {
    // md5("{}")
    assertEquals("99914b932bd37a50b983c5e7c90ae93b", ArgsFingerprint.of(Map.of(), Set.of()));
  }

  @Test
  void ignoresKeyOrder() {
    Map<String, Object> a = new LinkedHashMap<>();
    a.put("tenant", "t1");
    a.put("nested", Map.of("y", 1, "x", 2));
    Map<String, Object> b = new LinkedHashMap<>();
    b.put("nested", Map.of("x", 2, "y", 1));
    b.put("tenant", "t1");
    assertEquals(ArgsFingerprint.of(a, Set.of()), ArgsFingerprint.of(b, Set.of()));
  }

  @Test
  void varyArgsAreExcluded() {
    String one = ArgsFingerprint.of(new Filter("t1", 18, "ann"), Set.of("search"));
    String two = ArgsFingerprint.of(new Filter("t1", 18, "bob"), Set.of("search"));
    String three = ArgsFingerprint.of(new Filter("t1", 21, "ann"), Set.of("search"));
    assertEquals(one, two);
    assertNotEquals(one, three);
    assertEquals(32, one.length());

    assertEquals(ArgsFingerprint.of(Map.of(), Set.of()), ArgsFingerprint.of(Map.of("search", "x"), List.of("search")));
  }

  @Test
  void recordsAndMapsWithSameContentMatch() {
    assertEquals(
        ArgsFingerprint.of(Map.of("tenant", "t1", "minAge", 18, "search", "s"), Set.of()),
        ArgsFingerprint.of(new Filter("t1", 18, "s"), Set.of()));
  }
}
