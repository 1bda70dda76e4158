package io.intellixity.paginator.cursor;

import io.intellixity.paginator.error.InvalidCursorException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class CursorCodecTest {
  private static String raw(String json) {
    return Base64.getUrlEncoder().withoutPadding().encodeToString(json.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void roundTripsAllFields() {
    Cursor c = new Cursor("People", "byName", "abc123", Arrays.asList("ann", null, 7, true));
    String encoded = CursorCodec.encode(c);
    assertFalse(encoded.contains("="));
    assertFalse(encoded.contains("+"));
    assertFalse(encoded.contains("/"));
    assertEquals(c, CursorCodec.decode(encoded));
  }

  @Test
  void omitsAbsentFields() {
    Cursor start = Cursor.start("People", "default", null);
    Cursor decoded = CursorCodec.decode(CursorCodec.encode(start));
    assertEquals(start, decoded);
    assertFalse(decoded.hasBoundary());
    assertNull(decoded.argsFingerprint());
  }

  @Test
  void writesTemporalValuesAsIsoStrings() {
    Cursor c = new Cursor("q", "s", null, List.of(Instant.parse("2024-05-01T12:30:00Z")));
    String json = new String(Base64.getUrlDecoder().decode(CursorCodec.encode(c)), StandardCharsets.UTF_8);
    assertTrue(json.contains("\"2024-05-01T12:30:00Z\""), json);
    assertEquals(List.of("2024-05-01T12:30:00Z"), CursorCodec.decode(CursorCodec.encode(c)).values());
  }

  @Test
  void noCursorMeansFirstPage() {
    assertNull(CursorCodec.decode(null));
    assertNull(CursorCodec.decode("  "));
  }

  @Test
  void rejectsStructuralProblems() {
    assertMessage("Cursor is not valid base64url", "*not*base64*");
    assertMessage("Cursor contains invalid JSON", raw("{not json"));
    assertMessage("Cursor is not object-like", raw("[1, 2]"));
    assertMessage("Cursor is not object-like", raw("\"q\""));
    assertMessage("Cursor 'q' is not a string", raw("{\"s\": \"x\"}"));
    assertMessage("Cursor 'q' is not a string", raw("{\"q\": 1, \"s\": \"x\"}"));
    assertMessage("Cursor 's' is not a string", raw("{\"q\": \"x\", \"s\": []}"));
    assertMessage("Cursor 'a' is not a string", raw("{\"q\": \"x\", \"s\": \"y\", \"a\": 5}"));
    assertMessage("Cursor 'v' is not an array", raw("{\"q\": \"x\", \"s\": \"y\", \"v\": {\"k\": 1}}"));
  }

  @Test
  void decodeFailuresCarryDetails() {
    String bad = raw("{\"q\": 1, \"s\": \"x\"}");
    InvalidCursorException e = assertThrows(InvalidCursorException.class, () -> CursorCodec.decode(bad));
    assertEquals(1, e.info().get("q"));

    InvalidCursorException json = assertThrows(InvalidCursorException.class, () -> CursorCodec.decode(raw("{oops")));
    assertEquals(raw("{oops"), json.info().get("cursor"));
    assertNotNull(json.getCause());
  }

  @Test
  void explicitNullOptionalsAreAbsent() {
    Cursor c = CursorCodec.decode(raw("{\"q\": \"x\", \"s\": \"y\", \"a\": null, \"v\": null}"));
    assertEquals(Cursor.start("x", "y", null), c);
  }

  private static void assertMessage(String expected, String cursor) {
    InvalidCursorException e = assertThrows(InvalidCursorException.class, () -> CursorCodec.decode(cursor));
    assertEquals(expected, e.getMessage(), cursor);
  }
}
