package io.intellixity.paginator.cursor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.intellixity.paginator.error.InvalidCursorException;
import io.intellixity.paginator.error.PaginatorException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Cursor wire format: a JSON object {@code {q, s, a?, v?}} in URL-safe base64 without padding.\n
 *
 * The string is opaque to clients but neither signed nor encrypted; every decoded value is
 * validated again before it reaches a predicate. Fractional numbers decode as {@link java.math.BigDecimal}
 * and dates travel as ISO-8601 strings, so boundary values keep their full precision.\n
 */
public final class CursorCodec {
  private static final ObjectMapper JSON = new ObjectMapper()
      .registerModule(new JavaTimeModule())
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
      .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
  private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

  private CursorCodec() {}

  public static String encode(Cursor cursor) {
    ObjectNode root = JSON.createObjectNode();
    root.put("q", cursor.queryId());
    root.put("s", cursor.sortId());
    if (cursor.argsFingerprint() != null) root.put("a", cursor.argsFingerprint());
    if (cursor.values() != null) root.set("v", JSON.valueToTree(cursor.values()));
    try {
      return ENCODER.encodeToString(JSON.writeValueAsBytes(root));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize cursor values", e);
    }
  }

  /**
   * Decodes a client cursor. {@code null} or blank input means "no cursor" and yields {@code null}.
   *
   * @throws InvalidCursorException on any structural problem
   */
  public static Cursor decode(String encoded) {
    if (encoded == null || encoded.isBlank()) return null;

    byte[] raw;
    try {
      raw = DECODER.decode(encoded);
    } catch (IllegalArgumentException e) {
      throw new InvalidCursorException("Cursor is not valid base64url", Map.of("cursor", encoded), e);
    }

    JsonNode root;
    try {
      root = JSON.readTree(raw);
    } catch (IOException e) {
      throw new InvalidCursorException("Cursor contains invalid JSON", Map.of("cursor", encoded), e);
    }

    if (root == null || !root.isObject()) {
      throw new InvalidCursorException("Cursor is not object-like", Map.of("cursor", encoded));
    }
    String q = requireText(root, "q");
    String s = requireText(root, "s");

    String a = null;
    JsonNode an = root.get("a");
    if (an != null && !an.isNull()) a = requireText(root, "a");

    List<Object> values = null;
    JsonNode vn = root.get("v");
    if (vn != null && !vn.isNull()) {
      if (!vn.isArray()) {
        throw new InvalidCursorException("Cursor 'v' is not an array", PaginatorException.details("v", toJava(vn)));
      }
      values = new ArrayList<>(vn.size());
      for (JsonNode x : vn) values.add(toJava(x));
    }
    return new Cursor(q, s, a, values);
  }

  private static String requireText(JsonNode root, String field) {
    JsonNode n = root.get(field);
    if (n == null || !n.isTextual()) {
      throw new InvalidCursorException("Cursor '" + field + "' is not a string",
          PaginatorException.details(field, n == null ? null : toJava(n)));
    }
    return n.textValue();
  }

  private static Object toJava(JsonNode n) {
    if (n == null || n.isNull()) return null;
    try {
      return JSON.treeToValue(n, Object.class);
    } catch (JsonProcessingException e) {
      throw new InvalidCursorException("Cursor contains invalid JSON", Map.of("value", n.toString()), e);
    }
  }
}
