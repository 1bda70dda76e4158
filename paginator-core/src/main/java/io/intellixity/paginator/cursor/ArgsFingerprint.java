package io.intellixity.paginator.cursor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stable digest of the query arguments a cursor was minted under.
 *
 * <p>Arguments are converted to a JSON tree with map keys in sorted order; top-level properties
 * named in {@code varyArgs} are dropped first, so they may change between pages.</p>
 */
public final class ArgsFingerprint {
  private static final ObjectMapper JSON = new ObjectMapper()
      .registerModule(new JavaTimeModule())
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
      .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

  private ArgsFingerprint() {}

  /** MD5 hex of the canonical arguments, or {@code null} when {@code args} is {@code null}. */
  public static String of(Object args, Collection<String> varyArgs) {
    if (args == null) return null;
    Object tree = JSON.convertValue(args, Object.class);
    if (tree instanceof Map<?, ?> m && varyArgs != null && !varyArgs.isEmpty()) {
      Map<Object, Object> copy = new LinkedHashMap<>(m);
      copy.keySet().removeAll(varyArgs);
      tree = copy;
    }
    try {
      byte[] canonical = JSON.writeValueAsString(tree).getBytes(StandardCharsets.UTF_8);
      return HexFormat.of().formatHex(MessageDigest.getInstance("MD5").digest(canonical));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Pagination arguments are not serializable: " + args.getClass().getName(), e);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("MD5 not available", e);
    }
  }
}
