package io.intellixity.paginator.sort;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.paginator.error.ConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads sort declarations from JSON.\n
 *
 * <pre>{@code
 * {
 *   "default": ["id"],
 *   "recent":  [{"column": "created_at", "type": "date", "direction": "desc"}, "id"]
 * }
 * }</pre>
 *
 * Entries are either a bare column name or an object with {@code column}, {@code type},
 * {@code nullable}, {@code direction} and {@code valuePath}. Validators cannot be declared here.\n
 */
public final class SortDefinitions {
  private static final ObjectMapper JSON = new ObjectMapper();

  private SortDefinitions() {}

  public static Map<String, List<SortDescriptor>> fromJson(String json) {
    try {
      return fromTree(JSON.readTree(json));
    } catch (JsonProcessingException e) {
      throw new ConfigurationException("Sort definitions are not valid JSON", Map.of(), e);
    }
  }

  public static Map<String, List<SortDescriptor>> fromJson(InputStream in) {
    try {
      return fromTree(JSON.readTree(in));
    } catch (IOException e) {
      throw new ConfigurationException("Sort definitions are not valid JSON", Map.of(), e);
    }
  }

  private static Map<String, List<SortDescriptor>> fromTree(JsonNode root) {
    if (root == null || !root.isObject()) {
      throw new ConfigurationException("Sort definitions must be a JSON object");
    }
    Map<String, List<SortDescriptor>> out = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> it = root.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      out.put(e.getKey(), parseSort(e.getKey(), e.getValue()));
    }
    return out;
  }

  private static List<SortDescriptor> parseSort(String name, JsonNode n) {
    if (!n.isArray()) {
      throw new ConfigurationException("Sort '" + name + "' must be an array", Map.of("sort", name));
    }
    List<SortDescriptor> out = new ArrayList<>();
    for (JsonNode x : n) out.add(parseDescriptor(name, x));
    return List.copyOf(out);
  }

  private static SortDescriptor parseDescriptor(String sort, JsonNode n) {
    if (n.isTextual()) return SortDescriptor.of(n.asText());
    if (!n.isObject()) {
      throw new ConfigurationException("Sort '" + sort + "' has an entry that is neither a column name nor an object",
          Map.of("sort", sort, "entry", n.toString()));
    }
    String column = textOrNull(n.get("column"));
    if (column == null) {
      throw new ConfigurationException("Sort '" + sort + "' has an entry without 'column'",
          Map.of("sort", sort, "entry", n.toString()));
    }
    SortDescriptor d = SortDescriptor.of(column)
        .withType(textOrNull(n.get("type")))
        .withDirection(textOrNull(n.get("direction")))
        .withValuePath(textOrNull(n.get("valuePath")));
    JsonNode nullable = n.get("nullable");
    if (nullable != null && !nullable.isNull()) {
      if (!nullable.isBoolean()) {
        throw new ConfigurationException("'nullable' must be a boolean", Map.of("sort", sort, "column", column));
      }
      d = d.withNullable(nullable.booleanValue());
    }
    return d;
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }
}
