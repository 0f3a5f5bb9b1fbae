package io.recur.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Defensive copies that tolerate the null values JSON records may hold. Nested maps and lists are
 * copied too, so a schedule never shares mutable state with the record it was parsed from.
 */
public final class Copies {
  private Copies() {}

  /**
   * Returns an unmodifiable deep copy of a JSON-shaped map.
   *
   * @param source the map, may be null
   * @return the copy, empty if the source was null
   */
  public static Map<String, Object> map(Map<String, ?> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    Map<String, Object> copy = new LinkedHashMap<>();
    source.forEach((k, v) -> copy.put(k, deep(v)));
    return Collections.unmodifiableMap(copy);
  }

  static List<Integer> list(List<Integer> source) {
    return source == null ? null : List.copyOf(source);
  }

  private static Object deep(Object value) {
    if (value instanceof Map) {
      Map<String, Object> copy = new LinkedHashMap<>();
      ((Map<?, ?>) value).forEach((k, v) -> copy.put(String.valueOf(k), deep(v)));
      return Collections.unmodifiableMap(copy);
    }
    if (value instanceof Collection) {
      List<Object> copy = new ArrayList<>();
      for (Object v : (Collection<?>) value) {
        copy.add(deep(v));
      }
      return Collections.unmodifiableList(copy);
    }
    return value;
  }
}
