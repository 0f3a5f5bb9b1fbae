package io.recur.parser;

import io.recur.model.Copies;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only view of a raw record received from the platform's REST API.
 *
 * <p>Field lookups fall back to the older key names the platform has used for the same data.
 */
public final class RawRecord {
  public static final String START_DATE = "scheduleStartDate";
  public static final String START_DATE_ALIAS = "startDate";
  public static final String EXPRESSION = "scheduleExpression";
  public static final String EXPRESSION_ALIAS = "expression";
  public static final String ADVANCED = "advancedScheduleJson";
  public static final String ADVANCED_ALIAS = "advancedSchedule";
  public static final String IS_ACTIVE = "isActive";
  public static final String TIMEZONE = "timezone";

  private static final RawRecord EMPTY = new RawRecord(Map.of());

  private final Map<String, Object> fields;

  private RawRecord(Map<String, Object> fields) {
    this.fields = fields;
  }

  /**
   * Wraps a raw record. A null map is treated as empty.
   *
   * @param raw the raw record
   * @return a read-only view of the record
   */
  public static RawRecord of(Map<String, ?> raw) {
    if (raw == null || raw.isEmpty()) {
      return EMPTY;
    }
    return new RawRecord(Copies.map(raw));
  }

  /**
   * Returns the record as an unmodifiable map.
   *
   * @return the fields
   */
  public Map<String, Object> asMap() {
    return fields;
  }

  /**
   * Returns true if the record contains the key, even with a null value.
   *
   * @param key the field name
   * @return whether the key is present
   */
  public boolean has(String key) {
    return fields.containsKey(key);
  }

  /** The start date value, raw. */
  public Object startDate() {
    return first(START_DATE, START_DATE_ALIAS);
  }

  /** The schedule expression value, raw. */
  public Object expression() {
    return first(EXPRESSION, EXPRESSION_ALIAS);
  }

  /** The advanced payload, either a map or a JSON string. */
  public Object advancedPayload() {
    return first(ADVANCED, ADVANCED_ALIAS);
  }

  /**
   * Returns the {@code isActive} flag. Missing or unreadable values count as active.
   *
   * @return whether the schedule is active
   */
  public boolean isActive() {
    Object value = fields.get(IS_ACTIVE);
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    if (value instanceof String) {
      String s = ((String) value).trim().toLowerCase(Locale.ROOT);
      if (s.equals("false")) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns the top-level timezone, or null if absent or blank.
   *
   * @return the timezone name
   */
  public String timezone() {
    return asText(fields.get(TIMEZONE));
  }

  // The first truthy value wins; otherwise the primary key's value, which may be null or empty.
  private Object first(String key, String alias) {
    Object primary = fields.get(key);
    if (isTruthy(primary)) {
      return primary;
    }
    Object fallback = fields.get(alias);
    return isTruthy(fallback) ? fallback : primary;
  }

  /**
   * Returns false for null, empty strings, empty maps and collections, false, and zero. A
   * whitespace-only string is data: it may be a payload that fails to decode.
   *
   * @param value the value to test
   * @return whether the value carries data
   */
  public static boolean isTruthy(Object value) {
    if (value == null) {
      return false;
    }
    if (value instanceof String) {
      return !((String) value).isEmpty();
    }
    if (value instanceof Map) {
      return !((Map<?, ?>) value).isEmpty();
    }
    if (value instanceof Collection) {
      return !((Collection<?>) value).isEmpty();
    }
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    if (value instanceof Number) {
      return ((Number) value).doubleValue() != 0;
    }
    return true;
  }

  /**
   * Returns the value as trimmed text, or null if it is null or blank.
   *
   * @param value the value
   * @return the text
   */
  public static String asText(Object value) {
    if (value == null) {
      return null;
    }
    String s = value.toString().trim();
    return s.isEmpty() ? null : s;
  }

  /**
   * Coerces a value to an integer. Accepts integral numbers, whole decimals and numeric strings.
   *
   * @param value the value
   * @return the integer, or null if the value is not coercible or does not fit in an int
   */
  public static Integer asInteger(Object value) {
    BigDecimal whole = asWholeNumber(value);
    if (whole == null) {
      return null;
    }
    try {
      return whole.intValueExact();
    } catch (ArithmeticException e) {
      return null;
    }
  }

  /**
   * Coerces a value to a whole number of any magnitude, so callers can tell a value that is too
   * large from one that is not a number at all.
   *
   * @param value the value
   * @return the whole number, or null if the value is not numeric or has a fractional part
   */
  public static BigDecimal asWholeNumber(Object value) {
    if (value == null || value instanceof Boolean) {
      return null;
    }
    BigDecimal decimal;
    try {
      if (value instanceof Number) {
        decimal = new BigDecimal(value.toString());
      } else if (value instanceof String) {
        decimal = new BigDecimal(((String) value).trim());
      } else {
        return null;
      }
    } catch (NumberFormatException e) {
      return null;
    }
    return decimal.signum() == 0 || decimal.stripTrailingZeros().scale() <= 0 ? decimal : null;
  }
}
