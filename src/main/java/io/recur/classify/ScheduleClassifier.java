package io.recur.classify;

import io.recur.model.ScheduleType;
import io.recur.model.SimpleKeyword;
import io.recur.parser.RawRecord;
import java.util.Locale;
import java.util.Map;

/**
 * Decides which schedule variant a raw record holds.
 *
 * <p>The encodings can overlap in arbitrary input, so the checks run in a fixed order and the
 * first match wins:
 *
 * <ol>
 *   <li>a non-empty {@code advancedScheduleJson} is ADVANCED, even one holding only whitespace;
 *   <li>a {@code scheduleExpression} of exactly MANUAL or ONCE is SIMPLE;
 *   <li>an expression with whitespace and a digit is CRON;
 *   <li>anything else is SIMPLE.
 * </ol>
 */
public final class ScheduleClassifier {
  private ScheduleClassifier() {}

  /**
   * Classifies a raw record. Never throws; a null or empty record is SIMPLE.
   *
   * @param raw the raw record
   * @return the schedule type
   */
  public static ScheduleType determineScheduleType(Map<String, ?> raw) {
    return determineScheduleType(RawRecord.of(raw));
  }

  /**
   * Classifies a wrapped raw record.
   *
   * @param record the raw record
   * @return the schedule type
   */
  public static ScheduleType determineScheduleType(RawRecord record) {
    if (RawRecord.isTruthy(record.advancedPayload())) {
      return ScheduleType.ADVANCED;
    }
    Object expression = record.expression();
    if (expression == null) {
      return ScheduleType.SIMPLE;
    }
    String normalized = expression.toString().trim().toUpperCase(Locale.ROOT);
    if (normalized.equals(SimpleKeyword.MANUAL.name())
        || normalized.equals(SimpleKeyword.ONCE.name())) {
      return ScheduleType.SIMPLE;
    }
    if (looksLikeCron(normalized)) {
      return ScheduleType.CRON;
    }
    return ScheduleType.SIMPLE;
  }

  /**
   * A heuristic, not a grammar check: "run at 5" also matches.
   *
   * @param expression the trimmed expression
   * @return true if the expression has at least one whitespace character and one digit
   */
  static boolean looksLikeCron(String expression) {
    boolean space = false;
    boolean digit = false;
    for (int i = 0; i < expression.length(); i++) {
      char c = expression.charAt(i);
      space |= Character.isWhitespace(c);
      digit |= Character.isDigit(c);
    }
    return space && digit;
  }
}
