package io.recur;

import io.recur.model.Schedule;
import java.util.List;

/**
 * A parsed schedule together with the issues recovered from while parsing it.
 *
 * @param schedule the parsed schedule
 * @param issues the validation issues, in the order they were found
 */
public record ParseResult(Schedule schedule, List<ValidationIssue> issues) {
  /** Creates a new ParseResult with a defensive copy of the issues. */
  public ParseResult {
    issues = issues == null ? List.of() : List.copyOf(issues);
  }

  /**
   * Returns true if any issue was found.
   *
   * @return whether the record had problems
   */
  public boolean hasIssues() {
    return !issues.isEmpty();
  }
}
