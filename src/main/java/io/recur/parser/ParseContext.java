package io.recur.parser;

import io.recur.ValidationIssue;
import java.util.ArrayList;
import java.util.List;

/** Collects the validation issues found while parsing one raw record. */
public final class ParseContext {
  private final List<ValidationIssue> issues = new ArrayList<>();

  /**
   * Records an issue.
   *
   * @param issue the issue found
   */
  public void report(ValidationIssue issue) {
    issues.add(issue);
  }

  /**
   * Returns the issues found so far.
   *
   * @return an unmodifiable snapshot of the issues
   */
  public List<ValidationIssue> issues() {
    return List.copyOf(issues);
  }
}
