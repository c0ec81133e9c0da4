package io.b2mash.roaf.document;

import io.b2mash.roaf.section.ExclusiveChoice;

/**
 * Proposed position. {@code startDate} holds either the proposed start date or the explanation
 * for not having one.
 */
public record Position(
    String proposedJobTitle,
    ExclusiveChoice<String, String> startDate,
    boolean willBeMlro,
    boolean applyingAsMlro) {

  public boolean hasProposedStartDate() {
    return startDate.flag();
  }

  public String proposedStartDate() {
    return startDate.whenTrueOrNull();
  }

  public String startDateExplanation() {
    return startDate.whenFalseOrNull();
  }
}
