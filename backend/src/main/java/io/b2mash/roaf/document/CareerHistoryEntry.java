package io.b2mash.roaf.document;

import io.b2mash.roaf.section.Section;

/**
 * One career history row. Explanations are only present when the matching choice is "Other";
 * {@code dateTo} is null for the current position.
 */
public record CareerHistoryEntry(
    String activity,
    Section<String> activityExplanation,
    String nameOfEstablishment,
    String dateFrom,
    String dateTo,
    String positionTitle,
    String reasonForLeaving,
    Section<String> reasonForLeavingExplanation,
    String activitiesUndertaken,
    EmployerAddress address,
    EmployerContact contact,
    Section<Regulation> regulation,
    String activityDetails) {

  public record EmployerAddress(
      String buildingNameNumber,
      String streetName,
      String district,
      String city,
      String postcodePoBox,
      String telephoneNumber) {}

  public record EmployerContact(String name, String position, String telephone, String email) {}

  /** Present when the employer is or was regulated. */
  public record Regulation(String regulator, Section<String> regulatorDetails) {}
}
