package io.b2mash.roaf.document;

import io.b2mash.roaf.section.Section;

/**
 * Position of controller, director or partner held elsewhere. {@code ownershipPercentage} is the
 * raw whole number from the source, or null.
 */
public record OtherHoldingEntry(
    String nameOfEntity,
    String detailsOfPosition,
    String dateFrom,
    String dateTo,
    String address,
    String natureOfBusiness,
    String ownershipText,
    Number ownershipPercentage,
    Section<String> regulator,
    Section<String> conflictClarification) {

  public boolean isRegulated() {
    return regulator.isPresent();
  }

  public boolean hasConflictOfInterest() {
    return conflictClarification.isPresent();
  }
}
