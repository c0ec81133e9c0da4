package io.b2mash.roaf.document;

import io.b2mash.roaf.section.Section;

/** One licence or registration held with a regulator. */
public record RegulatoryHistoryEntry(
    String regulator,
    String dateStarted,
    String dateFinished,
    String licenseName,
    String registerName,
    String overview,
    Section<String> otherRegulatorDetails) {

  /** True when the regulator was chosen as "Other" and details are given instead. */
  public boolean isOtherRegulator() {
    return otherRegulatorDetails.isPresent();
  }
}
