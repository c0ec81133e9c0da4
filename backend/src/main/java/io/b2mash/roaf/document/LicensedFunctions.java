package io.b2mash.roaf.document;

import io.b2mash.roaf.section.Section;

/** Licensed function choice; only present when the candidate is not applying for a rep office. */
public record LicensedFunctions(
    String choice,
    String choiceLabel,
    String executiveType,
    Section<MandatoryFunctions> mandatoryFunctions,
    Section<ResponsibleOfficerConfirmations> responsibleOfficerConfirmations) {

  public record MandatoryFunctions(
      boolean seniorExecutiveOfficer,
      boolean financeOfficer,
      boolean complianceOfficer,
      boolean mlro,
      boolean noMandatoryFunction) {}

  public record ResponsibleOfficerConfirmations(
      String significantResponsibility, String significantInfluence, String notAnEmployee) {}
}
