package io.b2mash.roaf.document;

import io.b2mash.roaf.section.Section;

/** Firm, requestor and candidate identity (steps 0.3 and 1.1). */
public record Application(
    String id,
    String firmName,
    String firmNumber,
    Requestor requestor,
    String authorisedIndividualName,
    Section<String> repOfficeFunctions,
    Contact contact,
    Section<PreviousAddress> previousAddress,
    Section<OtherNames> otherNames,
    Section<PreviousAuthorisation> previousAuthorisation) {

  public record Requestor(String name, String position, String email, String phone) {}

  public record Contact(
      String address,
      String postCode,
      String country,
      String mobile,
      String email,
      String residenceDuration) {}

  public record PreviousAddress(String address, String postCode, String country) {}

  public record OtherNames(
      String stateOtherNames, String nativeName, String dateChanged, String reason) {}

  /**
   * Link to the candidate's earlier authorisation. The reference is the source lookup id, passed
   * through unresolved.
   */
  public record PreviousAuthorisation(String candidateReference) {}
}
