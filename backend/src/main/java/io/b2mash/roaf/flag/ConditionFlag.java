package io.b2mash.roaf.flag;

import static io.b2mash.roaf.flag.FlagPredicate.codeEquals;
import static io.b2mash.roaf.flag.FlagPredicate.codeSet;
import static io.b2mash.roaf.flag.FlagPredicate.hasItems;
import static io.b2mash.roaf.flag.FlagPredicate.isTrue;

import io.b2mash.roaf.picklist.OptionSetValues;
import io.b2mash.roaf.record.AuthorisedIndividualFields;
import io.b2mash.roaf.record.RawRecord;

/**
 * Registry of condition flags that shape the Authorised Individual document. Each constant names
 * the single raw field it reads and the predicate applied to it, so the business rule set is data
 * and every flag can be tested on its own.
 */
public enum ConditionFlag {

  /** Applying on behalf of a Representative Office; hides licensed functions. */
  REP_OFFICE("repOffice", AuthorisedIndividualFields.REP_OFFICE),

  PREVIOUSLY_HELD("previouslyHeld", AuthorisedIndividualFields.PREVIOUSLY_HELD),

  OTHER_NAMES("otherNames", AuthorisedIndividualFields.OTHER_NAMES),

  /** Less than 3 years at the current address; shows the previous address. */
  RESIDENCE_DURATION_LESS_THAN_3_YEARS(
      "residenceDurationLessThan3Years",
      AuthorisedIndividualFields.RESIDENCE_DURATION,
      codeEquals(
          AuthorisedIndividualFields.RESIDENCE_DURATION,
          OptionSetValues.RESIDENCE_LESS_THAN_3_YEARS)),

  /** Proposed start date given; otherwise an explanation is expected. */
  HAS_START_DATE("hasStartDate", AuthorisedIndividualFields.HAS_START_DATE),

  HAS_REGULATORY_HISTORY("hasRegulatoryHistory", AuthorisedIndividualFields.HAS_REGULATORY_HISTORY),

  LICENSED_FUNCTION_SELECTED(
      "licensedFunctionSelected",
      AuthorisedIndividualFields.LICENSED_FUNCTION,
      codeSet(AuthorisedIndividualFields.LICENSED_FUNCTION)),

  HAS_CAREER_HISTORY(
      "hasCareerHistory",
      AuthorisedIndividualFields.CAREER_HISTORY,
      hasItems(AuthorisedIndividualFields.CAREER_HISTORY)),

  HAS_HIGHER_EDUCATION(
      "hasHigherEducation",
      AuthorisedIndividualFields.HIGHER_EDUCATION,
      hasItems(AuthorisedIndividualFields.HIGHER_EDUCATION)),

  HAS_PROFESSIONAL_QUALIFICATIONS(
      "hasProfessionalQualifications",
      AuthorisedIndividualFields.PROFESSIONAL_QUALIFICATIONS,
      hasItems(AuthorisedIndividualFields.PROFESSIONAL_QUALIFICATIONS)),

  HAS_OTHER_QUALIFICATIONS(
      "hasOtherQualifications",
      AuthorisedIndividualFields.OTHER_QUALIFICATIONS,
      hasItems(AuthorisedIndividualFields.OTHER_QUALIFICATIONS)),

  HAS_PROFESSIONAL_MEMBERSHIPS(
      "hasProfessionalMemberships",
      AuthorisedIndividualFields.PROFESSIONAL_MEMBERSHIPS,
      hasItems(AuthorisedIndividualFields.PROFESSIONAL_MEMBERSHIPS)),

  HAS_DIFC_EXPERIENCE("hasDifcExperience", AuthorisedIndividualFields.HAS_DIFC_EXPERIENCE),

  HAS_SIMILAR_ROLE_EXPERIENCE(
      "hasSimilarRoleExperience", AuthorisedIndividualFields.HAS_SIMILAR_ROLE_EXPERIENCE),

  HAS_OTHER_HOLDINGS(
      "hasOtherHoldings",
      AuthorisedIndividualFields.OTHER_HOLDINGS,
      hasItems(AuthorisedIndividualFields.OTHER_HOLDINGS));

  private final String renderName;
  private final String sourceField;
  private final FlagPredicate predicate;

  ConditionFlag(String renderName, String sourceField) {
    this(renderName, sourceField, isTrue(sourceField));
  }

  ConditionFlag(String renderName, String sourceField, FlagPredicate predicate) {
    this.renderName = renderName;
    this.sourceField = sourceField;
    this.predicate = predicate;
  }

  /** Name under which the flag is exposed to templates. */
  public String renderName() {
    return renderName;
  }

  /** The raw field this flag is derived from. */
  public String sourceField() {
    return sourceField;
  }

  public boolean evaluate(RawRecord record) {
    return predicate.test(record);
  }
}
