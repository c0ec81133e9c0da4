package io.b2mash.roaf.section;

import io.b2mash.roaf.document.Application;
import io.b2mash.roaf.document.CandidateProfile;
import io.b2mash.roaf.document.CanonicalDocument;
import io.b2mash.roaf.document.LicensedFunctions;
import io.b2mash.roaf.document.Position;
import io.b2mash.roaf.document.WorkExperience;
import io.b2mash.roaf.flag.ConditionFlag;
import io.b2mash.roaf.flag.ConditionFlags;
import io.b2mash.roaf.picklist.PicklistFamily;
import io.b2mash.roaf.picklist.PicklistResolver;
import io.b2mash.roaf.record.AuthorisedIndividualFields;
import io.b2mash.roaf.record.RawRecord;
import org.springframework.stereotype.Component;

/**
 * Builds the single-valued regions of the Authorised Individual document. Every conditional region
 * goes through {@link Section#compose} or {@link ExclusiveChoice#select}, so visibility is decided
 * by a named flag and never by the presence of raw data.
 */
@Component
public class SectionComposer {

  private final PicklistResolver picklistResolver;

  public SectionComposer(PicklistResolver picklistResolver) {
    this.picklistResolver = picklistResolver;
  }

  public CanonicalDocument.Guidelines composeGuidelines(RawRecord record) {
    return new CanonicalDocument.Guidelines(
        picklistResolver.resolve(
            PicklistFamily.GUIDELINES_CONFIRM,
            record.code(AuthorisedIndividualFields.GUIDELINES_CONFIRM)));
  }

  public CanonicalDocument.Disclosure composeDisclosure(RawRecord record) {
    return new CanonicalDocument.Disclosure(
        record.isTrue(AuthorisedIndividualFields.CONSENT_TO_DISCLOSURE));
  }

  public Application composeApplication(String id, RawRecord record, ConditionFlags flags) {
    return new Application(
        id,
        record.textOrEmpty(AuthorisedIndividualFields.FIRM_NAME),
        record.textOrEmpty(AuthorisedIndividualFields.FIRM_NUMBER),
        new Application.Requestor(
            record.textOrEmpty(AuthorisedIndividualFields.REQUESTOR_NAME),
            record.textOrEmpty(AuthorisedIndividualFields.REQUESTOR_POSITION),
            record.textOrEmpty(AuthorisedIndividualFields.REQUESTOR_EMAIL),
            record.textOrEmpty(AuthorisedIndividualFields.REQUESTOR_PHONE)),
        record.textOrEmpty(AuthorisedIndividualFields.AUTHORISED_INDIVIDUAL_NAME),
        Section.compose(
            flags.isSet(ConditionFlag.REP_OFFICE),
            () ->
                picklistResolver.resolve(
                    PicklistFamily.REP_OFFICE_FUNCTION,
                    record.code(AuthorisedIndividualFields.REP_OFFICE_FUNCTIONS))),
        composeContact(record),
        Section.compose(
            flags.isSet(ConditionFlag.RESIDENCE_DURATION_LESS_THAN_3_YEARS),
            () ->
                new Application.PreviousAddress(
                    record.textOrEmpty(AuthorisedIndividualFields.PREVIOUS_ADDRESS),
                    record.textOrEmpty(AuthorisedIndividualFields.PREVIOUS_POSTCODE),
                    picklistResolver.resolve(
                        PicklistFamily.COUNTRY,
                        record.code(AuthorisedIndividualFields.PREVIOUS_COUNTRY)))),
        Section.compose(
            flags.isSet(ConditionFlag.OTHER_NAMES),
            () ->
                new Application.OtherNames(
                    record.textOrEmpty(AuthorisedIndividualFields.STATE_OTHER_NAMES),
                    record.textOrEmpty(AuthorisedIndividualFields.NATIVE_NAME),
                    record.dateOrEmpty(AuthorisedIndividualFields.DATE_NAME_CHANGED),
                    record.textOrEmpty(AuthorisedIndividualFields.REASON_FOR_NAME_CHANGE))),
        Section.compose(
            flags.isSet(ConditionFlag.PREVIOUSLY_HELD),
            () ->
                new Application.PreviousAuthorisation(
                    record.textOrEmpty(AuthorisedIndividualFields.PREVIOUS_CANDIDATE))));
  }

  private Application.Contact composeContact(RawRecord record) {
    return new Application.Contact(
        record.textOrEmpty(AuthorisedIndividualFields.ADDRESS),
        record.textOrEmpty(AuthorisedIndividualFields.POSTCODE),
        picklistResolver.resolve(
            PicklistFamily.COUNTRY, record.code(AuthorisedIndividualFields.COUNTRY)),
        record.textOrEmpty(AuthorisedIndividualFields.MOBILE),
        record.textOrEmpty(AuthorisedIndividualFields.CONTACT_EMAIL),
        picklistResolver.resolve(
            PicklistFamily.RESIDENCE_DURATION,
            record.code(AuthorisedIndividualFields.RESIDENCE_DURATION)));
  }

  /** Absent for rep office applications; the nested questions follow {@link DerivedFlags}. */
  public Section<LicensedFunctions> composeLicensedFunctions(
      RawRecord record, DerivedFlags derivedFlags) {
    return Section.compose(
        derivedFlags.showLicensedFunctionsSection(),
        () -> {
          Object choice = record.code(AuthorisedIndividualFields.LICENSED_FUNCTION);
          return new LicensedFunctions(
              picklistResolver.resolve(PicklistFamily.LICENSED_FUNCTION_KEY, choice),
              picklistResolver.resolve(PicklistFamily.LICENSED_FUNCTION, choice),
              picklistResolver.resolve(
                  PicklistFamily.EXECUTIVE_TYPE,
                  record.code(AuthorisedIndividualFields.EXECUTIVE_TYPE)),
              Section.compose(
                  derivedFlags.showMandatoryFunctionsQuestion(),
                  () ->
                      new LicensedFunctions.MandatoryFunctions(
                          record.isTrue(AuthorisedIndividualFields.SENIOR_EXECUTIVE_OFFICER),
                          record.isTrue(AuthorisedIndividualFields.FINANCE_OFFICER),
                          record.isTrue(AuthorisedIndividualFields.COMPLIANCE_OFFICER),
                          record.isTrue(AuthorisedIndividualFields.MLRO),
                          record.isTrue(AuthorisedIndividualFields.NO_MANDATORY_FUNCTION))),
              Section.compose(
                  derivedFlags.showResponsibleOfficerConfirmations(),
                  () ->
                      new LicensedFunctions.ResponsibleOfficerConfirmations(
                          record.textOrEmpty(
                              AuthorisedIndividualFields.RESPONSIBLE_OFFICER_CONFIRMATION_1),
                          record.textOrEmpty(
                              AuthorisedIndividualFields.RESPONSIBLE_OFFICER_CONFIRMATION_2),
                          record.textOrEmpty(
                              AuthorisedIndividualFields.RESPONSIBLE_OFFICER_CONFIRMATION_3))));
        });
  }

  public Position composePosition(RawRecord record, ConditionFlags flags) {
    return new Position(
        record.textOrEmpty(AuthorisedIndividualFields.PROPOSED_JOB_TITLE),
        ExclusiveChoice.select(
            flags.isSet(ConditionFlag.HAS_START_DATE),
            () -> record.dateOrEmpty(AuthorisedIndividualFields.PROPOSED_START_DATE),
            () -> record.textOrEmpty(AuthorisedIndividualFields.START_DATE_EXPLANATION)),
        record.isTrue(AuthorisedIndividualFields.WILL_BE_MLRO),
        record.isTrue(AuthorisedIndividualFields.APPLYING_AS_MLRO));
  }

  public CandidateProfile composeCandidateProfile(RawRecord record) {
    return new CandidateProfile(
        record.textOrNull(AuthorisedIndividualFields.CV_FILE),
        record.textOrNull(AuthorisedIndividualFields.CV_FILE_NAME),
        record.textOrNull(AuthorisedIndividualFields.JOB_DESCRIPTION_FILE),
        record.textOrNull(AuthorisedIndividualFields.JOB_DESCRIPTION_FILE_NAME));
  }

  public WorkExperience composeWorkExperience(RawRecord record, ConditionFlags flags) {
    return new WorkExperience(
        ExclusiveChoice.select(
            flags.isSet(ConditionFlag.HAS_DIFC_EXPERIENCE),
            () -> record.textOrEmpty(AuthorisedIndividualFields.DIFC_EXPERIENCE_OVERVIEW),
            () -> record.textOrEmpty(AuthorisedIndividualFields.DIFC_KNOWLEDGE_PLAN)),
        ExclusiveChoice.select(
            flags.isSet(ConditionFlag.HAS_SIMILAR_ROLE_EXPERIENCE),
            () ->
                picklistResolver.resolve(
                    PicklistFamily.YEARS_OF_EXPERIENCE,
                    record.code(AuthorisedIndividualFields.YEARS_OF_EXPERIENCE)),
            () -> record.textOrEmpty(AuthorisedIndividualFields.EXPERIENCE_PLAN)));
  }
}
