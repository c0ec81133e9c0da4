package io.b2mash.roaf.collection;

import io.b2mash.roaf.document.CareerHistoryEntry;
import io.b2mash.roaf.document.Citizenship;
import io.b2mash.roaf.document.HigherEducationEntry;
import io.b2mash.roaf.document.OtherHoldingEntry;
import io.b2mash.roaf.document.PassportDetail;
import io.b2mash.roaf.document.ProfessionalMembershipEntry;
import io.b2mash.roaf.document.QualificationEntry;
import io.b2mash.roaf.document.RegulatoryHistoryEntry;
import io.b2mash.roaf.picklist.OptionSetValues;
import io.b2mash.roaf.picklist.PicklistFamily;
import io.b2mash.roaf.picklist.PicklistResolver;
import io.b2mash.roaf.record.AuthorisedIndividualFields;
import io.b2mash.roaf.record.AuthorisedIndividualFields.CandidateInfo;
import io.b2mash.roaf.record.AuthorisedIndividualFields.CareerHistory;
import io.b2mash.roaf.record.AuthorisedIndividualFields.HigherEducation;
import io.b2mash.roaf.record.AuthorisedIndividualFields.LicenceDetail;
import io.b2mash.roaf.record.AuthorisedIndividualFields.Membership;
import io.b2mash.roaf.record.AuthorisedIndividualFields.OtherHolding;
import io.b2mash.roaf.record.AuthorisedIndividualFields.Qualification;
import io.b2mash.roaf.record.RawRecord;
import io.b2mash.roaf.section.Section;
import org.springframework.stereotype.Component;

/** Per-row mappers for the related-entity collections of an Authorised Individual. */
@Component
public class RepeatingEntryMappers {

  private final PicklistResolver picklistResolver;

  public RepeatingEntryMappers(PicklistResolver picklistResolver) {
    this.picklistResolver = picklistResolver;
  }

  public PassportDetail passportDetail(RawRecord item) {
    return new PassportDetail(
        picklistResolver.resolve(PicklistFamily.TITLE, item.code(CandidateInfo.TITLE)),
        item.textOrEmpty(CandidateInfo.FULL_NAME),
        item.dateOrEmpty(CandidateInfo.DATE_OF_BIRTH, CandidateInfo.DATE_OF_BIRTH_LEGACY),
        item.textOrEmpty(CandidateInfo.PLACE_OF_BIRTH),
        item.isTrue(CandidateInfo.UAE_RESIDENT),
        picklistResolver.resolve(
            PicklistFamily.CITIZENSHIP_COUNT, item.code(CandidateInfo.NUMBER_OF_CITIZENSHIPS)),
        item.textOrEmpty(CandidateInfo.OTHER_NAMES),
        item.textOrEmpty(CandidateInfo.NATIVE_NAME));
  }

  public Citizenship citizenship(RawRecord item) {
    return new Citizenship(
        picklistResolver.resolve(
            PicklistFamily.COUNTRY, item.code(AuthorisedIndividualFields.Citizenship.COUNTRY)),
        item.textOrEmpty(AuthorisedIndividualFields.Citizenship.PASSPORT_NO),
        item.dateOrEmpty(
            AuthorisedIndividualFields.Citizenship.EXPIRY_DATE,
            AuthorisedIndividualFields.Citizenship.EXPIRY_DATE_LEGACY));
  }

  public RegulatoryHistoryEntry regulatoryHistory(RawRecord item) {
    Object regulator = item.code(LicenceDetail.REGULATOR);
    boolean otherRegulator = OptionSetValues.matches(regulator, OptionSetValues.REGULATOR_OTHER);

    return new RegulatoryHistoryEntry(
        picklistResolver.resolve(PicklistFamily.REGULATOR, regulator),
        item.dateOrEmpty(LicenceDetail.DATE_STARTED),
        item.dateOrEmpty(LicenceDetail.DATE_FINISHED),
        item.textOrEmpty(LicenceDetail.LICENSE_NAME),
        item.textOrEmpty(LicenceDetail.REGISTER_NAME),
        item.textOrEmpty(LicenceDetail.OVERVIEW),
        Section.compose(
            otherRegulator, () -> item.textOrEmpty(LicenceDetail.OTHER_REGULATOR_DETAILS)));
  }

  public CareerHistoryEntry careerHistory(RawRecord item) {
    Object activity = item.code(CareerHistory.ACTIVITY);
    Object reasonForLeaving = item.code(CareerHistory.REASON_FOR_LEAVING);

    return new CareerHistoryEntry(
        picklistResolver.resolve(PicklistFamily.ACTIVITY, activity),
        Section.compose(
            OptionSetValues.matches(activity, OptionSetValues.ACTIVITY_OTHER),
            () -> item.textOrEmpty(CareerHistory.EXPLAIN_ACTIVITY)),
        item.textOrEmpty(CareerHistory.NAME_OF_ESTABLISHMENT),
        item.dateOrEmpty(CareerHistory.DATE_FROM),
        item.dateOrNull(CareerHistory.DATE_TO),
        item.textOrEmpty(CareerHistory.POSITION_TITLE),
        picklistResolver.resolve(PicklistFamily.REASON_FOR_LEAVING, reasonForLeaving),
        Section.compose(
            OptionSetValues.matches(reasonForLeaving, OptionSetValues.REASON_FOR_LEAVING_OTHER),
            () -> item.textOrEmpty(CareerHistory.EXPLAIN_REASON_FOR_LEAVING)),
        item.textOrNull(CareerHistory.ACTIVITIES_UNDERTAKEN),
        new CareerHistoryEntry.EmployerAddress(
            item.textOrNull(CareerHistory.ADDRESS),
            item.textOrNull(CareerHistory.STREET_NAME),
            item.textOrNull(CareerHistory.DISTRICT),
            item.textOrNull(CareerHistory.CITY),
            item.textOrNull(CareerHistory.POSTCODE),
            item.textOrNull(CareerHistory.TELEPHONE)),
        new CareerHistoryEntry.EmployerContact(
            item.textOrNull(CareerHistory.CONTACT_PERSON),
            item.textOrNull(CareerHistory.CONTACT_POSITION),
            item.textOrNull(CareerHistory.CONTACT_TELEPHONE),
            item.textOrNull(CareerHistory.CONTACT_EMAIL)),
        Section.compose(item.isTrue(CareerHistory.IS_REGULATED), () -> careerRegulation(item)),
        item.textOrNull(CareerHistory.ACTIVITY_DETAILS));
  }

  private CareerHistoryEntry.Regulation careerRegulation(RawRecord item) {
    Object regulator = item.code(CareerHistory.REGULATOR);
    return new CareerHistoryEntry.Regulation(
        picklistResolver.resolve(PicklistFamily.REGULATOR, regulator),
        Section.compose(
            OptionSetValues.matches(regulator, OptionSetValues.REGULATOR_OTHER),
            () -> item.textOrEmpty(CareerHistory.REGULATOR_DETAILS)));
  }

  public HigherEducationEntry higherEducation(RawRecord item) {
    return new HigherEducationEntry(
        item.textOrEmpty(HigherEducation.TITLE),
        item.textOrEmpty(HigherEducation.UNIVERSITY),
        item.dateOrEmpty(HigherEducation.DATE_OF_AWARD),
        picklistResolver.resolve(
            PicklistFamily.QUALIFICATION_CLASSIFICATION,
            item.code(HigherEducation.CLASSIFICATION)));
  }

  public QualificationEntry qualification(RawRecord item) {
    return new QualificationEntry(
        item.textOrEmpty(Qualification.NAME),
        item.textOrEmpty(Qualification.INSTITUTE),
        item.dateOrEmpty(Qualification.DATE_OF_AWARD));
  }

  public ProfessionalMembershipEntry professionalMembership(RawRecord item) {
    return new ProfessionalMembershipEntry(
        item.textOrEmpty(Membership.ORGANISATION),
        item.dateOrEmpty(Membership.DATE_OF_ADMISSION),
        item.textOrEmpty(Membership.EXPLANATION));
  }

  public OtherHoldingEntry otherHolding(RawRecord item) {
    Object ownership = item.raw(OtherHolding.OWNERSHIP_PERCENTAGE);
    return new OtherHoldingEntry(
        item.textOrEmpty(OtherHolding.NAME_OF_ENTITY),
        item.textOrEmpty(OtherHolding.DETAILS_OF_POSITION),
        item.dateOrEmpty(OtherHolding.DATE_FROM),
        item.dateOrNull(OtherHolding.DATE_TO),
        item.textOrNull(OtherHolding.ADDRESS),
        item.textOrNull(OtherHolding.NATURE_OF_BUSINESS),
        item.textOrNull(OtherHolding.OWNERSHIP_TEXT),
        ownership instanceof Number number ? number : null,
        Section.compose(
            item.isTrue(OtherHolding.IS_REGULATED),
            () ->
                picklistResolver.resolve(
                    PicklistFamily.REGULATOR, item.code(OtherHolding.REGULATOR))),
        Section.compose(
            item.isTrue(OtherHolding.HAS_CONFLICT_OF_INTEREST),
            () -> item.textOrEmpty(OtherHolding.CONFLICT_CLARIFICATION)));
  }
}
