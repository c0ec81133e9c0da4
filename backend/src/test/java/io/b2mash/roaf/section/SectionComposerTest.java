package io.b2mash.roaf.section;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.roaf.flag.FlagDeriver;
import io.b2mash.roaf.picklist.OptionSetValues;
import io.b2mash.roaf.picklist.TestPicklists;
import io.b2mash.roaf.record.AuthorisedIndividualFields;
import io.b2mash.roaf.record.RawRecord;
import io.b2mash.roaf.record.TestRecords;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SectionComposerTest {

  private final SectionComposer composer = new SectionComposer(TestPicklists.resolver());
  private final FlagDeriver flagDeriver = new FlagDeriver();

  @Test
  void composesGuidelinesAndDisclosure() {
    var record = TestRecords.load(TestRecords.FULL);

    assertThat(composer.composeGuidelines(record).confirmRead()).isEqualTo("I confirm");
    assertThat(composer.composeDisclosure(record).consentToDisclosure()).isTrue();
  }

  @Test
  void applicationCarriesRequestorAndContact() {
    var record = TestRecords.load(TestRecords.FULL);

    var application = composer.composeApplication("id-1", record, flagDeriver.deriveFlags(record));

    assertThat(application.id()).isEqualTo("id-1");
    assertThat(application.firmName()).isEqualTo("Gulf Capital Advisors Ltd");
    assertThat(application.requestor().name()).isEqualTo("Sarah Collins");
    assertThat(application.contact().country()).isEqualTo("United Arab Emirates");
    assertThat(application.contact().residenceDuration()).isEqualTo("Less than 3 years");
  }

  @Test
  void previousAddressPresentForShortResidence() {
    var record = TestRecords.load(TestRecords.FULL);

    var application = composer.composeApplication("id", record, flagDeriver.deriveFlags(record));

    var previous = application.previousAddress().orNull();
    assertThat(previous).isNotNull();
    assertThat(previous.address()).isEqualTo("Flat 3, 22 Queen's Gate");
    assertThat(previous.postCode()).isEqualTo("SW7 5JE");
    assertThat(previous.country()).isEqualTo("United Kingdom");
  }

  @Test
  void previousAddressAbsentForLongResidence() {
    var record =
        TestRecords.with(
            TestRecords.FULL,
            Map.of(
                AuthorisedIndividualFields.RESIDENCE_DURATION,
                OptionSetValues.RESIDENCE_3_YEARS_OR_MORE));

    var application = composer.composeApplication("id", record, flagDeriver.deriveFlags(record));

    assertThat(application.previousAddress().isPresent()).isFalse();
    assertThat(application.contact().residenceDuration()).isEqualTo("3 years or more");
  }

  @Test
  void missingResidenceDurationReadsAsThreeYearsOrMore() {
    var record =
        TestRecords.without(TestRecords.FULL, AuthorisedIndividualFields.RESIDENCE_DURATION);

    var application = composer.composeApplication("id", record, flagDeriver.deriveFlags(record));

    assertThat(application.previousAddress().isPresent()).isFalse();
    assertThat(application.contact().residenceDuration()).isEqualTo("3 years or more");
  }

  @Test
  void otherNamesAndPreviousAuthorisationFollowFlags() {
    var record = TestRecords.load(TestRecords.FULL);
    var application = composer.composeApplication("id", record, flagDeriver.deriveFlags(record));

    assertThat(application.otherNames().orNull().stateOtherNames()).isEqualTo("Omar Al-Haddad");
    assertThat(application.otherNames().orNull().dateChanged()).isEqualTo("2015-06-01");
    assertThat(application.previousAuthorisation().orNull().candidateReference())
        .isEqualTo("0f6a1c2d-7e8b-4a90-b1c2-d3e4f5a6b7c8");
    assertThat(application.repOfficeFunctions().isPresent()).isFalse();

    var cleared =
        TestRecords.with(
            TestRecords.FULL,
            Map.of(
                AuthorisedIndividualFields.OTHER_NAMES, false,
                AuthorisedIndividualFields.PREVIOUSLY_HELD, false));
    var clearedApplication =
        composer.composeApplication("id", cleared, flagDeriver.deriveFlags(cleared));

    assertThat(clearedApplication.otherNames().isPresent()).isFalse();
    assertThat(clearedApplication.previousAuthorisation().isPresent()).isFalse();
  }

  @Test
  void repOfficeShowsFunctionsAndHidesLicensedFunctions() {
    var record =
        TestRecords.with(
            TestRecords.FULL,
            Map.of(
                AuthorisedIndividualFields.REP_OFFICE, true,
                AuthorisedIndividualFields.REP_OFFICE_FUNCTIONS, 356960000));
    var flags = flagDeriver.deriveFlags(record);

    var application = composer.composeApplication("id", record, flags);
    var licensedFunctions =
        composer.composeLicensedFunctions(record, DerivedFlagRules.derive(flags, record));

    assertThat(application.repOfficeFunctions().orNull()).isEqualTo("Principal Representative");
    assertThat(licensedFunctions.isPresent()).isFalse();
  }

  @Test
  void licensedDirectorShowsMandatoryFunctions() {
    var record = TestRecords.load(TestRecords.FULL);
    var flags = flagDeriver.deriveFlags(record);

    var functions =
        composer.composeLicensedFunctions(record, DerivedFlagRules.derive(flags, record)).orNull();

    assertThat(functions.choice()).isEqualTo("LicensedDirector");
    assertThat(functions.choiceLabel()).isEqualTo("Licensed Director");
    assertThat(functions.executiveType()).isEqualTo("Executive");
    assertThat(functions.mandatoryFunctions().orNull().seniorExecutiveOfficer()).isTrue();
    assertThat(functions.mandatoryFunctions().orNull().financeOfficer()).isFalse();
    assertThat(functions.responsibleOfficerConfirmations().isPresent()).isFalse();
  }

  @Test
  void responsibleOfficerShowsConfirmationsOnly() {
    var record =
        TestRecords.with(
            TestRecords.FULL,
            Map.of(
                AuthorisedIndividualFields.LICENSED_FUNCTION,
                OptionSetValues.LICENSED_FUNCTION_RESPONSIBLE_OFFICER,
                AuthorisedIndividualFields.RESPONSIBLE_OFFICER_CONFIRMATION_1,
                "Confirmed"));
    var flags = flagDeriver.deriveFlags(record);

    var functions =
        composer.composeLicensedFunctions(record, DerivedFlagRules.derive(flags, record)).orNull();

    assertThat(functions.choice()).isEqualTo("ResponsibleOfficer");
    assertThat(functions.mandatoryFunctions().isPresent()).isFalse();
    var confirmations = functions.responsibleOfficerConfirmations().orNull();
    assertThat(confirmations.significantResponsibility()).isEqualTo("Confirmed");
    assertThat(confirmations.significantInfluence()).isEmpty();
    assertThat(confirmations.notAnEmployee()).isEmpty();
  }

  @Test
  void positionWithStartDateHasNoExplanation() {
    var record = TestRecords.load(TestRecords.FULL);

    var position = composer.composePosition(record, flagDeriver.deriveFlags(record));

    assertThat(position.proposedJobTitle()).isEqualTo("Chief Executive Officer");
    assertThat(position.hasProposedStartDate()).isTrue();
    assertThat(position.proposedStartDate()).isEqualTo("2026-01-15");
    assertThat(position.startDateExplanation()).isNull();
  }

  @Test
  void positionWithoutStartDateHasExplanationOnly() {
    var record =
        TestRecords.with(
            TestRecords.FULL,
            Map.of(
                AuthorisedIndividualFields.HAS_START_DATE, false,
                AuthorisedIndividualFields.START_DATE_EXPLANATION, "Subject to notice period"));

    var position = composer.composePosition(record, flagDeriver.deriveFlags(record));

    assertThat(position.proposedStartDate()).isNull();
    assertThat(position.startDateExplanation()).isEqualTo("Subject to notice period");
  }

  @Test
  void positionExplanationDefaultsToEmpty() {
    var record = RawRecord.of(Map.of(AuthorisedIndividualFields.HAS_START_DATE, false));

    var position = composer.composePosition(record, flagDeriver.deriveFlags(record));

    assertThat(position.startDateExplanation()).isEmpty();
  }

  @Test
  void workExperiencePicksOneSideOfEachPair() {
    var record = TestRecords.load(TestRecords.FULL);

    var experience = composer.composeWorkExperience(record, flagDeriver.deriveFlags(record));

    assertThat(experience.difcExperience().whenTrueOrNull()).isNull();
    assertThat(experience.difcExperience().whenFalseOrNull())
        .isEqualTo("Induction programme with the DFSA rulebook");
    assertThat(experience.similarRoleExperience().whenTrueOrNull()).isEqualTo("Not Specified");
    assertThat(experience.similarRoleExperience().whenFalseOrNull()).isNull();
  }

  @Test
  void candidateProfileKeepsUploadedFilesAndNullsMissingOnes() {
    var profile = composer.composeCandidateProfile(TestRecords.load(TestRecords.FULL));

    assertThat(profile.cvFileId()).isEqualTo("a1b2c3d4-file");
    assertThat(profile.cvFileName()).isEqualTo("omar-haddad-cv.pdf");
    assertThat(profile.jobDescriptionFileId()).isNull();
    assertThat(profile.jobDescriptionFileName()).isNull();
  }
}
