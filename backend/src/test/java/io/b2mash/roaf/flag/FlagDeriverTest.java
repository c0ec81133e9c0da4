package io.b2mash.roaf.flag;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.roaf.picklist.OptionSetValues;
import io.b2mash.roaf.record.AuthorisedIndividualFields;
import io.b2mash.roaf.record.RawRecord;
import io.b2mash.roaf.record.TestRecords;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class FlagDeriverTest {

  private final FlagDeriver deriver = new FlagDeriver();

  @Test
  void everyFlagIsFalseForEmptyRecord() {
    var flags = deriver.deriveFlags(RawRecord.empty());

    assertThat(flags.asMap()).hasSize(ConditionFlag.values().length).doesNotContainValue(true);
  }

  @Test
  void derivesFlagsFromFullRecord() {
    var flags = deriver.deriveFlags(TestRecords.load(TestRecords.FULL));

    assertThat(flags.isSet(ConditionFlag.REP_OFFICE)).isFalse();
    assertThat(flags.isSet(ConditionFlag.PREVIOUSLY_HELD)).isTrue();
    assertThat(flags.isSet(ConditionFlag.OTHER_NAMES)).isTrue();
    assertThat(flags.isSet(ConditionFlag.RESIDENCE_DURATION_LESS_THAN_3_YEARS)).isTrue();
    assertThat(flags.isSet(ConditionFlag.HAS_START_DATE)).isTrue();
    assertThat(flags.isSet(ConditionFlag.HAS_REGULATORY_HISTORY)).isTrue();
    assertThat(flags.isSet(ConditionFlag.LICENSED_FUNCTION_SELECTED)).isTrue();
    assertThat(flags.isSet(ConditionFlag.HAS_CAREER_HISTORY)).isTrue();
    assertThat(flags.isSet(ConditionFlag.HAS_HIGHER_EDUCATION)).isTrue();
    assertThat(flags.isSet(ConditionFlag.HAS_PROFESSIONAL_QUALIFICATIONS)).isTrue();
    assertThat(flags.isSet(ConditionFlag.HAS_OTHER_QUALIFICATIONS)).isFalse();
    assertThat(flags.isSet(ConditionFlag.HAS_PROFESSIONAL_MEMBERSHIPS)).isFalse();
    assertThat(flags.isSet(ConditionFlag.HAS_DIFC_EXPERIENCE)).isFalse();
    assertThat(flags.isSet(ConditionFlag.HAS_SIMILAR_ROLE_EXPERIENCE)).isTrue();
    assertThat(flags.isSet(ConditionFlag.HAS_OTHER_HOLDINGS)).isTrue();
  }

  @Test
  void residenceLessThanThreeYearsSetsFlag() {
    var record =
        RawRecord.of(
            Map.of(
                AuthorisedIndividualFields.RESIDENCE_DURATION,
                OptionSetValues.RESIDENCE_LESS_THAN_3_YEARS));

    assertThat(
            deriver.deriveFlags(record).isSet(ConditionFlag.RESIDENCE_DURATION_LESS_THAN_3_YEARS))
        .isTrue();
  }

  @Test
  void residenceThreeYearsOrMoreClearsFlag() {
    var record =
        RawRecord.of(
            Map.of(
                AuthorisedIndividualFields.RESIDENCE_DURATION,
                OptionSetValues.RESIDENCE_3_YEARS_OR_MORE));

    assertThat(
            deriver.deriveFlags(record).isSet(ConditionFlag.RESIDENCE_DURATION_LESS_THAN_3_YEARS))
        .isFalse();
  }

  @Test
  void residenceCodeAsStringStillMatches() {
    var record =
        RawRecord.of(Map.of(AuthorisedIndividualFields.RESIDENCE_DURATION, "612320000"));

    assertThat(
            deriver.deriveFlags(record).isSet(ConditionFlag.RESIDENCE_DURATION_LESS_THAN_3_YEARS))
        .isTrue();
  }

  @Test
  void truthyNonBooleanValuesDoNotSetFlags() {
    var record =
        RawRecord.of(
            Map.of(
                AuthorisedIndividualFields.REP_OFFICE, "true",
                AuthorisedIndividualFields.OTHER_NAMES, 1,
                AuthorisedIndividualFields.HAS_START_DATE, "yes"));

    var flags = deriver.deriveFlags(record);

    assertThat(flags.isSet(ConditionFlag.REP_OFFICE)).isFalse();
    assertThat(flags.isSet(ConditionFlag.OTHER_NAMES)).isFalse();
    assertThat(flags.isSet(ConditionFlag.HAS_START_DATE)).isFalse();
  }

  @Test
  void nonArrayRelationshipDoesNotSetCollectionFlag() {
    var record =
        RawRecord.of(
            Map.of(
                AuthorisedIndividualFields.CAREER_HISTORY, "not an array",
                AuthorisedIndividualFields.OTHER_HOLDINGS, List.of()));

    var flags = deriver.deriveFlags(record);

    assertThat(flags.isSet(ConditionFlag.HAS_CAREER_HISTORY)).isFalse();
    assertThat(flags.isSet(ConditionFlag.HAS_OTHER_HOLDINGS)).isFalse();
  }

  @ParameterizedTest
  @EnumSource(
      value = ConditionFlag.class,
      names = {
        "REP_OFFICE",
        "PREVIOUSLY_HELD",
        "OTHER_NAMES",
        "HAS_START_DATE",
        "HAS_REGULATORY_HISTORY",
        "HAS_DIFC_EXPERIENCE",
        "HAS_SIMILAR_ROLE_EXPERIENCE"
      })
  void booleanFlagFollowsItsSourceField(ConditionFlag flag) {
    var on = RawRecord.of(Map.of(flag.sourceField(), true));
    var off = RawRecord.of(Map.of(flag.sourceField(), false));

    assertThat(deriver.deriveFlags(on).isSet(flag)).isTrue();
    assertThat(deriver.deriveFlags(off).isSet(flag)).isFalse();
  }

  @ParameterizedTest
  @EnumSource(ConditionFlag.class)
  void changingSourceFieldLeavesOtherFlagsUntouched(ConditionFlag flag) {
    var baseline = deriver.deriveFlags(TestRecords.load(TestRecords.FULL));
    var removed = deriver.deriveFlags(TestRecords.without(TestRecords.FULL, flag.sourceField()));
    var replaced =
        deriver.deriveFlags(
            TestRecords.with(TestRecords.FULL, Map.of(flag.sourceField(), "changed")));

    for (ConditionFlag other : ConditionFlag.values()) {
      if (other == flag) {
        continue;
      }
      assertThat(removed.isSet(other)).as(other.name()).isEqualTo(baseline.isSet(other));
      assertThat(replaced.isSet(other)).as(other.name()).isEqualTo(baseline.isSet(other));
    }
  }

  @Test
  void outOfRangeResidenceCodeIsAnUnknownCode() {
    var record =
        RawRecord.of(
            Map.of(
                AuthorisedIndividualFields.ID,
                "abc",
                AuthorisedIndividualFields.RESIDENCE_DURATION,
                "1e999999999"));

    var flags = deriver.deriveFlags(record);

    assertThat(flags.isSet(ConditionFlag.RESIDENCE_DURATION_LESS_THAN_3_YEARS)).isFalse();
    assertThat(flags.asMap()).hasSize(ConditionFlag.values().length);
  }

  @Test
  void derivationIsDeterministic() {
    var record = TestRecords.load(TestRecords.FULL);

    assertThat(deriver.deriveFlags(record)).isEqualTo(deriver.deriveFlags(record));
  }

  @Test
  void renderNamesAreCamelCaseInDeclarationOrder() {
    var names = deriver.deriveFlags(RawRecord.empty()).asMap().keySet();

    assertThat(names)
        .startsWith("repOffice", "previouslyHeld", "otherNames", "residenceDurationLessThan3Years")
        .endsWith("hasOtherHoldings");
  }
}
