package io.b2mash.roaf.projection;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.roaf.picklist.OptionSetValues;
import io.b2mash.roaf.record.AuthorisedIndividualFields;
import io.b2mash.roaf.record.TestRecords;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SectionVisibilityReportTest {

  private final AuthorisedIndividualContextBuilder builder =
      new AuthorisedIndividualContextBuilder(AuthorisedIndividualProjectorTest.projector());

  @Test
  void reportsEveryConditionalRegion() {
    var report = builder.explainVisibility(TestRecords.load(TestRecords.FULL));

    assertThat(report.sections())
        .extracting(SectionVisibilityReport.SectionVisibility::code)
        .containsExactly(
            "AUTH_PREV_ADDRESS",
            "AUTH_OTHER_NAMES",
            "AUTH_LIC_FUNC",
            "AUTH_REP_OFFICE_FUNCTIONS",
            "AUTH_REG_HISTORY",
            "AUTH_POSITION_START_DATE");
  }

  @Test
  void explainsVisibleSectionsWithSourceValues() {
    var report = builder.explainVisibility(TestRecords.load(TestRecords.FULL));

    var previousAddress = report.section("AUTH_PREV_ADDRESS");
    assertThat(previousAddress.visible()).isTrue();
    assertThat(previousAddress.sourceField())
        .isEqualTo(AuthorisedIndividualFields.RESIDENCE_DURATION);
    assertThat(previousAddress.sourceValue())
        .isEqualTo(OptionSetValues.RESIDENCE_LESS_THAN_3_YEARS);
    assertThat(previousAddress.reason()).contains("less than 3 years");

    var regulatoryHistory = report.section("AUTH_REG_HISTORY");
    assertThat(regulatoryHistory.visible()).isTrue();
    assertThat(regulatoryHistory.recordCount()).isEqualTo(2);
  }

  @Test
  void repOfficeHidesLicensedFunctions() {
    var record =
        TestRecords.with(TestRecords.FULL, Map.of(AuthorisedIndividualFields.REP_OFFICE, true));

    var report = builder.explainVisibility(record);

    assertThat(report.section("AUTH_LIC_FUNC").visible()).isFalse();
    assertThat(report.section("AUTH_LIC_FUNC").reason()).startsWith("Hidden");
    assertThat(report.section("AUTH_REP_OFFICE_FUNCTIONS").visible()).isTrue();
  }

  @Test
  void countsRepeatingRegions() {
    var report = builder.explainVisibility(TestRecords.load(TestRecords.FULL));

    assertThat(report.repeatingSectionCounts())
        .containsEntry("citizenships", 3)
        .containsEntry("careerHistory", 2)
        .containsEntry("otherQualifications", 0);
    assertThat(report.flags()).containsEntry("hasStartDate", true);
  }
}
