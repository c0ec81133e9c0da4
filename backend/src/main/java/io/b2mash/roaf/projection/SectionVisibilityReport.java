package io.b2mash.roaf.projection;

import io.b2mash.roaf.document.CanonicalDocument;
import io.b2mash.roaf.flag.ConditionFlag;
import io.b2mash.roaf.record.AuthorisedIndividualFields;
import io.b2mash.roaf.record.RawRecord;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Diagnostic view of a projected document: for every conditional region, whether it is shown, the
 * raw field that decided it and a human-readable reason. Used when a template author needs to know
 * why a section did or did not render.
 */
public record SectionVisibilityReport(
    Map<String, Boolean> flags,
    List<SectionVisibility> sections,
    Map<String, Integer> repeatingSectionCounts) {

  public SectionVisibilityReport {
    flags = Collections.unmodifiableMap(new LinkedHashMap<>(flags));
    sections = List.copyOf(sections);
    repeatingSectionCounts =
        Collections.unmodifiableMap(new LinkedHashMap<>(repeatingSectionCounts));
  }

  /**
   * @param code stable region code, e.g. {@code AUTH_PREV_ADDRESS}
   * @param sourceValue raw value of {@code sourceField}; may be null
   * @param recordCount number of rows for repeating regions, null otherwise
   */
  public record SectionVisibility(
      String code,
      String name,
      boolean visible,
      String reason,
      String sourceField,
      Object sourceValue,
      Integer recordCount) {}

  public static SectionVisibilityReport of(RawRecord record, CanonicalDocument document) {
    var flags = document.flags();
    var sections = new ArrayList<SectionVisibility>();

    boolean shortResidence = flags.isSet(ConditionFlag.RESIDENCE_DURATION_LESS_THAN_3_YEARS);
    sections.add(
        visibility(
            record,
            "AUTH_PREV_ADDRESS",
            "Previous Address",
            shortResidence,
            shortResidence
                ? "Candidate has lived at current address for less than 3 years"
                : "Candidate has lived at current address for 3 years or more",
            AuthorisedIndividualFields.RESIDENCE_DURATION,
            null));

    boolean otherNames = flags.isSet(ConditionFlag.OTHER_NAMES);
    sections.add(
        visibility(
            record,
            "AUTH_OTHER_NAMES",
            "Other Names",
            otherNames,
            otherNames
                ? "Candidate has used other names or changed names"
                : "Candidate has not used other names",
            AuthorisedIndividualFields.OTHER_NAMES,
            null));

    boolean repOffice = flags.isSet(ConditionFlag.REP_OFFICE);
    sections.add(
        visibility(
            record,
            "AUTH_LIC_FUNC",
            "Licensed Functions",
            document.derivedFlags().showLicensedFunctionsSection(),
            repOffice
                ? "Hidden: candidate is applying for a Representative Office"
                : "Shown: candidate is not applying for a Representative Office",
            AuthorisedIndividualFields.REP_OFFICE,
            null));
    sections.add(
        visibility(
            record,
            "AUTH_REP_OFFICE_FUNCTIONS",
            "Representative Office Functions",
            document.application().repOfficeFunctions().isPresent(),
            repOffice
                ? "Candidate is applying for a Representative Office"
                : "Candidate is not applying for a Representative Office",
            AuthorisedIndividualFields.REP_OFFICE,
            null));

    boolean regulatoryHistory = flags.isSet(ConditionFlag.HAS_REGULATORY_HISTORY);
    sections.add(
        visibility(
            record,
            "AUTH_REG_HISTORY",
            "Regulatory History",
            regulatoryHistory,
            regulatoryHistory
                ? "Candidate holds or has held a regulatory licence"
                : "Candidate has no regulatory history",
            AuthorisedIndividualFields.HAS_REGULATORY_HISTORY,
            document.regulatoryHistory().size()));

    boolean startDate = flags.isSet(ConditionFlag.HAS_START_DATE);
    sections.add(
        visibility(
            record,
            "AUTH_POSITION_START_DATE",
            "Proposed Start Date vs Explanation",
            startDate,
            startDate
                ? "Candidate has a proposed start date, showing the date field"
                : "Candidate has no proposed start date, showing the explanation field",
            AuthorisedIndividualFields.HAS_START_DATE,
            null));

    var counts = new LinkedHashMap<String, Integer>();
    counts.put("passportDetails", document.passportDetails().size());
    counts.put("citizenships", document.citizenships().size());
    counts.put("regulatoryHistory", document.regulatoryHistory().size());
    counts.put("careerHistory", document.careerHistory().size());
    counts.put("higherEducation", document.higherEducation().size());
    counts.put("professionalQualifications", document.professionalQualifications().size());
    counts.put("otherQualifications", document.otherQualifications().size());
    counts.put("professionalMemberships", document.professionalMemberships().size());
    counts.put("otherHoldings", document.otherHoldings().size());

    return new SectionVisibilityReport(flags.asMap(), sections, counts);
  }

  private static SectionVisibility visibility(
      RawRecord record,
      String code,
      String name,
      boolean visible,
      String reason,
      String sourceField,
      Integer recordCount) {
    return new SectionVisibility(
        code, name, visible, reason, sourceField, record.raw(sourceField), recordCount);
  }

  /** Looks up a section by its code. */
  public SectionVisibility section(String code) {
    return sections.stream()
        .filter(s -> s.code().equals(code))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown section code: " + code));
  }
}
