package io.b2mash.roaf.document;

import io.b2mash.roaf.flag.ConditionFlags;
import io.b2mash.roaf.section.DerivedFlags;
import io.b2mash.roaf.section.Section;
import java.util.List;
import java.util.Objects;

/**
 * Canonical Authorised Individual document handed to the renderer. Conditional regions are
 * {@link Section}s; repeating regions are unmodifiable lists that are never null.
 */
public record CanonicalDocument(
    Guidelines guidelines,
    Disclosure disclosure,
    Application application,
    ConditionFlags flags,
    DerivedFlags derivedFlags,
    Section<LicensedFunctions> licensedFunctions,
    List<PassportDetail> passportDetails,
    List<Citizenship> citizenships,
    List<RegulatoryHistoryEntry> regulatoryHistory,
    Position position,
    List<CareerHistoryEntry> careerHistory,
    CandidateProfile candidateProfile,
    List<HigherEducationEntry> higherEducation,
    List<QualificationEntry> professionalQualifications,
    List<QualificationEntry> otherQualifications,
    List<ProfessionalMembershipEntry> professionalMemberships,
    WorkExperience workExperience,
    List<OtherHoldingEntry> otherHoldings,
    String generatedAt,
    String templateVersion) {

  public CanonicalDocument {
    Objects.requireNonNull(application, "application");
    Objects.requireNonNull(flags, "flags");
    Objects.requireNonNull(licensedFunctions, "licensedFunctions");
    passportDetails = List.copyOf(passportDetails);
    citizenships = List.copyOf(citizenships);
    regulatoryHistory = List.copyOf(regulatoryHistory);
    careerHistory = List.copyOf(careerHistory);
    higherEducation = List.copyOf(higherEducation);
    professionalQualifications = List.copyOf(professionalQualifications);
    otherQualifications = List.copyOf(otherQualifications);
    professionalMemberships = List.copyOf(professionalMemberships);
    otherHoldings = List.copyOf(otherHoldings);
  }

  /** Step 0.1. */
  public record Guidelines(String confirmRead) {}

  /** Step 0.2. */
  public record Disclosure(boolean consentToDisclosure) {}
}
