package io.b2mash.roaf.document;

import io.b2mash.roaf.section.Section;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Flattens a {@link CanonicalDocument} into the {@code Map<String, Object>} handed to the renderer.
 * Absent sections become {@code null}, present ones a populated map, and repeating regions a list
 * of maps that is never null. Keys are camelCase.
 */
public final class CanonicalDocumentContext {

  private CanonicalDocumentContext() {}

  public static Map<String, Object> toContext(CanonicalDocument document) {
    var context = new LinkedHashMap<String, Object>();

    // step 0
    var guidelines = new LinkedHashMap<String, Object>();
    guidelines.put("confirmRead", document.guidelines().confirmRead());
    context.put("guidelines", guidelines);

    var disclosure = new LinkedHashMap<String, Object>();
    disclosure.put("consentToDisclosure", document.disclosure().consentToDisclosure());
    context.put("disclosure", disclosure);

    context.put("application", applicationMap(document.application()));

    // flags
    context.put("flags", document.flags().asMap());
    context.put("derivedFlags", document.derivedFlags().asMap());

    context.put(
        "licensedFunctions",
        sectionMap(document.licensedFunctions(), CanonicalDocumentContext::licensedFunctionsMap));

    // step 1 collections
    context.put(
        "passportDetails",
        listOf(document.passportDetails(), CanonicalDocumentContext::passportDetailMap));
    context.put(
        "citizenships", listOf(document.citizenships(), CanonicalDocumentContext::citizenshipMap));
    context.put(
        "regulatoryHistory",
        listOf(document.regulatoryHistory(), CanonicalDocumentContext::regulatoryHistoryMap));

    context.put("position", positionMap(document.position()));

    // step 2
    context.put(
        "careerHistory",
        listOf(document.careerHistory(), CanonicalDocumentContext::careerHistoryMap));
    context.put("candidateProfile", candidateProfileMap(document.candidateProfile()));
    context.put(
        "higherEducation",
        listOf(document.higherEducation(), CanonicalDocumentContext::higherEducationMap));
    context.put(
        "professionalQualifications",
        listOf(document.professionalQualifications(), CanonicalDocumentContext::qualificationMap));
    context.put(
        "otherQualifications",
        listOf(document.otherQualifications(), CanonicalDocumentContext::qualificationMap));
    context.put(
        "professionalMemberships",
        listOf(document.professionalMemberships(), CanonicalDocumentContext::membershipMap));
    context.put("workExperience", workExperienceMap(document.workExperience()));
    context.put(
        "otherHoldings",
        listOf(document.otherHoldings(), CanonicalDocumentContext::otherHoldingMap));

    context.put("generatedAt", document.generatedAt());
    context.put("templateVersion", document.templateVersion());
    return context;
  }

  private static Map<String, Object> applicationMap(Application application) {
    var map = new LinkedHashMap<String, Object>();
    map.put("id", application.id());
    map.put("firmName", application.firmName());
    map.put("firmNumber", application.firmNumber());

    var requestor = new LinkedHashMap<String, Object>();
    requestor.put("name", application.requestor().name());
    requestor.put("position", application.requestor().position());
    requestor.put("email", application.requestor().email());
    requestor.put("phone", application.requestor().phone());
    map.put("requestor", requestor);

    map.put("authorisedIndividualName", application.authorisedIndividualName());
    map.put("repOfficeFunctions", application.repOfficeFunctions().orNull());

    var contact = new LinkedHashMap<String, Object>();
    contact.put("address", application.contact().address());
    contact.put("postCode", application.contact().postCode());
    contact.put("country", application.contact().country());
    contact.put("mobile", application.contact().mobile());
    contact.put("email", application.contact().email());
    contact.put("residenceDuration", application.contact().residenceDuration());
    map.put("contact", contact);

    map.put(
        "previousAddress",
        sectionMap(
            application.previousAddress(),
            previous -> {
              var m = new LinkedHashMap<String, Object>();
              m.put("address", previous.address());
              m.put("postCode", previous.postCode());
              m.put("country", previous.country());
              return m;
            }));
    map.put(
        "otherNames",
        sectionMap(
            application.otherNames(),
            names -> {
              var m = new LinkedHashMap<String, Object>();
              m.put("stateOtherNames", names.stateOtherNames());
              m.put("nativeName", names.nativeName());
              m.put("dateChanged", names.dateChanged());
              m.put("reason", names.reason());
              return m;
            }));
    map.put(
        "previousAuthorisation",
        sectionMap(
            application.previousAuthorisation(),
            previous -> {
              var m = new LinkedHashMap<String, Object>();
              m.put("candidateReference", previous.candidateReference());
              return m;
            }));
    return map;
  }

  private static Map<String, Object> licensedFunctionsMap(LicensedFunctions functions) {
    var map = new LinkedHashMap<String, Object>();
    map.put("choice", functions.choice());
    map.put("choiceLabel", functions.choiceLabel());
    map.put("executiveType", functions.executiveType());
    map.put(
        "mandatoryFunctions",
        sectionMap(
            functions.mandatoryFunctions(),
            mandatory -> {
              var m = new LinkedHashMap<String, Object>();
              m.put("seniorExecutiveOfficer", mandatory.seniorExecutiveOfficer());
              m.put("financeOfficer", mandatory.financeOfficer());
              m.put("complianceOfficer", mandatory.complianceOfficer());
              m.put("mlro", mandatory.mlro());
              m.put("noMandatoryFunction", mandatory.noMandatoryFunction());
              return m;
            }));
    map.put(
        "responsibleOfficerConfirmations",
        sectionMap(
            functions.responsibleOfficerConfirmations(),
            confirmations -> {
              var m = new LinkedHashMap<String, Object>();
              m.put("significantResponsibility", confirmations.significantResponsibility());
              m.put("significantInfluence", confirmations.significantInfluence());
              m.put("notAnEmployee", confirmations.notAnEmployee());
              return m;
            }));
    return map;
  }

  private static Map<String, Object> passportDetailMap(PassportDetail detail) {
    var map = new LinkedHashMap<String, Object>();
    map.put("title", detail.title());
    map.put("fullName", detail.fullName());
    map.put("dateOfBirth", detail.dateOfBirth());
    map.put("placeOfBirth", detail.placeOfBirth());
    map.put("uaeResident", detail.uaeResident());
    map.put("numberOfCitizenships", detail.numberOfCitizenships());
    map.put("otherNames", detail.otherNames());
    map.put("nativeName", detail.nativeName());
    return map;
  }

  private static Map<String, Object> citizenshipMap(Citizenship citizenship) {
    var map = new LinkedHashMap<String, Object>();
    map.put("country", citizenship.country());
    map.put("passportNo", citizenship.passportNo());
    map.put("expiryDate", citizenship.expiryDate());
    return map;
  }

  private static Map<String, Object> regulatoryHistoryMap(RegulatoryHistoryEntry entry) {
    var map = new LinkedHashMap<String, Object>();
    map.put("regulator", entry.regulator());
    map.put("isOtherRegulator", entry.isOtherRegulator());
    map.put("otherRegulatorDetails", entry.otherRegulatorDetails().orNull());
    map.put("dateStarted", entry.dateStarted());
    map.put("dateFinished", entry.dateFinished());
    map.put("licenseName", entry.licenseName());
    map.put("registerName", entry.registerName());
    map.put("overview", entry.overview());
    return map;
  }

  private static Map<String, Object> positionMap(Position position) {
    var map = new LinkedHashMap<String, Object>();
    map.put("proposedJobTitle", position.proposedJobTitle());
    map.put("hasProposedStartDate", position.hasProposedStartDate());
    map.put("proposedStartDate", position.proposedStartDate());
    map.put("startDateExplanation", position.startDateExplanation());
    map.put("willBeMlro", position.willBeMlro());
    map.put("applyingAsMlro", position.applyingAsMlro());
    return map;
  }

  private static Map<String, Object> careerHistoryMap(CareerHistoryEntry entry) {
    var map = new LinkedHashMap<String, Object>();
    map.put("activity", entry.activity());
    map.put("activityExplanation", entry.activityExplanation().orNull());
    map.put("nameOfEstablishment", entry.nameOfEstablishment());
    map.put("dateFrom", entry.dateFrom());
    map.put("dateTo", entry.dateTo());
    map.put("positionTitle", entry.positionTitle());
    map.put("reasonForLeaving", entry.reasonForLeaving());
    map.put("reasonForLeavingExplanation", entry.reasonForLeavingExplanation().orNull());
    map.put("activitiesUndertaken", entry.activitiesUndertaken());

    var address = new LinkedHashMap<String, Object>();
    address.put("buildingNameNumber", entry.address().buildingNameNumber());
    address.put("streetName", entry.address().streetName());
    address.put("district", entry.address().district());
    address.put("city", entry.address().city());
    address.put("postcodePoBox", entry.address().postcodePoBox());
    address.put("telephoneNumber", entry.address().telephoneNumber());
    map.put("address", address);

    var contact = new LinkedHashMap<String, Object>();
    contact.put("name", entry.contact().name());
    contact.put("position", entry.contact().position());
    contact.put("telephone", entry.contact().telephone());
    contact.put("email", entry.contact().email());
    map.put("contact", contact);

    map.put("isRegulated", entry.regulation().isPresent());
    map.put(
        "regulation",
        sectionMap(
            entry.regulation(),
            regulation -> {
              var m = new LinkedHashMap<String, Object>();
              m.put("regulator", regulation.regulator());
              m.put("regulatorDetails", regulation.regulatorDetails().orNull());
              return m;
            }));
    map.put("activityDetails", entry.activityDetails());
    return map;
  }

  private static Map<String, Object> candidateProfileMap(CandidateProfile profile) {
    var map = new LinkedHashMap<String, Object>();
    map.put("cvFileId", profile.cvFileId());
    map.put("cvFileName", profile.cvFileName());
    map.put("jobDescriptionFileId", profile.jobDescriptionFileId());
    map.put("jobDescriptionFileName", profile.jobDescriptionFileName());
    return map;
  }

  private static Map<String, Object> higherEducationMap(HigherEducationEntry entry) {
    var map = new LinkedHashMap<String, Object>();
    map.put("titleOfQualification", entry.titleOfQualification());
    map.put("universityName", entry.universityName());
    map.put("dateOfAward", entry.dateOfAward());
    map.put("classification", entry.classification());
    return map;
  }

  private static Map<String, Object> qualificationMap(QualificationEntry entry) {
    var map = new LinkedHashMap<String, Object>();
    map.put("qualificationName", entry.qualificationName());
    map.put("instituteName", entry.instituteName());
    map.put("dateOfAward", entry.dateOfAward());
    return map;
  }

  private static Map<String, Object> membershipMap(ProfessionalMembershipEntry entry) {
    var map = new LinkedHashMap<String, Object>();
    map.put("organisationName", entry.organisationName());
    map.put("dateOfAdmission", entry.dateOfAdmission());
    map.put("organisationExplanation", entry.organisationExplanation());
    return map;
  }

  private static Map<String, Object> workExperienceMap(WorkExperience experience) {
    var map = new LinkedHashMap<String, Object>();
    map.put("hasDifcExperience", experience.difcExperience().flag());
    map.put("difcExperienceOverview", experience.difcExperience().whenTrueOrNull());
    map.put("difcKnowledgePlan", experience.difcExperience().whenFalseOrNull());
    map.put("hasSimilarRoleExperience", experience.similarRoleExperience().flag());
    map.put("yearsOfExperience", experience.similarRoleExperience().whenTrueOrNull());
    map.put("experiencePlan", experience.similarRoleExperience().whenFalseOrNull());
    return map;
  }

  private static Map<String, Object> otherHoldingMap(OtherHoldingEntry entry) {
    var map = new LinkedHashMap<String, Object>();
    map.put("nameOfEntity", entry.nameOfEntity());
    map.put("detailsOfPosition", entry.detailsOfPosition());
    map.put("dateFrom", entry.dateFrom());
    map.put("dateTo", entry.dateTo());
    map.put("address", entry.address());
    map.put("natureOfBusiness", entry.natureOfBusiness());
    map.put("ownershipText", entry.ownershipText());
    map.put("ownershipPercentage", entry.ownershipPercentage());
    map.put("isRegulated", entry.isRegulated());
    map.put("regulator", entry.regulator().orNull());
    map.put("hasConflictOfInterest", entry.hasConflictOfInterest());
    map.put("conflictClarification", entry.conflictClarification().orNull());
    return map;
  }

  private static <T> Map<String, Object> sectionMap(
      Section<T> section, Function<T, Map<String, Object>> toMap) {
    return section.isPresent() ? toMap.apply(section.orNull()) : null;
  }

  private static <T> List<Map<String, Object>> listOf(
      List<T> items, Function<T, Map<String, Object>> toMap) {
    return items.stream().map(toMap).toList();
  }
}
