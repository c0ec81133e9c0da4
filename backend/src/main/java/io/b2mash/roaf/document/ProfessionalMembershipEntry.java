package io.b2mash.roaf.document;

public record ProfessionalMembershipEntry(
    String organisationName, String dateOfAdmission, String organisationExplanation) {}
