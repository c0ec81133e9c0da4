package io.b2mash.roaf.document;

public record HigherEducationEntry(
    String titleOfQualification,
    String universityName,
    String dateOfAward,
    String classification) {}
