package io.b2mash.roaf.document;

/** Professional or other relevant qualification; both collections share this shape. */
public record QualificationEntry(
    String qualificationName, String instituteName, String dateOfAward) {}
