package io.b2mash.roaf.document;

public record PassportDetail(
    String title,
    String fullName,
    String dateOfBirth,
    String placeOfBirth,
    boolean uaeResident,
    String numberOfCitizenships,
    String otherNames,
    String nativeName) {}
