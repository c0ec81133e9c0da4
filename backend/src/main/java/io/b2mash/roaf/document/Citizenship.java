package io.b2mash.roaf.document;

public record Citizenship(String country, String passportNo, String expiryDate) {}
