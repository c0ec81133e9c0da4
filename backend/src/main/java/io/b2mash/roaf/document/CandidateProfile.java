package io.b2mash.roaf.document;

/** Uploaded CV and job description references; each may be null when nothing was uploaded. */
public record CandidateProfile(
    String cvFileId,
    String cvFileName,
    String jobDescriptionFileId,
    String jobDescriptionFileName) {}
