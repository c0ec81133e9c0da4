package io.b2mash.roaf.document;

import io.b2mash.roaf.section.ExclusiveChoice;

/**
 * Step 2.2 experience answers.
 *
 * <p>{@code difcExperience}: overview of DIFC work when the candidate has worked in the DIFC,
 * otherwise the plan for obtaining DIFC knowledge. {@code similarRoleExperience}: years of
 * experience label when the candidate held a similar role, otherwise the plan for obtaining it.
 */
public record WorkExperience(
    ExclusiveChoice<String, String> difcExperience,
    ExclusiveChoice<String, String> similarRoleExperience) {}
