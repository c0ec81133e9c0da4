package io.b2mash.roaf.picklist;

/** Logical option-set families. Several Dataverse columns may share one family. */
public enum PicklistFamily {
  GUIDELINES_CONFIRM,
  TITLE,
  CITIZENSHIP_COUNT,
  COUNTRY,
  REGULATOR,
  RESIDENCE_DURATION,
  REP_OFFICE_FUNCTION,
  LICENSED_FUNCTION,
  LICENSED_FUNCTION_KEY,
  EXECUTIVE_TYPE,
  ACTIVITY,
  REASON_FOR_LEAVING,
  QUALIFICATION_CLASSIFICATION,
  YEARS_OF_EXPERIENCE
}
