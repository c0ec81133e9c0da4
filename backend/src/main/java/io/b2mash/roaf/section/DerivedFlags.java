package io.b2mash.roaf.section;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flags computed from other flags plus raw fields. Kept as named values so templates never repeat
 * the boolean logic.
 */
public record DerivedFlags(
    boolean showLicensedFunctionsSection,
    boolean showMandatoryFunctionsQuestion,
    boolean showResponsibleOfficerConfirmations) {

  public Map<String, Boolean> asMap() {
    var map = new LinkedHashMap<String, Boolean>();
    map.put("showLicensedFunctionsSection", showLicensedFunctionsSection);
    map.put("showMandatoryFunctionsQuestion", showMandatoryFunctionsQuestion);
    map.put("showResponsibleOfficerConfirmations", showResponsibleOfficerConfirmations);
    return map;
  }
}
