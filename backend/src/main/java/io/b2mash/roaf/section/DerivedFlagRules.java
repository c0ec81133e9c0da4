package io.b2mash.roaf.section;

import io.b2mash.roaf.flag.ConditionFlag;
import io.b2mash.roaf.flag.ConditionFlags;
import io.b2mash.roaf.picklist.OptionSetValues;
import io.b2mash.roaf.record.AuthorisedIndividualFields;
import io.b2mash.roaf.record.RawRecord;

/** Licensed-function visibility rules layered on top of the base condition flags. */
public final class DerivedFlagRules {

  private DerivedFlagRules() {}

  public static DerivedFlags derive(ConditionFlags flags, RawRecord record) {
    boolean repOffice = flags.isSet(ConditionFlag.REP_OFFICE);
    boolean choiceSet = flags.isSet(ConditionFlag.LICENSED_FUNCTION_SELECTED);
    boolean responsibleOfficer =
        OptionSetValues.matches(
            record.code(AuthorisedIndividualFields.LICENSED_FUNCTION),
            OptionSetValues.LICENSED_FUNCTION_RESPONSIBLE_OFFICER);

    return new DerivedFlags(
        !repOffice,
        !repOffice && choiceSet && !responsibleOfficer,
        !repOffice && responsibleOfficer);
  }
}
