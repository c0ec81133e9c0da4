package io.b2mash.roaf.picklist;

/** Option-set values that drive conditional logic rather than just display. */
public final class OptionSetValues {

  public static final int RESIDENCE_LESS_THAN_3_YEARS = 612320000;
  public static final int RESIDENCE_3_YEARS_OR_MORE = 612320001;

  public static final int LICENSED_FUNCTION_RESPONSIBLE_OFFICER = 4;

  public static final int REGULATOR_OTHER = 356960087;
  public static final int ACTIVITY_OTHER = 356960005;
  public static final int REASON_FOR_LEAVING_OTHER = 356960005;

  private OptionSetValues() {}

  /** True when {@code code} is the option-set value {@code expected}, in any numeric form. */
  public static boolean matches(Object code, int expected) {
    return PicklistCodes.normalize(code)
        .map(Integer.toString(expected)::equals)
        .orElse(false);
  }
}
