package io.b2mash.roaf.flag;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/** Immutable result of flag derivation for one record. Every {@link ConditionFlag} has a value. */
public final class ConditionFlags {

  private final Map<ConditionFlag, Boolean> values;

  private ConditionFlags(Map<ConditionFlag, Boolean> values) {
    this.values = values;
  }

  static ConditionFlags of(EnumMap<ConditionFlag, Boolean> values) {
    var copy = new EnumMap<ConditionFlag, Boolean>(ConditionFlag.class);
    for (ConditionFlag flag : ConditionFlag.values()) {
      copy.put(flag, Boolean.TRUE.equals(values.get(flag)));
    }
    return new ConditionFlags(Collections.unmodifiableMap(copy));
  }

  public boolean isSet(ConditionFlag flag) {
    return values.get(flag);
  }

  /** Flags keyed by render name, in declaration order. */
  public Map<String, Boolean> asMap() {
    var map = new LinkedHashMap<String, Boolean>();
    values.forEach((flag, value) -> map.put(flag.renderName(), value));
    return Collections.unmodifiableMap(map);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof ConditionFlags other && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "ConditionFlags" + asMap();
  }
}
