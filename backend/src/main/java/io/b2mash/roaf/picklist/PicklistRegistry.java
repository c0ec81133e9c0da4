package io.b2mash.roaf.picklist;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;

/**
 * Process-wide set of picklist tables, one per {@link PicklistFamily}. Built once at startup and
 * never mutated afterwards, so it is shared across concurrent projections without locking.
 */
public final class PicklistRegistry {

  private final Map<PicklistFamily, PicklistTable> tables;

  private PicklistRegistry(Map<PicklistFamily, PicklistTable> tables) {
    this.tables = tables;
  }

  /**
   * Freezes the given tables into a registry.
   *
   * @throws IllegalStateException if a family is supplied twice or not at all
   */
  public static PicklistRegistry of(Collection<PicklistTable> tables) {
    var byFamily = new EnumMap<PicklistFamily, PicklistTable>(PicklistFamily.class);
    for (PicklistTable table : tables) {
      if (byFamily.putIfAbsent(table.family(), table) != null) {
        throw new IllegalStateException("Picklist " + table.family() + " is defined twice");
      }
    }
    var missing = EnumSet.allOf(PicklistFamily.class);
    missing.removeAll(byFamily.keySet());
    if (!missing.isEmpty()) {
      throw new IllegalStateException("Picklists not loaded: " + missing);
    }
    return new PicklistRegistry(Collections.unmodifiableMap(byFamily));
  }

  public PicklistTable table(PicklistFamily family) {
    return tables.get(family);
  }

  public Map<PicklistFamily, PicklistTable> tables() {
    return tables;
  }
}
