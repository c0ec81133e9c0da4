package io.b2mash.roaf.flag;

import io.b2mash.roaf.picklist.OptionSetValues;
import io.b2mash.roaf.record.RawRecord;

/**
 * Pure predicate over a raw record. Implementations must read only the record and must treat a
 * missing field as {@code false}.
 */
@FunctionalInterface
public interface FlagPredicate {

  boolean test(RawRecord record);

  /** Two-option field holding JSON {@code true}. */
  static FlagPredicate isTrue(String field) {
    return record -> record.isTrue(field);
  }

  /** Option-set field equal to a sentinel value. */
  static FlagPredicate codeEquals(String field, int sentinel) {
    return record -> OptionSetValues.matches(record.code(field), sentinel);
  }

  /** Option-set field with any value chosen. */
  static FlagPredicate codeSet(String field) {
    return record -> record.hasCode(field);
  }

  /** Related-entity array with at least one row. */
  static FlagPredicate hasItems(String field) {
    return record -> record.hasItems(field);
  }
}
