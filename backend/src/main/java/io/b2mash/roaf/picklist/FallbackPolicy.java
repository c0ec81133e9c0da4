package io.b2mash.roaf.picklist;

import java.util.Objects;

/**
 * What a {@link PicklistTable} returns for a null or unknown code. Tables either fall back to the
 * empty string or to a fixed literal such as {@code "Unknown Country"}; a raw code is never echoed
 * into a document.
 */
public record FallbackPolicy(String label) {

  private static final FallbackPolicy EMPTY = new FallbackPolicy("");

  public FallbackPolicy {
    Objects.requireNonNull(label, "label");
  }

  public static FallbackPolicy empty() {
    return EMPTY;
  }

  public static FallbackPolicy literal(String label) {
    return label == null || label.isEmpty() ? EMPTY : new FallbackPolicy(label);
  }

  public boolean isEmpty() {
    return label.isEmpty();
  }
}
