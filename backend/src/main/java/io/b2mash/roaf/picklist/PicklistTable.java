package io.b2mash.roaf.picklist;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable option-set lookup for one {@link PicklistFamily}. Keys are stored normalized (see
 * {@link PicklistCodes}) so numeric and string forms of a code resolve identically.
 */
public final class PicklistTable {

  private final PicklistFamily family;
  private final Map<String, String> labels;
  private final FallbackPolicy fallback;

  private PicklistTable(
      PicklistFamily family, Map<String, String> labels, FallbackPolicy fallback) {
    this.family = family;
    this.labels = labels;
    this.fallback = fallback;
  }

  /**
   * Creates a table from raw option entries.
   *
   * @throws IllegalArgumentException if a code is blank or two codes normalize to the same key
   */
  public static PicklistTable of(
      PicklistFamily family, Map<?, String> options, FallbackPolicy fallback) {
    Objects.requireNonNull(family, "family");
    Objects.requireNonNull(fallback, "fallback");
    var normalized = new LinkedHashMap<String, String>();
    if (options != null) {
      options.forEach(
          (code, label) -> {
            String key =
                PicklistCodes.normalize(code)
                    .orElseThrow(
                        () ->
                            new IllegalArgumentException(
                                "Blank option code in picklist " + family));
            if (normalized.putIfAbsent(key, label == null ? "" : label) != null) {
              throw new IllegalArgumentException(
                  "Duplicate option code " + key + " in picklist " + family);
            }
          });
    }
    return new PicklistTable(family, Collections.unmodifiableMap(normalized), fallback);
  }

  public PicklistFamily family() {
    return family;
  }

  public FallbackPolicy fallback() {
    return fallback;
  }

  public Map<String, String> labels() {
    return labels;
  }

  /** Label for the code, or empty when the code is null or not part of this option set. */
  public Optional<String> find(Object code) {
    return PicklistCodes.normalize(code).map(labels::get);
  }

  public boolean contains(Object code) {
    return find(code).isPresent();
  }

  public int size() {
    return labels.size();
  }

  @Override
  public String toString() {
    return "PicklistTable[" + family + ", " + labels.size() + " options]";
  }
}
