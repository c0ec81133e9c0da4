package io.b2mash.roaf.picklist;

import java.util.List;
import java.util.Map;

/** DTO record for deserializing picklist pack JSON files from the classpath. */
public record PicklistPackDefinition(
    String packId, int version, String description, List<PicklistDefinition> tables) {

  /** One option set inside a pack; {@code fallback} absent or empty means the empty string. */
  public record PicklistDefinition(
      PicklistFamily family, String fallback, Map<String, String> options) {}
}
