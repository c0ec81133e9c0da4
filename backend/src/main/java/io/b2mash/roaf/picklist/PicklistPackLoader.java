package io.b2mash.roaf.picklist;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.ResourcePatternResolver;
import tools.jackson.databind.ObjectMapper;

/**
 * Loads picklist packs (JSON-defined option sets) from the classpath and freezes them into a
 * {@link PicklistRegistry}. Called once while the application context starts; any unreadable pack
 * or missing family aborts startup instead of surfacing later as blank labels.
 */
public class PicklistPackLoader {

  private static final Logger log = LoggerFactory.getLogger(PicklistPackLoader.class);

  private final ResourcePatternResolver resourceResolver;
  private final ObjectMapper objectMapper;

  public PicklistPackLoader(ResourcePatternResolver resourceResolver, ObjectMapper objectMapper) {
    this.resourceResolver = resourceResolver;
    this.objectMapper = objectMapper;
  }

  public PicklistRegistry load(String location) {
    List<PicklistPackDefinition> packs = loadPacks(location);
    var tables = new ArrayList<PicklistTable>();
    for (PicklistPackDefinition pack : packs) {
      if (pack.tables() == null) {
        log.warn("Picklist pack {} declares no tables", pack.packId());
        continue;
      }
      for (PicklistPackDefinition.PicklistDefinition definition : pack.tables()) {
        if (definition.family() == null) {
          throw new IllegalStateException(
              "Picklist pack " + pack.packId() + " has a table without family");
        }
        tables.add(
            PicklistTable.of(
                definition.family(),
                definition.options(),
                FallbackPolicy.literal(definition.fallback())));
      }
      log.info(
          "Loaded picklist pack {} v{} ({} tables)",
          pack.packId(),
          pack.version(),
          pack.tables().size());
    }
    return PicklistRegistry.of(tables);
  }

  private List<PicklistPackDefinition> loadPacks(String location) {
    Resource[] resources;
    try {
      resources = resourceResolver.getResources(location);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to scan for picklist packs at " + location, e);
    }
    if (resources.length == 0) {
      throw new IllegalStateException("No picklist packs found at " + location);
    }
    return Arrays.stream(resources)
        .map(
            resource -> {
              try {
                return objectMapper.readValue(
                    resource.getInputStream(), PicklistPackDefinition.class);
              } catch (Exception e) {
                throw new IllegalStateException(
                    "Failed to parse picklist pack: " + resource.getFilename(), e);
              }
            })
        .toList();
  }
}
