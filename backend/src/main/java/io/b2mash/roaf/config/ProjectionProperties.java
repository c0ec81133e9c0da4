package io.b2mash.roaf.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for the document projection.
 *
 * @param templateVersion version stamped on every generated document
 * @param picklistLocation resource pattern of the picklist packs loaded at startup
 */
@Validated
@ConfigurationProperties(prefix = "roaf.projection")
public record ProjectionProperties(
    @NotBlank String templateVersion, @NotBlank String picklistLocation) {}
