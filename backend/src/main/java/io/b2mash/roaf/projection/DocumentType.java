package io.b2mash.roaf.projection;

/** Source entity types that can be projected into a render context. */
public enum DocumentType {
  AUTHORISED_INDIVIDUAL
}
