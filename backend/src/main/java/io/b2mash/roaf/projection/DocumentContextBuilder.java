package io.b2mash.roaf.projection;

import io.b2mash.roaf.record.RawRecord;
import java.util.Map;

/**
 * Strategy interface for assembling the render context of one document type. Implementations
 * project the raw record and flatten the result, so renderers only ever see plain maps and lists.
 */
public interface DocumentContextBuilder {

  /** Returns the document type this builder handles. */
  DocumentType supports();

  /**
   * Builds the render context for the given record.
   *
   * @param record the source record, as read from the data source
   * @return a map of template variables ready for rendering
   */
  Map<String, Object> buildContext(RawRecord record);
}
