package io.b2mash.roaf.projection;

import io.b2mash.roaf.exception.UnsupportedDocumentTypeException;
import io.b2mash.roaf.record.RawRecord;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Entry point for renderers: picks the context builder registered for a document type. */
@Service
public class DocumentContextService {

  private static final Logger log = LoggerFactory.getLogger(DocumentContextService.class);

  private final List<DocumentContextBuilder> contextBuilders;

  public DocumentContextService(List<DocumentContextBuilder> contextBuilders) {
    this.contextBuilders = contextBuilders;
  }

  public Map<String, Object> buildContext(DocumentType documentType, RawRecord record) {
    var builder = findBuilder(documentType);
    var context = builder.buildContext(record);
    log.debug("Built {} context with {} top-level keys", documentType, context.size());
    return context;
  }

  private DocumentContextBuilder findBuilder(DocumentType documentType) {
    return contextBuilders.stream()
        .filter(b -> b.supports() == documentType)
        .findFirst()
        .orElseThrow(() -> new UnsupportedDocumentTypeException(documentType));
  }
}
