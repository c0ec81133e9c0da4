package io.b2mash.roaf.projection;

import io.b2mash.roaf.document.CanonicalDocumentContext;
import io.b2mash.roaf.record.RawRecord;
import java.util.Map;
import org.springframework.stereotype.Service;

@Service
public class AuthorisedIndividualContextBuilder implements DocumentContextBuilder {

  private final AuthorisedIndividualProjector projector;

  public AuthorisedIndividualContextBuilder(AuthorisedIndividualProjector projector) {
    this.projector = projector;
  }

  @Override
  public DocumentType supports() {
    return DocumentType.AUTHORISED_INDIVIDUAL;
  }

  @Override
  public Map<String, Object> buildContext(RawRecord record) {
    return CanonicalDocumentContext.toContext(projector.project(record));
  }

  /** Explains which conditional regions the record shows, and why. */
  public SectionVisibilityReport explainVisibility(RawRecord record) {
    return SectionVisibilityReport.of(record, projector.project(record));
  }
}
