package io.b2mash.b2b.commercial.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Writes every document lifecycle event to the log. */
@Component
public class DocumentEventLogger {

  private static final Logger log = LoggerFactory.getLogger(DocumentEventLogger.class);

  @EventListener
  public void onDocumentEvent(DocumentEvent event) {
    log.info(
        "{}: document={} ({} {}), actor={}, details={}",
        event.eventType(),
        event.documentId(),
        event.documentType(),
        event.documentNumber(),
        event.actorId(),
        event.details());
  }
}
