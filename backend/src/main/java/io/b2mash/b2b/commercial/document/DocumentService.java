package io.b2mash.b2b.commercial.document;

import io.b2mash.b2b.commercial.customer.CustomerDirectory;
import io.b2mash.b2b.commercial.document.dto.CreateDocumentRequest;
import io.b2mash.b2b.commercial.document.dto.DocumentPageResponse;
import io.b2mash.b2b.commercial.document.dto.DocumentResponse;
import io.b2mash.b2b.commercial.document.dto.LineRequest;
import io.b2mash.b2b.commercial.document.dto.PaymentRequest;
import io.b2mash.b2b.commercial.document.dto.PreviewRequest;
import io.b2mash.b2b.commercial.document.dto.PreviewResponse;
import io.b2mash.b2b.commercial.document.dto.PreviewResponse.LinePreview;
import io.b2mash.b2b.commercial.document.dto.UpdateDocumentRequest;
import io.b2mash.b2b.commercial.engine.Amounts;
import io.b2mash.b2b.commercial.engine.Document;
import io.b2mash.b2b.commercial.engine.DocumentAggregator;
import io.b2mash.b2b.commercial.engine.DocumentDraft;
import io.b2mash.b2b.commercial.engine.DocumentLifecycle;
import io.b2mash.b2b.commercial.engine.DocumentLine;
import io.b2mash.b2b.commercial.engine.DocumentStatus;
import io.b2mash.b2b.commercial.engine.DocumentType;
import io.b2mash.b2b.commercial.engine.DocumentValidationException;
import io.b2mash.b2b.commercial.engine.TransformationBuilder;
import io.b2mash.b2b.commercial.event.DocumentPaymentRecordedEvent;
import io.b2mash.b2b.commercial.event.DocumentStatusChangedEvent;
import io.b2mash.b2b.commercial.event.DocumentTransformedEvent;
import io.b2mash.b2b.commercial.event.DocumentValidatedEvent;
import io.b2mash.b2b.commercial.exception.ResourceNotFoundException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Runs document use cases: loads from the store, lets the lifecycle engine decide, writes the
 * result back and publishes the matching event.
 */
@Service
public class DocumentService {

  private static final Logger log = LoggerFactory.getLogger(DocumentService.class);

  static final String DEFAULT_CURRENCY = "EUR";

  private final DocumentStore documentStore;
  private final CustomerDirectory customerDirectory;
  private final DocumentLifecycle lifecycle;
  private final TransformationBuilder transformationBuilder;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public DocumentService(
      DocumentStore documentStore,
      CustomerDirectory customerDirectory,
      DocumentLifecycle lifecycle,
      TransformationBuilder transformationBuilder,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.documentStore = documentStore;
    this.customerDirectory = customerDirectory;
    this.lifecycle = lifecycle;
    this.transformationBuilder = transformationBuilder;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  // --- Queries ---

  public DocumentPageResponse listDocuments(DocumentQuery query) {
    var page = documentStore.findAll(query);
    return new DocumentPageResponse(
        page.items().stream().map(this::toResponse).toList(),
        page.total(),
        page.page(),
        page.pageSize());
  }

  public DocumentResponse getDocument(UUID id) {
    return toResponse(load(id));
  }

  /** Prices unsaved lines without touching the store. */
  public PreviewResponse preview(PreviewRequest request) {
    List<DocumentLine> lines = toLines(request.lines());
    var linePreviews =
        lines.stream().map(line -> LinePreview.from(line.lineNumber(), line.amounts())).toList();
    BigDecimal discount =
        request.discountPercent() != null ? request.discountPercent() : BigDecimal.ZERO;
    return PreviewResponse.from(linePreviews, DocumentAggregator.aggregate(lines, discount));
  }

  // --- Drafts ---

  public DocumentResponse createDraft(CreateDocumentRequest request, UUID actorId) {
    var customer =
        customerDirectory
            .findCustomer(request.customerId())
            .orElseThrow(() -> ResourceNotFoundException.customer(request.customerId()));

    var draft =
        new DocumentDraft(
            request.type(),
            customer.id(),
            customer.name(),
            customer.email(),
            request.date() != null ? request.date() : LocalDate.now(clock),
            request.dueDate(),
            request.validityDate(),
            request.currency() != null ? request.currency() : DEFAULT_CURRENCY,
            request.discountPercent(),
            request.notes(),
            request.internalNotes(),
            null,
            toLines(request.lines()));

    var created = documentStore.create(draft, actorId);
    log.info(
        "Created draft {} {} for customer {} with {} lines",
        created.type(),
        created.id(),
        created.customerId(),
        created.lines().size());
    return toResponse(created);
  }

  public DocumentResponse updateDraft(UUID id, UpdateDocumentRequest request) {
    var doc = load(id);
    lifecycle.requireEditable(doc);

    var builder = doc.toBuilder();
    if (request.date() != null) {
      builder.date(request.date());
    }
    if (request.dueDate() != null) {
      builder.dueDate(request.dueDate());
    }
    if (request.validityDate() != null) {
      builder.validityDate(request.validityDate());
    }
    if (request.currency() != null) {
      builder.currency(request.currency());
    }
    if (request.discountPercent() != null) {
      builder.discountPercent(request.discountPercent());
    }
    if (request.notes() != null) {
      builder.notes(request.notes());
    }
    if (request.internalNotes() != null) {
      builder.internalNotes(request.internalNotes());
    }
    if (request.lines() != null) {
      builder.lines(toLines(request.lines()));
    }

    var updated = documentStore.update(builder.build());
    log.info("Updated draft {} {}", updated.type(), updated.id());
    return toResponse(updated);
  }

  public void deleteDraft(UUID id) {
    var doc = load(id);
    if (!lifecycle.canDelete(doc)) {
      throw new DocumentValidationException(
          "Document cannot be deleted",
          "Only DRAFT documents can be deleted. Current status: " + doc.status() + ".");
    }
    documentStore.delete(id);
    log.info("Deleted draft {} {}", doc.type(), id);
  }

  // --- Lines ---

  public DocumentResponse addLine(UUID id, LineRequest request) {
    var doc = load(id);
    var updated =
        documentStore.update(lifecycle.addLine(doc, request.toLine(doc.lines().size() + 1)));
    log.info("Added line to document {}, now {} lines", id, updated.lines().size());
    return toResponse(updated);
  }

  public DocumentResponse updateLine(UUID id, int lineNumber, LineRequest request) {
    var doc = load(id);
    var updated =
        documentStore.update(lifecycle.replaceLine(doc, lineNumber, request.toLine(lineNumber)));
    log.info("Updated line {} of document {}", lineNumber, id);
    return toResponse(updated);
  }

  public DocumentResponse removeLine(UUID id, int lineNumber) {
    var doc = load(id);
    var updated = documentStore.update(lifecycle.removeLine(doc, lineNumber));
    log.info("Removed line {} from document {}", lineNumber, id);
    return toResponse(updated);
  }

  // --- Status ---

  public DocumentResponse validate(UUID id, UUID actorId) {
    var doc = load(id);
    var validated = lifecycle.validate(doc, actorId);
    var stored =
        documentStore.changeStatus(
            id, new StatusChange(DocumentStatus.VALIDATED, validated.validatedAt(), actorId));

    BigDecimal total = Amounts.forDisplay(validated.totals().total());
    int lineCount = validated.lines().size();
    eventPublisher.publishEvent(
        new DocumentValidatedEvent(
            "document.validated",
            id,
            doc.type(),
            doc.number(),
            actorId,
            validated.validatedAt(),
            Map.of("line_count", lineCount, "total", total),
            lineCount,
            total));
    log.info("Validated {} {} with total {}", doc.type(), id, total);
    return toResponse(stored);
  }

  /** Applies a status reported by the surrounding workflow (sent, accepted, delivered...). */
  public DocumentResponse changeStatus(UUID id, DocumentStatus target, UUID actorId) {
    var doc = load(id);
    var next = lifecycle.transition(doc, target);
    return storeStatus(doc, next, actorId);
  }

  public DocumentResponse cancel(UUID id, UUID actorId) {
    var doc = load(id);
    var next = lifecycle.cancel(doc);
    return storeStatus(doc, next, actorId);
  }

  public DocumentResponse recordPayment(UUID id, PaymentRequest request, UUID actorId) {
    var doc = load(id);
    var next = lifecycle.recordPayment(doc, request.amount());
    Instant paidAt = request.paidAt() != null ? request.paidAt() : next.updatedAt();

    var stored =
        documentStore.recordPayment(
            id, new PaymentRecord(request.amount(), request.reference(), paidAt));
    if (next.status() == DocumentStatus.PAID && stored.status() != DocumentStatus.PAID) {
      stored =
          documentStore.changeStatus(
              id, new StatusChange(DocumentStatus.PAID, next.paidAt(), actorId));
    }

    BigDecimal remaining = Amounts.forDisplay(next.remainingAmount());
    var details = new LinkedHashMap<String, Object>();
    details.put("amount", request.amount());
    details.put("remaining_amount", remaining);
    if (request.reference() != null) {
      details.put("reference", request.reference());
    }
    eventPublisher.publishEvent(
        new DocumentPaymentRecordedEvent(
            "document.payment_recorded",
            id,
            doc.type(),
            doc.number(),
            actorId,
            paidAt,
            details,
            request.amount(),
            request.reference(),
            remaining));
    if (next.status() != doc.status()) {
      publishStatusChanged(doc, next, actorId);
    }
    log.info(
        "Recorded payment of {} on {} {}, remaining {}",
        request.amount(),
        doc.type(),
        id,
        remaining);
    return toResponse(stored);
  }

  // --- Derived documents ---

  public DocumentResponse transform(UUID id, DocumentType targetType, UUID actorId) {
    var source = load(id);
    var child = documentStore.create(transformationBuilder.build(source, targetType), actorId);
    publishDerived("document.transformed", source, child, actorId);
    log.info("Transformed {} {} into {} {}", source.type(), id, child.type(), child.id());
    return toResponse(child);
  }

  public DocumentResponse convertQuoteToInvoice(UUID id, UUID actorId) {
    var source = load(id);
    var child = documentStore.create(transformationBuilder.convertQuoteToInvoice(source), actorId);
    publishDerived("document.converted", source, child, actorId);
    log.info("Converted quote {} into invoice {}", id, child.id());
    return toResponse(child);
  }

  public DocumentResponse duplicate(UUID id, UUID actorId) {
    var source = load(id);
    var copy = documentStore.create(transformationBuilder.duplicate(source), actorId);
    publishDerived("document.duplicated", source, copy, actorId);
    log.info("Duplicated {} {} as {}", source.type(), id, copy.id());
    return toResponse(copy);
  }

  // --- Helpers ---

  private Document load(UUID id) {
    return documentStore
        .findById(id)
        .orElseThrow(() -> ResourceNotFoundException.document(id));
  }

  private DocumentResponse toResponse(Document doc) {
    return DocumentResponse.from(doc, lifecycle.view(doc));
  }

  private static List<DocumentLine> toLines(List<LineRequest> requests) {
    if (requests == null) {
      return List.of();
    }
    var lines = new ArrayList<DocumentLine>(requests.size());
    for (int i = 0; i < requests.size(); i++) {
      lines.add(requests.get(i).toLine(i + 1));
    }
    return lines;
  }

  private DocumentResponse storeStatus(Document doc, Document next, UUID actorId) {
    var stored =
        documentStore.changeStatus(
            doc.id(), new StatusChange(next.status(), next.updatedAt(), actorId));
    publishStatusChanged(doc, next, actorId);
    log.info("Changed {} {} from {} to {}", doc.type(), doc.id(), doc.status(), next.status());
    return toResponse(stored);
  }

  private void publishStatusChanged(Document before, Document after, UUID actorId) {
    eventPublisher.publishEvent(
        new DocumentStatusChangedEvent(
            "document.status_changed",
            before.id(),
            before.type(),
            before.number(),
            actorId,
            after.updatedAt(),
            Map.of("old_status", before.status().name(), "new_status", after.status().name()),
            before.status(),
            after.status()));
  }

  private void publishDerived(String eventType, Document source, Document child, UUID actorId) {
    eventPublisher.publishEvent(
        new DocumentTransformedEvent(
            eventType,
            source.id(),
            source.type(),
            source.number(),
            actorId,
            clock.instant(),
            Map.of("child_type", child.type().name(), "child_id", String.valueOf(child.id())),
            child.id(),
            child.type(),
            child.number()));
  }
}
