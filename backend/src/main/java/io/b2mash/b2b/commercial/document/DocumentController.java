package io.b2mash.b2b.commercial.document;

import io.b2mash.b2b.commercial.document.dto.CreateDocumentRequest;
import io.b2mash.b2b.commercial.document.dto.DocumentPageResponse;
import io.b2mash.b2b.commercial.document.dto.DocumentResponse;
import io.b2mash.b2b.commercial.document.dto.LineRequest;
import io.b2mash.b2b.commercial.document.dto.PaymentRequest;
import io.b2mash.b2b.commercial.document.dto.PreviewRequest;
import io.b2mash.b2b.commercial.document.dto.PreviewResponse;
import io.b2mash.b2b.commercial.document.dto.StatusChangeRequest;
import io.b2mash.b2b.commercial.document.dto.TransformRequest;
import io.b2mash.b2b.commercial.document.dto.UpdateDocumentRequest;
import io.b2mash.b2b.commercial.engine.DocumentStatus;
import io.b2mash.b2b.commercial.engine.DocumentType;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for commercial documents. The acting user is passed by the gateway in the
 * {@code X-Member-Id} header; requests without it run as a system action.
 */
@RestController
@RequestMapping("/api/documents")
public class DocumentController {

  static final String MEMBER_HEADER = "X-Member-Id";

  private final DocumentService documentService;

  public DocumentController(DocumentService documentService) {
    this.documentService = documentService;
  }

  // --- Document CRUD ---

  @GetMapping
  public ResponseEntity<DocumentPageResponse> listDocuments(
      @RequestParam(required = false) DocumentType type,
      @RequestParam(required = false) DocumentStatus status,
      @RequestParam(name = "customer_id", required = false) UUID customerId,
      @RequestParam(defaultValue = "1") int page,
      @RequestParam(name = "page_size", defaultValue = "20") int pageSize) {
    return ResponseEntity.ok(
        documentService.listDocuments(
            new DocumentQuery(type, status, customerId, page, pageSize)));
  }

  /** Returns the document with its lifecycle flags evaluated now. */
  @GetMapping("/{id}")
  public ResponseEntity<DocumentResponse> getDocument(@PathVariable UUID id) {
    return ResponseEntity.ok(documentService.getDocument(id));
  }

  /**
   * Creates a draft document for an existing customer.
   *
   * @return 201 Created with the stored draft
   */
  @PostMapping
  public ResponseEntity<DocumentResponse> createDocument(
      @RequestHeader(name = MEMBER_HEADER, required = false) UUID memberId,
      @Valid @RequestBody CreateDocumentRequest request) {
    var created = documentService.createDraft(request, memberId);
    return ResponseEntity.created(URI.create("/api/documents/" + created.id())).body(created);
  }

  @PutMapping("/{id}")
  public ResponseEntity<DocumentResponse> updateDocument(
      @PathVariable UUID id, @Valid @RequestBody UpdateDocumentRequest request) {
    return ResponseEntity.ok(documentService.updateDraft(id, request));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteDocument(@PathVariable UUID id) {
    documentService.deleteDraft(id);
    return ResponseEntity.noContent().build();
  }

  /** Prices unsaved lines; nothing is stored. */
  @PostMapping("/preview")
  public ResponseEntity<PreviewResponse> preview(@Valid @RequestBody PreviewRequest request) {
    return ResponseEntity.ok(documentService.preview(request));
  }

  // --- Lines ---

  @PostMapping("/{id}/lines")
  public ResponseEntity<DocumentResponse> addLine(
      @PathVariable UUID id, @Valid @RequestBody LineRequest request) {
    return ResponseEntity.ok(documentService.addLine(id, request));
  }

  @PutMapping("/{id}/lines/{lineNumber}")
  public ResponseEntity<DocumentResponse> updateLine(
      @PathVariable UUID id,
      @PathVariable int lineNumber,
      @Valid @RequestBody LineRequest request) {
    return ResponseEntity.ok(documentService.updateLine(id, lineNumber, request));
  }

  @DeleteMapping("/{id}/lines/{lineNumber}")
  public ResponseEntity<DocumentResponse> removeLine(
      @PathVariable UUID id, @PathVariable int lineNumber) {
    return ResponseEntity.ok(documentService.removeLine(id, lineNumber));
  }

  // --- Lifecycle ---

  @PostMapping("/{id}/validate")
  public ResponseEntity<DocumentResponse> validate(
      @PathVariable UUID id, @RequestHeader(name = MEMBER_HEADER, required = false) UUID memberId) {
    return ResponseEntity.ok(documentService.validate(id, memberId));
  }

  /** Reports a status change made by the surrounding workflow. */
  @PostMapping("/{id}/status")
  public ResponseEntity<DocumentResponse> changeStatus(
      @PathVariable UUID id,
      @RequestHeader(name = MEMBER_HEADER, required = false) UUID memberId,
      @Valid @RequestBody StatusChangeRequest request) {
    return ResponseEntity.ok(documentService.changeStatus(id, request.status(), memberId));
  }

  @PostMapping("/{id}/cancel")
  public ResponseEntity<DocumentResponse> cancel(
      @PathVariable UUID id, @RequestHeader(name = MEMBER_HEADER, required = false) UUID memberId) {
    return ResponseEntity.ok(documentService.cancel(id, memberId));
  }

  @PostMapping("/{id}/payments")
  public ResponseEntity<DocumentResponse> recordPayment(
      @PathVariable UUID id,
      @RequestHeader(name = MEMBER_HEADER, required = false) UUID memberId,
      @Valid @RequestBody PaymentRequest request) {
    return ResponseEntity.ok(documentService.recordPayment(id, request, memberId));
  }

  // --- Derived documents ---

  @PostMapping("/{id}/transform")
  public ResponseEntity<DocumentResponse> transform(
      @PathVariable UUID id,
      @RequestHeader(name = MEMBER_HEADER, required = false) UUID memberId,
      @Valid @RequestBody TransformRequest request) {
    var child = documentService.transform(id, request.targetType(), memberId);
    return ResponseEntity.created(URI.create("/api/documents/" + child.id())).body(child);
  }

  @PostMapping("/{id}/duplicate")
  public ResponseEntity<DocumentResponse> duplicate(
      @PathVariable UUID id, @RequestHeader(name = MEMBER_HEADER, required = false) UUID memberId) {
    var copy = documentService.duplicate(id, memberId);
    return ResponseEntity.created(URI.create("/api/documents/" + copy.id())).body(copy);
  }

  @PostMapping("/{id}/convert-to-invoice")
  public ResponseEntity<DocumentResponse> convertToInvoice(
      @PathVariable UUID id, @RequestHeader(name = MEMBER_HEADER, required = false) UUID memberId) {
    var invoice = documentService.convertQuoteToInvoice(id, memberId);
    return ResponseEntity.created(URI.create("/api/documents/" + invoice.id())).body(invoice);
  }
}
