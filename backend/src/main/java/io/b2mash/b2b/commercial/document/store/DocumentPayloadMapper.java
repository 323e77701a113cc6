package io.b2mash.b2b.commercial.document.store;

import io.b2mash.b2b.commercial.engine.Amounts;
import io.b2mash.b2b.commercial.engine.Document;
import io.b2mash.b2b.commercial.engine.DocumentEngineException;
import io.b2mash.b2b.commercial.engine.DocumentLine;
import io.b2mash.b2b.commercial.engine.DocumentStatus;
import io.b2mash.b2b.commercial.engine.DocumentTotals;
import io.b2mash.b2b.commercial.engine.DocumentType;
import io.b2mash.b2b.commercial.engine.LineAmounts;
import io.b2mash.b2b.commercial.exception.DocumentStoreException;
import jakarta.validation.Validator;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Turns store payloads into engine documents. A payload is rejected as a whole when it misses
 * required fields, carries an unknown type or status, holds inputs the engine refuses, or stores
 * totals that differ from a fresh aggregation of its lines at display scale.
 */
@Component
public class DocumentPayloadMapper {

  private final Validator validator;

  public DocumentPayloadMapper(Validator validator) {
    this.validator = validator;
  }

  public Document toDocument(DocumentPayload payload) {
    if (payload == null) {
      throw new DocumentStoreException("Document store returned an empty document", List.of());
    }
    List<String> violations = new ArrayList<>();
    validator.validate(payload).stream()
        .map(v -> v.getPropertyPath() + " " + v.getMessage())
        .sorted()
        .forEach(violations::add);
    if (!violations.isEmpty()) {
      throw malformed(payload, violations);
    }

    DocumentType type = parse(DocumentType.class, "type", payload.type(), violations);
    DocumentStatus status = parse(DocumentStatus.class, "status", payload.status(), violations);
    if (!violations.isEmpty()) {
      throw malformed(payload, violations);
    }

    Document document;
    try {
      document = build(payload, type, status);
    } catch (DocumentEngineException e) {
      throw malformed(payload, List.of(e.getDetail()));
    }

    checkLineTotals(payload.lines(), violations);
    checkDocumentTotals(payload, document.totals(), violations);
    if (!violations.isEmpty()) {
      throw malformed(payload, violations);
    }
    return document;
  }

  public List<Document> toDocuments(List<DocumentPayload> payloads) {
    return payloads.stream().map(this::toDocument).toList();
  }

  private static Document build(DocumentPayload payload, DocumentType type, DocumentStatus status) {
    List<DocumentLine> lines = payload.lines().stream().map(DocumentLinePayload::toLine).toList();
    return Document.builder(type, payload.customerId(), payload.date())
        .id(payload.id())
        .number(payload.number())
        .status(status)
        .customerName(payload.customerName())
        .customerEmail(payload.customerEmail())
        .dueDate(payload.dueDate())
        .validityDate(payload.validityDate())
        .currency(payload.currency())
        .discountPercent(payload.discountPercent())
        .paidAmount(payload.paidAmount())
        .notes(payload.notes())
        .internalNotes(payload.internalNotes())
        .parentId(payload.parentId())
        .childIds(payload.childIds())
        .lines(lines)
        .createdBy(payload.createdBy())
        .validatedBy(payload.validatedBy())
        .createdAt(payload.createdAt())
        .validatedAt(payload.validatedAt())
        .sentAt(payload.sentAt())
        .paidAt(payload.paidAt())
        .cancelledAt(payload.cancelledAt())
        .updatedAt(payload.updatedAt())
        .build();
  }

  private static void checkLineTotals(List<DocumentLinePayload> lines, List<String> violations) {
    for (DocumentLinePayload line : lines) {
      LineAmounts expected = line.toLine().amounts();
      String prefix = "lines[" + line.lineNumber() + "].";
      compare(prefix + "subtotal", line.subtotal(), expected.subtotal(), violations);
      compare(
          prefix + "discount_amount", line.discountAmount(), expected.discountAmount(), violations);
      compare(prefix + "tax_amount", line.taxAmount(), expected.taxAmount(), violations);
      compare(prefix + "total", line.total(), expected.total(), violations);
    }
  }

  private static void checkDocumentTotals(
      DocumentPayload payload, DocumentTotals expected, List<String> violations) {
    compare("subtotal", payload.subtotal(), expected.subtotal(), violations);
    compare("discount_amount", payload.discountAmount(), expected.discountAmount(), violations);
    compare("tax_amount", payload.taxAmount(), expected.taxAmount(), violations);
    compare("total", payload.total(), expected.total(), violations);
  }

  private static void compare(
      String field, BigDecimal stored, BigDecimal computed, List<String> violations) {
    if (!Amounts.sameAtDisplayScale(stored, computed)) {
      violations.add(field + " is " + stored + " but lines give " + Amounts.forDisplay(computed));
    }
  }

  private static <E extends Enum<E>> E parse(
      Class<E> enumType, String field, String value, List<String> violations) {
    try {
      return Enum.valueOf(enumType, value);
    } catch (IllegalArgumentException e) {
      violations.add(field + " has unknown value '" + value + "'");
      return null;
    }
  }

  private static DocumentStoreException malformed(
      DocumentPayload payload, List<String> violations) {
    return new DocumentStoreException(
        "Document store returned a malformed document " + payload.id(), violations);
  }
}
