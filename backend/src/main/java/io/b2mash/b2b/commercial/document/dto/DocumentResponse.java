package io.b2mash.b2b.commercial.document.dto;

import io.b2mash.b2b.commercial.engine.Amounts;
import io.b2mash.b2b.commercial.engine.Document;
import io.b2mash.b2b.commercial.engine.DocumentStatus;
import io.b2mash.b2b.commercial.engine.DocumentTotals;
import io.b2mash.b2b.commercial.engine.DocumentType;
import io.b2mash.b2b.commercial.engine.LifecycleView;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/** A document with display-rounded totals and the lifecycle flags at the time of the request. */
public record DocumentResponse(
    UUID id,
    String number,
    DocumentType type,
    String typeLabel,
    DocumentStatus status,
    UUID customerId,
    String customerName,
    String customerEmail,
    LocalDate date,
    LocalDate dueDate,
    LocalDate validityDate,
    String currency,
    BigDecimal discountPercent,
    BigDecimal subtotal,
    BigDecimal discountAmount,
    BigDecimal taxAmount,
    BigDecimal total,
    BigDecimal paidAmount,
    BigDecimal remainingAmount,
    String notes,
    String internalNotes,
    UUID parentId,
    List<UUID> childIds,
    List<DocumentLineResponse> lines,
    UUID createdBy,
    UUID validatedBy,
    Instant createdAt,
    Instant validatedAt,
    Instant sentAt,
    Instant paidAt,
    Instant cancelledAt,
    Instant updatedAt,
    LifecycleResponse lifecycle) {

  public static DocumentResponse from(Document doc, LifecycleView view) {
    DocumentTotals totals = doc.totals().forDisplay();
    return new DocumentResponse(
        doc.id(),
        doc.number(),
        doc.type(),
        doc.type().getLabel(),
        doc.status(),
        doc.customerId(),
        doc.customerName(),
        doc.customerEmail(),
        doc.date(),
        doc.dueDate(),
        doc.validityDate(),
        doc.currency(),
        doc.discountPercent(),
        totals.subtotal(),
        totals.discountAmount(),
        totals.taxAmount(),
        totals.total(),
        Amounts.forDisplay(doc.paidAmount()),
        Amounts.forDisplay(doc.remainingAmount()),
        doc.notes(),
        doc.internalNotes(),
        doc.parentId(),
        doc.childIds(),
        doc.lines().stream().map(DocumentLineResponse::from).toList(),
        doc.createdBy(),
        doc.validatedBy(),
        doc.createdAt(),
        doc.validatedAt(),
        doc.sentAt(),
        doc.paidAt(),
        doc.cancelledAt(),
        doc.updatedAt(),
        LifecycleResponse.from(view));
  }
}
