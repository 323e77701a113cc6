package io.b2mash.b2b.commercial.document.store;

import io.b2mash.b2b.commercial.engine.Document;
import io.b2mash.b2b.commercial.engine.DocumentDraft;
import io.b2mash.b2b.commercial.engine.DocumentLine;
import io.b2mash.b2b.commercial.engine.DocumentTotals;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Wire form of a document as exchanged with the store. {@code type} and {@code status} travel as
 * strings so unknown tags can be reported instead of failing inside Jackson.
 */
public record DocumentPayload(
    UUID id,
    String number,
    @NotBlank String type,
    @NotBlank String status,
    UUID customerId,
    String customerName,
    String customerEmail,
    @NotNull LocalDate date,
    LocalDate dueDate,
    LocalDate validityDate,
    String currency,
    @NotNull BigDecimal discountPercent,
    @NotNull BigDecimal paidAmount,
    String notes,
    String internalNotes,
    UUID parentId,
    List<@NotNull UUID> childIds,
    @NotNull List<@Valid @NotNull DocumentLinePayload> lines,
    UUID createdBy,
    UUID validatedBy,
    Instant createdAt,
    Instant validatedAt,
    Instant sentAt,
    Instant paidAt,
    Instant cancelledAt,
    Instant updatedAt,
    @NotNull BigDecimal subtotal,
    @NotNull BigDecimal discountAmount,
    @NotNull BigDecimal taxAmount,
    @NotNull BigDecimal total) {

  public static DocumentPayload from(Document doc) {
    DocumentTotals totals = doc.totals().forDisplay();
    return new DocumentPayload(
        doc.id(),
        doc.number(),
        doc.type().name(),
        doc.status().name(),
        doc.customerId(),
        doc.customerName(),
        doc.customerEmail(),
        doc.date(),
        doc.dueDate(),
        doc.validityDate(),
        doc.currency(),
        doc.discountPercent(),
        doc.paidAmount(),
        doc.notes(),
        doc.internalNotes(),
        doc.parentId(),
        doc.childIds(),
        linePayloads(doc.lines()),
        doc.createdBy(),
        doc.validatedBy(),
        doc.createdAt(),
        doc.validatedAt(),
        doc.sentAt(),
        doc.paidAt(),
        doc.cancelledAt(),
        doc.updatedAt(),
        totals.subtotal(),
        totals.discountAmount(),
        totals.taxAmount(),
        totals.total());
  }

  public static DocumentPayload from(DocumentDraft draft, UUID createdBy) {
    DocumentTotals totals = draft.totals().forDisplay();
    return new DocumentPayload(
        null,
        null,
        draft.type().name(),
        draft.status().name(),
        draft.customerId(),
        draft.customerName(),
        draft.customerEmail(),
        draft.date(),
        draft.dueDate(),
        draft.validityDate(),
        draft.currency(),
        draft.discountPercent(),
        BigDecimal.ZERO,
        draft.notes(),
        draft.internalNotes(),
        draft.parentId(),
        List.of(),
        linePayloads(draft.lines()),
        createdBy,
        null,
        null,
        null,
        null,
        null,
        null,
        null,
        totals.subtotal(),
        totals.discountAmount(),
        totals.taxAmount(),
        totals.total());
  }

  private static List<DocumentLinePayload> linePayloads(List<DocumentLine> lines) {
    return lines.stream().map(DocumentLinePayload::from).toList();
  }
}
