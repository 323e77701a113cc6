package io.b2mash.b2b.commercial.engine;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Payload for a document that does not exist yet. The store assigns id and number; the status of
 * a new document is always {@link DocumentStatus#DRAFT}. Lines carry no identity.
 */
public record DocumentDraft(
    DocumentType type,
    UUID customerId,
    String customerName,
    String customerEmail,
    LocalDate date,
    LocalDate dueDate,
    LocalDate validityDate,
    String currency,
    BigDecimal discountPercent,
    String notes,
    String internalNotes,
    UUID parentId,
    List<DocumentLine> lines) {

  public DocumentDraft {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(date, "date");
    discountPercent = discountPercent != null ? discountPercent : BigDecimal.ZERO;
    lines = lines != null ? List.copyOf(lines) : List.of();
    LineCalculator.checkDiscountPercent(discountPercent);
  }

  public DocumentStatus status() {
    return DocumentStatus.DRAFT;
  }

  public DocumentTotals totals() {
    return DocumentAggregator.aggregate(lines, discountPercent);
  }
}
