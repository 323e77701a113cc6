package io.b2mash.b2b.commercial.engine;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A commercial document (quote, order, invoice, credit note, proforma or delivery note) as held
 * by a caller. Immutable: lifecycle operations return a new value that the caller submits to the
 * store.
 *
 * <p>Financial totals are not components. They are derived from {@link #lines()} by {@link
 * #totals()}, so a document value can never carry totals that disagree with its lines.
 */
public record Document(
    UUID id,
    String number,
    DocumentType type,
    DocumentStatus status,
    UUID customerId,
    String customerName,
    String customerEmail,
    LocalDate date,
    LocalDate dueDate,
    LocalDate validityDate,
    String currency,
    BigDecimal discountPercent,
    BigDecimal paidAmount,
    String notes,
    String internalNotes,
    UUID parentId,
    List<UUID> childIds,
    List<DocumentLine> lines,
    UUID createdBy,
    UUID validatedBy,
    Instant createdAt,
    Instant validatedAt,
    Instant sentAt,
    Instant paidAt,
    Instant cancelledAt,
    Instant updatedAt) {

  public Document {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(date, "date");
    discountPercent = discountPercent != null ? discountPercent : BigDecimal.ZERO;
    paidAmount = paidAmount != null ? paidAmount : BigDecimal.ZERO;
    childIds = childIds != null ? List.copyOf(childIds) : List.of();
    lines = lines != null ? List.copyOf(lines) : List.of();
    LineCalculator.checkDiscountPercent(discountPercent);
  }

  public DocumentTotals totals() {
    return DocumentAggregator.aggregate(lines, discountPercent);
  }

  /** Total still owed: {@code total − paidAmount}. */
  public BigDecimal remainingAmount() {
    return totals().total().subtract(paidAmount);
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public static Builder builder(DocumentType type, UUID customerId, LocalDate date) {
    return new Builder().type(type).customerId(customerId).date(date);
  }

  /** Builder for deriving modified copies; unset fields keep their current value. */
  public static final class Builder {

    private UUID id;
    private String number;
    private DocumentType type;
    private DocumentStatus status = DocumentStatus.DRAFT;
    private UUID customerId;
    private String customerName;
    private String customerEmail;
    private LocalDate date;
    private LocalDate dueDate;
    private LocalDate validityDate;
    private String currency = "EUR";
    private BigDecimal discountPercent = BigDecimal.ZERO;
    private BigDecimal paidAmount = BigDecimal.ZERO;
    private String notes;
    private String internalNotes;
    private UUID parentId;
    private List<UUID> childIds = List.of();
    private List<DocumentLine> lines = List.of();
    private UUID createdBy;
    private UUID validatedBy;
    private Instant createdAt;
    private Instant validatedAt;
    private Instant sentAt;
    private Instant paidAt;
    private Instant cancelledAt;
    private Instant updatedAt;

    private Builder() {}

    private Builder(Document source) {
      this.id = source.id;
      this.number = source.number;
      this.type = source.type;
      this.status = source.status;
      this.customerId = source.customerId;
      this.customerName = source.customerName;
      this.customerEmail = source.customerEmail;
      this.date = source.date;
      this.dueDate = source.dueDate;
      this.validityDate = source.validityDate;
      this.currency = source.currency;
      this.discountPercent = source.discountPercent;
      this.paidAmount = source.paidAmount;
      this.notes = source.notes;
      this.internalNotes = source.internalNotes;
      this.parentId = source.parentId;
      this.childIds = source.childIds;
      this.lines = source.lines;
      this.createdBy = source.createdBy;
      this.validatedBy = source.validatedBy;
      this.createdAt = source.createdAt;
      this.validatedAt = source.validatedAt;
      this.sentAt = source.sentAt;
      this.paidAt = source.paidAt;
      this.cancelledAt = source.cancelledAt;
      this.updatedAt = source.updatedAt;
    }

    public Builder id(UUID id) {
      this.id = id;
      return this;
    }

    public Builder number(String number) {
      this.number = number;
      return this;
    }

    public Builder type(DocumentType type) {
      this.type = type;
      return this;
    }

    public Builder status(DocumentStatus status) {
      this.status = status;
      return this;
    }

    public Builder customerId(UUID customerId) {
      this.customerId = customerId;
      return this;
    }

    public Builder customerName(String customerName) {
      this.customerName = customerName;
      return this;
    }

    public Builder customerEmail(String customerEmail) {
      this.customerEmail = customerEmail;
      return this;
    }

    public Builder date(LocalDate date) {
      this.date = date;
      return this;
    }

    public Builder dueDate(LocalDate dueDate) {
      this.dueDate = dueDate;
      return this;
    }

    public Builder validityDate(LocalDate validityDate) {
      this.validityDate = validityDate;
      return this;
    }

    public Builder currency(String currency) {
      this.currency = currency;
      return this;
    }

    public Builder discountPercent(BigDecimal discountPercent) {
      this.discountPercent = discountPercent;
      return this;
    }

    public Builder paidAmount(BigDecimal paidAmount) {
      this.paidAmount = paidAmount;
      return this;
    }

    public Builder notes(String notes) {
      this.notes = notes;
      return this;
    }

    public Builder internalNotes(String internalNotes) {
      this.internalNotes = internalNotes;
      return this;
    }

    public Builder parentId(UUID parentId) {
      this.parentId = parentId;
      return this;
    }

    public Builder childIds(List<UUID> childIds) {
      this.childIds = childIds;
      return this;
    }

    public Builder lines(List<DocumentLine> lines) {
      this.lines = lines;
      return this;
    }

    public Builder createdBy(UUID createdBy) {
      this.createdBy = createdBy;
      return this;
    }

    public Builder validatedBy(UUID validatedBy) {
      this.validatedBy = validatedBy;
      return this;
    }

    public Builder createdAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    public Builder validatedAt(Instant validatedAt) {
      this.validatedAt = validatedAt;
      return this;
    }

    public Builder sentAt(Instant sentAt) {
      this.sentAt = sentAt;
      return this;
    }

    public Builder paidAt(Instant paidAt) {
      this.paidAt = paidAt;
      return this;
    }

    public Builder cancelledAt(Instant cancelledAt) {
      this.cancelledAt = cancelledAt;
      return this;
    }

    public Builder updatedAt(Instant updatedAt) {
      this.updatedAt = updatedAt;
      return this;
    }

    public Document build() {
      return new Document(
          id,
          number,
          type,
          status,
          customerId,
          customerName,
          customerEmail,
          date,
          dueDate,
          validityDate,
          currency,
          discountPercent,
          paidAmount,
          notes,
          internalNotes,
          parentId,
          childIds,
          lines,
          createdBy,
          validatedBy,
          createdAt,
          validatedAt,
          sentAt,
          paidAt,
          cancelledAt,
          updatedAt);
    }
  }
}
