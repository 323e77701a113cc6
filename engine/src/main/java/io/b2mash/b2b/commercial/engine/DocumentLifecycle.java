package io.b2mash.b2b.commercial.engine;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * Lifecycle predicates and status transitions. Predicates are pure functions of the document and
 * the injected clock. Transitions never mutate their argument; they return the document value the
 * caller should submit to the store.
 */
public class DocumentLifecycle {

  private static final long MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

  private final Clock clock;

  public DocumentLifecycle(Clock clock) {
    this.clock = clock;
  }

  // --- Predicates ---

  public boolean canEdit(Document doc) {
    return doc.status().isEditable();
  }

  public boolean canValidate(Document doc) {
    return doc.status() == DocumentStatus.DRAFT && !doc.lines().isEmpty();
  }

  public boolean canTransform(Document doc) {
    return doc.status() == DocumentStatus.VALIDATED
        && TransformRegistry.isTransformable(doc.type());
  }

  public boolean canCancel(Document doc) {
    return !doc.status().isTerminal();
  }

  /** Deletion itself is performed by the store. */
  public boolean canDelete(Document doc) {
    return doc.status() == DocumentStatus.DRAFT;
  }

  /**
   * Whole days from now until the due date, rounded up; negative once the date has passed. The due
   * date is taken to start at midnight in the clock's zone.
   *
   * @return empty when the document has no due date
   */
  public OptionalLong daysUntilDue(Document doc) {
    if (doc.dueDate() == null) {
      return OptionalLong.empty();
    }
    Instant due = doc.dueDate().atStartOfDay(clock.getZone()).toInstant();
    long millis = Duration.between(clock.instant(), due).toMillis();
    return OptionalLong.of(-Math.floorDiv(-millis, MILLIS_PER_DAY));
  }

  public boolean isOverdue(Document doc) {
    if (doc.status().isTerminal()) {
      return false;
    }
    OptionalLong days = daysUntilDue(doc);
    return days.isPresent() && days.getAsLong() < 0;
  }

  /**
   * Guards field and line mutations.
   *
   * @throws DocumentValidationException if the document is not a draft
   */
  public void requireEditable(Document doc) {
    if (!canEdit(doc)) {
      throw new DocumentValidationException(
          "Document not editable",
          "Cannot edit document in status " + doc.status() + ". Must be DRAFT.");
    }
  }

  // --- Transitions ---

  /**
   * Validates a draft, freezing its lines.
   *
   * @param doc the draft to validate
   * @param validatedBy opaque id of the acting user, may be null
   * @return the VALIDATED document
   * @throws DocumentValidationException if the document is not a draft, has no lines, or has a
   *     line without description
   */
  public Document validate(Document doc, UUID validatedBy) {
    if (doc.status() != DocumentStatus.DRAFT) {
      throw new DocumentValidationException(
          "Invalid document status",
          "Cannot validate document in status " + doc.status() + ". Must be DRAFT.");
    }

    requireCompleteLines(doc);

    Instant now = stamp(doc);
    return doc.toBuilder()
        .status(DocumentStatus.VALIDATED)
        .validatedBy(validatedBy)
        .validatedAt(now)
        .updatedAt(now)
        .build();
  }

  /**
   * Applies a status change reported by the surrounding workflow (sent, accepted, delivered...).
   *
   * @throws IllegalTransitionException if the change is not permitted from the current status, or
   *     if it targets VALIDATED from DRAFT (use {@link #validate})
   * @throws DocumentValidationException if a draft is submitted as PENDING without complete lines
   */
  public Document transition(Document doc, DocumentStatus target) {
    if (doc.status() == DocumentStatus.DRAFT && target == DocumentStatus.VALIDATED) {
      throw new IllegalTransitionException(
          "Invalid status change", "A draft document is validated through the validate action.");
    }
    if (!doc.status().canTransitionTo(target)) {
      throw new IllegalTransitionException(
          "Invalid status change",
          "Cannot change document status from " + doc.status() + " to " + target + ".");
    }
    // lines are frozen from here on
    if (doc.status() == DocumentStatus.DRAFT && target == DocumentStatus.PENDING) {
      requireCompleteLines(doc);
    }

    Instant now = stamp(doc);
    var builder = doc.toBuilder().status(target).updatedAt(now);
    switch (target) {
      case VALIDATED -> {
        if (doc.validatedAt() == null) {
          builder.validatedAt(now);
        }
      }
      case SENT -> {
        if (doc.sentAt() == null) {
          builder.sentAt(now);
        }
      }
      case PAID -> {
        if (doc.paidAt() == null) {
          builder.paidAt(now);
        }
      }
      case CANCELLED -> {
        if (doc.cancelledAt() == null) {
          builder.cancelledAt(now);
        }
      }
      default -> {
        // no timestamp for this status
      }
    }
    return builder.build();
  }

  /**
   * Cancels a document.
   *
   * @throws IllegalTransitionException if the document is already PAID or CANCELLED
   */
  public Document cancel(Document doc) {
    if (!canCancel(doc)) {
      throw new IllegalTransitionException(
          "Invalid document status",
          "Cannot cancel document in status " + doc.status() + ".");
    }
    return transition(doc, DocumentStatus.CANCELLED);
  }

  /**
   * Records a payment against an invoice. The invoice moves to PAID once nothing remains owed.
   *
   * @param doc the invoice
   * @param amount amount received, greater than zero
   * @return the invoice with the payment applied
   * @throws DocumentValidationException if the document is not an invoice
   * @throws IllegalTransitionException if the invoice cannot become PAID from its status
   * @throws InputRangeException if the amount is missing or not positive
   */
  public Document recordPayment(Document doc, BigDecimal amount) {
    if (doc.type() != DocumentType.INVOICE) {
      throw new DocumentValidationException(
          "Payment not allowed", "Payments can only be recorded against invoices.");
    }
    if (amount == null || amount.signum() <= 0) {
      throw new InputRangeException("amount", "Payment amount must be greater than 0");
    }
    if (!doc.status().canTransitionTo(DocumentStatus.PAID)) {
      throw new IllegalTransitionException(
          "Invalid document status",
          "Cannot record payment for document in status " + doc.status() + ".");
    }

    var paid = doc.toBuilder().paidAmount(doc.paidAmount().add(amount)).build();
    if (paid.remainingAmount().signum() <= 0) {
      return transition(paid, DocumentStatus.PAID);
    }
    return paid.toBuilder().updatedAt(stamp(doc)).build();
  }

  // --- Line editing ---

  /** Appends a line to a draft; it is numbered after the existing lines. */
  public Document addLine(Document doc, DocumentLine line) {
    requireEditable(doc);
    var lines = new ArrayList<>(doc.lines());
    lines.add(line);
    return withRenumberedLines(doc, lines);
  }

  /**
   * Replaces the line at {@code lineNumber} on a draft, keeping its position and identity.
   *
   * @throws DocumentValidationException if the document is not a draft or has no such line
   */
  public Document replaceLine(Document doc, int lineNumber, DocumentLine line) {
    requireEditable(doc);
    int index = indexOf(doc, lineNumber);
    var lines = new ArrayList<>(doc.lines());
    DocumentLine existing = lines.get(index);
    lines.set(
        index,
        new DocumentLine(
            existing.id(),
            existing.lineNumber(),
            line.productId(),
            line.productCode(),
            line.description(),
            line.quantity(),
            line.unit(),
            line.unitPrice(),
            line.discountPercent(),
            line.taxRate(),
            line.notes()));
    return withRenumberedLines(doc, lines);
  }

  /**
   * Removes the line at {@code lineNumber} from a draft; later lines move up.
   *
   * @throws DocumentValidationException if the document is not a draft or has no such line
   */
  public Document removeLine(Document doc, int lineNumber) {
    requireEditable(doc);
    int index = indexOf(doc, lineNumber);
    var lines = new ArrayList<>(doc.lines());
    lines.remove(index);
    return withRenumberedLines(doc, lines);
  }

  private static int indexOf(Document doc, int lineNumber) {
    for (int i = 0; i < doc.lines().size(); i++) {
      if (doc.lines().get(i).lineNumber() == lineNumber) {
        return i;
      }
    }
    throw new DocumentValidationException(
        "Line not found", "Document has no line number " + lineNumber + ".");
  }

  private void requireCompleteLines(Document doc) {
    var violations = new ArrayList<String>();
    if (doc.lines().isEmpty()) {
      violations.add("Document has no lines");
    }
    violations.addAll(lineViolations(doc.lines()));
    if (!violations.isEmpty()) {
      throw new DocumentValidationException(
          "Document validation failed", String.join("; ", violations), violations);
    }
  }

  private Document withRenumberedLines(Document doc, List<DocumentLine> lines) {
    var renumbered = new ArrayList<DocumentLine>(lines.size());
    for (int i = 0; i < lines.size(); i++) {
      DocumentLine line = lines.get(i);
      renumbered.add(
          line.lineNumber() == i + 1
              ? line
              : new DocumentLine(
                  line.id(),
                  i + 1,
                  line.productId(),
                  line.productCode(),
                  line.description(),
                  line.quantity(),
                  line.unit(),
                  line.unitPrice(),
                  line.discountPercent(),
                  line.taxRate(),
                  line.notes()));
    }
    return doc.toBuilder().lines(renumbered).updatedAt(stamp(doc)).build();
  }

  /** Lifecycle flags for one observation, for callers that render several at once. */
  public LifecycleView view(Document doc) {
    OptionalLong days = daysUntilDue(doc);
    return new LifecycleView(
        canEdit(doc),
        canValidate(doc),
        canTransform(doc),
        canCancel(doc),
        canDelete(doc),
        isOverdue(doc),
        days.isPresent() ? days.getAsLong() : null,
        canTransform(doc) ? TransformRegistry.find(doc.type()).orElse(null) : null);
  }

  /** Current instant, never earlier than the document's creation. */
  private Instant stamp(Document doc) {
    Instant now = clock.instant();
    if (doc.createdAt() != null && now.isBefore(doc.createdAt())) {
      return doc.createdAt();
    }
    return now;
  }

  private static List<String> lineViolations(List<DocumentLine> lines) {
    return lines.stream()
        .filter(line -> !line.isComplete())
        .map(line -> "Line " + line.lineNumber() + " has no description")
        .toList();
  }
}
