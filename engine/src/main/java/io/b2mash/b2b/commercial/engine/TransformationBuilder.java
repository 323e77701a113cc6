package io.b2mash.b2b.commercial.engine;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the payload of a new document derived from an existing one. The source document is never
 * modified; it gains a child only once the caller persists the returned draft.
 *
 * <p>Nothing limits how many children a document may have: transforming the same source twice
 * yields two independent drafts.
 */
public class TransformationBuilder {

  private final Clock clock;
  private final DocumentLifecycle lifecycle;

  public TransformationBuilder(Clock clock, DocumentLifecycle lifecycle) {
    this.clock = clock;
    this.lifecycle = lifecycle;
  }

  /**
   * Builds the draft produced by transforming {@code source} into {@code targetType}.
   *
   * @param source a persisted, VALIDATED document of a transformable type
   * @param targetType must equal the registry target for the source type
   * @return the new DRAFT payload, linked to the source through {@code parentId}
   * @throws DocumentValidationException if the source cannot be transformed
   * @throws IllegalTransitionException if the target does not match the registry
   */
  public DocumentDraft build(Document source, DocumentType targetType) {
    if (!lifecycle.canTransform(source)) {
      throw new DocumentValidationException(
          "Document cannot be transformed",
          TransformRegistry.isTransformable(source.type())
              ? "Cannot transform document in status " + source.status() + ". Must be VALIDATED."
              : "Documents of type " + source.type() + " cannot be transformed.");
    }
    TransformRule rule = TransformRegistry.find(source.type()).orElseThrow();
    if (targetType != rule.targetType()) {
      throw new IllegalTransitionException(
          "Invalid transformation target",
          "A "
              + source.type()
              + " can only be transformed into "
              + rule.targetType()
              + ", not "
              + targetType
              + ".");
    }
    return derive(source, targetType);
  }

  /**
   * Builds the direct quote-to-invoice conversion, which skips the intermediate order.
   *
   * @throws IllegalTransitionException if the source is not a quote
   * @throws DocumentValidationException if the quote is not VALIDATED
   */
  public DocumentDraft convertQuoteToInvoice(Document source) {
    if (source.type() != DocumentType.QUOTE) {
      throw new IllegalTransitionException(
          "Invalid transformation target",
          "Only quotes can be converted to an invoice, got " + source.type() + ".");
    }
    if (source.status() != DocumentStatus.VALIDATED) {
      throw new DocumentValidationException(
          "Document cannot be transformed",
          "Cannot convert quote in status " + source.status() + ". Must be VALIDATED.");
    }
    return derive(source, DocumentType.INVOICE);
  }

  /**
   * Builds a copy of {@code source} of the same type, in any status. The copy is not linked to
   * its source; its notes are prefixed to mark it as a copy.
   */
  public DocumentDraft duplicate(Document source) {
    String marker = "Copy of " + (source.number() != null ? source.number() : "draft");
    String notes = source.notes() != null ? marker + "\n" + source.notes() : marker;
    return new DocumentDraft(
        source.type(),
        source.customerId(),
        source.customerName(),
        source.customerEmail(),
        LocalDate.now(clock),
        null,
        null,
        source.currency(),
        source.discountPercent(),
        notes,
        source.internalNotes(),
        null,
        copyLines(source.lines()));
  }

  private DocumentDraft derive(Document source, DocumentType targetType) {
    if (source.id() == null) {
      throw new DocumentValidationException(
          "Document cannot be transformed", "The source document has not been saved.");
    }
    return new DocumentDraft(
        targetType,
        source.customerId(),
        source.customerName(),
        source.customerEmail(),
        LocalDate.now(clock),
        null,
        null,
        source.currency(),
        source.discountPercent(),
        source.notes(),
        null,
        source.id(),
        copyLines(source.lines()));
  }

  private static List<DocumentLine> copyLines(List<DocumentLine> lines) {
    var copies = new ArrayList<DocumentLine>(lines.size());
    for (int i = 0; i < lines.size(); i++) {
      copies.add(lines.get(i).detached(i + 1));
    }
    return copies;
  }
}
