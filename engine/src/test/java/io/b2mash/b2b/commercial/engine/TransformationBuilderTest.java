package io.b2mash.b2b.commercial.engine;

import static io.b2mash.b2b.commercial.engine.TestDocuments.CLOCK;
import static io.b2mash.b2b.commercial.engine.TestDocuments.TODAY;
import static io.b2mash.b2b.commercial.engine.TestDocuments.document;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TransformationBuilderTest {

  private final DocumentLifecycle lifecycle = new DocumentLifecycle(CLOCK);
  private final TransformationBuilder builder = new TransformationBuilder(CLOCK, lifecycle);

  @Test
  void validatedQuote_becomesDraftOrderLinkedToQuote() {
    var quote =
        document(DocumentType.QUOTE, DocumentStatus.VALIDATED)
            .notes("Delivery within 2 weeks")
            .internalNotes("Margin is thin")
            .dueDate(TODAY.plusDays(30))
            .build();

    var order = builder.build(quote, DocumentType.ORDER);

    assertThat(order.type()).isEqualTo(DocumentType.ORDER);
    assertThat(order.status()).isEqualTo(DocumentStatus.DRAFT);
    assertThat(order.parentId()).isEqualTo(quote.id());
    assertThat(order.customerId()).isEqualTo(quote.customerId());
    assertThat(order.customerName()).isEqualTo("Acme Corp");
    assertThat(order.currency()).isEqualTo("EUR");
    assertThat(order.date()).isEqualTo(TODAY);
    assertThat(order.dueDate()).isNull();
    assertThat(order.notes()).isEqualTo("Delivery within 2 weeks");
    assertThat(order.internalNotes()).isNull();
  }

  @Test
  void transformedLines_keepPricingButLoseIdentity() {
    var quote = document(DocumentType.QUOTE, DocumentStatus.VALIDATED).build();

    var order = builder.build(quote, DocumentType.ORDER);

    assertThat(order.lines()).hasSize(2);
    for (int i = 0; i < 2; i++) {
      var source = quote.lines().get(i);
      var copy = order.lines().get(i);
      assertThat(copy.id()).isNull();
      assertThat(copy.lineNumber()).isEqualTo(i + 1);
      assertThat(copy.description()).isEqualTo(source.description());
      assertThat(copy.quantity()).isEqualTo(source.quantity());
      assertThat(copy.unit()).isEqualTo(source.unit());
      assertThat(copy.unitPrice()).isEqualTo(source.unitPrice());
      assertThat(copy.discountPercent()).isEqualTo(source.discountPercent());
      assertThat(copy.taxRate()).isEqualTo(source.taxRate());
      assertThat(copy.productCode()).isEqualTo(source.productCode());
    }
    assertThat(order.totals()).isEqualTo(quote.totals());
  }

  @Test
  void transform_doesNotMutateSource() {
    var quote = document(DocumentType.QUOTE, DocumentStatus.VALIDATED).build();
    var statusBefore = quote.status();
    var linesBefore = quote.lines();
    var totalBefore = quote.totals().total();

    builder.build(quote, DocumentType.ORDER);

    assertThat(quote.status()).isEqualTo(statusBefore);
    assertThat(quote.lines()).isEqualTo(linesBefore);
    assertThat(quote.totals().total()).isEqualByComparingTo(totalBefore);
    assertThat(quote.childIds()).isEmpty();
  }

  @Test
  void transform_canBeRepeated() {
    var order = document(DocumentType.ORDER, DocumentStatus.VALIDATED).build();

    var first = builder.build(order, DocumentType.INVOICE);
    var second = builder.build(order, DocumentType.INVOICE);

    assertThat(first).isEqualTo(second);
    assertThat(first.parentId()).isEqualTo(order.id());
  }

  @Test
  void transform_withTargetOtherThanRegistry_fails() {
    var order = document(DocumentType.ORDER, DocumentStatus.VALIDATED).build();

    assertThatThrownBy(() -> builder.build(order, DocumentType.CREDIT_NOTE))
        .isInstanceOf(IllegalTransitionException.class)
        .hasMessageContaining("INVOICE")
        .hasMessageContaining("CREDIT_NOTE");
  }

  @Test
  void transform_everyWrongTarget_fails() {
    var quote = document(DocumentType.QUOTE, DocumentStatus.VALIDATED).build();
    for (DocumentType target : DocumentType.values()) {
      if (target != DocumentType.ORDER) {
        assertThatThrownBy(() -> builder.build(quote, target))
            .as("target %s", target)
            .isInstanceOf(IllegalTransitionException.class);
      }
    }
  }

  @Test
  void transform_draftSource_fails() {
    var quote = document(DocumentType.QUOTE, DocumentStatus.DRAFT).build();

    assertThatThrownBy(() -> builder.build(quote, DocumentType.ORDER))
        .isInstanceOf(DocumentValidationException.class)
        .hasMessageContaining("Must be VALIDATED");
  }

  @Test
  void transform_invoice_fails() {
    var invoice = document(DocumentType.INVOICE, DocumentStatus.VALIDATED).build();

    assertThatThrownBy(() -> builder.build(invoice, DocumentType.CREDIT_NOTE))
        .isInstanceOf(DocumentValidationException.class)
        .hasMessageContaining("INVOICE");
  }

  @Test
  void transform_unsavedSource_fails() {
    var quote = document(DocumentType.QUOTE, DocumentStatus.VALIDATED).id(null).build();

    assertThatThrownBy(() -> builder.build(quote, DocumentType.ORDER))
        .isInstanceOf(DocumentValidationException.class);
  }

  @Test
  void convertQuoteToInvoice_skipsOrder() {
    var quote = document(DocumentType.QUOTE, DocumentStatus.VALIDATED).build();

    var invoice = builder.convertQuoteToInvoice(quote);

    assertThat(invoice.type()).isEqualTo(DocumentType.INVOICE);
    assertThat(invoice.parentId()).isEqualTo(quote.id());
    assertThat(invoice.lines()).hasSize(2);
  }

  @Test
  void convertQuoteToInvoice_rejectsOtherTypes() {
    var order = document(DocumentType.ORDER, DocumentStatus.VALIDATED).build();

    assertThatThrownBy(() -> builder.convertQuoteToInvoice(order))
        .isInstanceOf(IllegalTransitionException.class);
  }

  @Test
  void convertQuoteToInvoice_rejectsUnvalidatedQuote() {
    var quote = document(DocumentType.QUOTE, DocumentStatus.SENT).build();

    assertThatThrownBy(() -> builder.convertQuoteToInvoice(quote))
        .isInstanceOf(DocumentValidationException.class);
  }

  @Test
  void duplicate_copiesSameTypeWithoutParent() {
    var invoice =
        document(DocumentType.INVOICE, DocumentStatus.CANCELLED).notes("Net 30").build();

    var copy = builder.duplicate(invoice);

    assertThat(copy.type()).isEqualTo(DocumentType.INVOICE);
    assertThat(copy.status()).isEqualTo(DocumentStatus.DRAFT);
    assertThat(copy.parentId()).isNull();
    assertThat(copy.notes()).isEqualTo("Copy of DOC-2026-00001\nNet 30");
    assertThat(copy.lines()).allSatisfy(l -> assertThat(l.id()).isNull());
  }

  @Test
  void duplicate_withoutNotes_marksCopyOnly() {
    var quote = document(DocumentType.QUOTE, DocumentStatus.DRAFT).number(null).build();

    assertThat(builder.duplicate(quote).notes()).isEqualTo("Copy of draft");
  }
}
