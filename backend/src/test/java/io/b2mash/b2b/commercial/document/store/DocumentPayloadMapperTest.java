package io.b2mash.b2b.commercial.document.store;

import static io.b2mash.b2b.commercial.document.DocumentFixtures.document;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.commercial.engine.DocumentStatus;
import io.b2mash.b2b.commercial.engine.DocumentType;
import io.b2mash.b2b.commercial.exception.DocumentStoreException;
import jakarta.validation.Validation;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class DocumentPayloadMapperTest {

  private final DocumentPayloadMapper mapper =
      new DocumentPayloadMapper(Validation.buildDefaultValidatorFactory().getValidator());

  @Test
  void toDocument_acceptsConsistentPayload() {
    var original = document(DocumentType.INVOICE, DocumentStatus.SENT).build();

    var mapped = mapper.toDocument(DocumentPayload.from(original));

    assertThat(mapped).isEqualTo(original);
    assertThat(mapped.totals().total()).isEqualByComparingTo("374.00");
  }

  @Test
  void toDocument_rejectsUnknownStatus() {
    var good = DocumentPayload.from(document(DocumentType.QUOTE, DocumentStatus.DRAFT).build());
    var payload = withStatus(good, "ARCHIVED");

    assertThatThrownBy(() -> mapper.toDocument(payload))
        .isInstanceOf(DocumentStoreException.class)
        .satisfies(
            ex ->
                assertThat(violations(ex)).containsExactly("status has unknown value 'ARCHIVED'"));
  }

  @Test
  void toDocument_rejectsMissingLines() {
    var good = DocumentPayload.from(document(DocumentType.QUOTE, DocumentStatus.DRAFT).build());
    var payload = withLines(good, null);

    assertThatThrownBy(() -> mapper.toDocument(payload))
        .isInstanceOf(DocumentStoreException.class)
        .satisfies(ex -> assertThat(violations(ex)).anyMatch(v -> v.startsWith("lines")));
  }

  @Test
  void toDocument_rejectsStoredTotalThatDisagreesWithLines() {
    var good = DocumentPayload.from(document(DocumentType.INVOICE, DocumentStatus.SENT).build());
    var payload = withTotal(good, new BigDecimal("400.00"));

    assertThatThrownBy(() -> mapper.toDocument(payload))
        .isInstanceOf(DocumentStoreException.class)
        .satisfies(
            ex ->
                assertThat(violations(ex))
                    .containsExactly("total is 400.00 but lines give 374.00"));
  }

  @Test
  void toDocument_toleratesDifferencesBelowDisplayScale() {
    var good = DocumentPayload.from(document(DocumentType.INVOICE, DocumentStatus.SENT).build());
    var payload = withTotal(good, new BigDecimal("374.001"));

    assertThat(mapper.toDocument(payload).totals().total()).isEqualByComparingTo("374");
  }

  @Test
  void toDocument_rejectsLineWithNegativePrice() {
    var good = DocumentPayload.from(document(DocumentType.QUOTE, DocumentStatus.DRAFT).build());
    var line = good.lines().get(0);
    var broken =
        new DocumentLinePayload(
            line.id(),
            line.lineNumber(),
            line.productId(),
            line.productCode(),
            line.description(),
            line.quantity(),
            line.unit(),
            new BigDecimal("-1"),
            line.discountPercent(),
            line.taxRate(),
            line.notes(),
            line.subtotal(),
            line.discountAmount(),
            line.taxAmount(),
            line.total());
    var payload = withLines(good, List.of(broken, good.lines().get(1)));

    assertThatThrownBy(() -> mapper.toDocument(payload))
        .isInstanceOf(DocumentStoreException.class);
  }

  @Test
  void toDocument_rejectsNullChildId() {
    var good = DocumentPayload.from(document(DocumentType.QUOTE, DocumentStatus.VALIDATED).build());
    var childIds = new ArrayList<UUID>();
    childIds.add(UUID.randomUUID());
    childIds.add(null);
    var payload = withChildIds(good, childIds);

    assertThatThrownBy(() -> mapper.toDocument(payload))
        .isInstanceOf(DocumentStoreException.class)
        .satisfies(ex -> assertThat(violations(ex)).anyMatch(v -> v.startsWith("childIds")));
  }

  @Test
  void toDocument_rejectsEmptyBody() {
    assertThatThrownBy(() -> mapper.toDocument(null)).isInstanceOf(DocumentStoreException.class);
  }

  @SuppressWarnings("unchecked")
  private static List<String> violations(Throwable ex) {
    var properties = ((DocumentStoreException) ex).getBody().getProperties();
    assertThat(properties).isNotNull();
    return (List<String>) properties.get("violations");
  }

  private static DocumentPayload withStatus(DocumentPayload p, String status) {
    return copy(p, status, p.childIds(), p.lines(), p.total());
  }

  private static DocumentPayload withLines(DocumentPayload p, List<DocumentLinePayload> lines) {
    return copy(p, p.status(), p.childIds(), lines, p.total());
  }

  private static DocumentPayload withTotal(DocumentPayload p, BigDecimal total) {
    return copy(p, p.status(), p.childIds(), p.lines(), total);
  }

  private static DocumentPayload withChildIds(DocumentPayload p, List<UUID> childIds) {
    return copy(p, p.status(), childIds, p.lines(), p.total());
  }

  private static DocumentPayload copy(
      DocumentPayload p,
      String status,
      List<UUID> childIds,
      List<DocumentLinePayload> lines,
      BigDecimal total) {
    return new DocumentPayload(
        p.id(),
        p.number(),
        p.type(),
        status,
        p.customerId(),
        p.customerName(),
        p.customerEmail(),
        p.date(),
        p.dueDate(),
        p.validityDate(),
        p.currency(),
        p.discountPercent(),
        p.paidAmount(),
        p.notes(),
        p.internalNotes(),
        p.parentId(),
        childIds,
        lines,
        p.createdBy(),
        p.validatedBy(),
        p.createdAt(),
        p.validatedAt(),
        p.sentAt(),
        p.paidAt(),
        p.cancelledAt(),
        p.updatedAt(),
        p.subtotal(),
        p.discountAmount(),
        p.taxAmount(),
        total);
  }
}
