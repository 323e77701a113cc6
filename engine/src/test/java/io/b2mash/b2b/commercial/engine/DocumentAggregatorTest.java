package io.b2mash.b2b.commercial.engine;

import static io.b2mash.b2b.commercial.engine.TestDocuments.line;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

class DocumentAggregatorTest {

  @Test
  void aggregate_emptyLines_isZero() {
    var totals = DocumentAggregator.aggregate(List.of());

    assertThat(totals.subtotal()).isEqualByComparingTo("0");
    assertThat(totals.taxAmount()).isEqualByComparingTo("0");
    assertThat(totals.total()).isEqualByComparingTo("0");
  }

  @Test
  void aggregate_totalEqualsSumOfLineTotals() {
    var lines =
        List.of(
            line(1, "A", "3", "100", "10", "20"),
            line(2, "B", "1.5", "19.99", "0", "5.5"),
            line(3, "C", "0.25", "1000", "12.5", "0"));

    var totals = DocumentAggregator.aggregate(lines);

    BigDecimal lineTotalSum =
        lines.stream()
            .map(l -> l.amounts().total())
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    assertThat(totals.total()).isEqualByComparingTo(lineTotalSum);
    assertThat(totals.discountAmount()).isEqualByComparingTo("0");
  }

  @Test
  void aggregate_noRoundingDriftAcrossManyLines() {
    // 3 lines of 0.333... each would drift by a cent if rounded per line
    var lines =
        List.of(
            line(1, "A", "1", "0.335", "0", "0"),
            line(2, "B", "1", "0.335", "0", "0"),
            line(3, "C", "1", "0.335", "0", "0"));

    var totals = DocumentAggregator.aggregate(lines);

    assertThat(totals.subtotal()).isEqualByComparingTo("1.005");
    assertThat(totals.forDisplay().subtotal()).isEqualByComparingTo("1.01");
  }

  @Test
  void aggregate_documentDiscountReducesSubtotalButNotTax() {
    var lines = List.of(line(1, "A", "2", "100", "0", "20"));

    var totals = DocumentAggregator.aggregate(lines, new BigDecimal("10"));

    assertThat(totals.subtotal()).isEqualByComparingTo("200");
    assertThat(totals.discountAmount()).isEqualByComparingTo("20");
    assertThat(totals.taxAmount()).isEqualByComparingTo("40");
    assertThat(totals.total()).isEqualByComparingTo("220");
    assertThat(totals.total())
        .isEqualByComparingTo(
            totals.subtotal().subtract(totals.discountAmount()).add(totals.taxAmount()));
  }

  @Test
  void aggregate_rejectsDocumentDiscountAbove100() {
    assertThatThrownBy(() -> DocumentAggregator.aggregate(List.of(), new BigDecimal("101")))
        .isInstanceOf(InputRangeException.class);
  }

  @Test
  void documentTotals_matchAggregationOfItsLines() {
    var doc = TestDocuments.document(DocumentType.INVOICE, DocumentStatus.DRAFT).build();

    assertThat(doc.totals()).isEqualTo(DocumentAggregator.aggregate(doc.lines()));
    // 324 + 50
    assertThat(doc.totals().total()).isEqualByComparingTo("374");
    assertThat(doc.remainingAmount()).isEqualByComparingTo("374");
  }
}
