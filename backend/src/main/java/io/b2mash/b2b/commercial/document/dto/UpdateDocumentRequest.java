package io.b2mash.b2b.commercial.document.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/** Header changes to a draft. Null fields keep their value; non-null {@code lines} replace all. */
public record UpdateDocumentRequest(
    LocalDate date,
    LocalDate dueDate,
    LocalDate validityDate,
    @Size(min = 3, max = 3) String currency,
    @PositiveOrZero @DecimalMax("100") BigDecimal discountPercent,
    String notes,
    String internalNotes,
    List<@Valid @NotNull LineRequest> lines) {}
