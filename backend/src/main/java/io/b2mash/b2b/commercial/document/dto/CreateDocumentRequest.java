package io.b2mash.b2b.commercial.document.dto;

import io.b2mash.b2b.commercial.engine.DocumentType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record CreateDocumentRequest(
    @NotNull DocumentType type,
    @NotNull UUID customerId,
    LocalDate date,
    LocalDate dueDate,
    LocalDate validityDate,
    @Size(min = 3, max = 3) String currency,
    @PositiveOrZero @DecimalMax("100") BigDecimal discountPercent,
    String notes,
    String internalNotes,
    List<@Valid @NotNull LineRequest> lines) {}
