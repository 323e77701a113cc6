package io.b2mash.b2b.commercial.customer;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;

/** Display data of a customer, as returned by the customer directory. */
public record CustomerSummary(@NotNull UUID id, String code, @NotBlank String name, String email) {}
