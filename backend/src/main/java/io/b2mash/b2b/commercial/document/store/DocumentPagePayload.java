package io.b2mash.b2b.commercial.document.store;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record DocumentPagePayload(
    @NotNull List<@Valid @NotNull DocumentPayload> items,
    long total,
    int page,
    int pageSize) {}
