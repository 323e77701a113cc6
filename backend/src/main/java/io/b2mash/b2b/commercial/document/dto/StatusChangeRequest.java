package io.b2mash.b2b.commercial.document.dto;

import io.b2mash.b2b.commercial.engine.DocumentStatus;
import jakarta.validation.constraints.NotNull;

public record StatusChangeRequest(@NotNull DocumentStatus status) {}
