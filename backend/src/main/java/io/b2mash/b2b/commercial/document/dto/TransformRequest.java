package io.b2mash.b2b.commercial.document.dto;

import io.b2mash.b2b.commercial.engine.DocumentType;
import jakarta.validation.constraints.NotNull;

public record TransformRequest(@NotNull DocumentType targetType) {}
