package io.b2mash.b2b.commercial.document.dto;

import java.util.List;

public record DocumentPageResponse(
    List<DocumentResponse> items, long total, int page, int pageSize) {}
