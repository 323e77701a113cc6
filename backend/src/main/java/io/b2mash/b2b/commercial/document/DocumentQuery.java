package io.b2mash.b2b.commercial.document;

import io.b2mash.b2b.commercial.engine.DocumentStatus;
import io.b2mash.b2b.commercial.engine.DocumentType;
import java.util.UUID;

/** List filter. Null fields are not filtered on; {@code page} is 1-based. */
public record DocumentQuery(
    DocumentType type, DocumentStatus status, UUID customerId, int page, int pageSize) {

  public static final int DEFAULT_PAGE_SIZE = 20;
  public static final int MAX_PAGE_SIZE = 100;

  public DocumentQuery {
    if (page < 1) {
      page = 1;
    }
    if (pageSize < 1) {
      pageSize = DEFAULT_PAGE_SIZE;
    }
    pageSize = Math.min(pageSize, MAX_PAGE_SIZE);
  }
}
