package io.b2mash.b2b.commercial.document;

import io.b2mash.b2b.commercial.engine.Document;
import java.util.List;

public record DocumentPage(List<Document> items, long total, int page, int pageSize) {

  public DocumentPage {
    items = List.copyOf(items);
  }
}
