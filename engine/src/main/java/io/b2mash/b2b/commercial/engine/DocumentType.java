package io.b2mash.b2b.commercial.engine;

/** Kind of commercial document. */
public enum DocumentType {
  QUOTE("Quote"),
  ORDER("Order"),
  INVOICE("Invoice"),
  CREDIT_NOTE("Credit note"),
  PROFORMA("Proforma"),
  DELIVERY("Delivery note");

  private final String label;

  DocumentType(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }
}
