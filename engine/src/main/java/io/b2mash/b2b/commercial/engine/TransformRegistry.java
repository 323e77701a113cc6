package io.b2mash.b2b.commercial.engine;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Static table of which document type may be transformed into which other type. Every type is a
 * valid key; a type without a rule is simply not transformable.
 */
public final class TransformRegistry {

  private static final Map<DocumentType, TransformRule> RULES;

  static {
    var rules = new EnumMap<DocumentType, TransformRule>(DocumentType.class);
    rules.put(DocumentType.QUOTE, new TransformRule(DocumentType.ORDER, "Convert to order"));
    rules.put(DocumentType.ORDER, new TransformRule(DocumentType.INVOICE, "Create invoice"));
    rules.put(DocumentType.PROFORMA, new TransformRule(DocumentType.ORDER, "Convert to order"));
    rules.put(DocumentType.DELIVERY, new TransformRule(DocumentType.INVOICE, "Invoice delivery"));
    RULES = Collections.unmodifiableMap(rules);
  }

  private TransformRegistry() {}

  public static Optional<TransformRule> find(DocumentType sourceType) {
    return Optional.ofNullable(RULES.get(sourceType));
  }

  public static boolean isTransformable(DocumentType sourceType) {
    return RULES.containsKey(sourceType);
  }

  public static Map<DocumentType, TransformRule> rules() {
    return RULES;
  }
}
