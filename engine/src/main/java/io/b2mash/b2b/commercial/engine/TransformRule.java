package io.b2mash.b2b.commercial.engine;

/**
 * A permitted transformation.
 *
 * @param targetType the single type a source document may be transformed into
 * @param label action label shown to users
 */
public record TransformRule(DocumentType targetType, String label) {}
