package io.b2mash.b2b.commercial.engine;

/**
 * Snapshot of every lifecycle predicate for one document at one instant.
 *
 * @param daysUntilDue null when the document has no due date
 * @param transformRule the available transformation, null unless {@code canTransform}
 */
public record LifecycleView(
    boolean canEdit,
    boolean canValidate,
    boolean canTransform,
    boolean canCancel,
    boolean canDelete,
    boolean overdue,
    Long daysUntilDue,
    TransformRule transformRule) {}
