package io.b2mash.b2b.commercial.document.dto;

import io.b2mash.b2b.commercial.engine.DocumentType;
import io.b2mash.b2b.commercial.engine.LifecycleView;

public record LifecycleResponse(
    boolean canEdit,
    boolean canValidate,
    boolean canTransform,
    boolean canCancel,
    boolean canDelete,
    boolean overdue,
    Long daysUntilDue,
    DocumentType transformTarget,
    String transformLabel) {

  public static LifecycleResponse from(LifecycleView view) {
    var rule = view.transformRule();
    return new LifecycleResponse(
        view.canEdit(),
        view.canValidate(),
        view.canTransform(),
        view.canCancel(),
        view.canDelete(),
        view.overdue(),
        view.daysUntilDue(),
        rule != null ? rule.targetType() : null,
        rule != null ? rule.label() : null);
  }
}
