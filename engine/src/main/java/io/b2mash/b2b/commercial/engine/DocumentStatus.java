package io.b2mash.b2b.commercial.engine;

/**
 * Document lifecycle status. Enforces valid state transitions for the commercial workflow.
 *
 * <p>Valid transitions:
 *
 * <ul>
 *   <li>DRAFT → PENDING, VALIDATED (validate action only), CANCELLED
 *   <li>PENDING → VALIDATED, SENT, CANCELLED
 *   <li>VALIDATED → SENT, ACCEPTED, REJECTED, DELIVERED, INVOICED, PAID, CANCELLED
 *   <li>SENT → ACCEPTED, REJECTED, DELIVERED, INVOICED, PAID, CANCELLED
 *   <li>ACCEPTED → DELIVERED, INVOICED, CANCELLED
 *   <li>REJECTED → CANCELLED
 *   <li>DELIVERED → INVOICED, CANCELLED
 *   <li>INVOICED → PAID, CANCELLED
 *   <li>PAID and CANCELLED are terminal states (no transitions out)
 * </ul>
 */
public enum DocumentStatus {
  /** Initial state, the only editable one. */
  DRAFT,

  /** Submitted for internal approval. */
  PENDING,

  /** Lines frozen; the document may be sent or transformed. */
  VALIDATED,

  /** Sent to the customer. */
  SENT,

  /** Customer accepted. */
  ACCEPTED,

  /** Customer declined. */
  REJECTED,

  /** Goods delivered. */
  DELIVERED,

  /** An invoice was issued for this document. */
  INVOICED,

  /** Payment received. Terminal. */
  PAID,

  /** Cancelled. Terminal. */
  CANCELLED;

  /**
   * Checks if a transition from the current status to the target status is valid.
   *
   * @param target the target status
   * @return true if the transition is allowed, false otherwise
   */
  public boolean canTransitionTo(DocumentStatus target) {
    return switch (this) {
      case DRAFT -> target == PENDING || target == VALIDATED || target == CANCELLED;
      case PENDING -> target == SENT || target == CANCELLED;
      case VALIDATED ->
          target == SENT
              || target == ACCEPTED
              || target == REJECTED
              || target == DELIVERED
              || target == INVOICED
              || target == PAID
              || target == CANCELLED;
      case SENT ->
          target == ACCEPTED
              || target == REJECTED
              || target == DELIVERED
              || target == INVOICED
              || target == PAID
              || target == CANCELLED;
      case ACCEPTED -> target == DELIVERED || target == INVOICED || target == CANCELLED;
      case REJECTED -> target == CANCELLED;
      case DELIVERED -> target == INVOICED || target == CANCELLED;
      case INVOICED -> target == PAID || target == CANCELLED;
      case PAID, CANCELLED -> false;
    };
  }

  public boolean isTerminal() {
    return this == PAID || this == CANCELLED;
  }

  /** Only drafts accept field or line mutations. */
  public boolean isEditable() {
    return this == DRAFT;
  }
}
