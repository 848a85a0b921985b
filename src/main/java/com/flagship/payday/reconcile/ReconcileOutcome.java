package com.flagship.payday.reconcile;

public enum ReconcileOutcome {
    /** New events were appended. */
    APPLIED,
    /** Already reflected in the aggregate, or nothing to record yet. */
    NOOP,
    /** No aggregate owns the node reference. */
    UNMATCHED,
    /** The owning aggregate refused the notification. */
    REJECTED
}
