package io.github.drompincen.billingrecon.runtime.reconcile;

/**
 * A company, item or snapshot id that does not exist.
 */
public class BillingNotFoundException extends IllegalArgumentException {

    public BillingNotFoundException(String kind, String id) {
        super("Unknown " + kind + ": " + id);
    }
}
