package io.github.drompincen.billingrecon.runtime.reconcile;

/**
 * A billing operation cannot run because of a configuration or data gap an operator must fix,
 * such as an item with no linked PSA line or a company with no mapping for the vendor.
 * Never transient; retrying without fixing the data fails the same way.
 */
public class BillingPreconditionException extends RuntimeException {

    public BillingPreconditionException(String message) {
        super(message);
    }
}
