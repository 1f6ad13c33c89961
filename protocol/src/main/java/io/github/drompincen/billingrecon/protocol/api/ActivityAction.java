package io.github.drompincen.billingrecon.protocol.api;

/**
 * State transitions recorded in the billing activity log.
 */
public enum ActivityAction { DETECTED, AUTO_APPROVED, APPROVED, DISMISSED, SYNCED_TO_PSA }
