package io.github.drompincen.billingrecon.protocol.api;

public enum ItemStatus { PENDING, APPROVED, DISMISSED, ADJUSTED }
