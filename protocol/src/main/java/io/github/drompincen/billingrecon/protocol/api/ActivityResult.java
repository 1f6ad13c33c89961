package io.github.drompincen.billingrecon.protocol.api;

public enum ActivityResult { PENDING, NO_ACTION, SUCCESS }
