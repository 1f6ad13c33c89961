package io.github.drompincen.billingrecon.protocol.api;

public enum SnapshotStatus { IN_PROGRESS, COMPLETED, FAILED }
