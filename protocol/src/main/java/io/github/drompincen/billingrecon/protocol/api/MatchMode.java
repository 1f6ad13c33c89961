package io.github.drompincen.billingrecon.protocol.api;

/**
 * How a mapped PSA product name is compared against billing line product names.
 * Both modes ignore case.
 */
public enum MatchMode { SUBSTRING, EXACT }
