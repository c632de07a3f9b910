package com.crossreview.core.model;

import java.io.Serializable;

/**
 * Proposed fix: {@code oldCode} must match the file exactly, {@code newCode} replaces it.
 */
public record CodeChange(
    String oldCode,
    String newCode
) implements Serializable {}
