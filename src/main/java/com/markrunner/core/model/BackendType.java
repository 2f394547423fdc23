package com.markrunner.core.model;

/**
 * Execution strategies in descending capability order.
 */
public enum BackendType {
    COORDINATOR,
    INDIRECT_DISPATCH,
    SEQUENTIAL
}
