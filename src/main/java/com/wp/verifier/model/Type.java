package com.wp.verifier.model;

/**
 * Logical sort of an expression. Program integers are mathematical integers.
 */
public enum Type {
    INT,
    BOOL
}
