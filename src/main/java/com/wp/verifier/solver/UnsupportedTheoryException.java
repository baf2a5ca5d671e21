package com.wp.verifier.solver;

/**
 * Thrown when a formula contains something the solver theory cannot express.
 */
public class UnsupportedTheoryException extends RuntimeException {

    public UnsupportedTheoryException(String message) {
        super(message);
    }
}
