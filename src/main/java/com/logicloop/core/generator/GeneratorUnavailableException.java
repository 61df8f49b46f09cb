package com.logicloop.core.generator;

/**
 * The external generator could not be reached or did not answer in time.
 *
 * The only failure that ends a refinement session early; the controller
 * records it as GENERATOR_UNREACHABLE and keeps the history gathered so far.
 */
public class GeneratorUnavailableException extends RuntimeException {

    public GeneratorUnavailableException(String message) {
        super(message);
    }

    public GeneratorUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
