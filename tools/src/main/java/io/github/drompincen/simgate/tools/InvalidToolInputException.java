package io.github.drompincen.simgate.tools;

/**
 * A tool argument is missing, of the wrong type or out of range.
 */
public class InvalidToolInputException extends RuntimeException {

    public InvalidToolInputException(String message) {
        super(message);
    }
}
