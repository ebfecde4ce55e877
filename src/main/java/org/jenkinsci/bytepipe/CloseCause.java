package org.jenkinsci.bytepipe;

/**
 * Records where the last endpoint of one side of a pipe was closed.
 *
 * Attached as the cause of {@link BrokenPipeException} and of the {@link java.io.EOFException} thrown by
 * {@link ByteSource#readExact(byte[], int, int)} so that the stack trace of the close is available when diagnosing
 * the failure.
 */
public class CloseCause extends Exception {

    private static final long serialVersionUID = 1L;

    /*package*/ CloseCause(String message) {
        super(message);
    }
}
