package org.jenkinsci.bytepipe;

import java.io.IOException;

/**
 * Indicates that an operation was invoked on a pipe endpoint after it has been closed.
 */
public class PipeClosedException extends IOException {

    private static final long serialVersionUID = 1L;

    /**
     * @param message names the endpoint that was closed.
     */
    public PipeClosedException(String message) {
        super(message);
    }
}
