package org.jenkinsci.bytepipe;

import edu.umd.cs.findbugs.annotations.CheckForNull;
import java.io.IOException;

/**
 * Indicates that a write was attempted on a pipe that has no open read endpoint, so the bytes could never be read.
 */
public class BrokenPipeException extends IOException {

    private static final long serialVersionUID = 1L;

    /**
     * Constructor.
     *
     * @param cause where the last reader was closed. {@code null} if it is unknown.
     */
    public BrokenPipeException(@CheckForNull Throwable cause) {
        super("Pipe has no open readers", cause);
    }
}
