package org.jenkinsci.bytepipe;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;

/**
 * Indicates that a thread failed in the middle of updating the shared buffer of a pipe.
 *
 * The buffer may hold a partial write or a partial read at that point, so every later operation on any endpoint of
 * the same pipe fails with this exception. There is no recovery: the pipe has to be discarded.
 */
public class PipeCorruptedException extends IOException {

    private static final long serialVersionUID = 1L;

    /**
     * Constructor.
     *
     * @param cause the failure that interrupted the update of the buffer.
     */
    public PipeCorruptedException(@NonNull Throwable cause) {
        super("Pipe buffer was left in an inconsistent state by a failed operation", cause);
    }
}
