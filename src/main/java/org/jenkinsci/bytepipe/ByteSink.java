package org.jenkinsci.bytepipe;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;

/**
 * The writing capability of a pipe.
 *
 * Writes fail with {@link BrokenPipeException} as soon as no read endpoint is open, without blocking. They block only
 * while the pipe holds as many bytes as its capacity allows.
 */
public interface ByteSink extends Closeable, Flushable {

    /**
     * Appends as many bytes as the capacity of the pipe allows, possibly fewer than {@code len}.
     *
     * @return the number of bytes appended.
     */
    int writeSome(@NonNull byte[] b, int off, int len) throws IOException;

    /**
     * Appends all the bytes, waiting for space as needed.
     *
     * Bytes written concurrently by another writer may end up between two parts of {@code b}.
     */
    void writeAll(@NonNull byte[] b, int off, int len) throws IOException;

    default void writeAll(@NonNull byte[] b) throws IOException {
        writeAll(b, 0, b.length);
    }

    /**
     * Opens another write endpoint on the same pipe.
     */
    @NonNull
    ByteSink duplicate() throws IOException;
}
