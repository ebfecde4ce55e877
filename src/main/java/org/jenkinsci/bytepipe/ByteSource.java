package org.jenkinsci.bytepipe;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;

/**
 * The reading capability of a pipe.
 *
 * <p>
 * Every method may block the calling thread until the pipe can satisfy it. Blocking is uninterruptible: a blocked
 * reader is released when data arrives or when the last writer is closed, never by {@link Thread#interrupt()}.
 *
 * <p>
 * When several threads read concurrently, which of them gets the next bytes is unspecified.
 */
public interface ByteSource extends Closeable {

    /**
     * Reads some bytes. Blocks until at least one byte is available or every writer is closed.
     *
     * @return the number of bytes read, or {@literal -1} when no writer is open and nothing is left. Never
     *     {@literal 0} unless {@code len} is {@literal 0}.
     */
    int read(@NonNull byte[] b, int off, int len) throws IOException;

    /**
     * Reads exactly {@code len} bytes, blocking until they are all available.
     *
     * @throws EOFException if fewer than {@code len} bytes are buffered and no writer is open. Nothing is consumed in
     *     that case.
     */
    void readExact(@NonNull byte[] b, int off, int len) throws IOException;

    /**
     * Reads exactly {@code n} bytes into a new array.
     *
     * @see #readExact(byte[], int, int)
     */
    @NonNull
    default byte[] readExact(int n) throws IOException {
        byte[] b = new byte[n];
        readExact(b, 0, n);
        return b;
    }

    /**
     * Reads bytes up to and including the first {@code delimiter} and writes them to {@code out}.
     *
     * If every writer is closed before a delimiter shows up, the remaining bytes are written without a delimiter.
     *
     * @return the number of bytes written to {@code out}, {@literal 0} at end of stream.
     */
    int readUntil(byte delimiter, @NonNull OutputStream out) throws IOException;

    /**
     * Reads a line of UTF-8 text.
     *
     * @see #readLine(Charset)
     */
    @NonNull
    default String readLine() throws IOException {
        return readLine(StandardCharsets.UTF_8);
    }

    /**
     * Reads a line of text, including its {@code '\n'} terminator if it has one.
     *
     * @return the line, or the empty string at end of stream.
     * @throws MalformedInputException if the bytes of the line are not valid in {@code charset}. The bytes are
     *     consumed nevertheless.
     * @throws IllegalArgumentException if {@code charset} does not encode {@code '\n'} as the single byte
     *     {@literal 0x0A}, as UTF-16 does not. Nothing is consumed in that case.
     */
    @NonNull
    String readLine(@NonNull Charset charset) throws IOException;

    /**
     * Blocks until every writer is closed and returns all the remaining bytes.
     *
     * @return the remaining bytes, an empty array once the pipe has been drained.
     */
    @NonNull
    byte[] readToEnd() throws IOException;

    /**
     * Reads the remaining bytes as UTF-8 text.
     *
     * @see #readToString(Charset)
     */
    @NonNull
    default String readToString() throws IOException {
        return readToString(StandardCharsets.UTF_8);
    }

    /**
     * Blocks until every writer is closed and decodes all the remaining bytes.
     *
     * @throws MalformedInputException if the bytes are not valid in {@code charset}. The bytes are left in the pipe.
     */
    @NonNull
    String readToString(@NonNull Charset charset) throws IOException;

    /**
     * Opens another read endpoint on the same pipe.
     */
    @NonNull
    ByteSource duplicate() throws IOException;
}
