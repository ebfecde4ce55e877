package org.jenkinsci.bytepipe;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.io.OutputStream;
import java.lang.ref.Reference;
import net.jcip.annotations.ThreadSafe;

/**
 * The write end of a {@link BytePipe}.
 *
 * <p>
 * Every write succeeds only while at least one {@link PipeInputStream} of the pipe is open, and fails with
 * {@link BrokenPipeException} otherwise. A write blocks only while the pipe holds as many bytes as its capacity
 * allows.
 *
 * <p>
 * Closing this stream gives up its share in the pipe. Once every write endpoint is closed, readers see the end of
 * the stream after draining what is left.
 */
@ThreadSafe
public class PipeOutputStream extends OutputStream implements ByteSink {

    private final Endpoint endpoint;

    PipeOutputStream(@NonNull SharedPipeBuffer buffer) {
        this.endpoint = Endpoint.open(buffer, SharedPipeBuffer.Side.WRITE, this);
    }

    private SharedPipeBuffer buffer() throws IOException {
        endpoint.checkOpen();
        return endpoint.buffer();
    }

    @Override
    public void write(int b) throws IOException {
        writeAll(new byte[] {(byte) b}, 0, 1);
    }

    /**
     * Same as {@link #writeAll(byte[], int, int)}.
     */
    @Override
    public void write(@NonNull byte[] b, int off, int len) throws IOException {
        writeAll(b, off, len);
    }

    @Override
    public int writeSome(@NonNull byte[] b, int off, int len) throws IOException {
        try {
            return buffer().writeSome(b, off, len);
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    @Override
    public void writeAll(@NonNull byte[] b, int off, int len) throws IOException {
        try {
            buffer().writeAll(b, off, len);
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    /**
     * Bytes are visible to readers as soon as a write returns, so there is nothing to flush.
     */
    @Override
    public void flush() throws IOException {
        try {
            buffer().checkUsable();
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    @NonNull
    @Override
    public PipeOutputStream duplicate() throws IOException {
        try {
            return new PipeOutputStream(buffer());
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    /**
     * Returns true if this endpoint has been closed.
     */
    public boolean isClosed() {
        return endpoint.isClosed();
    }

    @Override
    public void close() {
        endpoint.close();
    }

    @Override
    public String toString() {
        return "PipeOutputStream[" + endpoint.buffer() + (isClosed() ? ",closed" : "") + "]";
    }
}
