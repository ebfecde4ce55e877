package org.jenkinsci.bytepipe;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.lang.ref.Reference;
import java.nio.charset.Charset;
import java.util.Arrays;
import net.jcip.annotations.ThreadSafe;

/**
 * The read end of a {@link BytePipe}.
 *
 * <p>
 * Unlike {@link java.io.PipedInputStream} this is not tied to one writer thread: any number of threads may write to
 * the pipe through any number of {@link PipeOutputStream}s, and this stream reports end of stream only once all of them
 * are closed. Several threads may also read from this stream or from its {@link #duplicate() duplicates}.
 *
 * <p>
 * Closing this stream gives up its share in the pipe. Once every read endpoint is closed, writes fail with
 * {@link BrokenPipeException}.
 */
@ThreadSafe
public class PipeInputStream extends InputStream implements ByteSource {

    private static final byte[] NEWLINE = {'\n'};

    /**
     * Every method that reaches the buffer keeps {@code this} reachable until it returns, otherwise a thread blocked
     * in the buffer could see its own endpoint reclaimed by the {@link java.lang.ref.Cleaner}.
     */
    private final Endpoint endpoint;

    PipeInputStream(@NonNull SharedPipeBuffer buffer) {
        this.endpoint = Endpoint.open(buffer, SharedPipeBuffer.Side.READ, this);
    }

    private SharedPipeBuffer buffer() throws IOException {
        endpoint.checkOpen();
        return endpoint.buffer();
    }

    @Override
    public int read() throws IOException {
        byte[] b = new byte[1];
        int n = read(b, 0, 1);
        if (n < 0) {
            return -1;
        }
        return b[0] & 0xFF;
    }

    @Override
    public int read(@NonNull byte[] b, int off, int len) throws IOException {
        try {
            return buffer().read(b, off, len);
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    @Override
    public void readExact(@NonNull byte[] b, int off, int len) throws IOException {
        try {
            buffer().readExact(b, off, len);
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    @Override
    public int readUntil(byte delimiter, @NonNull OutputStream out) throws IOException {
        byte[] bytes;
        try {
            bytes = buffer().readUntil(delimiter);
        } finally {
            Reference.reachabilityFence(this);
        }
        out.write(bytes);
        return bytes.length;
    }

    @NonNull
    @Override
    public String readLine(@NonNull Charset charset) throws IOException {
        if (!Arrays.equals("\n".getBytes(charset), NEWLINE)) {
            throw new IllegalArgumentException("Lines cannot be split on a single byte in " + charset);
        }
        byte[] line;
        try {
            line = buffer().readUntil(NEWLINE[0]);
        } finally {
            Reference.reachabilityFence(this);
        }
        return SharedPipeBuffer.decode(line, charset);
    }

    @NonNull
    @Override
    public byte[] readToEnd() throws IOException {
        try {
            return buffer().readToEnd();
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    /**
     * Same as {@link #readToEnd()}.
     */
    @NonNull
    @Override
    public byte[] readAllBytes() throws IOException {
        return readToEnd();
    }

    @NonNull
    @Override
    public String readToString(@NonNull Charset charset) throws IOException {
        try {
            return buffer().readToString(charset);
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    /**
     * Blocks like {@link #read(byte[], int, int)} and then discards up to {@code n} bytes.
     */
    @Override
    public long skip(long n) throws IOException {
        try {
            return buffer().skip(n);
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    /**
     * Number of bytes that can be read without blocking.
     */
    @Override
    public int available() throws IOException {
        try {
            return (int) Math.min(Integer.MAX_VALUE, buffer().available());
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    @NonNull
    @Override
    public PipeInputStream duplicate() throws IOException {
        try {
            return new PipeInputStream(buffer());
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
        return "PipeInputStream[" + endpoint.buffer() + (isClosed() ? ",closed" : "") + "]";
    }
}
