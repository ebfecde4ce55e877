package org.jenkinsci.bytepipe;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jenkinsci.bytepipe.util.ByteQueue;

/**
 * An in-process pipe that carries bytes from writer threads to reader threads.
 *
 * <pre>
 * BytePipe pipe = BytePipe.create();
 * try (PipeOutputStream out = pipe.getOut()) {
 *     out.write("Hello".getBytes(StandardCharsets.UTF_8));
 * }
 * byte[] hello = pipe.getIn().readExact(5);
 * </pre>
 *
 * <p>
 * The pipe keeps a count of open read endpoints and of open write endpoints. Endpoints are opened by
 * {@link #create()} and by {@link PipeInputStream#duplicate()}/{@link PipeOutputStream#duplicate()}, and closed by
 * their {@code close()} method. When no writer is left, reads drain what is buffered and then report the end of the
 * stream. When no reader is left, writes fail with {@link BrokenPipeException}.
 *
 * <p>
 * The buffer grows as needed up to the capacity of the pipe. See {@link ByteSink#writeSome(byte[], int, int)} and
 * {@link ByteSink#writeAll(byte[], int, int)} for what happens when it is full.
 */
public final class BytePipe {

    private static final Logger LOGGER = Logger.getLogger(BytePipe.class.getName());

    /**
     * Largest capacity a pipe can have: the largest array the JVM can allocate, as reads may return the whole buffer
     * in one array.
     */
    public static final long MAX_CAPACITY = Integer.MAX_VALUE - 8;

    /**
     * Capacity of pipes created by {@link #create()}.
     */
    static final long DEFAULT_CAPACITY = Long.getLong(BytePipe.class.getName() + ".capacity", MAX_CAPACITY);

    /**
     * Size of the pages the buffer of a pipe is made of.
     */
    static final int PAGE_SIZE = Integer.getInteger(BytePipe.class.getName() + ".pageSize", 8192);

    private final PipeInputStream in;

    private final PipeOutputStream out;

    private BytePipe(SharedPipeBuffer buffer) {
        this.in = new PipeInputStream(buffer);
        this.out = new PipeOutputStream(buffer);
    }

    /**
     * Creates a pipe with the default capacity.
     *
     * The default is {@link #MAX_CAPACITY} unless the {@code org.jenkinsci.bytepipe.BytePipe.capacity} system
     * property says otherwise.
     */
    @NonNull
    public static BytePipe create() {
        return create(DEFAULT_CAPACITY);
    }

    /**
     * Creates a pipe that buffers at most {@code capacity} bytes.
     *
     * @throws IllegalArgumentException if {@code capacity} is not in {@code [1, MAX_CAPACITY]}.
     */
    @NonNull
    public static BytePipe create(long capacity) {
        SharedPipeBuffer buffer = new SharedPipeBuffer(new ByteQueue(PAGE_SIZE), capacity);
        LOGGER.log(Level.FINEST, "Created pipe with capacity {0}", capacity);
        return new BytePipe(buffer);
    }

    /**
     * The read endpoint opened along with the pipe.
     */
    @NonNull
    public PipeInputStream getIn() {
        return in;
    }

    /**
     * The write endpoint opened along with the pipe.
     */
    @NonNull
    public PipeOutputStream getOut() {
        return out;
    }
}
