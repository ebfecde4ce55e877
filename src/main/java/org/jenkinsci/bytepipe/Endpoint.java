package org.jenkinsci.bytepipe;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.lang.ref.Cleaner;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Holds the liveness count contribution of one open endpoint.
 *
 * The count is given back exactly once, either by an explicit {@link #close()} or, when the endpoint became
 * unreachable without being closed, by the {@link Cleaner}. This object never refers to the endpoint it belongs to,
 * otherwise the endpoint could never become unreachable.
 */
final class Endpoint implements Runnable {

    private static final Logger LOGGER = Logger.getLogger(Endpoint.class.getName());

    private static final Cleaner CLEANER = Cleaner.create();

    private final SharedPipeBuffer buffer;

    private final SharedPipeBuffer.Side side;

    private final AtomicBoolean closed = new AtomicBoolean();

    /**
     * Set before {@link #run()} is invoked through an explicit close.
     */
    private volatile boolean closedExplicitly;

    /**
     * Where the endpoint was opened, reported when it is leaked.
     */
    private final Throwable allocatedAt = new Throwable("Pipe endpoint opened here");

    private final Cleaner.Cleanable cleanable;

    private Endpoint(SharedPipeBuffer buffer, SharedPipeBuffer.Side side, Object owner) {
        this.buffer = buffer;
        this.side = side;
        buffer.acquire(side);
        this.cleanable = CLEANER.register(owner, this);
    }

    /**
     * Registers a new open endpoint of the given side, owned by {@code owner}.
     */
    static Endpoint open(@NonNull SharedPipeBuffer buffer, @NonNull SharedPipeBuffer.Side side, @NonNull Object owner) {
        return new Endpoint(buffer, side, owner);
    }

    @NonNull
    SharedPipeBuffer buffer() {
        return buffer;
    }

    boolean isClosed() {
        return closed.get();
    }

    void checkOpen() throws PipeClosedException {
        if (closed.get()) {
            throw new PipeClosedException("Pipe " + side.name().toLowerCase() + " endpoint is already closed");
        }
    }

    void close() {
        closedExplicitly = true;
        cleanable.clean();
    }

    @Override
    public void run() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (!closedExplicitly) {
            LOGGER.log(Level.WARNING, "Pipe " + side.name().toLowerCase() + " endpoint was never closed", allocatedAt);
        }
        buffer.release(side);
    }
}
