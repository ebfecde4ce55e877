package org.jenkinsci.bytepipe;

import edu.umd.cs.findbugs.annotations.CheckForNull;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.jcip.annotations.GuardedBy;
import net.jcip.annotations.ThreadSafe;
import org.jenkinsci.bytepipe.util.ByteQueue;

/**
 * The state shared by all the endpoints of one {@link BytePipe}.
 *
 * <p>
 * Bytes are kept in a single {@link ByteQueue} guarded by {@link #lock}. A thread that cannot make progress waits on
 * {@link #changed} and re-evaluates its condition every time it wakes up, whatever woke it. Every append, every drain
 * and every transition of a liveness counter to zero signals {@link #changed}.
 *
 * <p>
 * The reader and writer counts are atomics that are read without holding {@link #lock}. A waiter evaluates them while
 * holding the lock and the endpoint that drops a count to zero acquires the lock to signal, so a waiter cannot miss
 * the transition between its check and its wait.
 *
 * <p>
 * Waits are uninterruptible. The only way to release a blocked reader or writer is to make its condition true,
 * typically by closing the endpoints of the other side.
 */
@ThreadSafe
final class SharedPipeBuffer {

    private static final Logger LOGGER = Logger.getLogger(SharedPipeBuffer.class.getName());

    private static final byte[] EMPTY_BYTE_ARRAY = new byte[0];

    /**
     * The two kinds of endpoint.
     */
    enum Side {
        READ,
        WRITE
    }

    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Signalled whenever the queue or a liveness count changes.
     */
    private final Condition changed = lock.newCondition();

    @GuardedBy("lock")
    private final ByteQueue queue;

    /**
     * Largest number of bytes {@link #queue} may hold.
     */
    private final long capacity;

    /**
     * Largest result {@link #readToEnd()} and {@link #readToString(Charset)} may accumulate.
     */
    private final long maxResult;

    private final AtomicInteger readers = new AtomicInteger();

    private final AtomicInteger writers = new AtomicInteger();

    /**
     * Set once a thread fails while mutating {@link #queue}. Never cleared.
     */
    @CheckForNull
    private volatile Throwable corruption;

    @CheckForNull
    private volatile CloseCause readersClosed;

    @CheckForNull
    private volatile CloseCause writersClosed;

    SharedPipeBuffer(@NonNull ByteQueue queue, long capacity) {
        this(queue, capacity, BytePipe.MAX_CAPACITY);
    }

    SharedPipeBuffer(@NonNull ByteQueue queue, long capacity, long maxResult) {
        if (capacity <= 0 || capacity > BytePipe.MAX_CAPACITY) {
            throw new IllegalArgumentException("capacity must be in [1," + BytePipe.MAX_CAPACITY + "]: " + capacity);
        }
        this.queue = queue;
        this.capacity = capacity;
        this.maxResult = maxResult;
    }

    long getCapacity() {
        return capacity;
    }

    int getReaderCount() {
        return readers.get();
    }

    int getWriterCount() {
        return writers.get();
    }

    private boolean hasReaders() {
        return readers.get() > 0;
    }

    private boolean hasWriters() {
        return writers.get() > 0;
    }

    /**
     * Registers a new open endpoint.
     */
    void acquire(@NonNull Side side) {
        (side == Side.READ ? readers : writers).incrementAndGet();
    }

    /**
     * Unregisters an open endpoint. Must be called exactly once per {@link #acquire(Side)}.
     */
    void release(@NonNull Side side) {
        AtomicInteger count = side == Side.READ ? readers : writers;
        int left = count.decrementAndGet();
        if (left < 0) {
            throw new IllegalStateException(side + " endpoint released more often than acquired");
        }
        if (left > 0) {
            return;
        }
        CloseCause cause = new CloseCause("Last " + side.name().toLowerCase() + " endpoint was closed");
        if (side == Side.READ) {
            readersClosed = cause;
        } else {
            writersClosed = cause;
        }
        LOGGER.log(Level.FINE, "Last {0} endpoint closed", side);
        lock.lock();
        try {
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @GuardedBy("lock")
    private void checkIntact() throws PipeCorruptedException {
        Throwable t = corruption;
        if (t != null) {
            throw new PipeCorruptedException(t);
        }
    }

    @GuardedBy("lock")
    private void await() throws PipeCorruptedException {
        changed.awaitUninterruptibly();
        checkIntact();
    }

    /**
     * Runs an update of {@link #queue}. If it fails halfway the buffer is marked as corrupted and every waiter is
     * woken up so that it fails too.
     */
    @GuardedBy("lock")
    private long mutate(LongSupplier update) {
        try {
            long r = update.getAsLong();
            changed.signalAll();
            return r;
        } catch (RuntimeException | Error e) {
            corruption = e;
            LOGGER.log(Level.SEVERE, "Pipe buffer corrupted by a failed update", e);
            changed.signalAll();
            throw e;
        }
    }

    @GuardedBy("lock")
    private byte[] drain(long len) {
        byte[] result = len == 0 ? EMPTY_BYTE_ARRAY : new byte[(int) len];
        mutate(() -> queue.get(result, 0, result.length));
        return result;
    }

    private EOFException endOfStream(int wanted, long available) {
        LOGGER.log(
                Level.FINE,
                "Exact read of {0} bytes cannot complete, only {1} will ever be available",
                new Object[] {wanted, available});
        EOFException e = new EOFException(
                "Pipe has no open writers: wanted " + wanted + " bytes but only " + available + " are available");
        e.initCause(writersClosed);
        return e;
    }

    private BrokenPipeException brokenPipe() {
        LOGGER.log(Level.FINE, "Write attempted on a pipe with no open readers");
        return new BrokenPipeException(readersClosed);
    }

    /**
     * Blocks while the queue is empty and a writer is still open.
     *
     * @return number of bytes read, or {@literal -1} at end of stream.
     */
    int read(byte[] b, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, b.length);
        if (len == 0) {
            return 0;
        }
        lock.lock();
        try {
            checkIntact();
            while (queue.isEmpty()) {
                if (!hasWriters()) {
                    return -1;
                }
                await();
            }
            return (int) mutate(() -> queue.get(b, off, len));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Same wait as {@link #read(byte[], int, int)} but discards the bytes.
     */
    long skip(long n) throws IOException {
        if (n <= 0) {
            return 0;
        }
        lock.lock();
        try {
            checkIntact();
            while (queue.isEmpty()) {
                if (!hasWriters()) {
                    return 0;
                }
                await();
            }
            return mutate(() -> queue.skip(n));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until {@code len} bytes are buffered, then removes exactly that many. Fails without removing anything
     * once fewer than {@code len} bytes are buffered and no writer is open.
     */
    void readExact(byte[] b, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, b.length);
        if (len > capacity) {
            throw new IllegalArgumentException(
                    "Cannot read " + len + " bytes at once from a pipe holding at most " + capacity);
        }
        lock.lock();
        try {
            checkIntact();
            while (queue.remaining() < len) {
                if (!hasWriters()) {
                    throw endOfStream(len, queue.remaining());
                }
                await();
            }
            mutate(() -> queue.get(b, off, len));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes bytes up to and including the first {@code delimiter}.
     *
     * If no delimiter is buffered this blocks until one arrives. When every writer is gone it returns whatever is
     * left, possibly nothing. If the queue fills up to its capacity without a delimiter the whole queue is returned,
     * as writers could not append the delimiter before somebody drains.
     */
    @NonNull
    byte[] readUntil(byte delimiter) throws IOException {
        lock.lock();
        try {
            checkIntact();
            // absolute position up to which the stream has been searched, stable across drains by other readers
            long searched = queue.consumed();
            while (true) {
                long from = Math.max(0, searched - queue.consumed());
                long idx = queue.indexOf(delimiter, from);
                if (idx >= 0) {
                    return drain(idx + 1);
                }
                long size = queue.remaining();
                if (!hasWriters() || size >= capacity) {
                    return drain(size);
                }
                searched = queue.consumed() + size;
                await();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until every writer is closed and returns everything that was buffered.
     *
     * Whenever the queue reaches its capacity while writers are open it is emptied into the result so that the
     * writers can go on. If the result would grow past the largest array this fails before taking the chunk that does
     * not fit, which stays in the queue; the chunks taken earlier are lost.
     */
    @NonNull
    byte[] readToEnd() throws IOException {
        lock.lock();
        try {
            ByteArrayOutputStream spill = null;
            while (true) {
                checkIntact();
                while (hasWriters() && queue.remaining() < capacity) {
                    await();
                }
                checkResultSize(spill, queue.remaining());
                byte[] chunk = drain(queue.remaining());
                if (!hasWriters()) {
                    if (spill == null) {
                        return chunk;
                    }
                    spill.write(chunk, 0, chunk.length);
                    return spill.toByteArray();
                }
                if (spill == null) {
                    spill = new ByteArrayOutputStream(chunk.length);
                }
                spill.write(chunk, 0, chunk.length);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Like {@link #readToEnd()} but decodes the bytes. On a decoding failure the bytes still held by the queue are
     * left in place.
     */
    @NonNull
    String readToString(@NonNull Charset charset) throws IOException {
        lock.lock();
        try {
            ByteArrayOutputStream spill = null;
            while (true) {
                checkIntact();
                while (hasWriters() && queue.remaining() < capacity) {
                    await();
                }
                checkResultSize(spill, queue.remaining());
                if (!hasWriters()) {
                    byte[] tail = queue.toByteArray();
                    byte[] all = tail;
                    if (spill != null) {
                        spill.write(tail, 0, tail.length);
                        all = spill.toByteArray();
                    }
                    String s = decode(all, charset);
                    mutate(() -> queue.skip(tail.length));
                    return s;
                }
                byte[] chunk = drain(queue.remaining());
                if (spill == null) {
                    spill = new ByteArrayOutputStream(chunk.length);
                }
                spill.write(chunk, 0, chunk.length);
            }
        } finally {
            lock.unlock();
        }
    }

    private void checkResultSize(@CheckForNull ByteArrayOutputStream spill, long more) throws IOException {
        long total = (spill == null ? 0 : spill.size()) + more;
        if (total > maxResult) {
            throw new IOException("Pipe content of at least " + total + " bytes does not fit in one array of at most "
                    + maxResult + " bytes");
        }
    }

    /**
     * Decodes bytes, reporting malformed or unmappable input instead of replacing it.
     */
    @NonNull
    static String decode(@NonNull byte[] bytes, @NonNull Charset charset) throws CharacterCodingException {
        return charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
    }

    /**
     * Number of buffered bytes, never blocks.
     */
    long available() throws IOException {
        lock.lock();
        try {
            checkIntact();
            return queue.remaining();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends as much of the given bytes as fits under the capacity. Blocks only while the queue is full.
     *
     * @return number of bytes appended.
     * @throws BrokenPipeException if no reader is open, checked before anything else and again after every wait.
     */
    int writeSome(byte[] b, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, b.length);
        lock.lock();
        try {
            while (true) {
                checkIntact();
                if (!hasReaders()) {
                    throw brokenPipe();
                }
                if (len == 0) {
                    return 0;
                }
                long room = capacity - queue.remaining();
                if (room > 0) {
                    int n = (int) Math.min(len, room);
                    mutate(() -> {
                        queue.put(b, off, n);
                        return n;
                    });
                    return n;
                }
                changed.awaitUninterruptibly();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends all the given bytes, in as many chunks as the capacity requires.
     */
    void writeAll(byte[] b, int off, int len) throws IOException {
        lock.lock();
        try {
            do {
                int n = writeSome(b, off, len);
                off += n;
                len -= n;
            } while (len > 0);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fails if the buffer has been corrupted.
     */
    void checkUsable() throws IOException {
        lock.lock();
        try {
            checkIntact();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "SharedPipeBuffer[capacity=" + capacity + ",readers=" + readers.get() + ",writers=" + writers.get()
                + "]";
    }
}
