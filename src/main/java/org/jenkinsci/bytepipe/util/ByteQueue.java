/*
 * The MIT License
 *
 * Copyright (c) 2026, the bytepipe authors
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package org.jenkinsci.bytepipe.util;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.Objects;
import net.jcip.annotations.NotThreadSafe;

/**
 * An unbounded FIFO queue of bytes.
 *
 * <p>
 * The bytes live in a chain of fixed-size pages. Pages are allocated lazily by the writer and dropped as soon as the
 * reader has consumed them, so the memory held is proportional to the number of bytes currently queued rather than
 * to the largest amount ever queued.
 *
 * <p>
 * Positions passed to and returned from {@link #indexOf(byte, long)} and {@link #peek(long, byte[], int, int)} are
 * relative to the current head of the queue. {@link #consumed()} can be used to turn them into positions that stay
 * stable while other parties drain the queue.
 *
 * @since 1.0
 */
@NotThreadSafe
public class ByteQueue {
    /**
     * An empty byte array constant.
     */
    private static final byte[] EMPTY_BYTE_ARRAY = new byte[0];

    /**
     * Pages in FIFO order. The first page is read from {@link #readPosition}, the last page is written at
     * {@link #writePosition}.
     */
    private final ArrayDeque<byte[]> pages = new ArrayDeque<>();

    private final int pageSize;

    /**
     * Offset of the next byte to read in the first page.
     */
    private int readPosition;

    /**
     * Offset of the next byte to write in the last page.
     */
    private int writePosition;

    /**
     * Number of bytes currently queued.
     */
    private long size;

    /**
     * Number of bytes ever removed from the head of this queue.
     */
    private long consumed;

    /**
     * Constructor.
     *
     * @param pageSize the size of the pages the bytes are stored in.
     */
    public ByteQueue(int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("page size must be positive: " + pageSize);
        }
        this.pageSize = pageSize;
    }

    /**
     * Appends bytes to the tail of the queue.
     *
     * @param src    the bytes to append.
     * @param offset the offset of the first byte in {@code src}.
     * @param len    the number of bytes to append.
     */
    public void put(@NonNull byte[] src, int offset, int len) {
        Objects.checkFromIndexSize(offset, len, src.length);
        while (len > 0) {
            if (pages.isEmpty() || writePosition == pageSize) {
                pages.addLast(new byte[pageSize]);
                writePosition = 0;
            }
            int chunk = Math.min(len, pageSize - writePosition);
            System.arraycopy(src, offset, pages.getLast(), writePosition, chunk);
            writePosition += chunk;
            offset += chunk;
            len -= chunk;
            size += chunk;
        }
    }

    /**
     * Removes bytes from the head of the queue.
     *
     * @param dst    the array to copy the bytes into.
     * @param offset the offset in {@code dst} to start copying at.
     * @param len    the maximum number of bytes to remove.
     * @return the number of bytes removed, {@literal 0} if the queue is empty.
     */
    public int get(@NonNull byte[] dst, int offset, int len) {
        Objects.checkFromIndexSize(offset, len, dst.length);
        int n = (int) Math.min(len, size);
        int remaining = n;
        while (remaining > 0) {
            byte[] page = pages.getFirst();
            int chunk = Math.min(remaining, headEnd() - readPosition);
            System.arraycopy(page, readPosition, dst, offset, chunk);
            offset += chunk;
            remaining -= chunk;
            advance(chunk);
        }
        return n;
    }

    /**
     * Discards bytes from the head of the queue.
     *
     * @param bytes the maximum number of bytes to discard.
     * @return the number of bytes discarded.
     */
    public long skip(long bytes) {
        long n = Math.max(0, Math.min(bytes, size));
        long remaining = n;
        while (remaining > 0) {
            int chunk = (int) Math.min(remaining, headEnd() - readPosition);
            remaining -= chunk;
            advance(chunk);
        }
        return n;
    }

    /**
     * Moves the read position forward by {@code chunk} bytes, which must all be in the first page.
     */
    private void advance(int chunk) {
        readPosition += chunk;
        size -= chunk;
        consumed += chunk;
        if (readPosition == headEnd()) {
            pages.removeFirst();
            readPosition = 0;
        }
    }

    /**
     * The end of the readable region of the first page.
     */
    private int headEnd() {
        return pages.size() == 1 ? writePosition : pageSize;
    }

    /**
     * Copies bytes without removing them.
     *
     * @param position the position relative to the head of the queue to start copying from.
     * @param dst      the array to copy the bytes into.
     * @param offset   the offset in {@code dst} to start copying at.
     * @param len      the maximum number of bytes to copy.
     * @return the number of bytes copied. Can be {@literal 0} if {@code position} is beyond the end of the queue.
     */
    public int peek(long position, @NonNull byte[] dst, int offset, int len) {
        Objects.checkFromIndexSize(offset, len, dst.length);
        if (position < 0) {
            throw new IndexOutOfBoundsException("negative position: " + position);
        }
        int n = (int) Math.max(0, Math.min(len, size - position));
        int copied = 0;
        long skip = position;
        int start = readPosition;
        int index = 0;
        for (Iterator<byte[]> it = pages.iterator(); it.hasNext() && copied < n; index++) {
            byte[] page = it.next();
            int end = index == pages.size() - 1 ? writePosition : pageSize;
            int avail = end - start;
            if (skip >= avail) {
                skip -= avail;
            } else {
                int from = start + (int) skip;
                skip = 0;
                int chunk = Math.min(n - copied, end - from);
                System.arraycopy(page, from, dst, offset + copied, chunk);
                copied += chunk;
            }
            start = 0;
        }
        return n;
    }

    /**
     * Finds the first occurrence of a byte.
     *
     * @param b         the byte to look for.
     * @param fromIndex the position relative to the head of the queue to start searching at.
     * @return the position relative to the head of the queue, or {@literal -1} if there is no such byte at or after
     *     {@code fromIndex}.
     */
    public long indexOf(byte b, long fromIndex) {
        long skip = Math.max(0, fromIndex);
        if (skip >= size) {
            return -1;
        }
        long base = 0;
        int start = readPosition;
        int index = 0;
        for (byte[] page : pages) {
            int end = index == pages.size() - 1 ? writePosition : pageSize;
            int avail = end - start;
            if (skip >= avail) {
                skip -= avail;
            } else {
                for (int i = start + (int) skip; i < end; i++) {
                    if (page[i] == b) {
                        return base + (i - start);
                    }
                }
                skip = 0;
            }
            base += avail;
            start = 0;
            index++;
        }
        return -1;
    }

    /**
     * Returns the number of bytes currently queued.
     *
     * @return the number of bytes currently queued.
     */
    public long remaining() {
        return size;
    }

    /**
     * Checks if the queue holds no bytes.
     *
     * @return {@code true} if there are no bytes to read.
     */
    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Returns the number of bytes removed from the head of this queue since it was created.
     *
     * @return the number of bytes removed by {@link #get(byte[], int, int)} and {@link #skip(long)}.
     */
    public long consumed() {
        return consumed;
    }

    /**
     * Returns a copy of the queued bytes without removing them.
     *
     * @return the queued bytes.
     */
    @NonNull
    public byte[] toByteArray() {
        if (size == 0) {
            return EMPTY_BYTE_ARRAY;
        }
        if (size > Integer.MAX_VALUE) {
            throw new OutOfMemoryError("Queue holds too many bytes for an array: " + size);
        }
        byte[] result = new byte[(int) size];
        peek(0, result, 0, result.length);
        return result;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public String toString() {
        return getClass().getSimpleName() + "[pageSize=" + pageSize + ",pages=" + pages.size() + ",remaining=" + size
                + ",consumed=" + consumed + "]";
    }
}
