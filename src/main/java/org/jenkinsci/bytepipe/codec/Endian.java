package org.jenkinsci.bytepipe.codec;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import org.apache.commons.io.IOUtils;

/**
 * Reads and writes fixed-width numbers in a given byte order.
 *
 * <p>
 * Every read consumes exactly the width of the value from the stream and fails with {@link EOFException} if the
 * stream ends first. Single byte values are offered in every order for uniformity even though byte order does not
 * affect them.
 *
 * <p>
 * Unsigned values are widened to the next larger Java type, and 128-bit values are {@link BigInteger}s.
 */
public enum Endian {
    BIG(ByteOrder.BIG_ENDIAN),
    LITTLE(ByteOrder.LITTLE_ENDIAN),
    /**
     * The byte order of the platform the JVM runs on.
     */
    NATIVE(ByteOrder.nativeOrder());

    private static final BigInteger TWO_TO_THE_64 = BigInteger.ONE.shiftLeft(64);
    private static final BigInteger INT128_MIN = BigInteger.ONE.shiftLeft(127).negate();
    private static final BigInteger INT128_MAX = BigInteger.ONE.shiftLeft(127).subtract(BigInteger.ONE);
    private static final BigInteger UINT128_MAX = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);

    private final ByteOrder order;

    Endian(ByteOrder order) {
        this.order = order;
    }

    @NonNull
    public ByteOrder order() {
        return order;
    }

    private ByteBuffer readValue(InputStream in, int width) throws IOException {
        byte[] b = new byte[width];
        int n = IOUtils.read(in, b);
        if (n < width) {
            throw new EOFException("Expected " + width + " bytes but the stream ended after " + n);
        }
        return ByteBuffer.wrap(b).order(order);
    }

    private ByteBuffer allocate(int width) {
        return ByteBuffer.allocate(width).order(order);
    }

    private static void writeValue(OutputStream out, ByteBuffer value) throws IOException {
        out.write(value.array());
    }

    public byte readByte(@NonNull InputStream in) throws IOException {
        return readValue(in, Byte.BYTES).get();
    }

    public int readUnsignedByte(@NonNull InputStream in) throws IOException {
        return Byte.toUnsignedInt(readByte(in));
    }

    public short readShort(@NonNull InputStream in) throws IOException {
        return readValue(in, Short.BYTES).getShort();
    }

    public int readUnsignedShort(@NonNull InputStream in) throws IOException {
        return Short.toUnsignedInt(readShort(in));
    }

    public int readInt(@NonNull InputStream in) throws IOException {
        return readValue(in, Integer.BYTES).getInt();
    }

    public long readUnsignedInt(@NonNull InputStream in) throws IOException {
        return Integer.toUnsignedLong(readInt(in));
    }

    public long readLong(@NonNull InputStream in) throws IOException {
        return readValue(in, Long.BYTES).getLong();
    }

    @NonNull
    public BigInteger readUnsignedLong(@NonNull InputStream in) throws IOException {
        long v = readLong(in);
        BigInteger result = BigInteger.valueOf(v);
        return v < 0 ? result.add(TWO_TO_THE_64) : result;
    }

    /**
     * Reads a two's complement 128-bit integer.
     */
    @NonNull
    public BigInteger readInt128(@NonNull InputStream in) throws IOException {
        return new BigInteger(toBigEndian(readValue(in, 16).array()));
    }

    @NonNull
    public BigInteger readUnsignedInt128(@NonNull InputStream in) throws IOException {
        return new BigInteger(1, toBigEndian(readValue(in, 16).array()));
    }

    public float readFloat(@NonNull InputStream in) throws IOException {
        return readValue(in, Float.BYTES).getFloat();
    }

    public double readDouble(@NonNull InputStream in) throws IOException {
        return readValue(in, Double.BYTES).getDouble();
    }

    public void writeByte(@NonNull OutputStream out, byte v) throws IOException {
        writeValue(out, allocate(Byte.BYTES).put(v));
    }

    public void writeUnsignedByte(@NonNull OutputStream out, int v) throws IOException {
        checkRange(v, 0xFF);
        writeByte(out, (byte) v);
    }

    public void writeShort(@NonNull OutputStream out, short v) throws IOException {
        writeValue(out, allocate(Short.BYTES).putShort(v));
    }

    public void writeUnsignedShort(@NonNull OutputStream out, int v) throws IOException {
        checkRange(v, 0xFFFF);
        writeShort(out, (short) v);
    }

    public void writeInt(@NonNull OutputStream out, int v) throws IOException {
        writeValue(out, allocate(Integer.BYTES).putInt(v));
    }

    public void writeUnsignedInt(@NonNull OutputStream out, long v) throws IOException {
        checkRange(v, 0xFFFFFFFFL);
        writeInt(out, (int) v);
    }

    public void writeLong(@NonNull OutputStream out, long v) throws IOException {
        writeValue(out, allocate(Long.BYTES).putLong(v));
    }

    public void writeUnsignedLong(@NonNull OutputStream out, @NonNull BigInteger v) throws IOException {
        if (v.signum() < 0 || v.bitLength() > 64) {
            throw new IllegalArgumentException("Not an unsigned 64-bit value: " + v);
        }
        writeLong(out, v.longValue());
    }

    /**
     * Writes a two's complement 128-bit integer.
     *
     * @throws IllegalArgumentException if {@code v} does not fit in 128 bits.
     */
    public void writeInt128(@NonNull OutputStream out, @NonNull BigInteger v) throws IOException {
        if (v.compareTo(INT128_MIN) < 0 || v.compareTo(INT128_MAX) > 0) {
            throw new IllegalArgumentException("Not a signed 128-bit value: " + v);
        }
        out.write(fromBigEndian(fit(v.toByteArray(), v.signum() < 0 ? (byte) 0xFF : 0)));
    }

    public void writeUnsignedInt128(@NonNull OutputStream out, @NonNull BigInteger v) throws IOException {
        if (v.signum() < 0 || v.compareTo(UINT128_MAX) > 0) {
            throw new IllegalArgumentException("Not an unsigned 128-bit value: " + v);
        }
        out.write(fromBigEndian(fit(v.toByteArray(), (byte) 0)));
    }

    public void writeFloat(@NonNull OutputStream out, float v) throws IOException {
        writeValue(out, allocate(Float.BYTES).putFloat(v));
    }

    public void writeDouble(@NonNull OutputStream out, double v) throws IOException {
        writeValue(out, allocate(Double.BYTES).putDouble(v));
    }

    /**
     * Reads up to {@code length} bytes. Fewer bytes are returned only if the stream ends first.
     *
     * @throws IOException if reading fails, with a message stating how many bytes were expected.
     */
    @NonNull
    public static byte[] readBytes(@NonNull InputStream in, int length) throws IOException {
        if (length < 0) {
            throw new IllegalArgumentException("negative length: " + length);
        }
        byte[] b = new byte[length];
        int n;
        try {
            n = IOUtils.read(in, b);
        } catch (IOException e) {
            throw new IOException("Expected " + length + " bytes, but ran into an error instead", e);
        }
        return n == length ? b : Arrays.copyOf(b, n);
    }

    public static void writeBytes(@NonNull OutputStream out, @NonNull byte[] b) throws IOException {
        out.write(b);
    }

    private static void checkRange(long v, long max) {
        if (v < 0 || v > max) {
            throw new IllegalArgumentException("Value " + v + " is not in [0," + max + "]");
        }
    }

    /**
     * Sign or zero extends, or strips the extra sign byte of, a big-endian two's complement array to 16 bytes.
     */
    private static byte[] fit(byte[] raw, byte pad) {
        byte[] result = new byte[16];
        int len = Math.min(raw.length, 16);
        Arrays.fill(result, 0, 16 - len, pad);
        System.arraycopy(raw, raw.length - len, result, 16 - len, len);
        return result;
    }

    private byte[] toBigEndian(byte[] b) {
        return order == ByteOrder.BIG_ENDIAN ? b : reverse(b);
    }

    private byte[] fromBigEndian(byte[] b) {
        return order == ByteOrder.BIG_ENDIAN ? b : reverse(b);
    }

    private static byte[] reverse(byte[] b) {
        for (int i = 0, j = b.length - 1; i < j; i++, j--) {
            byte t = b[i];
            b[i] = b[j];
            b[j] = t;
        }
        return b;
    }
}
