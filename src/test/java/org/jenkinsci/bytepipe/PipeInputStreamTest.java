package org.jenkinsci.bytepipe;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.jenkinsci.bytepipe.BytePipeTest.b;
import static org.jenkinsci.bytepipe.BytePipeTest.s;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.apache.commons.io.IOUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class PipeInputStreamTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    /**
     * Gives a task the time to reach its wait and checks that it is still there.
     */
    static void assertBlocked(Future<?> f) throws InterruptedException {
        Thread.sleep(200);
        assertThat("task should still be blocked", f.isDone(), is(false));
    }

    static Throwable failure(Future<?> f) {
        ExecutionException e = assertThrows(ExecutionException.class, () -> f.get(10, TimeUnit.SECONDS));
        return e.getCause();
    }

    @Test
    void readBlocksUntilDataArrives() throws Exception {
        BytePipe pipe = BytePipe.create();
        Future<String> f = executor.submit(() -> {
            byte[] buf = new byte[16];
            int n = pipe.getIn().read(buf, 0, buf.length);
            return new String(buf, 0, n, StandardCharsets.UTF_8);
        });
        assertBlocked(f);

        pipe.getOut().write(b("abc"));
        assertThat(f.get(10, TimeUnit.SECONDS), is("abc"));
    }

    @Test
    void readReportsEndOfStreamOnceEveryWriterIsClosed() throws Exception {
        BytePipe pipe = BytePipe.create();
        PipeOutputStream second = pipe.getOut().duplicate();
        Future<Integer> f = executor.submit(() -> pipe.getIn().read(new byte[4], 0, 4));

        pipe.getOut().close();
        assertBlocked(f);

        second.close();
        assertThat(f.get(10, TimeUnit.SECONDS), is(-1));
    }

    @Test
    void zeroLengthReadDoesNotBlock() throws Exception {
        BytePipe pipe = BytePipe.create();
        assertThat(pipe.getIn().read(new byte[4], 0, 0), is(0));
    }

    @Test
    void singleByteRead() throws Exception {
        BytePipe pipe = BytePipe.create();
        pipe.getOut().write(0xFE);
        pipe.getOut().close();
        assertThat(pipe.getIn().read(), is(0xFE));
        assertThat(pipe.getIn().read(), is(-1));
    }

    @Test
    void readExactWaitsForAllTheBytes() throws Exception {
        BytePipe pipe = BytePipe.create();
        Future<byte[]> f = executor.submit(() -> pipe.getIn().readExact(6));

        pipe.getOut().write(b("abc"));
        assertBlocked(f);
        assertThat(pipe.getIn().available(), is(3));

        pipe.getOut().write(b("defgh"));
        assertThat(s(f.get(10, TimeUnit.SECONDS)), is("abcdef"));
        assertThat(s(pipe.getIn().readExact(2)), is("gh"));
    }

    @Test
    void blockedReadExactFailsWhenLastWriterCloses() throws Exception {
        BytePipe pipe = BytePipe.create();
        pipe.getOut().write(b("Hi"));
        Future<byte[]> f = executor.submit(() -> pipe.getIn().readExact(5));
        assertBlocked(f);

        pipe.getOut().close();
        assertThat(failure(f), instanceOf(EOFException.class));
    }

    @Test
    void readExactLargerThanCapacityIsRejected() throws Exception {
        BytePipe pipe = BytePipe.create(4);
        assertThrows(IllegalArgumentException.class, () -> pipe.getIn().readExact(5));
    }

    @Test
    void readUntilWaitsForTheDelimiter() throws Exception {
        BytePipe pipe = BytePipe.create();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Future<Integer> f = executor.submit(() -> pipe.getIn().readUntil((byte) ';', out));

        pipe.getOut().write(b("ab"));
        assertBlocked(f);
        pipe.getOut().write(b("c;d;"));

        assertThat(f.get(10, TimeUnit.SECONDS), is(4));
        assertThat(out.toString(StandardCharsets.UTF_8), is("abc;"));
        assertThat(pipe.getIn().available(), is(2));
    }

    @Test
    void readUntilAppendsToWhatIsAlreadyThere() throws Exception {
        BytePipe pipe = BytePipe.create();
        pipe.getOut().write(b("ef\ngh"));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(b("abcd"));

        assertThat(pipe.getIn().readUntil((byte) '\n', out), is(3));
        assertThat(out.toString(StandardCharsets.UTF_8), is("abcdef\n"));
    }

    @Test
    void readUntilReturnsTheRestWhenNoDelimiterWillArrive() throws Exception {
        BytePipe pipe = BytePipe.create();
        pipe.getOut().write(b("abc"));
        Future<byte[]> f = executor.submit(() -> {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            pipe.getIn().readUntil((byte) '\n', out);
            return out.toByteArray();
        });
        assertBlocked(f);

        pipe.getOut().close();
        assertThat(s(f.get(10, TimeUnit.SECONDS)), is("abc"));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        assertThat(pipe.getIn().readUntil((byte) '\n', out), is(0));
        assertThat(out.size(), is(0));
    }

    @Test
    void readUntilReturnsAFullBufferWithoutDelimiter() throws Exception {
        BytePipe pipe = BytePipe.create(4);
        Future<?> writer = executor.submit(() -> {
            try (PipeOutputStream out = pipe.getOut()) {
                out.writeAll(b("abcdefgh;"));
            }
            return null;
        });

        assertThat(s(readUntil(pipe.getIn(), ';')), is("abcd"));
        assertThat(s(readUntil(pipe.getIn(), ';')), is("efgh"));
        assertThat(s(readUntil(pipe.getIn(), ';')), is(";"));
        writer.get(10, TimeUnit.SECONDS);
        assertThat(readUntil(pipe.getIn(), ';').length, is(0));
    }

    private static byte[] readUntil(PipeInputStream in, char delimiter) throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        in.readUntil((byte) delimiter, out);
        return out.toByteArray();
    }

    @Test
    void readUntilFindsDelimiterAfterAnotherReaderDrained() throws Exception {
        BytePipe pipe = BytePipe.create();
        PipeInputStream other = pipe.getIn().duplicate();
        Future<byte[]> f = executor.submit(() -> readUntil(pipe.getIn(), '\n'));

        pipe.getOut().write(b("0123456789"));
        assertBlocked(f);
        // the blocked reader has searched 10 bytes, the other reader takes 8 of them away
        assertThat(s(other.readExact(8)), is("01234567"));
        pipe.getOut().write(b("\n"));

        assertThat(s(f.get(10, TimeUnit.SECONDS)), is("89\n"));
    }

    @Test
    void readLineRejectsMalformedText() throws Exception {
        BytePipe pipe = BytePipe.create();
        pipe.getOut().write(new byte[] {(byte) 0xC3, (byte) 0x28, '\n', 'o', 'k', '\n'});

        assertThrows(CharacterCodingException.class, () -> pipe.getIn().readLine());
        // the malformed line is gone
        assertThat(pipe.getIn().readLine(), is("ok\n"));
    }

    @Test
    void readLineRejectsCharsetsWithoutASingleByteNewline() throws Exception {
        BytePipe pipe = BytePipe.create();
        byte[] text = "ab\ncd".getBytes(StandardCharsets.UTF_16LE);
        pipe.getOut().write(text);
        pipe.getOut().close();

        assertThrows(IllegalArgumentException.class, () -> pipe.getIn().readLine(StandardCharsets.UTF_16LE));
        assertThrows(IllegalArgumentException.class, () -> pipe.getIn().readLine(StandardCharsets.UTF_16));
        assertThat(pipe.getIn().readToString(StandardCharsets.UTF_16LE), is("ab\ncd"));
    }

    @Test
    void readLineInASingleByteCharset() throws Exception {
        BytePipe pipe = BytePipe.create();
        pipe.getOut().write("caf\u00e9\nx".getBytes(StandardCharsets.ISO_8859_1));
        assertThat(pipe.getIn().readLine(StandardCharsets.ISO_8859_1), is("caf\u00e9\n"));
        assertThat(pipe.getIn().available(), is(1));
    }

    @Test
    void readLineDecodesMultiByteCharacters() throws Exception {
        BytePipe pipe = BytePipe.create();
        pipe.getOut().write(b("héllo wörld\n"));
        assertThat(pipe.getIn().readLine(), is("héllo wörld\n"));
        assertThat(pipe.getIn().available(), is(0));
    }

    @Test
    void readToEndBlocksUntilEveryWriterIsClosed() throws Exception {
        BytePipe pipe = BytePipe.create();
        PipeOutputStream second = pipe.getOut().duplicate();
        Future<byte[]> f = executor.submit(() -> pipe.getIn().readToEnd());

        pipe.getOut().write(b("one,"));
        pipe.getOut().close();
        assertBlocked(f);

        second.write(b("two"));
        assertBlocked(f);
        second.close();
        assertThat(s(f.get(10, TimeUnit.SECONDS)), is("one,two"));
    }

    @Test
    void readToEndDrainsAFullBufferSoThatWritersCanGoOn() throws Exception {
        byte[] data = new byte[1000];
        for (int i = 0; i < data.length; i++) {
            data[i] = (byte) i;
        }
        BytePipe pipe = BytePipe.create(8);
        Future<?> writer = executor.submit(() -> {
            try (PipeOutputStream out = pipe.getOut()) {
                out.write(data);
            }
            return null;
        });

        assertThat(pipe.getIn().readAllBytes(), is(data));
        writer.get(10, TimeUnit.SECONDS);
    }

    @Test
    void readToStringWithSmallCapacity() throws Exception {
        String text = "The quick brown fox jumps over the lazy dog";
        BytePipe pipe = BytePipe.create(5);
        Future<?> writer = executor.submit(() -> {
            try (PipeOutputStream out = pipe.getOut()) {
                out.write(b(text));
            }
            return null;
        });

        assertThat(pipe.getIn().readToString(), is(text));
        writer.get(10, TimeUnit.SECONDS);
    }

    @Test
    void readToStringLeavesMalformedBytesInThePipe() throws Exception {
        BytePipe pipe = BytePipe.create();
        pipe.getOut().write(new byte[] {'a', (byte) 0xFF});
        pipe.getOut().close();

        assertThrows(CharacterCodingException.class, () -> pipe.getIn().readToString());
        assertThat(pipe.getIn().readToEnd(), is(new byte[] {'a', (byte) 0xFF}));
    }

    @Test
    void skipDiscardsBufferedBytes() throws Exception {
        BytePipe pipe = BytePipe.create();
        pipe.getOut().write(b("0123456789"));
        pipe.getOut().close();

        assertThat(pipe.getIn().skip(4), is(4L));
        assertThat(pipe.getIn().skip(0), is(0L));
        assertThat(IOUtils.toString(pipe.getIn(), StandardCharsets.UTF_8), is("456789"));
        assertThat(pipe.getIn().skip(1), is(0L));
    }

    @Test
    void closedEndpointRejectsOperations() throws Exception {
        BytePipe pipe = BytePipe.create();
        PipeInputStream in = pipe.getIn();
        PipeInputStream other = in.duplicate();
        in.close();
        in.close();

        assertThat(in.isClosed(), is(true));
        assertThrows(PipeClosedException.class, () -> in.read());
        assertThrows(PipeClosedException.class, () -> in.readToEnd());
        assertThrows(PipeClosedException.class, in::duplicate);

        // closing twice gave back one reader only, the duplicate keeps the pipe readable
        pipe.getOut().write(b("still here"));
        pipe.getOut().close();
        assertThat(other.readToString(), is("still here"));

        other.close();
        assertThrows(PipeClosedException.class, () -> pipe.getOut().write(1));
    }

    @Test
    void markIsNotSupported() {
        assertThat(BytePipe.create().getIn().markSupported(), is(false));
    }
}
