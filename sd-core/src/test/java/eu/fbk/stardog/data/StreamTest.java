package eu.fbk.stardog.data;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Assert;
import org.junit.Test;

public class StreamTest {

    private static byte[] data(final int size) {
        final byte[] data = new byte[size];
        for (int i = 0; i < size; ++i) {
            data[i] = (byte) (i % 251);
        }
        return data;
    }

    @Test
    public void testChunks() throws IOException {
        final byte[] data = data(10000);
        for (final int chunkSize : new int[] { 1, 7, 1024, Stream.DEFAULT_CHUNK_SIZE, 20000 }) {
            final CountingInputStream in = new CountingInputStream(data);
            final ByteArrayOutputStream out = new ByteArrayOutputStream();
            int chunks = 0;
            try (Stream<byte[]> stream = Stream.read(in, chunkSize)) {
                for (final byte[] chunk : stream) {
                    Assert.assertTrue(chunk.length > 0 && chunk.length <= chunkSize);
                    out.write(chunk);
                    ++chunks;
                }
                Assert.assertTrue(stream.isClosed());
            }
            Assert.assertArrayEquals(data, out.toByteArray());
            Assert.assertEquals((data.length + chunkSize - 1) / chunkSize, chunks);
            Assert.assertEquals(1, in.closeCount.get());
        }
    }

    @Test
    public void testEmpty() {
        final CountingInputStream in = new CountingInputStream(new byte[0]);
        final Stream<byte[]> stream = Stream.read(in);
        Assert.assertFalse(stream.iterator().hasNext());
        Assert.assertTrue(stream.isClosed());
        Assert.assertEquals(1, in.closeCount.get());
    }

    @Test
    public void testEarlyClose() {
        final CountingInputStream in = new CountingInputStream(data(100));
        final Stream<byte[]> stream = Stream.read(in, 10);
        final Iterator<byte[]> iterator = stream.iterator();
        Assert.assertEquals(10, iterator.next().length);
        stream.close();
        stream.close();
        Assert.assertEquals(1, in.closeCount.get());
        try {
            iterator.hasNext();
            Assert.fail();
        } catch (final IllegalStateException ex) {
            // ok
        }
    }

    @Test
    public void testReadFailure() {
        final AtomicInteger closed = new AtomicInteger();
        final InputStream failing = new InputStream() {

            private int count;

            @Override
            public int read() throws IOException {
                if (++this.count > 5) {
                    throw new IOException("connection reset");
                }
                return 'x';
            }

            @Override
            public void close() {
                closed.incrementAndGet();
            }

        };
        final Stream<byte[]> stream = Stream.read(failing, 2);
        int chunks = 0;
        try {
            for (final byte[] chunk : stream) {
                Assert.assertEquals(2, chunk.length);
                ++chunks;
            }
            Assert.fail();
        } catch (final UncheckedIOException ex) {
            Assert.assertEquals("connection reset", ex.getCause().getMessage());
        }
        Assert.assertEquals(2, chunks);
        Assert.assertTrue(stream.isClosed());
        Assert.assertEquals(1, closed.get());
    }

    @Test
    public void testSingleUse() {
        final Stream<byte[]> stream = Stream.read(new CountingInputStream(data(5)), 2);
        Assert.assertTrue(stream.isAvailable());
        final Iterator<byte[]> iterator = stream.iterator();
        Assert.assertFalse(stream.isAvailable());
        try {
            stream.iterator();
            Assert.fail();
        } catch (final IllegalStateException ex) {
            // ok
        }
        Assert.assertEquals(2, iterator.next().length);
        stream.close();

        final Stream<byte[]> closed = Stream.read(new CountingInputStream(data(5)));
        closed.close();
        try {
            closed.iterator();
            Assert.fail();
        } catch (final IllegalStateException ex) {
            // ok
        }
    }

    @Test
    public void testOnClose() {
        final AtomicInteger counter = new AtomicInteger();
        final Runnable action = counter::incrementAndGet;
        final Stream<byte[]> stream = Stream.read(new CountingInputStream(data(3)));
        stream.onClose(action, action);
        final Iterator<byte[]> iterator = stream.iterator();
        Assert.assertEquals(3, iterator.next().length);
        Assert.assertFalse(iterator.hasNext());
        Assert.assertEquals(1, counter.get());
        stream.onClose(action);
        Assert.assertEquals(2, counter.get());
        try {
            stream.onClose("not closeable");
            Assert.fail();
        } catch (final IllegalArgumentException ex) {
            // ok
        }
    }

    private static final class CountingInputStream extends FilterInputStream {

        final AtomicInteger closeCount = new AtomicInteger();

        CountingInputStream(final byte[] data) {
            super(new ByteArrayInputStream(data));
        }

        @Override
        public void close() throws IOException {
            this.closeCount.incrementAndGet();
            super.close();
        }

    }

}
