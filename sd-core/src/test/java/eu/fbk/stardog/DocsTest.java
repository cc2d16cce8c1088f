package eu.fbk.stardog;

import java.io.ByteArrayOutputStream;

import com.google.common.base.Charsets;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import eu.fbk.stardog.data.Content;
import eu.fbk.stardog.data.Stream;
import eu.fbk.stardog.http.Request;

public class DocsTest {

    private static final String TEXT = "Stardog stores documents next to the graph.";

    private MemoryTransport transport;

    private DefaultConnection connection;

    @Before
    public void setUp() throws StardogException {
        this.transport = new MemoryTransport();
        this.connection = DefaultConnection.open(this.transport, MemoryTransport.DATABASE);
    }

    @After
    public void tearDown() {
        this.connection.close();
    }

    @Test
    public void testLifecycle() throws Throwable {
        final Docs docs = this.connection.docs();
        Assert.assertEquals(0L, docs.size());

        docs.add("notes.txt", Content.raw(TEXT, "text/plain"));
        final Request add = this.transport.getLastRequest();
        Assert.assertEquals(Request.POST, add.getMethod());
        Assert.assertEquals("test/docs", add.getPath());
        Assert.assertEquals(1, add.getParts().size());
        Assert.assertEquals("upload", add.getParts().get(0).getName());
        Assert.assertEquals("notes.txt", add.getParts().get(0).getFilename());
        Assert.assertEquals("text/plain", add.getParts().get(0).getMediaType());
        Assert.assertFalse(add.isFormEncoded());
        Assert.assertEquals(1L, docs.size());

        Assert.assertEquals(TEXT, docs.get("notes.txt").exec());
        Assert.assertEquals("*/*", this.transport.getLastRequest().getHeader("Accept"));
        Assert.assertEquals("test/docs/notes.txt", this.transport.getLastRequest().getPath());

        docs.delete("notes.txt");
        Assert.assertEquals(Request.DELETE, this.transport.getLastRequest().getMethod());
        Assert.assertEquals(0L, docs.size());

        try {
            docs.get("notes.txt").exec();
            Assert.fail();
        } catch (final StardogException ex) {
            Assert.assertEquals(404, ex.getStatus());
            Assert.assertEquals("DocumentNotFound", ex.getCode());
        }
        Assert.assertEquals(0, this.transport.getOpenResponses());
    }

    @Test
    public void testStream() throws Throwable {
        final Docs docs = this.connection.docs();
        docs.add("notes.txt", Content.raw(TEXT, "text/plain"));
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (Stream<byte[]> stream = docs.get("notes.txt").execStream(8)) {
            try {
                this.connection.export().execStream();
                Assert.fail();
            } catch (final UsageException ex) {
                // ok
            }
            for (final byte[] chunk : stream) {
                out.write(chunk);
            }
        }
        Assert.assertEquals(TEXT, new String(out.toByteArray(), Charsets.UTF_8));
        Assert.assertEquals(0, this.transport.getOpenResponses());
    }

    @Test
    public void testClearOutsideTransaction() throws Throwable {
        final Docs docs = this.connection.docs();
        this.connection.begin();
        docs.add("a.txt", Content.raw("a", "text/plain"));
        docs.add("b.txt", Content.raw("b", "text/plain"));
        Assert.assertEquals("test/docs", this.transport.getLastRequest().getPath());
        this.connection.rollback();

        // documents do not take part to transactions
        Assert.assertEquals(2L, docs.size());
        docs.clear();
        Assert.assertEquals(Request.DELETE, this.transport.getLastRequest().getMethod());
        Assert.assertEquals("test/docs", this.transport.getLastRequest().getPath());
        Assert.assertEquals(0L, docs.size());
    }

    @Test
    public void testClosedConnection() throws Throwable {
        final Docs docs = this.connection.docs();
        this.connection.close();
        try {
            docs.size();
            Assert.fail();
        } catch (final UsageException ex) {
            // ok
        }
        try {
            docs.get("x.txt");
            Assert.fail();
        } catch (final UsageException ex) {
            // ok
        }
    }

}
