package eu.fbk.stardog;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.OutputStream;
import java.util.Iterator;
import java.util.zip.GZIPOutputStream;

import com.google.common.base.Charsets;
import com.google.common.io.Resources;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.openrdf.model.impl.URIImpl;
import org.openrdf.query.BindingSet;

import eu.fbk.stardog.data.Content;
import eu.fbk.stardog.data.QueryKind;
import eu.fbk.stardog.data.QueryResult;
import eu.fbk.stardog.data.Stream;
import eu.fbk.stardog.http.Request;

public class DefaultConnectionTest {

    private static final String FOAF = "http://xmlns.com/foaf/0.1/";

    private static final String GRAPH = "http://example.org/g1";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

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

    private static Content example() {
        return Content.url(DefaultConnectionTest.class.getResource("example.ttl"));
    }

    private void load(final Content content) throws StardogException {
        this.connection.begin();
        this.connection.add(content);
        this.connection.commit();
    }

    @Test
    public void testOpen() {
        Assert.assertEquals(1, this.transport.getRequests().size());
        final Request request = this.transport.getLastRequest();
        Assert.assertEquals(Request.GET, request.getMethod());
        Assert.assertEquals("admin/alive", request.getPath());
        Assert.assertEquals(TransactionState.INACTIVE, this.connection.getState());
        Assert.assertNull(this.connection.getTransactionID());
        Assert.assertEquals(MemoryTransport.DATABASE, this.connection.getDatabase());
        Assert.assertEquals(0, this.transport.getOpenResponses());
    }

    @Test
    public void testOpenFailure() {
        final MemoryTransport transport = new MemoryTransport();
        transport.fail("admin/alive", 503, null, "Server starting");
        try {
            DefaultConnection.open(transport, MemoryTransport.DATABASE);
            Assert.fail();
        } catch (final StardogException ex) {
            Assert.assertEquals(503, ex.getStatus());
            Assert.assertEquals("Server starting", ex.getServerMessage());
        }
        Assert.assertTrue(transport.isClosed());

        final MemoryTransport unreachable = new MemoryTransport();
        unreachable.failTransport("admin/alive");
        try {
            DefaultConnection.open(unreachable, MemoryTransport.DATABASE);
            Assert.fail();
        } catch (final TransportException ex) {
            Assert.assertEquals(0, ex.getStatus());
        } catch (final StardogException ex) {
            Assert.fail("Expected a TransportException: " + ex);
        }
        Assert.assertTrue(unreachable.isClosed());
    }

    @Test
    public void testCommit() throws Throwable {
        final String id = this.connection.begin();
        Assert.assertEquals("tx-1", id);
        Assert.assertEquals(TransactionState.ACTIVE, this.connection.getState());
        Assert.assertEquals(id, this.connection.getTransactionID());
        Assert.assertEquals("test/transaction/begin", this.transport.getLastRequest().getPath());

        this.connection.add(example());
        final Request add = this.transport.getLastRequest();
        Assert.assertEquals("test/tx-1/add", add.getPath());
        Assert.assertEquals("text/turtle", add.getEntity().getMediaType());

        // changes are visible in the transaction only
        Assert.assertEquals(0L, this.connection.size());
        final QueryResult.Tuples people = this.connection.select(
                "SELECT ?p WHERE { ?p a <" + FOAF + "Person> }").exec();
        Assert.assertEquals("test/tx-1/query", this.transport.getLastRequest().getPath());
        Assert.assertEquals(2, people.size());

        this.connection.commit();
        Assert.assertEquals("test/transaction/commit/tx-1", this.transport.getLastRequest()
                .getPath());
        Assert.assertEquals(TransactionState.INACTIVE, this.connection.getState());
        Assert.assertNull(this.connection.getTransactionID());
        Assert.assertEquals(5L, this.connection.size());
        Assert.assertEquals(0, this.transport.getOpenResponses());
    }

    @Test
    public void testCommitPersists() throws Throwable {
        this.connection.begin();
        this.connection.add(Content.raw("<urn:s> <urn:p> \"v\" .", "text/turtle"));
        Assert.assertTrue(this.connection.ask("ASK { <urn:s> <urn:p> \"v\" }").exec());
        this.connection.commit();
        Assert.assertEquals(1L, this.connection.size());
        Assert.assertTrue(this.connection.ask("ASK { <urn:s> <urn:p> \"v\" }").exec());

        // a later rollback does not undo committed data
        this.connection.begin();
        this.connection.remove(Content.raw("<urn:s> <urn:p> \"v\" .", "text/turtle"));
        Assert.assertFalse(this.connection.ask("ASK { <urn:s> <urn:p> \"v\" }").exec());
        this.connection.rollback();
        Assert.assertEquals(1L, this.connection.size());
        Assert.assertTrue(this.connection.ask("ASK { <urn:s> <urn:p> \"v\" }").exec());
    }

    @Test
    public void testRollback() throws Throwable {
        this.connection.begin();
        this.connection.add(example());
        Assert.assertTrue(this.connection.ask("ASK { ?s ?p \"Alice\" }").exec());
        this.connection.rollback();
        Assert.assertEquals("test/transaction/rollback/tx-1", this.transport.getLastRequest()
                .getPath());
        Assert.assertEquals(TransactionState.INACTIVE, this.connection.getState());
        Assert.assertNull(this.connection.getTransactionID());
        Assert.assertEquals(0L, this.connection.size());
        Assert.assertFalse(this.connection.ask("ASK { ?s ?p \"Alice\" }").exec());
    }

    @Test
    public void testSingleTripleRoundTrip() throws Throwable {
        load(Content.raw("<urn:s> <urn:p> \"v\" .", "text/turtle"));
        final QueryResult.Tuples tuples = this.connection.select(
                "SELECT ?o WHERE { <urn:s> <urn:p> ?o }").exec();
        Assert.assertEquals(1, tuples.size());
        Assert.assertEquals("v", tuples.getRows().get(0).getValue("o").stringValue());
    }

    @Test
    public void testRejectedCalls() throws Throwable {
        final int requests = this.transport.getRequests().size();
        try {
            this.connection.add(example());
            Assert.fail();
        } catch (final UsageException ex) {
            // ok
        }
        try {
            this.connection.remove(example());
            Assert.fail();
        } catch (final UsageException ex) {
            // ok
        }
        try {
            this.connection.clear();
            Assert.fail();
        } catch (final UsageException ex) {
            // ok
        }
        try {
            this.connection.commit();
            Assert.fail();
        } catch (final UsageException ex) {
            // ok
        }
        try {
            this.connection.rollback();
            Assert.fail();
        } catch (final UsageException ex) {
            // ok
        }
        Assert.assertEquals(requests, this.transport.getRequests().size());

        this.connection.begin();
        try {
            this.connection.begin();
            Assert.fail();
        } catch (final UsageException ex) {
            // ok
        }
        Assert.assertEquals(requests + 1, this.transport.getRequests().size());
        Assert.assertEquals(TransactionState.ACTIVE, this.connection.getState());
        Assert.assertEquals("tx-1", this.connection.getTransactionID());
    }

    @Test
    public void testRollbackFailure() throws Throwable {
        this.connection.begin();
        this.transport.fail("rollback/tx-1", 500, null, "Internal error");
        try {
            this.connection.rollback();
            Assert.fail();
        } catch (final StardogException ex) {
            Assert.assertEquals(500, ex.getStatus());
        }
        Assert.assertEquals(TransactionState.INACTIVE, this.connection.getState());
        Assert.assertNull(this.connection.getTransactionID());
    }

    @Test
    public void testCommitFailure() throws Throwable {
        this.connection.begin();
        this.connection.add(example());
        this.transport.fail("commit/tx-1", 500, "TxCommitFailed", "Disk full");
        try {
            this.connection.commit();
            Assert.fail();
        } catch (final IndeterminateTransactionException ex) {
            Assert.assertEquals("tx-1", ex.getTransactionID());
            Assert.assertEquals(500, ex.getCause().getStatus());
            Assert.assertEquals("TxCommitFailed", ex.getCause().getCode());
        }
        Assert.assertEquals(TransactionState.INDETERMINATE, this.connection.getState());
        Assert.assertNull(this.connection.getTransactionID());

        try {
            this.connection.add(example());
            Assert.fail();
        } catch (final UsageException ex) {
            // ok
        }

        Assert.assertEquals("tx-2", this.connection.begin());
        Assert.assertEquals(TransactionState.ACTIVE, this.connection.getState());
        this.connection.add(example());
        this.connection.commit();
        Assert.assertEquals(5L, this.connection.size());
    }

    @Test
    public void testCommitTransportFailure() throws Throwable {
        this.connection.begin();
        this.transport.failTransport("commit/tx-1");
        try {
            this.connection.commit();
            Assert.fail();
        } catch (final IndeterminateTransactionException ex) {
            Assert.assertTrue(ex.getCause() instanceof TransportException);
        }
        Assert.assertEquals(TransactionState.INDETERMINATE, this.connection.getState());
    }

    @Test
    public void testGraphs() throws Throwable {
        this.connection.begin();
        this.connection.add(example().withContext(GRAPH));
        this.connection.add(Content.raw("<urn:s> <urn:p> <urn:o> .", "text/turtle"));
        Assert.assertEquals(GRAPH, this.transport.getRequests().get(2).getParameter("graph-uri"));
        Assert.assertNull(this.transport.getLastRequest().getParameter("graph-uri"));
        this.connection.commit();
        Assert.assertEquals(6L, this.connection.size());

        Assert.assertTrue(this.connection.export(GRAPH).exec().contains("Alice"));
        Assert.assertFalse(this.connection.export(GRAPH).exec().contains("urn:o"));

        this.connection.begin();
        this.connection.remove(Content.raw("<http://example.org/bob> <" + FOAF
                + "name> \"Bob\" .", "text/turtle").withContext(GRAPH));
        this.connection.commit();
        Assert.assertEquals(5L, this.connection.size());

        this.connection.begin();
        this.connection.clear(GRAPH);
        Assert.assertEquals("test/tx-3/clear", this.transport.getLastRequest().getPath());
        Assert.assertEquals(GRAPH, this.transport.getLastRequest().getParameter("graph-uri"));
        this.connection.commit();
        Assert.assertEquals(1L, this.connection.size());

        this.connection.begin();
        this.connection.clear();
        Assert.assertNull(this.transport.getLastRequest().getParameter("graph-uri"));
        this.connection.commit();
        Assert.assertEquals(0L, this.connection.size());
    }

    @Test
    public void testGzipContent() throws Throwable {
        final File file = new File(this.folder.getRoot(), "data.ttl.gz");
        try (OutputStream out = new GZIPOutputStream(new FileOutputStream(file))) {
            Resources.copy(DefaultConnectionTest.class.getResource("example.ttl"), out);
        }
        final Content content = Content.file(file);
        Assert.assertEquals(Content.GZIP, content.getEncoding());
        load(content);
        Assert.assertEquals("gzip", this.transport.getRequests().get(2).getEntity()
                .getEncoding());
        Assert.assertEquals(5L, this.connection.size());
    }

    @Test
    public void testQueries() throws Throwable {
        load(example());

        final QueryResult.Tuples names = this.connection
                .select("SELECT ?name WHERE { ?p <" + FOAF + "name> ?name }")
                .binding("p", new URIImpl("http://example.org/alice")).reasoning(true)
                .limit(10L).exec();
        Assert.assertEquals(1, names.size());
        Assert.assertEquals("name", names.getVariables().get(0));
        final BindingSet row = names.getRows().get(0);
        Assert.assertEquals("Alice", row.getValue("name").stringValue());
        final Request request = this.transport.getLastRequest();
        Assert.assertEquals("test/query", request.getPath());
        Assert.assertEquals("<http://example.org/alice>", request.getParameter("$p"));
        Assert.assertEquals("true", request.getParameter("reasoning"));
        Assert.assertEquals("10", request.getParameter("limit"));
        Assert.assertNull(request.getParameter("offset"));
        Assert.assertNull(request.getParameter("timeout"));
        Assert.assertEquals("application/sparql-results+json", request.getHeader("Accept"));

        Assert.assertTrue(this.connection.ask("ASK { ?p <" + FOAF + "knows> ?q }").exec());
        Assert.assertEquals("text/boolean", this.transport.getLastRequest().getHeader("Accept"));

        final String graph = this.connection.graph(
                "CONSTRUCT { ?p a ?t } WHERE { ?p a ?t }").exec();
        Assert.assertTrue(graph.contains("http://example.org/alice"));
        Assert.assertEquals("text/turtle", this.transport.getLastRequest().getHeader("Accept"));

        this.connection.graph("CONSTRUCT { ?p a ?t } WHERE { ?p a ?t }")
                .contentType("application/rdf+xml").exec();
        Assert.assertEquals("application/rdf+xml", this.transport.getLastRequest().getHeader(
                "Accept"));

        final QueryResult.Tuples paths = this.connection.paths(
                "PATHS START ?x = <urn:a> END ?y VIA ?p").exec();
        Assert.assertEquals(1, paths.size());
        Assert.assertEquals(QueryKind.PATHS, paths.getKind());

        this.connection.update("INSERT DATA { <urn:x> <urn:p> <urn:y> }").exec();
        Assert.assertEquals("test/update", this.transport.getLastRequest().getPath());
        Assert.assertEquals(6L, this.connection.size());
    }

    @Test
    public void testTransactionalQueries() throws Throwable {
        this.connection.begin();
        this.connection.update("INSERT DATA { <urn:x> <urn:p> <urn:y> }").exec();
        Assert.assertEquals("test/tx-1/update", this.transport.getLastRequest().getPath());
        Assert.assertTrue(this.connection.ask("ASK { <urn:x> ?p ?o }").exec());
        Assert.assertEquals("test/tx-1/query", this.transport.getLastRequest().getPath());

        final String plan = this.connection.explain("SELECT * WHERE { ?s ?p ?o }").exec();
        Assert.assertTrue(plan.startsWith("Projection"));
        Assert.assertEquals("test/explain", this.transport.getLastRequest().getPath());

        this.connection.rollback();
        Assert.assertEquals(0L, this.connection.size());
    }

    @Test
    public void testQueryFailure() throws Throwable {
        try {
            this.connection.select("SELEC ?x WHERE { ?x ?y ?z }").exec();
            Assert.fail();
        } catch (final StardogException ex) {
            Assert.assertEquals(400, ex.getStatus());
            Assert.assertEquals("QEQPE2", ex.getCode());
            Assert.assertTrue(ex.getMessage().startsWith("[400] QEQPE2: "));
        }
        Assert.assertEquals(TransactionState.INACTIVE, this.connection.getState());
        Assert.assertEquals(0, this.transport.getOpenResponses());
    }

    @Test
    public void testExportStream() throws Throwable {
        load(example());
        final byte[] expected = this.connection.export().execBytes();
        Assert.assertEquals("text/turtle", this.transport.getLastRequest().getHeader("Accept"));
        Assert.assertTrue(new String(expected, Charsets.UTF_8).contains("Alice"));

        for (final int chunkSize : new int[] { 1, 1024, Stream.DEFAULT_CHUNK_SIZE }) {
            final ByteArrayOutputStream out = new ByteArrayOutputStream();
            try (Stream<byte[]> stream = this.connection.export().execStream(chunkSize)) {
                Assert.assertEquals(1, this.transport.getOpenResponses());
                for (final byte[] chunk : stream) {
                    Assert.assertTrue(chunk.length > 0 && chunk.length <= chunkSize);
                    out.write(chunk);
                }
            }
            Assert.assertArrayEquals(expected, out.toByteArray());
            Assert.assertEquals(0, this.transport.getOpenResponses());
        }
    }

    @Test
    public void testStreamClosedWithConnection() throws Throwable {
        load(example());
        final Stream<byte[]> stream = this.connection.export().execStream(4);
        final Iterator<byte[]> iterator = stream.iterator();
        Assert.assertEquals(4, iterator.next().length);
        this.connection.close();
        Assert.assertTrue(stream.isClosed());
        Assert.assertEquals(0, this.transport.getOpenResponses());
        try {
            iterator.next();
            Assert.fail();
        } catch (final IllegalStateException ex) {
            // ok
        }
    }

    @Test
    public void testSingleOpenStream() throws Throwable {
        load(example());
        final Stream<byte[]> stream = this.connection.export().execStream(4);
        try {
            this.connection.export().execStream();
            Assert.fail();
        } catch (final UsageException ex) {
            // ok
        }
        Assert.assertEquals(1, this.transport.getOpenResponses());

        // buffered reads are still allowed
        Assert.assertTrue(this.connection.export().exec().contains("Bob"));

        stream.iterator().next();
        stream.close();
        Assert.assertEquals(0, this.transport.getOpenResponses());
        try (Stream<byte[]> other = this.connection.export().execStream()) {
            Assert.assertTrue(other.iterator().hasNext());
        }
    }

    @Test
    public void testClose() throws Throwable {
        this.connection.begin();
        this.connection.add(example());
        final Stream<byte[]> stream = this.connection.export().execStream();
        Assert.assertEquals(1, this.transport.getOpenResponses());

        this.connection.close();
        Assert.assertEquals("test/transaction/rollback/tx-1", this.transport.getLastRequest()
                .getPath());
        Assert.assertEquals(TransactionState.CLOSED, this.connection.getState());
        Assert.assertNull(this.connection.getTransactionID());
        Assert.assertEquals(0, this.transport.getOpenResponses());
        Assert.assertTrue(this.transport.isClosed());
        Assert.assertTrue(stream.isClosed());
        try {
            stream.iterator();
            Assert.fail();
        } catch (final IllegalStateException ex) {
            // ok
        }
        stream.close();

        this.connection.close();
        try {
            this.connection.begin();
            Assert.fail();
        } catch (final UsageException ex) {
            // ok
        }
        try {
            this.connection.select("SELECT * WHERE { ?s ?p ?o }");
            Assert.fail();
        } catch (final UsageException ex) {
            // ok
        }
        try {
            this.connection.docs();
            Assert.fail();
        } catch (final UsageException ex) {
            // ok
        }
        Assert.assertEquals(TransactionState.CLOSED, this.connection.getState());
    }

    @Test
    public void testCloseWithRollbackFailure() throws Throwable {
        this.connection.begin();
        this.transport.fail("rollback/tx-1", 500, null, "Internal error");
        this.connection.close();
        Assert.assertEquals(TransactionState.CLOSED, this.connection.getState());
        Assert.assertTrue(this.transport.isClosed());
    }

    @Test
    public void testOperationReuse() throws Throwable {
        load(example());
        final Operation.Ask ask = this.connection.ask("ASK { ?p <" + FOAF + "name> ?n }");
        final int requests = this.transport.getRequests().size();
        Assert.assertTrue(ask.exec());
        Assert.assertTrue(ask.exec());
        Assert.assertEquals(requests + 2, this.transport.getRequests().size());
    }

}
