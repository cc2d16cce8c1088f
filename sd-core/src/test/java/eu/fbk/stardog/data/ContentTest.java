package eu.fbk.stardog.data;

import java.io.File;
import java.net.URL;

import com.google.common.base.Charsets;
import com.google.common.io.Files;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class ContentTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testRaw() throws Throwable {
        final Content content = Content.raw("<urn:s> <urn:p> \"è\" .", "text/turtle");
        Assert.assertEquals("text/turtle", content.getMediaType());
        Assert.assertNull(content.getEncoding());
        Assert.assertNull(content.getName());
        Assert.assertNull(content.getContext());
        Assert.assertEquals("<urn:s> <urn:p> \"è\" .",
                content.getSource().asCharSource(Charsets.UTF_8).read());

        final Content withContext = content.withContext("urn:g");
        Assert.assertEquals("urn:g", withContext.getContext());
        Assert.assertNull(content.getContext());
        Assert.assertEquals("text/turtle", withContext.getMediaType());
    }

    @Test
    public void testFile() throws Throwable {
        final File turtle = this.folder.newFile("data.ttl");
        Files.write("<urn:s> <urn:p> <urn:o> .", turtle, Charsets.UTF_8);
        final Content content = Content.file(turtle);
        Assert.assertEquals("text/turtle", content.getMediaType());
        Assert.assertNull(content.getEncoding());
        Assert.assertEquals("data.ttl", content.getName());
        Assert.assertEquals(turtle.length(), content.getSource().size());

        final Content gzipped = Content.file(new File(this.folder.getRoot(), "data.rdf.gz"));
        Assert.assertEquals("application/rdf+xml", gzipped.getMediaType());
        Assert.assertEquals(Content.GZIP, gzipped.getEncoding());

        Assert.assertEquals("text/plain", Content.file(new File("notes.txt")).getMediaType());
        Assert.assertEquals("application/pdf", Content.file(new File("paper.pdf"))
                .getMediaType());
        Assert.assertEquals("application/graphql", Content.file(new File("people.graphql"))
                .getMediaType());
        Assert.assertEquals("application/x-custom", Content.file(new File("data.bin"),
                "application/x-custom").getMediaType());

        try {
            Content.file(new File("data.unknown"));
            Assert.fail();
        } catch (final IllegalArgumentException ex) {
            // ok
        }
    }

    @Test
    public void testUrl() throws Throwable {
        final URL url = ContentTest.class.getResource("/eu/fbk/stardog/example.ttl");
        final Content content = Content.url(url).withContext("urn:g");
        Assert.assertEquals("text/turtle", content.getMediaType());
        Assert.assertEquals("example.ttl", content.getName());
        Assert.assertEquals("urn:g", content.getContext());
        Assert.assertTrue(content.getSource().asCharSource(Charsets.UTF_8).read()
                .contains("Alice"));
        Assert.assertTrue(content.toString().contains("example.ttl"));
    }

}
