/**
 * Copyright (C) 2024  Wikimedia Foundation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.wikimedia.analytics.pvstream.core;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.wikimedia.analytics.pvstream.core.filter.PageviewFilter;
import org.wikimedia.analytics.pvstream.core.source.GzipContentStream;
import org.wikimedia.analytics.pvstream.core.source.LineSplitter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestPageviewStream {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private File dump(String... lines) throws IOException {
        return PageviewDumps.write(folder.newFile(), PageviewDumps.gzipLines(lines));
    }

    private static List<RowResult> drain(PageviewStream stream) {
        List<RowResult> results = new ArrayList<>();
        for (RowResult result : stream) {
            results.add(result);
        }
        return results;
    }

    @Test
    public void testFilteredMobileRow() throws Exception {
        File file = dump("en.m Rust_(programming_language) 42 -");
        PageviewFilter filter = PageviewFilter.builder().domainCodes("en.m").minViews(10).build();

        try (PageviewStream stream = Pageviews.streamFromFile(file.toPath(), filter)) {
            List<RowResult> results = drain(stream);

            assertEquals(1, results.size());
            PageviewRow row = results.get(0).getRow();
            assertEquals("en.m", row.getDomainCode());
            assertEquals("Rust_(programming_language)", row.getPageTitle());
            assertEquals(42L, row.getViews());
            assertEquals("en", row.getLanguage());
            assertEquals("wikipedia.org", row.getDomain());
            assertTrue(row.isMobile());
        }
    }

    @Test
    public void testRowBelowMinViewsIsDropped() throws Exception {
        File file = dump("fr Paris 3");
        PageviewFilter filter = PageviewFilter.builder().minViews(10).build();

        try (PageviewStream stream = Pageviews.streamFromFile(file.toPath(), filter)) {
            assertFalse(stream.hasNext());
            assertEquals(1, stream.getLinesRead());
        }
    }

    @Test
    public void testParseErrorDoesNotStopTheStream() throws Exception {
        File file = dump("badline", "de Berlin 7 0");

        try (PageviewStream stream = Pageviews.streamFromFile(file.toPath(), PageviewFilter.acceptAll())) {
            List<RowResult> results = drain(stream);

            assertEquals(2, results.size());
            assertFalse(results.get(0).isOk());
            assertThat(results.get(0).getError()).isInstanceOf(LineParseException.class);
            assertEquals(1L, results.get(0).getError().getLineNumber());
            assertEquals("Berlin", results.get(1).getRow().getPageTitle());
            assertEquals(1, stream.getErrorsProduced());
            assertEquals(1, stream.getRowsProduced());
        }
    }

    @Test
    public void testLineRegexSuppressesMalformedLines() throws Exception {
        File file = dump("badline", "en A 1 0", "fr B 2 0");
        PageviewFilter filter = PageviewFilter.builder().lineRegex("^en ").build();

        try (PageviewStream stream = Pageviews.streamFromFile(file.toPath(), filter)) {
            List<RowResult> results = drain(stream);

            assertEquals(1, results.size());
            assertEquals("A", results.get(0).getRow().getPageTitle());
            assertEquals(3, stream.getLinesRead());
        }
    }

    @Test
    public void testDecodeErrorIsReportedEvenWithLineRegex() throws Exception {
        byte[] content = {'e', 'n', ' ', (byte) 0xFF, ' ', '1', ' ', '0', '\n', 'e', 'n', ' ', 'A', ' ', '1', '\n'};
        File file = PageviewDumps.write(folder.newFile(), PageviewDumps.gzip(content));
        PageviewFilter filter = PageviewFilter.builder().lineRegex("^en ").build();

        try (PageviewStream stream = Pageviews.streamFromFile(file.toPath(), filter)) {
            List<RowResult> results = drain(stream);

            assertEquals(2, results.size());
            assertThat(results.get(0).getError()).isInstanceOf(LineDecodeException.class);
            assertEquals(1L, results.get(0).getError().getLineNumber());
            assertTrue(results.get(1).isOk());
        }
    }

    @Test
    public void testUnknownDomainCodePassesThrough() throws Exception {
        File file = dump("xx.unknown Page 5 0");

        try (PageviewStream stream = Pageviews.streamFromFile(file.toPath(), PageviewFilter.acceptAll())) {
            PageviewRow row = stream.next().getRow();

            assertEquals("xx", row.getLanguage());
            assertEquals(null, row.getDomain());
            assertFalse(row.isMobile());
        }
    }

    @Test
    public void testUnknownDomainCodeFailsLanguageAndDomainFilters() throws Exception {
        File file = dump("en.m.b Foo 5 0", "xx.unknown Bar 6 0", "en Baz 7 0");
        PageviewFilter byLanguage = PageviewFilter.builder().languages("en", "xx").build();
        PageviewFilter byDomain = PageviewFilter.builder().domains("wikipedia.org").build();

        for (PageviewFilter filter : Arrays.asList(byLanguage, byDomain)) {
            try (PageviewStream stream = Pageviews.streamFromFile(file.toPath(), filter)) {
                List<RowResult> results = drain(stream);

                assertEquals(1, results.size());
                assertEquals("Baz", results.get(0).getRow().getPageTitle());
            }
        }
    }

    @Test
    public void testUnknownDomainCodePassesOtherFilters() throws Exception {
        File file = dump("en.m.b Foo 5 0", "xx.unknown Bar 6 0");
        PageviewFilter filter = PageviewFilter.builder().minViews(5).mobile(false).build();

        try (PageviewStream stream = Pageviews.streamFromFile(file.toPath(), filter)) {
            List<RowResult> results = drain(stream);

            assertEquals(2, results.size());
            assertEquals("en", results.get(0).getRow().getLanguage());
            assertFalse(results.get(0).getRow().isKnown());
            assertEquals("xx", results.get(1).getRow().getLanguage());
        }
    }

    @Test
    public void testRowsComeInFileOrder() throws Exception {
        File file = dump("en A 1 0", "en B 2 0", "en C 3 0", "en D 4 0");

        try (PageviewStream stream = Pageviews.streamFromFile(file.toPath(), PageviewFilter.acceptAll())) {
            List<String> titles = new ArrayList<>();
            for (RowResult result : stream) {
                titles.add(result.getRow().getPageTitle());
            }
            assertEquals(Arrays.asList("A", "B", "C", "D"), titles);
        }
    }

    @Test
    public void testExhaustionClosesTheStream() throws Exception {
        File file = dump("en A 1 0");

        PageviewStream stream = Pageviews.streamFromFile(file.toPath(), PageviewFilter.acceptAll());
        stream.next();
        assertFalse(stream.isClosed());
        assertFalse(stream.hasNext());
        assertTrue(stream.isClosed());
        try {
            stream.next();
            fail("Expected NoSuchElementException");
        } catch (NoSuchElementException e) {
            // expected
        }
    }

    @Test
    public void testEarlyCloseReleasesSource() throws Exception {
        TrackingInputStream compressed = new TrackingInputStream(PageviewDumps.gzipLines("en A 1 0", "en B 2 0"));
        PageviewStream stream = new PageviewStream("test",
            new LineSplitter(new GzipContentStream(compressed, 64, "test"), 64), PageviewFilter.acceptAll());

        assertTrue(stream.hasNext());
        stream.close();
        stream.close();

        assertTrue(compressed.closed);
        assertFalse(stream.hasNext());
    }

    @Test
    public void testCorruptDataIsFatal() throws Exception {
        File file = PageviewDumps.write(folder.newFile(), "not gzip at all".getBytes(StandardCharsets.UTF_8));

        PageviewStream stream = Pageviews.streamFromFile(file.toPath(), PageviewFilter.acceptAll());
        try {
            stream.hasNext();
            fail("Expected UncheckedIOException");
        } catch (UncheckedIOException e) {
            assertThat(e.getCause()).isInstanceOf(SourceException.class);
            assertEquals(SourceException.Kind.DECOMPRESSION, ((SourceException) e.getCause()).getKind());
        }
        assertTrue(stream.isClosed());
        assertFalse(stream.hasNext());
    }

    @Test
    public void testMissingFile() {
        try {
            Pageviews.streamFromFile(folder.getRoot().toPath().resolve("nope.gz"), PageviewFilter.acceptAll());
            fail("Expected SourceException");
        } catch (SourceException e) {
            assertEquals(SourceException.Kind.NOT_FOUND, e.getKind());
        }
    }

    @Test
    public void testIterableOnlyOnce() throws Exception {
        File file = dump("en A 1 0");

        try (PageviewStream stream = Pageviews.streamFromFile(file.toPath(), PageviewFilter.acceptAll())) {
            Iterator<RowResult> first = stream.iterator();
            assertTrue(first.hasNext());
            try {
                stream.iterator();
                fail("Expected IllegalStateException");
            } catch (IllegalStateException e) {
                // expected
            }
        }
    }

    private static class TrackingInputStream extends ByteArrayInputStream {

        private boolean closed;

        TrackingInputStream(byte[] content) {
            super(content);
        }

        @Override
        public void close() throws IOException {
            closed = true;
            super.close();
        }
    }
}
