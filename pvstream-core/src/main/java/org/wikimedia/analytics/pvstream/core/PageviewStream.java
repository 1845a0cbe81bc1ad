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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;

import org.apache.log4j.Logger;
import org.wikimedia.analytics.pvstream.core.filter.PageviewFilter;
import org.wikimedia.analytics.pvstream.core.source.ContentSource;
import org.wikimedia.analytics.pvstream.core.source.LineSplitter;

/**
 * The filtered, decoded rows of a pageview dump, pulled one at a time.
 * <p>
 * Every call to {@link #hasNext()} reads just as many lines as needed to
 * produce the next accepted row or per-row error, so memory use does not
 * depend on the size of the dump. Lines failing to parse or decode come out
 * as error elements ({@link RowResult#getError()}) and the stream goes on.
 * <p>
 * A failure of the source itself is fatal: it is thrown from
 * {@link #hasNext()} or {@link #next()} as an {@link UncheckedIOException}
 * wrapping the {@link SourceException}, the stream is closed and yields
 * nothing more.
 * <p>
 * The underlying file or connection is released once the stream is
 * exhausted, on a fatal failure, or on {@link #close()}. Callers stopping
 * early should use try-with-resources:
 * <pre>
 * try (PageviewStream rows = Pageviews.streamFromFile(path, filter)) {
 *     for (RowResult result : rows) { ... }
 * }
 * </pre>
 * Instances are single-pass and not thread safe.
 */
public class PageviewStream implements Iterator<RowResult>, Iterable<RowResult>, Closeable {

    private static final Logger LOG = Logger.getLogger(PageviewStream.class.getName());

    private final String description;
    private final LineSplitter lines;
    private final PageviewFilter filter;

    private RowResult next;
    private boolean closed;
    private boolean iterated;

    private long linesRead;
    private long rowsProduced;
    private long errorsProduced;

    PageviewStream(String description, LineSplitter lines, PageviewFilter filter) {
        this.description = description;
        this.lines = lines;
        this.filter = filter;
    }

    /**
     * Opens a source and assembles the stream over it.
     *
     * @throws SourceException if the source cannot be opened
     */
    public static PageviewStream open(ContentSource source, PageviewFilter filter) throws SourceException {
        InputStream in = source.open();
        LineSplitter lines = new LineSplitter(in, source.getSettings().getReadBufferSize());
        return new PageviewStream(source.describe(), lines, filter);
    }

    @Override
    public boolean hasNext() {
        if (next == null && !closed) {
            try {
                next = advance();
            } catch (SourceException e) {
                closeAfterFailure(e);
                throw new UncheckedIOException(e);
            }
            if (next == null) {
                closeOnExhaustion();
            }
        }
        return next != null;
    }

    @Override
    public RowResult next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        RowResult result = next;
        next = null;
        return result;
    }

    /**
     * @return this stream; it can only be iterated once
     */
    @Override
    public Iterator<RowResult> iterator() {
        if (iterated) {
            throw new IllegalStateException("PageviewStream can only be iterated once");
        }
        iterated = true;
        return this;
    }

    private RowResult advance() throws SourceException {
        LineSplitter.Line line;
        while ((line = lines.readLine()) != null) {
            linesRead++;
            if (!line.isDecoded()) {
                errorsProduced++;
                return RowResult.error(new LineDecodeException(line.getNumber(), line.getDecodeError()));
            }

            String text = line.getText();
            if (!filter.acceptsLine(text)) {
                continue;
            }

            PageviewRow row;
            try {
                row = PageviewLineParser.parse(text, line.getNumber());
            } catch (LineParseException e) {
                errorsProduced++;
                return RowResult.error(e);
            }

            if (filter.accepts(row)) {
                rowsProduced++;
                return RowResult.ok(row);
            }
        }
        return null;
    }

    public long getLinesRead() {
        return linesRead;
    }

    public long getRowsProduced() {
        return rowsProduced;
    }

    public long getErrorsProduced() {
        return errorsProduced;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        next = null;
        lines.close();
    }

    private void closeAfterFailure(SourceException failure) {
        try {
            close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    private void closeOnExhaustion() {
        try {
            close();
        } catch (IOException e) {
            // every row was delivered, the failure is still reported
            throw new UncheckedIOException(
                new SourceException(SourceException.Kind.READ, "Failed closing " + description, e));
        }
        LOG.debug("Finished " + description + ": " + linesRead + " lines, "
            + rowsProduced + " rows, " + errorsProduced + " errors");
    }
}
