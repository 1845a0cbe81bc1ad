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

package org.wikimedia.analytics.pvstream.core.batch;

import java.io.IOException;
import java.io.UncheckedIOException;

import com.google.common.base.Preconditions;
import org.apache.log4j.Logger;
import org.wikimedia.analytics.pvstream.core.PageviewStream;
import org.wikimedia.analytics.pvstream.core.RowResult;
import org.wikimedia.analytics.pvstream.core.SourceException;
import org.wikimedia.analytics.pvstream.core.WriteException;

/**
 * Drains a {@link PageviewStream} into a {@link BatchSink}.
 * <p>
 * Accepted rows are gathered in stream order into batches of
 * {@code batchSize} rows, each full batch is flushed as one block, and a
 * last partial batch is flushed when the stream ends. Lines failing to parse
 * or decode are left out and counted. Source and sink failures abort the
 * whole write.
 */
public class BatchedRowWriter {

    private static final Logger LOG = Logger.getLogger(BatchedRowWriter.class.getName());

    private final BatchSink sink;
    private final int batchSize;

    public BatchedRowWriter(BatchSink sink, int batchSize) {
        Preconditions.checkArgument(batchSize > 0, "batch size must be > 0, got %s", batchSize);
        this.sink = Preconditions.checkNotNull(sink);
        this.batchSize = batchSize;
    }

    /**
     * Writes every accepted row of the stream and finishes the sink. The
     * stream is closed in all cases.
     *
     * @throws SourceException if the stream fails; the sink is aborted
     * @throws WriteException if the sink fails; the sink is aborted
     */
    public WriteSummary write(PageviewStream rows) throws SourceException, WriteException {
        RowBatch batch = new RowBatch(batchSize);
        long rowsWritten = 0;
        long blocksWritten = 0;
        long rowsSkipped = 0;

        try {
            while (hasNext(rows)) {
                RowResult result = rows.next();
                if (!result.isOk()) {
                    rowsSkipped++;
                    LOG.debug("Skipping line: " + result.getError().getMessage());
                    continue;
                }
                batch.add(result.getRow());
                if (batch.isFull()) {
                    rowsWritten += flush(batch);
                    blocksWritten++;
                }
            }
            if (!batch.isEmpty()) {
                rowsWritten += flush(batch);
                blocksWritten++;
            }
            sink.finish();
        } catch (SourceException | WriteException | RuntimeException e) {
            sink.abort(e);
            closeAfterFailure(rows, e);
            throw e;
        }

        close(rows);
        WriteSummary summary = new WriteSummary(rowsWritten, blocksWritten, rowsSkipped);
        if (rowsSkipped > 0) {
            LOG.warn("Skipped " + rowsSkipped + " lines that failed to parse or decode");
        }
        LOG.info("Wrote " + summary);
        return summary;
    }

    private int flush(RowBatch batch) throws WriteException {
        int size = batch.size();
        sink.writeBatch(batch);
        batch.clear();
        return size;
    }

    private static boolean hasNext(PageviewStream rows) throws SourceException {
        try {
            return rows.hasNext();
        } catch (UncheckedIOException e) {
            IOException cause = e.getCause();
            if (cause instanceof SourceException) {
                throw (SourceException) cause;
            }
            throw e;
        }
    }

    private static void close(PageviewStream rows) throws SourceException {
        try {
            rows.close();
        } catch (SourceException e) {
            throw e;
        } catch (IOException e) {
            throw new SourceException(SourceException.Kind.READ, "Failed closing pageview stream", e);
        }
    }

    private static void closeAfterFailure(PageviewStream rows, Exception failure) {
        try {
            rows.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }
}
