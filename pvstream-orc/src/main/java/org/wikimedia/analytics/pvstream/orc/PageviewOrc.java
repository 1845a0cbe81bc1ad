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

package org.wikimedia.analytics.pvstream.orc;

import java.io.IOException;
import java.net.URL;
import java.nio.file.Path;

import com.google.common.base.Preconditions;
import org.apache.hadoop.conf.Configuration;
import org.wikimedia.analytics.pvstream.core.PageviewStream;
import org.wikimedia.analytics.pvstream.core.SourceException;
import org.wikimedia.analytics.pvstream.core.WriteException;
import org.wikimedia.analytics.pvstream.core.batch.BatchedRowWriter;
import org.wikimedia.analytics.pvstream.core.batch.WriteSummary;
import org.wikimedia.analytics.pvstream.core.filter.PageviewFilter;
import org.wikimedia.analytics.pvstream.core.source.ContentSource;

/**
 * Entry points for converting a pageview dump into an ORC file.
 * <p>
 * The source is opened before the output is created, so a missing input
 * leaves no output behind. Lines failing to parse or decode are skipped and
 * counted in the returned {@link WriteSummary}.
 */
public final class PageviewOrc {

    private PageviewOrc() {
    }

    public static WriteSummary writeFromFile(Path input, Path output, PageviewFilter filter)
        throws SourceException, WriteException {
        ContentSource source = ContentSource.forFile(input);
        return write(source, output, source.getSettings().getBatchSize(), filter, new Configuration());
    }

    public static WriteSummary writeFromFile(Path input, Path output, int batchSize, PageviewFilter filter)
        throws SourceException, WriteException {
        return write(ContentSource.forFile(input), output, batchSize, filter, new Configuration());
    }

    public static WriteSummary writeFromUrl(URL input, Path output, PageviewFilter filter)
        throws SourceException, WriteException {
        ContentSource source = ContentSource.forUrl(input);
        return write(source, output, source.getSettings().getBatchSize(), filter, new Configuration());
    }

    public static WriteSummary writeFromUrl(URL input, Path output, int batchSize, PageviewFilter filter)
        throws SourceException, WriteException {
        return write(ContentSource.forUrl(input), output, batchSize, filter, new Configuration());
    }

    /**
     * Streams the source through the filter into an ORC file at
     * {@code output}, ending a stripe after every {@code batchSize} rows.
     * <p>
     * A batch only maps to exactly one stripe while its encoded size stays
     * under {@code orc.stripe.size} (64 MiB by default): the ORC writer cuts a
     * bigger batch into several stripes on its own. Raise the stripe size in
     * {@code conf} along with the batch size to keep the mapping.
     *
     * @param conf Hadoop configuration for the ORC writer (compression,
     *   stripe size, file system)
     * @throws SourceException if the source fails; fatal
     * @throws WriteException if the output cannot be written; fatal
     */
    public static WriteSummary write(ContentSource source, Path output, int batchSize,
                                     PageviewFilter filter, Configuration conf)
        throws SourceException, WriteException {
        Preconditions.checkArgument(batchSize > 0, "batch size must be > 0, got %s", batchSize);

        PageviewStream rows = PageviewStream.open(source, filter);
        OrcBatchSink sink;
        try {
            sink = OrcBatchSink.create(output, conf);
        } catch (WriteException e) {
            try {
                rows.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        return new BatchedRowWriter(sink, batchSize).write(rows);
    }
}
