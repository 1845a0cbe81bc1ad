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
import java.nio.charset.StandardCharsets;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.hive.ql.exec.vector.BytesColumnVector;
import org.apache.hadoop.hive.ql.exec.vector.LongColumnVector;
import org.apache.hadoop.hive.ql.exec.vector.VectorizedRowBatch;
import org.apache.log4j.Logger;
import org.apache.orc.OrcFile;
import org.apache.orc.TypeDescription;
import org.apache.orc.Writer;
import org.wikimedia.analytics.pvstream.core.WriteException;
import org.wikimedia.analytics.pvstream.core.batch.BatchSink;
import org.wikimedia.analytics.pvstream.core.batch.RowBatch;

/**
 * Writes row batches to an ORC file, ending a stripe after each batch.
 * Batches larger than {@code orc.stripe.size} span several stripes.
 * <p>
 * An existing file at the output path is overwritten. If the write is
 * aborted the partial file is removed.
 */
public class OrcBatchSink implements BatchSink {

    private static final Logger LOG = Logger.getLogger(OrcBatchSink.class.getName());

    private final Path path;
    private final Configuration conf;
    private final Writer writer;
    private final TypeDescription schema;

    private boolean done;
    private long stripes;

    OrcBatchSink(Path path, Configuration conf, Writer writer, TypeDescription schema) {
        this.path = path;
        this.conf = conf;
        this.writer = writer;
        this.schema = schema;
    }

    /**
     * Creates the output file and an ORC writer on it.
     *
     * @throws WriteException if the file cannot be created
     */
    public static OrcBatchSink create(java.nio.file.Path output, Configuration conf) throws WriteException {
        Path path = new Path(output.toAbsolutePath().toUri());
        TypeDescription schema = PageviewOrcSchema.create();
        Writer writer;
        try {
            writer = OrcFile.createWriter(path, OrcFile.writerOptions(conf)
                .setSchema(schema)
                .overwrite(true));
        } catch (IOException e) {
            throw new WriteException("Failed creating ORC file " + path, e);
        }
        return new OrcBatchSink(path, conf, writer, schema);
    }

    @Override
    public void writeBatch(RowBatch batch) throws WriteException {
        checkOpen();
        if (batch.isEmpty()) {
            return;
        }
        try {
            writer.addRowBatch(toVectorized(batch));
            // closes the stripe so every batch is its own block
            writer.writeIntermediateFooter();
        } catch (IOException e) {
            throw new WriteException("Failed writing " + batch.size() + " rows to " + path, e);
        }
        stripes++;
    }

    VectorizedRowBatch toVectorized(RowBatch batch) {
        int size = batch.size();
        VectorizedRowBatch vectorized = schema.createRowBatch(size);
        BytesColumnVector domainCodes = (BytesColumnVector) vectorized.cols[PageviewOrcSchema.DOMAIN_CODE_COLUMN];
        BytesColumnVector pageTitles = (BytesColumnVector) vectorized.cols[PageviewOrcSchema.PAGE_TITLE_COLUMN];
        LongColumnVector views = (LongColumnVector) vectorized.cols[PageviewOrcSchema.VIEWS_COLUMN];
        BytesColumnVector languages = (BytesColumnVector) vectorized.cols[PageviewOrcSchema.LANGUAGE_COLUMN];
        BytesColumnVector domains = (BytesColumnVector) vectorized.cols[PageviewOrcSchema.DOMAIN_COLUMN];
        LongColumnVector mobile = (LongColumnVector) vectorized.cols[PageviewOrcSchema.MOBILE_COLUMN];

        for (int i = 0; i < size; i++) {
            setString(domainCodes, i, batch.getDomainCodes()[i]);
            setString(pageTitles, i, batch.getPageTitles()[i]);
            views.vector[i] = batch.getViews()[i];
            setString(languages, i, batch.getLanguages()[i]);
            setString(domains, i, batch.getDomains()[i]);
            mobile.vector[i] = batch.getMobile()[i] ? 1 : 0;
        }
        vectorized.size = size;
        return vectorized;
    }

    private static void setString(BytesColumnVector column, int row, String value) {
        if (value == null) {
            column.noNulls = false;
            column.isNull[row] = true;
            return;
        }
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        column.setRef(row, bytes, 0, bytes.length);
    }

    @Override
    public void finish() throws WriteException {
        checkOpen();
        done = true;
        try {
            writer.close();
        } catch (IOException e) {
            throw new WriteException("Failed finalizing ORC file " + path, e);
        }
        LOG.info("Finalized ORC file " + path + " (" + stripes + " stripes)");
    }

    @Override
    public void abort(Exception cause) {
        if (done) {
            return;
        }
        done = true;
        try {
            writer.close();
        } catch (IOException | RuntimeException e) {
            cause.addSuppressed(e);
        }
        try {
            FileSystem fs = path.getFileSystem(conf);
            fs.delete(path, false);
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
        LOG.warn("Aborted ORC file " + path + ": " + cause.getMessage());
    }

    private void checkOpen() throws WriteException {
        if (done) {
            throw new WriteException("ORC file " + path + " is already closed");
        }
    }

    public Path getPath() {
        return path;
    }
}
