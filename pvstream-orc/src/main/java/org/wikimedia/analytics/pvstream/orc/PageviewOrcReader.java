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

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.hive.ql.exec.vector.BytesColumnVector;
import org.apache.hadoop.hive.ql.exec.vector.LongColumnVector;
import org.apache.hadoop.hive.ql.exec.vector.VectorizedRowBatch;
import org.apache.orc.CompressionKind;
import org.apache.orc.OrcFile;
import org.apache.orc.Reader;
import org.apache.orc.RecordReader;
import org.apache.orc.TypeDescription;
import org.wikimedia.analytics.pvstream.core.PageviewRow;

/**
 * Reads a pageview ORC file back into {@link PageviewRow}s.
 */
public class PageviewOrcReader implements Closeable {

    private final Path path;
    private final Reader reader;

    private PageviewOrcReader(Path path, Reader reader) {
        this.path = path;
        this.reader = reader;
    }

    public static PageviewOrcReader open(java.nio.file.Path file) throws IOException {
        return open(file, new Configuration());
    }

    /**
     * @throws IOException if the file cannot be read or does not have the
     *   pageview schema
     */
    public static PageviewOrcReader open(java.nio.file.Path file, Configuration conf) throws IOException {
        Path path = new Path(file.toAbsolutePath().toUri());
        Reader reader = OrcFile.createReader(path, OrcFile.readerOptions(conf));
        if (!PageviewOrcSchema.SCHEMA.equals(reader.getSchema())) {
            IOException e = new IOException("Unexpected schema in " + path + ": " + reader.getSchema());
            try {
                reader.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        return new PageviewOrcReader(path, reader);
    }

    public long getNumberOfRows() {
        return reader.getNumberOfRows();
    }

    public int getNumberOfStripes() {
        return reader.getStripes().size();
    }

    public TypeDescription getSchema() {
        return reader.getSchema();
    }

    public CompressionKind getCompression() {
        return reader.getCompressionKind();
    }

    /**
     * Passes every row, in file order, to the consumer.
     */
    public void forEachRow(Consumer<PageviewRow> consumer) throws IOException {
        VectorizedRowBatch batch = reader.getSchema().createRowBatch();
        try (RecordReader rows = reader.rows()) {
            while (rows.nextBatch(batch)) {
                BytesColumnVector domainCodes = (BytesColumnVector) batch.cols[PageviewOrcSchema.DOMAIN_CODE_COLUMN];
                BytesColumnVector pageTitles = (BytesColumnVector) batch.cols[PageviewOrcSchema.PAGE_TITLE_COLUMN];
                LongColumnVector views = (LongColumnVector) batch.cols[PageviewOrcSchema.VIEWS_COLUMN];
                BytesColumnVector languages = (BytesColumnVector) batch.cols[PageviewOrcSchema.LANGUAGE_COLUMN];
                BytesColumnVector domains = (BytesColumnVector) batch.cols[PageviewOrcSchema.DOMAIN_COLUMN];
                LongColumnVector mobile = (LongColumnVector) batch.cols[PageviewOrcSchema.MOBILE_COLUMN];

                for (int i = 0; i < batch.size; i++) {
                    consumer.accept(new PageviewRow(
                        getString(domainCodes, i),
                        getString(pageTitles, i),
                        getLong(views, i),
                        getString(languages, i),
                        getString(domains, i),
                        getLong(mobile, i) != 0));
                }
            }
        }
    }

    public List<PageviewRow> readAll() throws IOException {
        List<PageviewRow> result = new ArrayList<>();
        forEachRow(result::add);
        return result;
    }

    private static String getString(BytesColumnVector column, int row) {
        int index = column.isRepeating ? 0 : row;
        if (!column.noNulls && column.isNull[index]) {
            return null;
        }
        return new String(column.vector[index], column.start[index], column.length[index], StandardCharsets.UTF_8);
    }

    private static long getLong(LongColumnVector column, int row) {
        return column.vector[column.isRepeating ? 0 : row];
    }

    public Path getPath() {
        return path;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
