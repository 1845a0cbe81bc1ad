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

package org.wikimedia.analytics.pvstream.core.source;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;

import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.wikimedia.analytics.pvstream.core.SourceException;

/**
 * Gzip decompression of a source's bytes.
 * <p>
 * The gzip header is not read when the stream is created but on the first
 * read, so corrupt data is reported when the pipeline reaches it rather than
 * when the source is opened. Concatenated members are read as one stream,
 * whatever the pace at which their bytes arrive; anything after a member
 * that is not another valid member is an error.
 * <p>
 * Transport failures arrive already as {@link SourceException}s and pass
 * through; every other failure is reported as
 * {@link SourceException.Kind#DECOMPRESSION}.
 */
public class GzipContentStream extends InputStream {

    private final InputStream compressed;
    private final int bufferSize;
    private final String description;

    private GzipCompressorInputStream decompressed;
    private boolean closed;

    public GzipContentStream(InputStream compressed, int bufferSize, String description) {
        this.compressed = compressed;
        this.bufferSize = bufferSize;
        this.description = description;
    }

    private InputStream decompressed() throws IOException {
        if (closed) {
            throw new IOException("Stream closed");
        }
        if (decompressed == null) {
            try {
                decompressed = new GzipCompressorInputStream(new BufferedInputStream(compressed, bufferSize), true);
            } catch (IOException e) {
                throw translate(e);
            }
        }
        return decompressed;
    }

    @Override
    public int read() throws IOException {
        InputStream in = decompressed();
        try {
            return in.read();
        } catch (IOException e) {
            throw translate(e);
        }
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        InputStream in = decompressed();
        try {
            return in.read(b, off, len);
        } catch (IOException e) {
            throw translate(e);
        }
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        if (decompressed != null) {
            decompressed.close();
        } else {
            compressed.close();
        }
    }

    private SourceException translate(IOException e) {
        if (e instanceof SourceException) {
            return (SourceException) e;
        }
        return new SourceException(SourceException.Kind.DECOMPRESSION, "Corrupt gzip data in " + description, e);
    }
}
