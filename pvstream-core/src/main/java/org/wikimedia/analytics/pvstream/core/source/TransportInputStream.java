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

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

import org.wikimedia.analytics.pvstream.core.SourceException;

/**
 * Wraps the raw bytes of a source so that transport failures surface as
 * {@link SourceException}s of the source's kind, and can be told apart from
 * failures of the decompression layered on top.
 */
class TransportInputStream extends FilterInputStream {

    private final SourceException.Kind failureKind;
    private final String description;

    TransportInputStream(InputStream in, SourceException.Kind failureKind, String description) {
        super(in);
        this.failureKind = failureKind;
        this.description = description;
    }

    @Override
    public int read() throws IOException {
        try {
            return super.read();
        } catch (IOException e) {
            throw tag(e);
        }
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        try {
            return in.read(b, off, len);
        } catch (IOException e) {
            throw tag(e);
        }
    }

    @Override
    public long skip(long n) throws IOException {
        try {
            return super.skip(n);
        } catch (IOException e) {
            throw tag(e);
        }
    }

    @Override
    public int available() throws IOException {
        try {
            return super.available();
        } catch (IOException e) {
            throw tag(e);
        }
    }

    private SourceException tag(IOException e) {
        if (e instanceof SourceException) {
            return (SourceException) e;
        }
        return new SourceException(failureKind, "Failed reading " + description, e);
    }
}
