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

import java.io.InputStream;
import java.net.URL;
import java.nio.file.Path;

import org.wikimedia.analytics.pvstream.core.SourceException;
import org.wikimedia.analytics.pvstream.core.StreamSettings;

/**
 * Where the gzip-compressed bytes of a pageview dump come from.
 * <p>
 * A source is opened once per pipeline run. The stream it returns is
 * single-pass, decompresses lazily, and must be closed by the caller.
 */
public abstract class ContentSource {

    protected final StreamSettings settings;

    protected ContentSource(StreamSettings settings) {
        this.settings = settings;
    }

    public static ContentSource forFile(Path path) {
        return new FileContentSource(path, StreamSettings.fromSystemProperties());
    }

    public static ContentSource forFile(Path path, StreamSettings settings) {
        return new FileContentSource(path, settings);
    }

    public static ContentSource forUrl(URL url) {
        return new UrlContentSource(url, StreamSettings.fromSystemProperties());
    }

    public static ContentSource forUrl(URL url, StreamSettings settings) {
        return new UrlContentSource(url, settings);
    }

    /**
     * Opens the compressed bytes. Transport failures while reading them must
     * surface as {@link SourceException}s.
     *
     * @throws SourceException if the content cannot be reached
     */
    protected abstract InputStream openCompressed() throws SourceException;

    /**
     * @return a human readable name of the source, for logs and errors
     */
    public abstract String describe();

    public StreamSettings getSettings() {
        return settings;
    }

    /**
     * Opens the source and returns its decompressed bytes.
     *
     * @throws SourceException if the content cannot be reached; corrupt
     *   compressed data is only reported once it is read
     */
    public InputStream open() throws SourceException {
        return new GzipContentStream(openCompressed(), settings.getReadBufferSize(), describe());
    }

    @Override
    public String toString() {
        return describe();
    }
}
