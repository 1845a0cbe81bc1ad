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

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.net.URLConnection;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import org.apache.commons.io.IOUtils;
import org.apache.commons.io.input.BoundedInputStream;
import org.apache.log4j.Logger;
import org.wikimedia.analytics.pvstream.core.SourceException;
import org.wikimedia.analytics.pvstream.core.StreamSettings;

/**
 * A dump served over HTTP(S), e.g. from
 * https://dumps.wikimedia.org/other/pageviews/.
 * <p>
 * Opening the source issues a single GET request; the response body is read
 * incrementally as the pipeline pulls and is never held in memory as a whole.
 * There are no retries.
 */
public class UrlContentSource extends ContentSource {

    private static final Logger LOG = Logger.getLogger(UrlContentSource.class.getName());

    private final URL url;

    public UrlContentSource(URL url, StreamSettings settings) {
        super(settings);
        this.url = url;
    }

    @Override
    protected InputStream openCompressed() throws SourceException {
        HttpURLConnection connection = connect();
        InputStream body;
        try {
            body = connection.getInputStream();
        } catch (IOException e) {
            connection.disconnect();
            throw new SourceException(SourceException.Kind.CONNECTION, "Failed reading response of " + url, e);
        }
        return new ConnectionInputStream(body, connection, url.toString());
    }

    /**
     * Downloads the compressed dump as is to a local file, creating or
     * truncating it. At most {@link StreamSettings#getDownloadMaxBytes()}
     * bytes are copied.
     * <p>
     * Useful when the same dump is to be parsed several times; for a single
     * pass, streaming the URL directly avoids the disk round trip.
     *
     * @return the number of bytes written
     * @throws SourceException if the download fails
     * @throws IOException if the target cannot be written
     */
    public long downloadTo(Path target) throws IOException {
        try (InputStream in = new BoundedInputStream(openCompressed(), settings.getDownloadMaxBytes());
             OutputStream out = Files.newOutputStream(target,
                 StandardOpenOption.CREATE,
                 StandardOpenOption.TRUNCATE_EXISTING,
                 StandardOpenOption.WRITE)) {
            long copied = IOUtils.copyLarge(in, out);
            LOG.info("Downloaded " + copied + " bytes from " + url + " to " + target);
            return copied;
        }
    }

    private HttpURLConnection connect() throws SourceException {
        URLConnection urlConnection;
        try {
            urlConnection = url.openConnection();
        } catch (IOException e) {
            throw new SourceException(SourceException.Kind.CONNECTION, "Failed connecting to " + url, e);
        }
        if (!(urlConnection instanceof HttpURLConnection)) {
            throw new SourceException(SourceException.Kind.CONNECTION,
                "Unsupported URL scheme '" + url.getProtocol() + "' in " + url);
        }

        HttpURLConnection connection = (HttpURLConnection) urlConnection;
        connection.setConnectTimeout(settings.getConnectTimeoutMs());
        connection.setReadTimeout(settings.getReadTimeoutMs());
        connection.setRequestProperty("User-Agent", settings.getUserAgent());

        int status;
        try {
            status = connection.getResponseCode();
        } catch (IOException e) {
            connection.disconnect();
            throw new SourceException(SourceException.Kind.CONNECTION, "Failed connecting to " + url, e);
        }

        if (status < 200 || status >= 300) {
            LOG.warn("Got HTTP status " + status + " for " + url);
            connection.disconnect();
            throw new SourceException(SourceException.Kind.CONNECTION,
                "HTTP status " + status + " for " + url);
        }

        LOG.info("Streaming pageviews from " + url);
        return connection;
    }

    @Override
    public String describe() {
        return url.toString();
    }

    /**
     * Response body that releases its connection when closed.
     */
    private static class ConnectionInputStream extends TransportInputStream {

        private final HttpURLConnection connection;

        ConnectionInputStream(InputStream body, HttpURLConnection connection, String description) {
            super(body, SourceException.Kind.CONNECTION, description);
            this.connection = connection;
        }

        @Override
        public void close() throws IOException {
            try {
                super.close();
            } finally {
                connection.disconnect();
            }
        }
    }
}
