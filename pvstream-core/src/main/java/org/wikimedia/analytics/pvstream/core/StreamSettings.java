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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * Tuning knobs of the ingest pipeline.
 * <p>
 * Each value can be overridden with a JVM system property, e.g.
 * {@code -Dpvstream.http.read.timeout.ms=120000}. Unset or unparsable
 * properties fall back to the defaults below.
 */
public class StreamSettings {

    public static final String READ_BUFFER_SIZE_PROPERTY = "pvstream.read.buffer.size";
    public static final String CONNECT_TIMEOUT_PROPERTY = "pvstream.http.connect.timeout.ms";
    public static final String READ_TIMEOUT_PROPERTY = "pvstream.http.read.timeout.ms";
    public static final String USER_AGENT_PROPERTY = "pvstream.http.user.agent";
    public static final String BATCH_SIZE_PROPERTY = "pvstream.batch.size";
    public static final String DOWNLOAD_MAX_BYTES_PROPERTY = "pvstream.download.max.bytes";

    public static final int DEFAULT_READ_BUFFER_SIZE = 256 * 1024;
    public static final int DEFAULT_CONNECT_TIMEOUT_MS = 30000;
    public static final int DEFAULT_READ_TIMEOUT_MS = 60000;
    public static final String DEFAULT_USER_AGENT = "pvstream/0.1 (Wikimedia Analytics)";

    /** Default number of rows per columnar block, the default ORC/Parquet row group size. */
    public static final int DEFAULT_BATCH_SIZE = 122880;

    /** Pageview dumps are well below this, it only guards against runaway downloads. */
    public static final long DEFAULT_DOWNLOAD_MAX_BYTES = 1L << 30;

    private final int readBufferSize;
    private final int connectTimeoutMs;
    private final int readTimeoutMs;
    private final String userAgent;
    private final int batchSize;
    private final long downloadMaxBytes;

    public StreamSettings(
        int readBufferSize,
        int connectTimeoutMs,
        int readTimeoutMs,
        String userAgent,
        int batchSize,
        long downloadMaxBytes
    ) {
        Preconditions.checkArgument(readBufferSize > 0, "read buffer size must be > 0");
        Preconditions.checkArgument(connectTimeoutMs >= 0, "connect timeout must be >= 0");
        Preconditions.checkArgument(readTimeoutMs >= 0, "read timeout must be >= 0");
        Preconditions.checkArgument(batchSize > 0, "batch size must be > 0");
        Preconditions.checkArgument(downloadMaxBytes > 0, "download limit must be > 0");
        this.readBufferSize = readBufferSize;
        this.connectTimeoutMs = connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs;
        this.userAgent = Preconditions.checkNotNull(userAgent);
        this.batchSize = batchSize;
        this.downloadMaxBytes = downloadMaxBytes;
    }

    public static StreamSettings defaults() {
        return new StreamSettings(
            DEFAULT_READ_BUFFER_SIZE,
            DEFAULT_CONNECT_TIMEOUT_MS,
            DEFAULT_READ_TIMEOUT_MS,
            DEFAULT_USER_AGENT,
            DEFAULT_BATCH_SIZE,
            DEFAULT_DOWNLOAD_MAX_BYTES);
    }

    public static StreamSettings fromSystemProperties() {
        return new StreamSettings(
            Integer.getInteger(READ_BUFFER_SIZE_PROPERTY, DEFAULT_READ_BUFFER_SIZE),
            Integer.getInteger(CONNECT_TIMEOUT_PROPERTY, DEFAULT_CONNECT_TIMEOUT_MS),
            Integer.getInteger(READ_TIMEOUT_PROPERTY, DEFAULT_READ_TIMEOUT_MS),
            System.getProperty(USER_AGENT_PROPERTY, DEFAULT_USER_AGENT),
            Integer.getInteger(BATCH_SIZE_PROPERTY, DEFAULT_BATCH_SIZE),
            Long.getLong(DOWNLOAD_MAX_BYTES_PROPERTY, DEFAULT_DOWNLOAD_MAX_BYTES));
    }

    public int getReadBufferSize() {
        return readBufferSize;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public long getDownloadMaxBytes() {
        return downloadMaxBytes;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("readBufferSize", readBufferSize)
            .add("connectTimeoutMs", connectTimeoutMs)
            .add("readTimeoutMs", readTimeoutMs)
            .add("userAgent", userAgent)
            .add("batchSize", batchSize)
            .add("downloadMaxBytes", downloadMaxBytes)
            .toString();
    }
}
