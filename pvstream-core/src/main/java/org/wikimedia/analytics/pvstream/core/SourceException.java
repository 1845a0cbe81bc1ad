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

import java.io.IOException;

/**
 * Thrown when the raw content of a pageview dump cannot be obtained:
 * the file is missing, the remote server cannot be reached or answers
 * with an error, or the compressed data is corrupt.
 * <p>
 * Source failures are fatal. Once one is raised the pipeline stops and
 * no further rows are produced.
 */
public class SourceException extends IOException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        NOT_FOUND,
        CONNECTION,
        DECOMPRESSION,
        READ
    }

    private final Kind kind;

    public SourceException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SourceException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public String getMessage() {
        return kind + ": " + super.getMessage();
    }
}
