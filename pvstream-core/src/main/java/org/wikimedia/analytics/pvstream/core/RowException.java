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

/**
 * Base class of the failures affecting a single line of a dump.
 * <p>
 * A row exception never stops the pipeline. In iterator mode it is handed
 * to the caller as an error element, in batch mode the line is left out.
 */
public abstract class RowException extends Exception {

    private static final long serialVersionUID = 1L;

    private final long lineNumber;

    protected RowException(long lineNumber, String message) {
        super(message);
        this.lineNumber = lineNumber;
    }

    protected RowException(long lineNumber, String message, Throwable cause) {
        super(message, cause);
        this.lineNumber = lineNumber;
    }

    /**
     * @return the 1-based number of the offending line in the decompressed dump
     */
    public long getLineNumber() {
        return lineNumber;
    }
}
