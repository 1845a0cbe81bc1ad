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
 * Thrown when a line does not have the expected
 * {@code domain_code page_title views} shape.
 */
public class LineParseException extends RowException {

    private static final long serialVersionUID = 1L;

    private final String line;

    public LineParseException(long lineNumber, String line, String reason) {
        super(lineNumber, reason + " at line " + lineNumber + ": '" + line + "'");
        this.line = line;
    }

    public String getLine() {
        return line;
    }
}
