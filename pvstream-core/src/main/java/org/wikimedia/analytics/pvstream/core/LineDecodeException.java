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

import java.nio.charset.CharacterCodingException;

/**
 * Thrown when the bytes of a line are not valid UTF-8.
 */
public class LineDecodeException extends RowException {

    private static final long serialVersionUID = 1L;

    public LineDecodeException(long lineNumber, CharacterCodingException cause) {
        super(lineNumber, "Invalid UTF-8 at line " + lineNumber, cause);
    }
}
