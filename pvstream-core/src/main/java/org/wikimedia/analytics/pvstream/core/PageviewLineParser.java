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

import org.apache.commons.lang3.StringUtils;
import org.wikimedia.analytics.pvstream.core.domain.DomainCodeDecoder;

/**
 * Parses one line of an hourly pageview dump.
 * <p>
 * Lines hold space separated fields {@code domain_code page_title views},
 * usually followed by an unused fourth field. Only the first three are
 * required, anything after them is ignored.
 */
public class PageviewLineParser {

    private static final String FIELD_SEPARATORS = " \t";

    /**
     * Maximum number of significant views digits; anything longer cannot fit
     * {@link PageviewRow#MAX_VIEWS}. Leading zeros are not counted.
     */
    private static final int MAX_VIEWS_DIGITS = 10;

    private PageviewLineParser() {}

    /**
     * @param line the decoded line, without its terminator
     * @param lineNumber the 1-based line number, used in error reports
     * @return the parsed and decoded row
     * @throws LineParseException if the line has fewer than three fields or
     *   its views field is not a non-negative 32 bit integer
     */
    public static PageviewRow parse(String line, long lineNumber) throws LineParseException {
        // Split at most into 4 parts, the remainder of the line is never looked at.
        String[] fields = StringUtils.split(line, FIELD_SEPARATORS, 4);
        if (fields == null || fields.length < 3) {
            throw new LineParseException(lineNumber, line, "Expected at least 3 fields");
        }

        String domainCode = fields[0];
        String pageTitle = fields[1];
        long views = parseViews(fields[2]);
        if (views < 0) {
            throw new LineParseException(lineNumber, line, "Invalid view count '" + fields[2] + "'");
        }

        return new PageviewRow(domainCode, pageTitle, views, DomainCodeDecoder.decode(domainCode));
    }

    /**
     * @return the view count, or -1 if the token is not a plain decimal
     *   number in [0, MAX_VIEWS]
     */
    static long parseViews(String token) {
        int length = token.length();
        if (length == 0) {
            return -1;
        }
        int start = 0;
        while (start < length - 1 && token.charAt(start) == '0') {
            start++;
        }
        if (length - start > MAX_VIEWS_DIGITS) {
            return -1;
        }
        long value = 0;
        for (int i = start; i < length; i++) {
            char c = token.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
            value = value * 10 + (c - '0');
        }
        return value <= PageviewRow.MAX_VIEWS ? value : -1;
    }
}
