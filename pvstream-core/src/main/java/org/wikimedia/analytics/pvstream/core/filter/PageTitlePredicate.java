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

package org.wikimedia.analytics.pvstream.core.filter;

import java.util.regex.Pattern;

import org.wikimedia.analytics.pvstream.core.PageviewRow;

/**
 * Accepts rows whose page title contains a match of a regular expression.
 * Anchors have their usual meaning: {@code ^Rust$} only accepts the title
 * {@code Rust}.
 */
public class PageTitlePredicate implements RowPredicate {

    private final Pattern pattern;

    public PageTitlePredicate(Pattern pattern) {
        this.pattern = pattern;
    }

    @Override
    public boolean accepts(PageviewRow row) {
        return pattern.matcher(row.getPageTitle()).find();
    }

    @Override
    public String toString() {
        return "page_title ~ /" + pattern.pattern() + "/";
    }
}
