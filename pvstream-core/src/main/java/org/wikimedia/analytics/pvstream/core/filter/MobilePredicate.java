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

import org.wikimedia.analytics.pvstream.core.PageviewRow;

/**
 * Accepts either only mobile rows or only non-mobile rows.
 */
public class MobilePredicate implements RowPredicate {

    private final boolean mobile;

    public MobilePredicate(boolean mobile) {
        this.mobile = mobile;
    }

    @Override
    public boolean accepts(PageviewRow row) {
        return row.isMobile() == mobile;
    }

    @Override
    public String toString() {
        return "mobile == " + mobile;
    }
}
