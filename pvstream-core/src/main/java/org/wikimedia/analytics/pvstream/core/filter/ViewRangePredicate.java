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
 * Accepts rows whose view count lies within inclusive bounds. Either bound
 * may be open. With {@code min > max} no row is accepted.
 */
public class ViewRangePredicate implements RowPredicate {

    private final long min;
    private final long max;

    /**
     * @param min lowest accepted count, or null for no lower bound
     * @param max highest accepted count, or null for no upper bound
     */
    public ViewRangePredicate(Long min, Long max) {
        this.min = min == null ? 0L : min;
        this.max = max == null ? Long.MAX_VALUE : max;
    }

    public boolean isEmpty() {
        return min > max;
    }

    @Override
    public boolean accepts(PageviewRow row) {
        long views = row.getViews();
        return views >= min && views <= max;
    }

    @Override
    public String toString() {
        return min + " <= views <= " + max;
    }
}
