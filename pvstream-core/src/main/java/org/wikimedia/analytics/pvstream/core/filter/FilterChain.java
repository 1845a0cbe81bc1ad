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

import java.util.List;

import com.google.common.collect.ImmutableList;
import org.wikimedia.analytics.pvstream.core.PageviewRow;

/**
 * Ordered set of predicates a row must all meet.
 * <p>
 * Evaluation stops at the first predicate that rejects the row, so the
 * cheap checks are expected first.
 */
public class FilterChain {

    protected final List<RowPredicate> chain;

    public FilterChain(List<RowPredicate> predicates) {
        this.chain = ImmutableList.copyOf(predicates);
    }

    public boolean accepts(PageviewRow row) {
        for (RowPredicate predicate : chain) {
            if (!predicate.accepts(row)) {
                return false;
            }
        }
        return true;
    }

    public boolean isEmpty() {
        return chain.isEmpty();
    }

    public List<RowPredicate> getPredicates() {
        return chain;
    }

    @Override
    public String toString() {
        return chain.toString();
    }
}
