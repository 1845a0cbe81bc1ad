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
 * A single condition a parsed row has to meet to be forwarded.
 * <p>
 * Predicates are assembled into a {@link FilterChain} once per pipeline and
 * evaluated for every row, so implementations must not compile or validate
 * anything in {@link #accepts(PageviewRow)}.
 */
public interface RowPredicate {

    boolean accepts(PageviewRow row);
}
