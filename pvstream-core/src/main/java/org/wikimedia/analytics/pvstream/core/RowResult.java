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

import com.google.common.base.Preconditions;

/**
 * One element of a {@link PageviewStream}: either an accepted row, or the
 * per-row failure that prevented a line from becoming one.
 */
public final class RowResult {

    private final PageviewRow row;
    private final RowException error;

    private RowResult(PageviewRow row, RowException error) {
        this.row = row;
        this.error = error;
    }

    public static RowResult ok(PageviewRow row) {
        return new RowResult(Preconditions.checkNotNull(row), null);
    }

    public static RowResult error(RowException error) {
        return new RowResult(null, Preconditions.checkNotNull(error));
    }

    public boolean isOk() {
        return row != null;
    }

    /**
     * @return the row
     * @throws IllegalStateException if this element is an error
     */
    public PageviewRow getRow() {
        if (row == null) {
            throw new IllegalStateException("No row: " + error.getMessage(), error);
        }
        return row;
    }

    /**
     * @return the per-row failure, or null if this element is a row
     */
    public RowException getError() {
        return error;
    }

    @Override
    public String toString() {
        return isOk() ? "RowResult[" + row + "]" : "RowResult[error: " + error.getMessage() + "]";
    }
}
