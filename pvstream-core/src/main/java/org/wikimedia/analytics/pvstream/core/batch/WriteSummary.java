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

package org.wikimedia.analytics.pvstream.core.batch;

import com.google.common.base.MoreObjects;

/**
 * What a batched write produced.
 */
public class WriteSummary {

    private final long rowsWritten;
    private final long blocksWritten;
    private final long rowsSkipped;

    public WriteSummary(long rowsWritten, long blocksWritten, long rowsSkipped) {
        this.rowsWritten = rowsWritten;
        this.blocksWritten = blocksWritten;
        this.rowsSkipped = rowsSkipped;
    }

    public long getRowsWritten() {
        return rowsWritten;
    }

    public long getBlocksWritten() {
        return blocksWritten;
    }

    /**
     * @return the number of lines left out because they failed to parse or decode
     */
    public long getRowsSkipped() {
        return rowsSkipped;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("rowsWritten", rowsWritten)
            .add("blocksWritten", blocksWritten)
            .add("rowsSkipped", rowsSkipped)
            .toString();
    }
}
