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

import org.wikimedia.analytics.pvstream.core.WriteException;

/**
 * The columnar container rows are written to, one block per batch.
 * <p>
 * A sink receives any number of {@link #writeBatch(RowBatch)} calls followed
 * by exactly one {@link #finish()}, or by {@link #abort(Exception)} if the
 * write has to be given up.
 */
public interface BatchSink {

    /**
     * Appends the batch as one self-describing block. The batch is cleared
     * and reused once this returns.
     */
    void writeBatch(RowBatch batch) throws WriteException;

    /**
     * Writes the closing metadata and releases the output.
     */
    void finish() throws WriteException;

    /**
     * Releases the output after a failure. Must not throw; secondary
     * failures are added to {@code cause} as suppressed exceptions.
     */
    void abort(Exception cause);
}
