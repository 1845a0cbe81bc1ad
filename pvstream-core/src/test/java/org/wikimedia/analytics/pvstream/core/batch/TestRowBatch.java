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

import junit.framework.TestCase;
import org.wikimedia.analytics.pvstream.core.PageviewRow;

public class TestRowBatch extends TestCase {

    private static PageviewRow row(int i) {
        return new PageviewRow("en", "Title_" + i, i, "en", i % 2 == 0 ? "wikipedia.org" : null, i % 3 == 0);
    }

    public void testAddAndReadBack() {
        RowBatch batch = new RowBatch(10);
        batch.add(row(1));
        batch.add(row(2));

        assertEquals(2, batch.size());
        assertEquals(row(1), batch.getRow(0));
        assertEquals(row(2), batch.getRow(1));
        assertEquals("Title_2", batch.getPageTitles()[1]);
        assertEquals(2L, batch.getViews()[1]);
        assertNull(batch.getDomains()[0]);
    }

    public void testGrowsUpToCapacity() {
        RowBatch batch = new RowBatch(3000);
        for (int i = 0; i < 3000; i++) {
            batch.add(row(i));
        }

        assertTrue(batch.isFull());
        assertEquals(row(2999), batch.getRow(2999));
        assertEquals(row(1024), batch.getRow(1024));
    }

    public void testAddToFullBatch() {
        RowBatch batch = new RowBatch(1);
        batch.add(row(1));
        try {
            batch.add(row(2));
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertEquals(1, batch.size());
        }
    }

    public void testClear() {
        RowBatch batch = new RowBatch(2);
        batch.add(row(1));
        batch.add(row(2));
        batch.clear();

        assertTrue(batch.isEmpty());
        assertNull(batch.getDomainCodes()[0]);
        batch.add(row(3));
        assertEquals(row(3), batch.getRow(0));
    }

    public void testRowOutsideBatch() {
        RowBatch batch = new RowBatch(4);
        batch.add(row(1));
        try {
            batch.getRow(1);
            fail("Expected IndexOutOfBoundsException");
        } catch (IndexOutOfBoundsException e) {
            assertEquals(1, batch.size());
        }
    }

    public void testCapacityMustBePositive() {
        try {
            new RowBatch(0);
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("capacity"));
        }
    }
}
