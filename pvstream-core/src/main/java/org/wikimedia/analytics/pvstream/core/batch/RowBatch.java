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

import java.util.Arrays;

import com.google.common.base.Preconditions;
import org.wikimedia.analytics.pvstream.core.PageviewRow;

/**
 * A bounded group of rows laid out column by column, one array per row
 * attribute. Arrays grow on demand up to the batch capacity.
 */
public class RowBatch {

    private static final int INITIAL_CAPACITY = 1024;

    private final int capacity;
    private int size;

    private String[] domainCodes;
    private String[] pageTitles;
    private long[] views;
    private String[] languages;
    private String[] domains;
    private boolean[] mobile;

    public RowBatch(int capacity) {
        Preconditions.checkArgument(capacity > 0, "batch capacity must be > 0, got %s", capacity);
        this.capacity = capacity;
        allocate(Math.min(capacity, INITIAL_CAPACITY));
    }

    private void allocate(int length) {
        domainCodes = new String[length];
        pageTitles = new String[length];
        views = new long[length];
        languages = new String[length];
        domains = new String[length];
        mobile = new boolean[length];
    }

    private void grow() {
        int length = (int) Math.min((long) capacity, 2L * domainCodes.length);
        domainCodes = Arrays.copyOf(domainCodes, length);
        pageTitles = Arrays.copyOf(pageTitles, length);
        views = Arrays.copyOf(views, length);
        languages = Arrays.copyOf(languages, length);
        domains = Arrays.copyOf(domains, length);
        mobile = Arrays.copyOf(mobile, length);
    }

    /**
     * @throws IllegalStateException if the batch is full
     */
    public void add(PageviewRow row) {
        if (isFull()) {
            throw new IllegalStateException("Batch is full (" + capacity + " rows)");
        }
        if (size == domainCodes.length) {
            grow();
        }
        domainCodes[size] = row.getDomainCode();
        pageTitles[size] = row.getPageTitle();
        views[size] = row.getViews();
        languages[size] = row.getLanguage();
        domains[size] = row.getDomain();
        mobile[size] = row.isMobile();
        size++;
    }

    /**
     * @return the row at the given position, rebuilt from the columns
     */
    public PageviewRow getRow(int index) {
        Preconditions.checkElementIndex(index, size);
        return new PageviewRow(domainCodes[index], pageTitles[index], views[index],
            languages[index], domains[index], mobile[index]);
    }

    public void clear() {
        // drop the references so rows do not outlive their batch
        Arrays.fill(domainCodes, 0, size, null);
        Arrays.fill(pageTitles, 0, size, null);
        Arrays.fill(languages, 0, size, null);
        Arrays.fill(domains, 0, size, null);
        size = 0;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public boolean isFull() {
        return size == capacity;
    }

    /*
     * Column accessors. Arrays may be longer than the batch, only the first
     * size() entries are meaningful.
     */

    public String[] getDomainCodes() {
        return domainCodes;
    }

    public String[] getPageTitles() {
        return pageTitles;
    }

    public long[] getViews() {
        return views;
    }

    public String[] getLanguages() {
        return languages;
    }

    public String[] getDomains() {
        return domains;
    }

    public boolean[] getMobile() {
        return mobile;
    }
}
