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

import java.net.URL;
import java.nio.file.Path;

import org.wikimedia.analytics.pvstream.core.filter.PageviewFilter;
import org.wikimedia.analytics.pvstream.core.source.ContentSource;

/**
 * Entry points for reading a pageview dump row by row.
 */
public final class Pageviews {

    private Pageviews() {
    }

    /**
     * @throws SourceException of kind NOT_FOUND if the file does not exist
     */
    public static PageviewStream streamFromFile(Path path, PageviewFilter filter) throws SourceException {
        return PageviewStream.open(ContentSource.forFile(path), filter);
    }

    public static PageviewStream streamFromFile(Path path, PageviewFilter filter, StreamSettings settings)
        throws SourceException {
        return PageviewStream.open(ContentSource.forFile(path, settings), filter);
    }

    /**
     * @throws SourceException of kind CONNECTION if the request fails or the
     *   response status is not 2xx
     */
    public static PageviewStream streamFromUrl(URL url, PageviewFilter filter) throws SourceException {
        return PageviewStream.open(ContentSource.forUrl(url), filter);
    }

    public static PageviewStream streamFromUrl(URL url, PageviewFilter filter, StreamSettings settings)
        throws SourceException {
        return PageviewStream.open(ContentSource.forUrl(url, settings), filter);
    }
}
