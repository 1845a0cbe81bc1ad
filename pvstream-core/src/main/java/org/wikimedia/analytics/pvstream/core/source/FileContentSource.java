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

package org.wikimedia.analytics.pvstream.core.source;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import org.apache.log4j.Logger;
import org.wikimedia.analytics.pvstream.core.SourceException;
import org.wikimedia.analytics.pvstream.core.StreamSettings;

/**
 * A dump stored on the local file system.
 */
public class FileContentSource extends ContentSource {

    private static final Logger LOG = Logger.getLogger(FileContentSource.class.getName());

    private final Path path;

    public FileContentSource(Path path, StreamSettings settings) {
        super(settings);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    @Override
    protected InputStream openCompressed() throws SourceException {
        if (!Files.isRegularFile(path)) {
            throw new SourceException(SourceException.Kind.NOT_FOUND,
                Files.exists(path) ? path + " is not a regular file" : path + " does not exist");
        }

        InputStream in;
        try {
            in = Files.newInputStream(path);
        } catch (NoSuchFileException e) {
            throw new SourceException(SourceException.Kind.NOT_FOUND, path + " does not exist", e);
        } catch (IOException e) {
            throw new SourceException(SourceException.Kind.READ, "Failed opening " + path, e);
        }
        LOG.info("Reading pageviews from file " + path);
        return new TransportInputStream(in, SourceException.Kind.READ, path.toString());
    }

    @Override
    public String describe() {
        return path.toString();
    }
}
