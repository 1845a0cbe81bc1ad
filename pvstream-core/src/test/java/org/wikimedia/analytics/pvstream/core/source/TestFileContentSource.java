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

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import org.apache.commons.io.IOUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.wikimedia.analytics.pvstream.core.PageviewDumps;
import org.wikimedia.analytics.pvstream.core.SourceException;
import org.wikimedia.analytics.pvstream.core.StreamSettings;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class TestFileContentSource {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testReadsFile() throws IOException {
        File dump = PageviewDumps.write(folder.newFile("pageviews.gz"), PageviewDumps.gzipLines("en.m Rust 1234 0"));

        ContentSource source = ContentSource.forFile(dump.toPath(), StreamSettings.defaults());
        try (InputStream in = source.open()) {
            assertEquals("en.m Rust 1234 0\n", IOUtils.toString(in, StandardCharsets.UTF_8));
        }
        assertEquals(dump.toPath().toString(), source.describe());
    }

    @Test
    public void testMissingFile() {
        Path missing = folder.getRoot().toPath().resolve("missing.gz");
        try {
            ContentSource.forFile(missing).open();
            fail("Expected SourceException");
        } catch (SourceException e) {
            assertEquals(SourceException.Kind.NOT_FOUND, e.getKind());
        }
    }

    @Test
    public void testDirectoryIsNotFound() {
        try {
            ContentSource.forFile(folder.getRoot().toPath()).open();
            fail("Expected SourceException");
        } catch (SourceException e) {
            assertEquals(SourceException.Kind.NOT_FOUND, e.getKind());
        }
    }

    @Test
    public void testCorruptFileFailsOnRead() throws IOException {
        File dump = folder.newFile("corrupt.gz");
        PageviewDumps.write(dump, "plain text".getBytes(StandardCharsets.UTF_8));

        // open succeeds, the gzip header is only checked when reading
        try (InputStream in = ContentSource.forFile(dump.toPath()).open()) {
            in.read();
            fail("Expected SourceException");
        } catch (SourceException e) {
            assertEquals(SourceException.Kind.DECOMPRESSION, e.getKind());
        }
    }
}
