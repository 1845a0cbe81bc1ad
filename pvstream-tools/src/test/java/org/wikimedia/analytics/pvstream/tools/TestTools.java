// Copyright 2024 Wikimedia Foundation
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package org.wikimedia.analytics.pvstream.tools;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.zip.GZIPOutputStream;

import junit.framework.TestCase;
import org.wikimedia.analytics.pvstream.core.PageviewRow;
import org.wikimedia.analytics.pvstream.core.filter.PageviewFilter;
import org.wikimedia.analytics.pvstream.orc.PageviewOrc;

public class TestTools extends TestCase {

    private File directory;
    private File orcFile;

    @Override
    protected void setUp() throws Exception {
        directory = Files.createTempDirectory("pvstream-tools").toFile();
        File dump = new File(directory, "pageviews.gz");
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(dump.toPath()))) {
            out.write("en.m Rust 1234 0\nxx.unknown Page 5 0\n".getBytes(StandardCharsets.UTF_8));
        }
        orcFile = new File(directory, "pageviews.orc");
        PageviewOrc.writeFromFile(dump.toPath(), orcFile.toPath(), 1, PageviewFilter.acceptAll());
    }

    @Override
    protected void tearDown() throws Exception {
        File[] files = directory.listFiles();
        if (files != null) {
            for (File file : files) {
                Files.deleteIfExists(file.toPath());
            }
        }
        Files.deleteIfExists(directory.toPath());
    }

    private static String capture(ToolRun run) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (PrintStream out = new PrintStream(bytes, true, "UTF-8")) {
            run.run(out);
        }
        return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
    }

    private interface ToolRun {
        void run(PrintStream out) throws IOException;
    }

    public void testRender() {
        assertEquals("en.m\tRust\t1234\ten\twikipedia.org\ttrue",
            Dump.render(new PageviewRow("en.m", "Rust", 1234, "en", "wikipedia.org", true)));
        assertEquals("xx.unknown\tPage\t5\txx\t\\N\tfalse",
            Dump.render(new PageviewRow("xx.unknown", "Page", 5, "xx", null, false)));
    }

    public void testDump() throws IOException {
        String output = capture(out -> Dump.dump(orcFile.getPath(), out));

        String[] lines = output.split("\n");
        assertEquals(2, lines.length);
        assertEquals("en.m\tRust\t1234\ten\twikipedia.org\ttrue", lines[0]);
        assertEquals("xx.unknown\tPage\t5\txx\t\\N\tfalse", lines[1]);
    }

    public void testInfo() throws IOException {
        String output = capture(out -> Info.info(orcFile.getPath(), out));

        assertTrue(output, output.contains("Rows: 2"));
        assertTrue(output, output.contains("Stripes: 2"));
        assertTrue(output, output.contains("Schema: struct<domain_code:string,"));
        assertTrue(output, output.contains("Compression: "));
    }
}
