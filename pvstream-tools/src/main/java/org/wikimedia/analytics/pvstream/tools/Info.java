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

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;

import org.wikimedia.analytics.pvstream.orc.PageviewOrcReader;

/**
 * Dumps information about a pageview ORC file to stdout.
 */
public class Info {

    /**
     * Renders a row of key, and value for the user
     */
    private static void renderKeyValue(PrintStream out, String key, Object value) {
        out.println(key + ": " + value);
    }

    static void info(String file, PrintStream out) throws IOException {
        try (PageviewOrcReader reader = PageviewOrcReader.open(Paths.get(file))) {
            renderKeyValue(out, "Schema", reader.getSchema());
            renderKeyValue(out, "Rows", reader.getNumberOfRows());
            renderKeyValue(out, "Stripes", reader.getNumberOfStripes());
            renderKeyValue(out, "Compression", reader.getCompression());
        }
    }

    /**
     * Dumps information about a pageview ORC file to stdout.
     *
     * @param args the first item is the filename of the file to get
     *     information about.
     * @throws IOException if file cannot be opened, read, ...
     */
    public static void main(String[] args) throws IOException {
        if (args == null || args.length != 1) {
            System.err.println("Usage: <file>\n"
                    + "\n"
                    + "<file> - file to get info about.");
            System.exit(1);
        }
        info(args[0], System.out);
    }
}
