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

import org.wikimedia.analytics.pvstream.core.PageviewRow;
import org.wikimedia.analytics.pvstream.orc.PageviewOrcReader;

/**
 * Dumps a pageview ORC file to stdout.
 * <p>
 * Each row is printed on a separate line, columns separated by tabs. A null
 * domain is printed as {@code \N}.
 */
public class Dump {

    static final String NULL_MARKER = "\\N";

    static String render(PageviewRow row) {
        return row.getDomainCode()
            + "\t" + row.getPageTitle()
            + "\t" + row.getViews()
            + "\t" + row.getLanguage()
            + "\t" + (row.getDomain() == null ? NULL_MARKER : row.getDomain())
            + "\t" + row.isMobile();
    }

    static void dump(String file, PrintStream out) throws IOException {
        try (PageviewOrcReader reader = PageviewOrcReader.open(Paths.get(file))) {
            reader.forEachRow(row -> out.println(render(row)));
        }
    }

    /**
     * Dumps a pageview ORC file to stdout.
     * @param args the first item is used as name of the file be read.
     * @throws IOException if the file cannot be opened or read.
     */
    public static void main(String[] args) throws IOException {
        if (args == null || args.length != 1) {
            System.err.println("Usage: <file>\n" + "\n"
                    + "<file> - Read this file as a pageview ORC file and output text to stdout.");
            System.exit(1);
        }
        dump(args[0], System.out);
    }
}
