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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.wikimedia.analytics.pvstream.core.SourceException;

/**
 * Splits a decompressed dump into lines.
 * <p>
 * Lines end at {@code \n}; a {@code \r} right before it is dropped, and a
 * last line without terminator is returned as well. Each line is decoded as
 * strict UTF-8 on its own, so an invalid line is reported through
 * {@link Line#getDecodeError()} and reading goes on with the next one.
 */
public class LineSplitter implements Closeable {

    private static final int INITIAL_LINE_CAPACITY = 256;

    private final InputStream in;
    private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);

    private final byte[] buffer;
    private int position;
    private int limit;

    private byte[] line = new byte[INITIAL_LINE_CAPACITY];
    private int lineLength;

    private long lineNumber;
    private boolean eof;

    public LineSplitter(InputStream in, int bufferSize) {
        this.in = in;
        this.buffer = new byte[bufferSize];
    }

    /**
     * @return the next line, or null once the input is exhausted
     * @throws SourceException if the underlying source fails
     */
    public Line readLine() throws SourceException {
        if (eof) {
            return null;
        }
        lineLength = 0;
        boolean sawBytes = false;
        while (true) {
            if (position >= limit && !fill()) {
                eof = true;
                return sawBytes ? decodeLine() : null;
            }
            sawBytes = true;
            int start = position;
            while (position < limit && buffer[position] != '\n') {
                position++;
            }
            append(start, position - start);
            if (position < limit) {
                // skip the terminator
                position++;
                return decodeLine();
            }
        }
    }

    public long getLineNumber() {
        return lineNumber;
    }

    @Override
    public void close() throws IOException {
        eof = true;
        in.close();
    }

    private boolean fill() throws SourceException {
        int read;
        try {
            do {
                read = in.read(buffer, 0, buffer.length);
            } while (read == 0);
        } catch (SourceException e) {
            throw e;
        } catch (IOException e) {
            throw new SourceException(SourceException.Kind.READ, "Failed reading line " + (lineNumber + 1), e);
        }
        if (read < 0) {
            return false;
        }
        position = 0;
        limit = read;
        return true;
    }

    private void append(int start, int length) {
        if (lineLength + length > line.length) {
            line = Arrays.copyOf(line, Math.max(line.length * 2, lineLength + length));
        }
        System.arraycopy(buffer, start, line, lineLength, length);
        lineLength += length;
    }

    private Line decodeLine() {
        lineNumber++;
        int length = lineLength;
        if (length > 0 && line[length - 1] == '\r') {
            length--;
        }
        decoder.reset();
        try {
            String text = decoder.decode(ByteBuffer.wrap(line, 0, length)).toString();
            return new Line(lineNumber, text, null);
        } catch (CharacterCodingException e) {
            return new Line(lineNumber, null, e);
        }
    }

    /**
     * One line of the dump: either its text or the reason it could not be
     * decoded.
     */
    public static final class Line {

        private final long number;
        private final String text;
        private final CharacterCodingException decodeError;

        Line(long number, String text, CharacterCodingException decodeError) {
            this.number = number;
            this.text = text;
            this.decodeError = decodeError;
        }

        public long getNumber() {
            return number;
        }

        /**
         * @return the decoded text, or null if the line is not valid UTF-8
         */
        public String getText() {
            return text;
        }

        public CharacterCodingException getDecodeError() {
            return decodeError;
        }

        public boolean isDecoded() {
            return decodeError == null;
        }
    }
}
