/*
 * Copyright (c) 2026, RapidBench contributors.
 * All rights reserved.
 *
 * This file is part of RapidBench.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package com.rapidbench.bench;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.rapidbench.util.Params;

/**
 * Tokenizes an InputStream containing circuit text. This class buffers its
 * input internally in a ring buffer of twice the maximum token length, so
 * arbitrarily large inputs are read with bounded memory. To minimize copying
 * data, combining it with a {@link java.io.BufferedInputStream} should be
 * avoided.
 *
 * Bytes are classified by a {@link CharClassTable}. Clean bytes separate
 * tokens, comment bytes discard the rest of the physical line and stop bytes
 * end both the statement and the line. A NUL byte ends the input.
 */
public class BenchTokenizer implements AutoCloseable {

    private final String source;

    private final InputStream in;

    private final CharClassTable charClasses;

    private final byte[] buffer;
    private static final Charset charset = StandardCharsets.UTF_8;

    protected final int maxTokenLength;
    protected final int bufferAddressMask;

    protected int offset = 0;
    private int available = 0;
    private boolean sawEOF = false;

    protected long byteOffset;
    private int lineNumber = 1;
    private int lastByte = -1;

    public BenchTokenizer(String source, InputStream in, CharClassTable charClasses, int maxTokenLength) {
        this.source = source;
        this.in = in;
        this.charClasses = charClasses;
        this.maxTokenLength = maxTokenLength;
        //Only a power of two does not share any bits with its lower neighbour
        if (maxTokenLength <= 0 || (maxTokenLength & (maxTokenLength - 1)) != 0) {
            throw new IllegalStateException("max token length must be a power of two but is " + maxTokenLength);
        }
        bufferAddressMask = maxTokenLength * 2 - 1;
        this.buffer = new byte[maxTokenLength * 2];
    }

    public BenchTokenizer(String source, InputStream in) {
        this(source, in, CharClassTable.bench(), Params.RB_BENCH_MAX_TOKEN_LENGTH);
    }

    private boolean ensureRead(int startOffset, int endOffset) throws IOException {
        while (startOffset < endOffset) {
            int actuallyRead = in.read(buffer, startOffset, endOffset - startOffset);
            if (actuallyRead == -1) {
                sawEOF = true;
                return false;
            }
            available += actuallyRead;
            startOffset += actuallyRead;
        }
        return true;
    }

    /**
     * Load more data from stream.
     *
     * Only does anything if there is no more than one max token length of data
     * available. Then, fills all free space of the buffer. This way, a token that
     * starts in the buffer never needs a refill beyond the buffer size.
     */
    protected void fill() throws IOException {
        if (available > maxTokenLength || sawEOF) {
            return;
        }
        int fillStart = (offset + available) & bufferAddressMask;
        int free = buffer.length - available;
        int firstPart = Math.min(free, buffer.length - fillStart);
        if (ensureRead(fillStart, fillStart + firstPart) && free > firstPart) {
            ensureRead(0, free - firstPart);
        }
    }

    /**
     * Looks ahead without consuming.
     * @param distance Number of bytes past the current position.
     * @return The byte value, or -1 at the end of input.
     */
    private int peek(int distance) throws IOException {
        if (distance >= available) {
            fill();
            if (distance >= available) {
                return -1;
            }
        }
        int b = buffer[(offset + distance) & bufferAddressMask] & 0xFF;
        return b == 0 ? -1 : b;
    }

    void skipInBuffer(int amount) {
        available -= amount;
        offset = bufferAddressMask & (offset + amount);
        byteOffset += amount;
    }

    /**
     * Read two separate locations from a buffer, concatenating them into a single string.
     * Supports multi-byte characters split between the two parts
     * @param buffer the buffer to read from
     * @param start1 first part start
     * @param length1 first part length
     * @param start2 second part start
     * @param length2 second part length
     * @return the string assembled from the two locations
     */
    public static String byteArrayToStringMulti(byte[] buffer, int start1, int length1, int start2, int length2) {
        //To support multi-byte characters being split between the parts, we have to take
        // care to first concatenate, then decode.
        byte[] complete = new byte[length1 + length2];
        System.arraycopy(buffer, start1, complete, 0, length1);
        System.arraycopy(buffer, start2, complete, length1, length2);
        return new String(complete, charset);
    }

    private String decode(int startOffset, int length) {
        if (startOffset + length <= buffer.length) {
            return new String(buffer, startOffset, length, charset);
        }
        int firstLength = buffer.length - startOffset;
        return byteArrayToStringMulti(buffer, startOffset, firstLength, 0, length - firstLength);
    }

    /**
     * Consumes clean bytes, comments and stop bytes up to the next token or the
     * end of input.
     * @return True if at least one stop byte was consumed.
     */
    private boolean skipSeparators() throws IOException {
        boolean crossedStop = false;
        int b;
        while ((b = peek(0)) != -1) {
            CharClass charClass = charClasses.classify(b);
            if (charClass == CharClass.NORMAL) {
                break;
            }
            if (charClass == CharClass.COMMENT) {
                while (b != -1 && charClasses.classify(b) != CharClass.STOP) {
                    lastByte = b;
                    skipInBuffer(1);
                    b = peek(0);
                }
                continue;
            }
            if (charClass == CharClass.STOP) {
                // CR LF is a single line terminator
                if (!(b == '\n' && lastByte == '\r')) {
                    lineNumber++;
                }
                crossedStop = true;
            }
            lastByte = b;
            skipInBuffer(1);
        }
        return crossedStop;
    }

    private BenchToken readToken() throws IOException {
        int length = 0;
        int b;
        while ((b = peek(length)) != -1 && charClasses.classify(b) == CharClass.NORMAL) {
            length++;
            if (length > maxTokenLength) {
                throw tokenTooLong();
            }
        }
        BenchToken token = new BenchToken(decode(offset, length), lineNumber, byteOffset);
        lastByte = buffer[(offset + length - 1) & bufferAddressMask] & 0xFF;
        skipInBuffer(length);
        return token;
    }

    private TokenTooLongException tokenTooLong() {
        String start = decode(offset, Math.min(150, maxTokenLength));
        return new TokenTooLongException(source, lineNumber, "String buffer overflow on byte offset "
                + byteOffset + " parsing token starting with " + start + "...\n\t Please revisit why this "
                + "token is so long or increase " + Params.RB_BENCH_MAX_TOKEN_LENGTH_NAME
                + " (currently " + maxTokenLength + ")");
    }

    /**
     * Get the next token object
     * @return token object, or null if at end of input
     */
    public BenchToken getOptionalNextToken() {
        try {
            skipSeparators();
            if (peek(0) == -1) {
                return null;
            }
            return readToken();
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: IOException while reading circuit text: " + source, e);
        }
    }

    /**
     * Gets the tokens of the next statement, that is all tokens up to the next
     * stop byte. Lines without tokens are skipped. A statement cut short by the
     * end of input is returned as is.
     * @return The non-empty list of tokens, or null if at end of input
     */
    public List<BenchToken> getOptionalNextStatement() {
        try {
            List<BenchToken> statement = new ArrayList<>();
            while (true) {
                boolean crossedStop = skipSeparators();
                if (crossedStop && !statement.isEmpty()) {
                    return statement;
                }
                if (peek(0) == -1) {
                    return statement.isEmpty() ? null : statement;
                }
                statement.add(readToken());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: IOException while reading circuit text: " + source, e);
        }
    }

    /**
     * @return The current line, starting at 1 and advanced by every line
     * terminator consumed so far.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * @return The number of bytes consumed so far.
     */
    public long getByteOffset() {
        return byteOffset;
    }

    public String getSource() {
        return source;
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
