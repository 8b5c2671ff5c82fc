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

package com.rapidbench.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;

import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import com.github.luben.zstd.ZstdInputStream;
import com.github.luben.zstd.ZstdOutputStream;

/**
 * Stream helpers shared by the binary netlist reader and writer.
 */
public class FileTools {

    /** Static empty array to save on memory */
    public static final String[] emptyStringArray = new String[0];

    //===================================================================================//
    /* Get Streams                                                                       */
    //===================================================================================//
    /**
     * Creates a Kryo output stream that instantiates a Zstandard compression stream
     * from an output stream.
     *
     * @param os The existing output stream to wrap.
     * @return The created kryo-zstd output stream.
     */
    public static Output getKryoZstdOutputStream(OutputStream os) {
        return new Output(getZstdOutputStream(os));
    }

    /**
     * Wraps the provided output stream with a Zstandard compression stream.
     *
     * @param os The existing output stream.
     * @return The new output stream that will use Zstandard compression.
     */
    public static OutputStream getZstdOutputStream(OutputStream os) {
        try {
            return new ZstdOutputStream(os, Params.RB_ZSTD_COMPRESSION_LEVEL);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Creates a Kryo input stream from decompressing a Zstandard compressed input
     * stream.
     *
     * @param input The input stream to read from.
     * @return The created kryo-zstd input stream.
     */
    public static Input getKryoZstdInputStream(InputStream input) {
        try {
            return new Input(new ZstdInputStream(input));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    //===================================================================================//
    /* Array Read/Write                                                                  */
    //===================================================================================//
    public static void writeStringArray(Output dos, String[] stringArray) {
        dos.writeInt(stringArray.length);
        for (String s : stringArray) {
            dos.writeString(s);
        }
    }

    public static String[] readStringArray(Input dis) {
        int size = dis.readInt();
        if (size == 0) {
            return emptyStringArray;
        }
        String[] strings = new String[size];
        for (int i = 0; i < strings.length; i++) {
            strings[i] = dis.readString();
        }
        return strings;
    }

    public static void writeLongArray(Output dos, long[] longArray) {
        dos.writeInt(longArray.length);
        for (long l : longArray) {
            dos.writeLong(l);
        }
    }

    public static long[] readLongArray(Input dis) {
        long[] longs = new long[dis.readInt()];
        for (int i = 0; i < longs.length; i++) {
            longs[i] = dis.readLong();
        }
        return longs;
    }
}
