/*
 * Copyright 2025 AxonOps
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
 */
package com.axonops.nfaregex.parser;

import java.util.Objects;

/**
 * Forward cursor over pattern text with one character of lookahead.
 *
 * <p>{@link #peek()} and {@link #get()} return {@link #EOF} past the end of the input.
 */
public final class PatternReader {

    public static final int EOF = -1;

    private final CharSequence source;
    private int position;

    public PatternReader(CharSequence source) {
        this.source = Objects.requireNonNull(source, "source cannot be null");
    }

    /**
     * @return the next character without consuming it, or {@link #EOF}
     */
    public int peek() {
        return position < source.length() ? source.charAt(position) : EOF;
    }

    /**
     * @return the next character, consuming it, or {@link #EOF} (nothing is consumed then)
     */
    public int get() {
        if (position >= source.length()) {
            return EOF;
        }
        return source.charAt(position++);
    }

    /**
     * Steps back over the last consumed character.
     */
    public void unget() {
        if (position > 0) {
            position--;
        }
    }

    public boolean atEnd() {
        return position >= source.length();
    }

    /**
     * @return index of the next character to be read
     */
    public int position() {
        return position;
    }

    public CharSequence source() {
        return source;
    }
}
