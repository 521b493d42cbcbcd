/*
 * Copyright 2012-2017 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.arakelian.jsonstream;

import java.io.IOException;

/**
 * Thrown by a strict {@link StreamingJsonParser} when a significant character is not accepted by the
 * current {@link ParserState}.
 */
public class JsonSyntaxException extends IOException {
    private static String format(
            final char ch,
            final ParserState state,
            final long position) {
        return "Got '" + ch + "' but expected one of '" + state.getExpectedChars() + "': state=" + state
                + ",position=" + position;
    }

    private final char offendingChar;

    private final ParserState state;

    private final long position;

    public JsonSyntaxException(final char offendingChar, final ParserState state, final long position) {
        super(format(offendingChar, state, position));
        this.offendingChar = offendingChar;
        this.state = state;
        this.position = position;
    }

    /**
     * Returns the characters that would have been accepted instead of the offending character.
     *
     * @return the characters that would have been accepted
     */
    public String getExpectedChars() {
        return state.getExpectedChars();
    }

    public char getOffendingChar() {
        return offendingChar;
    }

    /**
     * Returns the zero-based position of the offending character, counted across every fragment
     * the parser has consumed.
     *
     * @return position of the offending character
     */
    public long getPosition() {
        return position;
    }

    public ParserState getState() {
        return state;
    }
}
