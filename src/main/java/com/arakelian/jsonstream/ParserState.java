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

/**
 * States of the {@link StreamingJsonParser} state machine.
 *
 * Each state outside of a string knows the set of significant characters it accepts; strict
 * parsers reject anything else, lenient parsers ignore it.
 */
public enum ParserState {
    /** before the root '{' **/
    START("{"),

    /** '{' or ',' just read; expecting a key or '}' **/
    EXPECT_KEY_OR_END("\"}"),

    /** inside a key string **/
    IN_KEY(null),

    /** key just read **/
    EXPECT_COLON(":"),

    /** ':' just read; expecting a string or object **/
    EXPECT_VALUE("\"{"),

    /** inside a string value **/
    IN_VALUE(null),

    /** member value or nested object just closed **/
    EXPECT_COMMA_OR_END(",}");

    private final String expectedChars;

    private ParserState(final String expectedChars) {
        this.expectedChars = expectedChars;
    }

    /**
     * Returns true if the given character is significant in this state. String states accept any
     * character as content.
     *
     * @param ch
     *            character to test
     * @return true if the given character is accepted
     */
    public boolean accepts(final char ch) {
        return expectedChars == null || expectedChars.indexOf(ch) != -1;
    }

    /**
     * Returns the characters accepted in this state, or null for states that accept any character.
     *
     * @return the characters accepted in this state
     */
    public String getExpectedChars() {
        return expectedChars;
    }

    public boolean isInString() {
        return expectedChars == null;
    }
}
