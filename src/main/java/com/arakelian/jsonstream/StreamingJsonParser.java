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
import java.io.Reader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Incremental parser for a subset of JSON where every value is either a string or an object.
 *
 * Input may arrive in fragments of any size, down to single characters, and a token may span
 * fragments. The parsed structure can be inspected with {@link #snapshot()} at any time, including
 * in the middle of a key or a value:
 *
 * <ul>
 * <li>a member appears once the type of its value is known: the opening quote of a string, or the
 * opening brace of an object</li>
 * <li>a string value grows as its characters arrive</li>
 * <li>a member whose key is incomplete, or whose value has not started, is omitted</li>
 * </ul>
 *
 * Escape sequences are not interpreted; a backslash is an ordinary character. Only one root object
 * is parsed and anything after its closing brace is inert.
 *
 * Instances are not thread-safe; callers feeding a parser from several threads must serialize calls
 * to {@link #consume(CharSequence)} and {@link #snapshot()}.
 */
public final class StreamingJsonParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(StreamingJsonParser.class);

    /** matches the default buffer size of a BufferedReader **/
    private static final int READ_BUFFER_SIZE = 8192;

    private static boolean isWhitespace(final char ch) {
        return ch == ' ' || ch == '\n' || ch == '\t' || ch == '\r';
    }

    public static ImmutableMap<String, Object> parseAll(final CharSequence json) throws JsonSyntaxException {
        return parseAll(json, StreamingJsonParserOptions.lenient());
    }

    public static ImmutableMap<String, Object> parseAll(final CharSequence json, final boolean strict)
            throws JsonSyntaxException {
        return parseAll(json, strict ? StreamingJsonParserOptions.strict() : StreamingJsonParserOptions.lenient());
    }

    /**
     * Parses the given text in a single call and returns the resulting snapshot.
     *
     * @param json
     *            JSON text, possibly incomplete
     * @param options
     *            parser options
     * @return snapshot of the root object
     * @throws JsonSyntaxException
     *             if options are strict and the text contains an unexpected character
     */
    public static ImmutableMap<String, Object> parseAll(
            final CharSequence json,
            final StreamingJsonParserOptions options) throws JsonSyntaxException {
        final StreamingJsonParser parser = new StreamingJsonParser(options);
        parser.consume(json);
        return parser.snapshot();
    }

    private final StreamingJsonParserOptions options;

    private final ValueTree tree = new ValueTree();

    /** handles of open objects below the root; the root is implied when the stack is empty **/
    private int[] stack = new int[16];

    /** pointer into the stack of open objects **/
    private int level;

    /** current parser state **/
    private ParserState state = ParserState.START;

    /** key of the member being parsed **/
    private final StringBuilder key = new StringBuilder();

    /** handle of the string value receiving characters, or -1 **/
    private int target = -1;

    /** true once the closing brace of the root object has been read **/
    private boolean complete;

    /** number of characters consumed so far **/
    private long position;

    /** true once ignored input after the root object has been logged **/
    private boolean loggedTrailing;

    public StreamingJsonParser() {
        this(StreamingJsonParserOptions.lenient());
    }

    public StreamingJsonParser(final boolean strict) {
        this(strict ? StreamingJsonParserOptions.strict() : StreamingJsonParserOptions.lenient());
    }

    public StreamingJsonParser(final StreamingJsonParserOptions options) {
        Preconditions.checkArgument(options != null, "options must be non-null");
        this.options = options;
    }

    /**
     * Consumes a fragment of input given as a character array.
     *
     * @param buf
     *            character buffer
     * @param off
     *            offset of first character to consume
     * @param len
     *            number of characters to consume
     * @throws JsonSyntaxException
     *             if the parser is strict and a character is not accepted; characters before it
     *             remain applied
     */
    public void consume(final char[] buf, final int off, final int len) throws JsonSyntaxException {
        Preconditions.checkArgument(buf != null, "buf must be non-null");
        Preconditions.checkPositionIndexes(off, off + len, buf.length);
        for (int i = off, end = off + len; i < end; i++) {
            consume(buf[i]);
        }
    }

    private void consume(final char ch) throws JsonSyntaxException {
        if (!state.isInString() && isWhitespace(ch)) {
            position++;
            return;
        }

        if (!state.accepts(ch) && options.isStrict()) {
            LOGGER.debug("Rejected '{}' in state {} at position {}", ch, state, position);
            throw new JsonSyntaxException(ch, state, position);
        }

        if (complete) {
            // a second root object is never started
            if (!loggedTrailing) {
                LOGGER.trace("Ignoring input after root object at position {}", position);
                loggedTrailing = true;
            }
        } else if (state.accepts(ch)) {
            process(ch);
        }
        position++;
    }

    /**
     * Consumes a fragment of input. Fragments may be of any length, including empty, and tokens
     * may span fragments.
     *
     * @param fragment
     *            next fragment of input
     * @throws JsonSyntaxException
     *             if the parser is strict and a character is not accepted; characters before it
     *             remain applied
     */
    public void consume(final CharSequence fragment) throws JsonSyntaxException {
        Preconditions.checkArgument(fragment != null, "fragment must be non-null");
        for (int i = 0, length = fragment.length(); i < length; i++) {
            consume(fragment.charAt(i));
        }
    }

    /**
     * Consumes everything that can be read from the given reader. The reader is not closed.
     *
     * @param in
     *            source of input
     * @throws IOException
     *             if the reader fails, or if the parser is strict and a character is not accepted
     */
    public void consume(final Reader in) throws IOException {
        Preconditions.checkArgument(in != null, "in must be non-null");
        final char[] buf = new char[READ_BUFFER_SIZE];
        for (int n = in.read(buf); n != -1; n = in.read(buf)) {
            consume(buf, 0, n);
        }
    }

    private int currentObject() {
        return level == 0 ? ValueTree.ROOT : stack[level - 1];
    }

    private void endObject() {
        if (level != 0) {
            level--;
        } else if (!complete) {
            complete = true;
            LOGGER.debug("Root object closed at position {}", position);
        }
        state = ParserState.EXPECT_COMMA_OR_END;
    }

    /**
     * Returns the number of objects currently open, counting the root object. Returns 0 before the
     * root object is opened and after it is closed.
     *
     * @return the current nesting depth
     */
    public int getDepth() {
        return state == ParserState.START || complete ? 0 : level + 1;
    }

    public StreamingJsonParserOptions getOptions() {
        return options;
    }

    /**
     * Returns the number of characters consumed so far, whitespace included. Characters rejected
     * by a strict parser are not counted.
     *
     * @return the number of characters consumed
     */
    public long getPosition() {
        return position;
    }

    public ParserState getState() {
        return state;
    }

    public boolean isComplete() {
        return complete;
    }

    public boolean isStrict() {
        return options.isStrict();
    }

    /** Applies a character that the current state accepts **/
    private void process(final char ch) {
        switch (state) {
        case START:
            state = ParserState.EXPECT_KEY_OR_END;
            break;

        case EXPECT_KEY_OR_END:
            if (ch == '"') {
                key.setLength(0);
                state = ParserState.IN_KEY;
            } else {
                endObject();
            }
            break;

        case IN_KEY:
            if (ch == '"') {
                state = ParserState.EXPECT_COLON;
            } else {
                key.append(ch);
            }
            break;

        case EXPECT_COLON:
            state = ParserState.EXPECT_VALUE;
            break;

        case EXPECT_VALUE:
            if (ch == '"') {
                target = tree.newString(currentObject(), key.toString());
                state = ParserState.IN_VALUE;
            } else {
                push(tree.newObject(currentObject(), key.toString()));
                state = ParserState.EXPECT_KEY_OR_END;
            }
            break;

        case IN_VALUE:
            if (ch == '"') {
                target = -1;
                state = ParserState.EXPECT_COMMA_OR_END;
            } else {
                tree.append(target, ch);
            }
            break;

        case EXPECT_COMMA_OR_END:
            if (ch == ',') {
                state = ParserState.EXPECT_KEY_OR_END;
            } else {
                endObject();
            }
            break;

        default:
            throw new IllegalStateException("Unexpected parser state: " + state);
        }
    }

    private void push(final int handle) {
        if (level >= stack.length) {
            final int[] newstack = new int[stack.length << 1];
            System.arraycopy(stack, 0, newstack, 0, stack.length);
            stack = newstack;
        }
        stack[level++] = handle;
    }

    /**
     * Returns a copy of everything parsed so far. The result is not affected by later calls to
     * {@link #consume(CharSequence)}.
     *
     * @return copy of the root object as nested maps of strings
     */
    public ImmutableMap<String, Object> snapshot() {
        return tree.snapshot();
    }

    /**
     * Renders the current snapshot as JSON text.
     *
     * @param pretty
     *            true for indented output
     * @return JSON text of everything parsed so far
     */
    public String toJson(final boolean pretty) {
        return JsonWriter.toString(snapshot(), pretty);
    }

    @Override
    public String toString() {
        return "StreamingJsonParser[state=" + state + ", depth=" + getDepth() + ", position=" + position
                + ", strict=" + options.isStrict() + "]";
    }
}
