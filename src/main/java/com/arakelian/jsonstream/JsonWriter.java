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

import java.io.Closeable;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;

/**
 * Fast JSON writer for objects and strings, used to render parser snapshots as text.
 */
public class JsonWriter<W extends Writer> implements Closeable {
    private static enum CommaState {
        BEFORE_FIRST, AFTER_KEY, AFTER_VALUE;
    }

    private final static char[] DIGIT_TO_CHAR = { '0', '1', '2', '3', '4', '5', '6', '7', '8', '9', 'A', 'B',
            'C', 'D', 'E', 'F' };

    /**
     * Convenience function for converting a string or map of nested maps into a JSON string.
     *
     * @param value
     *            Java object to be converted
     * @param pretty
     *            true if pretty output
     * @return a JSON representation of the given object
     */
    public static String toString(final Object value, final boolean pretty) {
        try (final JsonWriter<StringWriter> writer = new JsonWriter<>(new StringWriter())) {
            writer.withPretty(pretty);
            writer.writeObject(value);
            return writer.getWriter().toString();
        } catch (final IOException e) {
            // we're writing to a string buffer and shouldn't have an error
            throw new RuntimeException("Unexpected exception while generating JSON", e);
        }
    }

    private W writer;

    private int indent;

    private boolean pretty = true;

    private CommaState[] commaState = new CommaState[32];

    public JsonWriter(final W writer) {
        setWriter(writer);
        reset();
    }

    private final void afterValue() {
        this.commaState[indent] = CommaState.AFTER_VALUE;
    }

    /** Verifies that a value may be written at the current position **/
    private final void beforeValue() {
        final CommaState state = this.commaState[indent];
        if (indent == 0) {
            if (state != CommaState.BEFORE_FIRST) {
                throw new IllegalStateException("Only a single root value may be written");
            }
        } else if (state != CommaState.AFTER_KEY) {
            throw new IllegalStateException("Object members require a key before each value");
        }
    }

    @Override
    public void close() throws IOException {
        try {
            if (writer != null) {
                writer.close();
            }
        } finally {
            writer = null;
            reset();
        }
    }

    public final JsonWriter<W> flush() throws IOException {
        writer.flush();
        return this;
    }

    public final W getWriter() {
        return writer;
    }

    private void indent() throws IOException {
        if (pretty) {
            for (int i = 0; i < indent; i++) {
                writer.write("  ");
            }
        }
    }

    private final void internalWriteEscapedChar(final char ch) throws IOException {
        switch (ch) {
        case '"':
            writer.write("\\\"");
            break;
        case '\\':
            writer.write("\\\\");
            break;
        case '\b':
            writer.write("\\b");
            break;
        case '\f':
            writer.write("\\f");
            break;
        case '\n':
            writer.write("\\n");
            break;
        case '\r':
            writer.write("\\r");
            break;
        case '\t':
            writer.write("\\t");
            break;
        default:
            // Reference: http://www.unicode.org/versions/Unicode5.1.0/
            if (ch <= '\u001F' || ch == '\u007F') {
                writer.write("\\u");
                internalWriteHex(ch, 4);
            } else {
                writer.write(ch);
            }
        }
    }

    private final void internalWriteEscapedString(final CharSequence csq) throws IOException {
        writer.write('\"');
        for (int i = 0, len = csq != null ? csq.length() : 0; i < len; i++) {
            internalWriteEscapedChar(csq.charAt(i));
        }
        writer.write('\"');
    }

    private final int internalWriteHex(final int l1, int minLength) throws IOException {
        if (l1 >= 16) {
            final int l2 = l1 / 16;
            minLength = internalWriteHex(l2, minLength - 1);
            while (minLength > 1) {
                writer.write('0');
                minLength--;
            }
            writer.write(DIGIT_TO_CHAR[l1 - l2 * 16]);
            minLength--;
        } else {
            while (minLength > 1) {
                writer.write('0');
                minLength--;
            }
            writer.write(DIGIT_TO_CHAR[l1]);
            minLength--;
        }
        return minLength;
    }

    private final void nextLine() throws IOException {
        if (pretty) {
            writer.write("\n");
        }
        indent();
    }

    public final void reset() {
        this.indent = 0;
        this.commaState[indent] = CommaState.BEFORE_FIRST;
    }

    public final void setPretty(final boolean pretty) {
        this.pretty = pretty;
    }

    public final void setWriter(final W writer) {
        this.writer = writer;
    }

    public final JsonWriter<W> withPretty(final boolean pretty) {
        setPretty(pretty);
        return this;
    }

    public final JsonWriter<W> writeEndObject() throws IOException {
        if (indent == 0) {
            throw new IllegalStateException("No object to end");
        }
        final CommaState state = this.commaState[indent];
        if (state == CommaState.AFTER_KEY) {
            throw new IllegalStateException("Missing value for last key");
        }
        indent--;
        if (state == CommaState.AFTER_VALUE) {
            nextLine();
        }
        writer.write('}');
        afterValue();
        return this;
    }

    public final JsonWriter<W> writeKey(final CharSequence key) throws IOException {
        if (indent == 0) {
            throw new IllegalStateException("Keys may only be written inside an object");
        }
        final CommaState state = this.commaState[indent];
        if (state == CommaState.AFTER_KEY) {
            throw new IllegalStateException("Missing value for last key");
        }
        if (state == CommaState.AFTER_VALUE) {
            writer.write(',');
        }
        nextLine();
        internalWriteEscapedString(key);
        if (pretty) {
            // space before colon matches Jackson
            writer.write(" ");
        }
        writer.write(":");
        if (pretty) {
            writer.write(" ");
        }
        this.commaState[indent] = CommaState.AFTER_KEY;
        return this;
    }

    public final JsonWriter<W> writeKeyValue(final CharSequence key, final Object value) throws IOException {
        writeKey(key).writeObject(value);
        return this;
    }

    public final JsonWriter<W> writeMap(final Map<?, ?> map) throws IOException {
        return writeObject(map);
    }

    public final JsonWriter<W> writeNull() throws IOException {
        beforeValue();
        writer.write("null");
        afterValue();
        return this;
    }

    /**
     * Writes a string, null, or a map of nested maps; any other object is written as its string
     * form. Nested maps are written without recursion so depth is limited only by memory.
     *
     * @param value
     *            value to write
     * @return this writer
     * @throws IOException
     *             if the underlying writer fails
     */
    public final JsonWriter<W> writeObject(final Object value) throws IOException {
        if (!(value instanceof Map)) {
            return writeScalar(value);
        }

        final Deque<Iterator<? extends Map.Entry<?, ?>>> open = new ArrayDeque<>();
        writeStartObject();
        open.push(((Map<?, ?>) value).entrySet().iterator());
        while (!open.isEmpty()) {
            final Iterator<? extends Map.Entry<?, ?>> members = open.peek();
            if (!members.hasNext()) {
                writeEndObject();
                open.pop();
                continue;
            }

            final Map.Entry<?, ?> member = members.next();
            writeKey(String.valueOf(member.getKey()));
            final Object memberValue = member.getValue();
            if (memberValue instanceof Map) {
                writeStartObject();
                open.push(((Map<?, ?>) memberValue).entrySet().iterator());
            } else {
                writeScalar(memberValue);
            }
        }
        return this;
    }

    private JsonWriter<W> writeScalar(final Object value) throws IOException {
        if (value == null) {
            return writeNull();
        }
        if (value instanceof CharSequence) {
            return writeString((CharSequence) value);
        }
        return writeString(value.toString());
    }

    public final JsonWriter<W> writeStartObject() throws IOException {
        beforeValue();
        if (++indent >= commaState.length) {
            commaState = Arrays.copyOf(commaState, commaState.length << 1);
        }
        this.commaState[indent] = CommaState.BEFORE_FIRST;
        writer.write('{');
        return this;
    }

    public final JsonWriter<W> writeString(final CharSequence csq) throws IOException {
        beforeValue();
        internalWriteEscapedString(csq);
        afterValue();
        return this;
    }
}
