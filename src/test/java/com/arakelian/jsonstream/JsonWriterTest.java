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

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.IOException;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableMap;

public class JsonWriterTest {
    @FunctionalInterface
    public interface JsonTest {
        void execute(JsonWriter<StringWriter> writer) throws IOException;
    }

    /** Logger **/
    private static final Logger LOGGER = LoggerFactory.getLogger(JsonWriterTest.class);

    private void assertIllegalStateException(final JsonTest test) throws IOException {
        final StringWriter sw = new StringWriter();
        try (JsonWriter<StringWriter> writer = new JsonWriter<>(sw)) {
            writer.setPretty(false);
            Assertions.assertThrows(IllegalStateException.class, () -> {
                test.execute(writer);
                writer.flush();
                LOGGER.info("Supposed to be invalid: {}", sw.toString());
            });
        }
    }

    private String capture(final JsonTest test) throws IOException {
        final StringWriter sw = new StringWriter();
        try (JsonWriter<StringWriter> writer = new JsonWriter<>(sw)) {
            writer.setPretty(false);
            test.execute(writer);
        }
        return sw.toString();
    }

    @Test
    public void testDeepNesting() {
        Object value = "leaf";
        final StringBuilder expected = new StringBuilder();
        for (int i = 0; i < 200_000; i++) {
            value = ImmutableMap.of("k", value);
            expected.append("{\"k\":");
        }
        expected.append("\"leaf\"");
        for (int i = 0; i < 200_000; i++) {
            expected.append('}');
        }
        assertEquals(expected.toString(), JsonWriter.toString(value, false));
    }

    @Test
    public void testEmptyObject() throws IOException {
        assertEquals("{}", JsonWriter.toString(ImmutableMap.of(), true));
        assertEquals("{\n  \"a\" : {}\n}", JsonWriter.toString(ImmutableMap.of("a", ImmutableMap.of()), true));
    }

    @Test
    public void testEscaping() throws IOException {
        assertEquals("\"a\\\"b\\\\c\\n\\t\\u0001\"", capture(writer -> writer.writeString("a\"b\\c\n\t\u0001")));
        assertEquals("\"café\"", capture(writer -> writer.writeString("café")));
    }

    @Test
    public void testKeyNotAllowed() throws IOException {
        assertIllegalStateException(writer -> {
            writer.writeKey("hello");
        });
    }

    @Test
    public void testMissingKey() throws IOException {
        assertIllegalStateException(writer -> {
            // objects require key value pairs, not standalone values
            writer.writeStartObject();
            writer.writeString("value");
            writer.writeEndObject();
        });
    }

    @Test
    public void testMissingValue() throws IOException {
        assertIllegalStateException(writer -> {
            writer.writeStartObject();
            writer.writeKey("key");
            writer.writeEndObject();
        });
    }

    @Test
    public void testMultipleRootObjects() throws IOException {
        assertIllegalStateException(writer -> {
            writer.writeString("one");
            writer.writeString("two");
        });
        assertIllegalStateException(writer -> {
            writer.writeMap(ImmutableMap.of());
            writer.writeString("string");
        });
    }

    @Test
    public void testNull() throws IOException {
        assertEquals("null", capture(writer -> writer.writeObject(null)));
        assertEquals("{\"a\":null,\"b\":\"c\"}", capture(writer -> {
            final Map<String, Object> map = new LinkedHashMap<>();
            map.put("a", null);
            map.put("b", "c");
            writer.writeMap(map);
        }));
    }

    @Test
    public void testPretty() throws IOException {
        final ImmutableMap<String, Object> value = ImmutableMap.of(
                "title",
                "Product",
                "properties",
                ImmutableMap.of("id", ImmutableMap.of("type", "integer"), "name", "n"));
        final String expected = "" + //
                "{\n" + //
                "  \"title\" : \"Product\",\n" + //
                "  \"properties\" : {\n" + //
                "    \"id\" : {\n" + //
                "      \"type\" : \"integer\"\n" + //
                "    },\n" + //
                "    \"name\" : \"n\"\n" + //
                "  }\n" + //
                "}";
        assertEquals(expected, JsonWriter.toString(value, true));
        assertEquals(
                "{\"title\":\"Product\",\"properties\":{\"id\":{\"type\":\"integer\"},\"name\":\"n\"}}",
                JsonWriter.toString(value, false));
    }

    @Test
    public void testStreamingCalls() throws IOException {
        assertEquals("{\"a\":\"b\",\"c\":{\"d\":\"e\"}}", capture(writer -> {
            writer.writeStartObject();
            writer.writeKeyValue("a", "b");
            writer.writeKey("c").writeStartObject();
            writer.writeKey("d").writeString("e");
            writer.writeEndObject();
            writer.writeEndObject();
        }));
    }
}
