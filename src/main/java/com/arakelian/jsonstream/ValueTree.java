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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Owns every value created while parsing. Values are addressed by integer handle; the root object
 * always has handle {@link #ROOT} and is never replaced.
 *
 * A value that is overwritten by a duplicate key stays in the tree but is no longer reachable from
 * the root, so it never appears in a snapshot.
 */
public final class ValueTree {
    /** An object whose members are still being copied by {@link ValueTree#snapshot()} **/
    private static final class Frame {
        /** key of this object in its parent, null for the root **/
        private final String key;

        private final Iterator<Map.Entry<String, Integer>> members;

        private final ImmutableMap.Builder<String, Object> builder = ImmutableMap.builder();

        private Frame(final String key, final ObjectValue object) {
            this.key = key;
            this.members = object.members().entrySet().iterator();
        }
    }

    /** handle of the root object **/
    public static final int ROOT = 0;

    private final List<JsonValue> values = new ArrayList<>();

    ValueTree() {
        values.add(new ObjectValue());
    }

    private int add(final int parent, final String key, final JsonValue value) {
        Preconditions.checkArgument(key != null, "key must be non-null");
        final ObjectValue container = get(parent).asObject();
        final int handle = values.size();
        values.add(value);
        container.put(key, handle);
        return handle;
    }

    /**
     * Appends a character to the string value with the given handle.
     *
     * @param handle
     *            handle of a string value
     * @param ch
     *            character to append
     */
    void append(final int handle, final char ch) {
        get(handle).asString().append(ch);
    }

    public JsonValue get(final int handle) {
        Preconditions.checkElementIndex(handle, values.size(), "handle");
        return values.get(handle);
    }

    public ObjectValue getRoot() {
        return values.get(ROOT).asObject();
    }

    /**
     * Creates an empty object and stores it in the given parent object under the given key.
     *
     * @param parent
     *            handle of the parent object
     * @param key
     *            member name
     * @return handle of the new object
     */
    int newObject(final int parent, final String key) {
        return add(parent, key, new ObjectValue());
    }

    /**
     * Creates an empty string and stores it in the given parent object under the given key.
     *
     * @param parent
     *            handle of the parent object
     * @param key
     *            member name
     * @return handle of the new string
     */
    int newString(final int parent, final String key) {
        return add(parent, key, new StringValue());
    }

    /**
     * Returns the number of values owned by this tree, including the root and any values orphaned
     * by duplicate keys.
     *
     * @return number of values owned by this tree
     */
    public int size() {
        return values.size();
    }

    /**
     * Returns a copy of the root object as nested maps. Values are either {@link String} or another
     * {@code ImmutableMap<String, Object>}; iteration order matches the order keys were first seen.
     *
     * @return copy of the root object
     */
    public ImmutableMap<String, Object> snapshot() {
        final Deque<Frame> frames = new ArrayDeque<>();
        frames.push(new Frame(null, getRoot()));
        for (;;) {
            final Frame frame = frames.peek();
            if (!frame.members.hasNext()) {
                frames.pop();
                final ImmutableMap<String, Object> object = frame.builder.build();
                if (frames.isEmpty()) {
                    return object;
                }
                frames.peek().builder.put(frame.key, object);
                continue;
            }

            final Map.Entry<String, Integer> member = frame.members.next();
            final JsonValue value = values.get(member.getValue().intValue());
            switch (value.getKind()) {
            case STRING:
                frame.builder.put(member.getKey(), value.toString());
                break;
            case OBJECT:
                frames.push(new Frame(member.getKey(), (ObjectValue) value));
                break;
            default:
                throw new IllegalStateException("Unexpected value kind: " + value.getKind());
            }
        }
    }
}
