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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Object value. Members refer to their values by {@link ValueTree} handle and are kept in the order
 * in which their keys first appeared.
 */
public final class ObjectValue extends JsonValue {
    private final Map<String, Integer> members = new LinkedHashMap<>();

    ObjectValue() {
    }

    /**
     * Returns the handle of the value stored under the given key, or -1 if there is no such member.
     *
     * @param key
     *            member name
     * @return handle of the member value, or -1
     */
    public int get(final String key) {
        final Integer handle = members.get(key);
        return handle != null ? handle.intValue() : -1;
    }

    @Override
    public Kind getKind() {
        return Kind.OBJECT;
    }

    public boolean has(final String key) {
        return members.containsKey(key);
    }

    /**
     * Returns a read-only view of the members of this object, keyed by name.
     *
     * @return read-only view of member handles
     */
    public Map<String, Integer> members() {
        return Collections.unmodifiableMap(members);
    }

    /** Last write wins; a replaced key keeps its original position. **/
    final void put(final String key, final int handle) {
        members.put(key, Integer.valueOf(handle));
    }

    public int size() {
        return members.size();
    }
}
