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
 * A node of a {@link ValueTree}. There are exactly two kinds of values, strings and objects, and
 * code that inspects a value switches on {@link #getKind()}.
 */
public abstract class JsonValue {
    public enum Kind {
        STRING, OBJECT;
    }

    JsonValue() {
        // only StringValue and ObjectValue
    }

    public final ObjectValue asObject() {
        if (getKind() != Kind.OBJECT) {
            throw new IllegalStateException("Expected object but found " + getKind());
        }
        return (ObjectValue) this;
    }

    public final StringValue asString() {
        if (getKind() != Kind.STRING) {
            throw new IllegalStateException("Expected string but found " + getKind());
        }
        return (StringValue) this;
    }

    public abstract Kind getKind();
}
