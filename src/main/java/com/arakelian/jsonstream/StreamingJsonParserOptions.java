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

import org.immutables.value.Value;

@Value.Immutable(copy = false)
@Value.Style(get = { "is*", "get*" })
public abstract class StreamingJsonParserOptions {
    private static final StreamingJsonParserOptions LENIENT = ImmutableStreamingJsonParserOptions.builder()
            .build();

    private static final StreamingJsonParserOptions STRICT = ImmutableStreamingJsonParserOptions.builder()
            .strict(true).build();

    public static StreamingJsonParserOptions lenient() {
        return LENIENT;
    }

    public static StreamingJsonParserOptions strict() {
        return STRICT;
    }

    /**
     * Returns true if characters that are not accepted by the current parser state should raise a
     * {@link JsonSyntaxException}; when false, such characters are silently ignored so that
     * truncated or noisy input still yields everything parsed so far.
     *
     * @return true if parsing is strict
     */
    @Value.Default
    public boolean isStrict() {
        return false;
    }
}
