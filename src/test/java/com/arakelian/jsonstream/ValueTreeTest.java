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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableMap;

public class ValueTreeTest {
    @Test
    public void testAppend() {
        final ValueTree tree = new ValueTree();
        final int handle = tree.newString(ValueTree.ROOT, "greeting");
        assertEquals(ImmutableMap.of("greeting", ""), tree.snapshot());
        for (final char ch : "hello".toCharArray()) {
            tree.append(handle, ch);
        }
        assertEquals(ImmutableMap.of("greeting", "hello"), tree.snapshot());
        assertEquals(5, tree.get(handle).asString().length());
    }

    @Test
    public void testKinds() {
        final ValueTree tree = new ValueTree();
        final int str = tree.newString(ValueTree.ROOT, "s");
        final int obj = tree.newObject(ValueTree.ROOT, "o");
        assertEquals(JsonValue.Kind.STRING, tree.get(str).getKind());
        assertEquals(JsonValue.Kind.OBJECT, tree.get(obj).getKind());

        Assertions.assertThrows(IllegalStateException.class, () -> tree.append(obj, 'x'));
        Assertions.assertThrows(IllegalStateException.class, () -> tree.newString(str, "child"));
        Assertions.assertThrows(IndexOutOfBoundsException.class, () -> tree.get(99));
    }

    @Test
    public void testMutatorsNotPublic() throws NoSuchMethodException {
        assertFalse(Modifier.isPublic(ValueTree.class.getDeclaredMethod("append", int.class, char.class).getModifiers()));
        assertFalse(Modifier.isPublic(ValueTree.class.getDeclaredMethod("newObject", int.class, String.class).getModifiers()));
        assertFalse(Modifier.isPublic(ValueTree.class.getDeclaredMethod("newString", int.class, String.class).getModifiers()));
        assertFalse(Modifier.isPublic(ValueTree.class.getDeclaredConstructor().getModifiers()));

        // the parser's tree is never handed out
        for (final Method method : StreamingJsonParser.class.getMethods()) {
            assertFalse(ValueTree.class.isAssignableFrom(method.getReturnType()), method.getName());
        }
    }

    @Test
    public void testNested() {
        final ValueTree tree = new ValueTree();
        final int a = tree.newObject(ValueTree.ROOT, "a");
        final int b = tree.newObject(a, "b");
        tree.append(tree.newString(b, "c"), 'd');
        assertEquals(
                ImmutableMap.of("a", ImmutableMap.of("b", ImmutableMap.of("c", "d"))),
                tree.snapshot());
        assertTrue(tree.getRoot().has("a"));
        assertEquals(a, tree.getRoot().get("a"));
        assertEquals(-1, tree.getRoot().get("b"));
    }

    @Test
    public void testOverwriteOrphansPreviousValue() {
        final ValueTree tree = new ValueTree();
        final int first = tree.newString(ValueTree.ROOT, "k");
        tree.newString(ValueTree.ROOT, "other");
        final int second = tree.newObject(ValueTree.ROOT, "k");

        final ObjectValue root = tree.getRoot();
        assertEquals(2, root.size());
        assertEquals(second, root.get("k"));
        assertEquals(4, tree.size());

        // the orphan still accepts characters but is never visible
        tree.append(first, 'x');
        assertEquals(ImmutableMap.of("k", ImmutableMap.of(), "other", ""), tree.snapshot());
        assertFalse(tree.snapshot().containsValue("x"));
    }

    @Test
    public void testRootIsEmptyObject() {
        final ValueTree tree = new ValueTree();
        assertEquals(1, tree.size());
        assertEquals(0, tree.getRoot().size());
        assertEquals(ImmutableMap.of(), tree.snapshot());
        Assertions.assertThrows(UnsupportedOperationException.class, () -> tree.getRoot().members().clear());
    }
}
