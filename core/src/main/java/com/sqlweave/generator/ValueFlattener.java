package com.sqlweave.generator;

import com.sqlweave.exception.UnsupportedValueException;

import java.lang.reflect.Array;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;

/**
 * Recursive flattening of IN/NOT IN operands.
 *
 * <p>Arrays (including primitive arrays), iterables and optionals are
 * containers and are expanded depth-first into one flat list; everything else
 * is a leaf. A null or an empty Optional ends its branch and is kept as a
 * single null leaf (rendered {@code NULL}). Expressions, tables, statements
 * and other collaborators are always leaves. An iterable or array that
 * contains itself is rejected with {@link UnsupportedValueException}.
 *
 * <pre>
 *   flatten(1, List.of(2, new int[] {3, 4}), Optional.of(5))   -- [1, 2, 3, 4, 5]
 * </pre>
 */
public final class ValueFlattener {

    private ValueFlattener() {}

    /**
     * Flattens the given values.
     *
     * @param values the values; a null array is treated as a single null value
     * @return a new mutable list of leaves
     */
    public static List<Object> flatten(Object... values) {
        List<Object> result = new ArrayList<>();
        if (values == null) {
            result.add(null);
            return result;
        }
        Set<Object> path = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Object value : values) {
            flattenInto(value, result, path);
        }
        return result;
    }

    private static void flattenInto(Object value, List<Object> result, Set<Object> path) {
        Iterator<?> children = children(value);
        if (children == null) {
            result.add(value);
            return;
        }
        // optionals cannot contain themselves and are not tracked
        boolean tracked = !(value instanceof Optional<?>);
        if (tracked && !path.add(value)) {
            throw new UnsupportedValueException(
                "self-referencing container " + value.getClass().getName(), value.getClass());
        }
        try {
            while (children.hasNext()) {
                flattenInto(children.next(), result, path);
            }
        } finally {
            if (tracked) {
                path.remove(value);
            }
        }
    }

    /**
     * Returns an iterator over a container's children.
     *
     * @return the children, or null if the value is a leaf
     */
    private static Iterator<?> children(Object value) {
        if (value == null || ValueMarshaller.isRenderable(value) || value instanceof Path) {
            return null;
        }
        if (value instanceof Optional<?> optional) {
            return optional.isPresent()
                ? List.of(optional.get()).iterator()
                : nullLeaf();
        }
        if (value instanceof Iterable<?> iterable) {
            return iterable.iterator();
        }
        if (value.getClass().isArray()) {
            return arrayIterator(value);
        }
        return null;
    }

    private static Iterator<?> nullLeaf() {
        List<Object> single = new ArrayList<>(1);
        single.add(null);
        return single.iterator();
    }

    private static Iterator<Object> arrayIterator(Object array) {
        int length = Array.getLength(array);
        return new Iterator<>() {
            private int index;

            @Override
            public boolean hasNext() {
                return index < length;
            }

            @Override
            public Object next() {
                if (index >= length) {
                    throw new NoSuchElementException();
                }
                return Array.get(array, index++);
            }
        };
    }
}
