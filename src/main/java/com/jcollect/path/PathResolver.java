package com.jcollect.path;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves dot-separated key paths ({@code "user.profile.name"}) against arbitrary item shapes.
 * <p>
 * Maps are keyed by segment, lists and arrays take an integer segment (negative counts from the
 * end), records and beans are read through their accessors. A missing segment resolves to "no
 * value" and never throws.
 */
public final class PathResolver {
    /** Path addressing the item itself, for collections of scalars. */
    public static final String VALUE = "$value";

    private static final Object MISSING = new Object();

    private PathResolver() {}

    /**
     * Returns the value at {@code path}, or {@code null} when any segment is absent.
     */
    public static Object resolve(Object item, String path) {
        Object result = lookup(item, path);
        return result == MISSING ? null : result;
    }

    /**
     * Returns true when every segment of {@code path} is present, even if the final value is null.
     */
    public static boolean has(Object item, String path) {
        return lookup(item, path) != MISSING;
    }

    /**
     * Returns a shallow copy of a map item with the field at {@code path} removed. Nested maps
     * along the path are copied, the rest of the item is shared. Non-map items are returned as-is.
     */
    public static Object without(Object item, String path) {
        if (!(item instanceof Map<?, ?> map) || path == null || path.isEmpty()) {
            return item;
        }
        int dot = path.indexOf('.');
        Map<Object, Object> copy = new LinkedHashMap<>(map);
        if (dot < 0) {
            copy.remove(path);
            return copy;
        }
        String head = path.substring(0, dot);
        if (copy.containsKey(head)) {
            copy.put(head, without(copy.get(head), path.substring(dot + 1)));
        }
        return copy;
    }

    private static Object lookup(Object item, String path) {
        if (path == null) {
            return MISSING;
        }
        if (path.equals(VALUE)) {
            return item;
        }
        Object current = item;
        int start = 0;
        while (true) {
            int dot = path.indexOf('.', start);
            String segment = dot < 0 ? path.substring(start) : path.substring(start, dot);
            current = segment(current, segment);
            if (current == MISSING || dot < 0) {
                return current;
            }
            start = dot + 1;
        }
    }

    private static Object segment(Object current, String segment) {
        if (current == null) {
            return MISSING;
        }
        if (current instanceof Map<?, ?> map) {
            return map.containsKey(segment) ? map.get(segment) : MISSING;
        }
        if (current instanceof List<?> list) {
            int index = index(segment, list.size());
            return index < 0 ? MISSING : list.get(index);
        }
        if (current.getClass().isArray()) {
            int index = index(segment, Array.getLength(current));
            return index < 0 ? MISSING : Array.get(current, index);
        }
        if (current instanceof CharSequence || current instanceof Number || current instanceof Boolean) {
            return MISSING;
        }
        return property(current, segment);
    }

    private static int index(String segment, int size) {
        int index;
        try {
            index = Integer.parseInt(segment);
        } catch (NumberFormatException e) {
            return -1;
        }
        if (index < 0) {
            index = size + index;
        }
        return index >= 0 && index < size ? index : -1;
    }

    private static Object property(Object bean, String name) {
        Class<?> type = bean.getClass();
        try {
            if (type.isRecord()) {
                for (RecordComponent component : type.getRecordComponents()) {
                    if (component.getName().equals(name)) {
                        Method accessor = component.getAccessor();
                        accessor.trySetAccessible();
                        return accessor.invoke(bean);
                    }
                }
                return MISSING;
            }
            String suffix = Character.toUpperCase(name.charAt(0)) + name.substring(1);
            for (String candidate : new String[] {"get" + suffix, "is" + suffix}) {
                Method method = publicMethod(type, candidate);
                if (method != null) {
                    method.trySetAccessible();
                    return method.invoke(bean);
                }
            }
            Field field = type.getField(name);
            field.trySetAccessible();
            return Modifier.isStatic(field.getModifiers()) ? MISSING : field.get(bean);
        } catch (ReflectiveOperationException | RuntimeException e) {
            return MISSING;
        }
    }

    private static Method publicMethod(Class<?> type, String name) {
        try {
            Method method = type.getMethod(name);
            return method.getReturnType() == void.class ? null : method;
        } catch (NoSuchMethodException e) {
            return null;
        }
    }
}
