package com.jcollect.async;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Arrays;
import java.util.Objects;

/**
 * One recorded chain call: the method name and the arguments it was given, in order.
 */
public record Operation(String method, ImmutableList<Object> args) {
    public Operation {
        Objects.requireNonNull(method, "method");
        args = args == null ? Lists.immutable.empty() : args;
    }

    public static Operation of(String method, Object... args) {
        return new Operation(method, Lists.immutable.withAll(Arrays.asList(args == null ? new Object[0] : args)));
    }

    public Object[] argsArray() {
        return args.toArray(new Object[0]);
    }

    @Override
    public String toString() {
        return args.isEmpty() ? "[" + method + "]" : "[" + method + ", " + args.makeString(", ") + "]";
    }
}
