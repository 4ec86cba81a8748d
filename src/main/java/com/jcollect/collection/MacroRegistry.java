package com.jcollect.collection;

import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Maps;
import org.eclipse.collections.impl.factory.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;

/**
 * Named macros, looked up here first and then in the parent registry. Every collection owns a
 * registry whose parent is, unless injected otherwise, the process-wide {@link #shared()} one.
 * <p>
 * Names of public {@link ItemCollection} methods are reserved. Registration is not synchronized;
 * re-registering a name replaces the previous macro.
 */
public class MacroRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(MacroRegistry.class);

    private static final MacroRegistry SHARED = new MacroRegistry(null);

    private static final ImmutableSet<String> BUILT_INS = builtInNames();

    private final MacroRegistry parent;
    private final MutableMap<String, Macro> macros = Maps.mutable.empty();

    public MacroRegistry() {
        this(null);
    }

    public MacroRegistry(MacroRegistry parent) {
        this.parent = parent;
    }

    public static MacroRegistry shared() {
        return SHARED;
    }

    public static boolean isBuiltIn(String name) {
        return BUILT_INS.contains(name);
    }

    /**
     * @throws MacroCollisionException if {@code name} is a built-in method name
     */
    public MacroRegistry register(String name, Macro macro) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Macro name must not be blank");
        }
        if (macro == null) {
            throw new IllegalArgumentException("Macro " + name + " must not be null");
        }
        if (isBuiltIn(name)) {
            throw new MacroCollisionException(name);
        }
        if (macros.put(name, macro) != null) {
            LOGGER.debug("Replaced macro {}", name);
        } else {
            LOGGER.debug("Registered macro {}", name);
        }
        return this;
    }

    /**
     * Returns the macro registered here or in an ancestor, or {@code null}.
     */
    public Macro lookup(String name) {
        Macro macro = macros.get(name);
        if (macro == null && parent != null) {
            return parent.lookup(name);
        }
        return macro;
    }

    public boolean contains(String name) {
        return lookup(name) != null;
    }

    public MacroRegistry parent() {
        return parent;
    }

    private static ImmutableSet<String> builtInNames() {
        return Sets.immutable.with(ItemCollection.class.getMethods())
                .collect(Method::getName);
    }
}
