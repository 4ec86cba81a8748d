package com.jcollect.collection;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MacroRegistryTest {

    private static final Macro ONE = (self, args) -> 1;
    private static final Macro TWO = (self, args) -> 2;

    @Test
    public void testLookupFallsBackToParent() {
        MacroRegistry parent = new MacroRegistry().register("answer", ONE);
        MacroRegistry child = new MacroRegistry(parent);

        assertSame(ONE, child.lookup("answer"));
        assertTrue(child.contains("answer"));
        assertNull(child.lookup("missing"));
        assertSame(parent, child.parent());
    }

    @Test
    public void testChildShadowsParent() {
        MacroRegistry parent = new MacroRegistry().register("answer", ONE);
        MacroRegistry child = new MacroRegistry(parent).register("answer", TWO);

        assertSame(TWO, child.lookup("answer"));
        assertSame(ONE, parent.lookup("answer"));
    }

    @Test
    public void testReRegisteringReplaces() {
        MacroRegistry registry = new MacroRegistry().register("answer", ONE).register("answer", TWO);
        assertSame(TWO, registry.lookup("answer"));
    }

    @Test
    public void testBuiltInNamesAreReserved() {
        assertTrue(MacroRegistry.isBuiltIn("where"));
        assertTrue(MacroRegistry.isBuiltIn("groupBy"));
        assertTrue(MacroRegistry.isBuiltIn("call"));
        assertFalse(MacroRegistry.isBuiltIn("double"));

        MacroCollisionException e = assertThrows(MacroCollisionException.class,
            () -> new MacroRegistry().register("filter", ONE));
        assertTrue(e.getMessage().contains("filter"));
    }

    @Test
    public void testInvalidRegistrations() {
        assertThrows(IllegalArgumentException.class, () -> new MacroRegistry().register(null, ONE));
        assertThrows(IllegalArgumentException.class, () -> new MacroRegistry().register("x", null));
    }

    @Test
    public void testSharedRegistryIsSingleton() {
        assertSame(MacroRegistry.shared(), MacroRegistry.shared());
        assertNull(MacroRegistry.shared().parent());
    }
}
