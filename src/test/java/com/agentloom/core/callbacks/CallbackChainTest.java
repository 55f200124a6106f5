package com.agentloom.core.callbacks;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class CallbackChainTest {

    @Test
    @DisplayName("returns the first non-empty result and stops there")
    void firstDecision() {
        var invoked = new ArrayList<String>();
        List<Supplier<Optional<String>>> callbacks = List.of(
                () -> {
                    invoked.add("a");
                    return Optional.empty();
                },
                () -> {
                    invoked.add("b");
                    return Optional.of("B");
                },
                () -> {
                    invoked.add("c");
                    return Optional.of("C");
                });

        Optional<String> result = CallbackChain.firstDecision("test", callbacks, Supplier::get);

        assertEquals(Optional.of("B"), result);
        assertEquals(List.of("a", "b"), invoked);
    }

    @Test
    @DisplayName("a null result counts as no decision")
    void nullIsEmpty() {
        List<Supplier<Optional<String>>> callbacks = List.of(() -> null, () -> Optional.of("x"));
        assertEquals(Optional.of("x"), CallbackChain.firstDecision("test", callbacks, Supplier::get));
    }

    @Test
    @DisplayName("no callbacks means no decision")
    void emptyChain() {
        assertTrue(CallbackChain.<Supplier<Optional<String>>, String>firstDecision("test", List.of(), Supplier::get)
                .isEmpty());
    }

    @Test
    @DisplayName("unchecked failures propagate unchanged")
    void uncheckedPropagates() {
        var boom = new IllegalArgumentException("boom");
        List<Supplier<Optional<String>>> callbacks = List.of(() -> {
            throw boom;
        });
        var thrown = assertThrows(IllegalArgumentException.class,
                () -> CallbackChain.firstDecision("test", callbacks, Supplier::get));
        assertSame(boom, thrown);
    }

    @Test
    @DisplayName("checked failures are wrapped with the phase name")
    void checkedWrapped() {
        List<String> callbacks = List.of("only");
        var ex = assertThrows(CallbackExecutionException.class,
                () -> CallbackChain.firstDecision("after_tool", callbacks, cb -> {
                    throw new IOException("io");
                }));
        assertTrue(ex.getMessage().startsWith("after_tool"));
        assertInstanceOf(IOException.class, ex.getCause());
    }
}
