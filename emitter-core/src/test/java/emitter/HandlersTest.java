package emitter;

import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HandlersTest {

    interface Adder {
        void add(int a, int b, int c);
    }

    @Test
    void typedHandlersCaptureArity() {
        assertEquals(0, Handlers.of(() -> {}).arity());
        assertEquals(1, Handlers.of((String a) -> {}).arity());
        assertEquals(2, Handlers.of((Integer a, Integer b) -> {}).arity());
        assertEquals(3, Handlers.of((Integer a, Integer b, Integer c) -> {}).arity());
        assertEquals(4, Handlers.of((Integer a, Integer b, Integer c, Integer d) -> {}).arity());
        assertEquals(7, Handlers.of(7, args -> {}).arity());
    }

    @Test
    void typedHandlerReceivesArgumentsInOrder() throws Exception {
        AtomicReference<String> seen = new AtomicReference<>();
        EventHandler handler = Handlers.of((String a, Integer b) -> seen.set(a + b));

        handler.onEvent(new Object[] {"x", 1});

        assertEquals("x1", seen.get());
    }

    @Test
    void argsHandlerRejectsNegativeArity() {
        assertThrows(IllegalArgumentException.class, () -> Handlers.of(-1, args -> {}));
    }

    @Test
    void typedHandlerRejectsNull() {
        assertThrows(NullPointerException.class, () -> Handlers.of((Handlers.Handler0) null));
    }

    @Test
    void wrongArgumentTypeFailsInsideHandler() {
        EventHandler handler = Handlers.of((String s) -> s.length());

        assertThrows(ClassCastException.class, () -> handler.onEvent(new Object[] {42}));
    }

    @Test
    void adaptReturnsEventHandlerUnchanged() {
        EventHandler handler = Handlers.of(() -> {});

        assertSame(handler, Handlers.adapt(handler).orElseThrow());
    }

    @Test
    void adaptRunnable() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        EventHandler handler = Handlers.adapt((Runnable) calls::incrementAndGet).orElseThrow();
        handler.onEvent(new Object[0]);

        assertEquals(0, handler.arity());
        assertEquals(1, calls.get());
    }

    @Test
    void adaptBiConsumer() throws Exception {
        AtomicInteger sum = new AtomicInteger();
        BiConsumer<Integer, Integer> add = (a, b) -> sum.set(a + b);

        EventHandler handler = Handlers.adapt(add).orElseThrow();
        handler.onEvent(new Object[] {1, 2});

        assertEquals(2, handler.arity());
        assertEquals(3, sum.get());
    }

    @Test
    void adaptUserDefinedFunctionalInterfaceWithPrimitives() throws Exception {
        AtomicInteger sum = new AtomicInteger();
        Adder adder = (a, b, c) -> sum.set(a + b + c);

        EventHandler handler = Handlers.adapt(adder).orElseThrow();
        handler.onEvent(new Object[] {1, 2, 3});

        assertEquals(3, handler.arity());
        assertEquals(6, sum.get());
    }

    @Test
    void adaptedHandlerRethrowsOriginalFailure() {
        EventHandler handler = Handlers.adapt((Runnable) () -> {
            throw new IllegalStateException("raise");
        }).orElseThrow();

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> handler.onEvent(new Object[0]));
        assertEquals("raise", e.getMessage());
    }

    @Test
    void nonCallableValuesAreRejected() {
        assertTrue(Handlers.adapt(null).isEmpty());
        assertTrue(Handlers.adapt(new Object()).isEmpty());
        assertTrue(Handlers.adapt("not a function").isEmpty());
        assertTrue(Handlers.adapt(new int[] {1, 2}).isEmpty());
    }

    @Test
    void adaptIsEmptyOptionalNotNull() {
        Optional<EventHandler> adapted = Handlers.adapt(42);

        assertTrue(adapted.isEmpty());
    }
}
