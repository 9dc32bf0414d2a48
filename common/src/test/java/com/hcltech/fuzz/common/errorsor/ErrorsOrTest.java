package com.hcltech.fuzz.common.errorsor;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ErrorsOrTest {

    @Nested
    class ConstructionAndPredicates {
        @Test
        void liftCreatesValue() {
            ErrorsOr<Integer> eo = ErrorsOr.lift(42);
            assertTrue(eo.isValue());
            assertFalse(eo.isError());
            assertEquals(Optional.of(42), eo.getValue());
            assertTrue(eo.getErrors().isEmpty());
        }

        @Test
        void errorsCreatesError() {
            ErrorsOr<String> eo = ErrorsOr.errors(List.of("boom"));
            assertTrue(eo.isError());
            assertFalse(eo.isValue());
            assertEquals(List.of("boom"), eo.getErrors());
            assertEquals(Optional.empty(), eo.getValue());
        }

        @Test
        void errorsFactoryRejectsEmptyList() {
            assertThrows(IllegalArgumentException.class, () -> ErrorsOr.errors(List.of()));
        }

        @Test
        void liftOrErrorsPicksByEmptiness() {
            assertEquals(ErrorsOr.lift("ok"), ErrorsOr.liftOrErrors("ok", List.of()));
            assertEquals(ErrorsOr.errors(List.of("a", "b")), ErrorsOr.liftOrErrors("ok", List.of("a", "b")));
        }

        @Test
        void valueRejectsNull() {
            assertThrows(NullPointerException.class, () -> ErrorsOr.lift(null));
        }
    }

    @Nested
    class Extractors {
        @Test
        void valueOrThrowReturnsValue() {
            assertEquals("x", ErrorsOr.lift("x").valueOrThrow());
        }

        @Test
        void valueOrThrowOnErrorThrows() {
            ErrorsOr<String> eo = ErrorsOr.errors(List.of("nope"));
            IllegalStateException ex = assertThrows(IllegalStateException.class, eo::valueOrThrow);
            assertTrue(ex.getMessage().contains("nope"));
        }

        @Test
        void errorsOrThrowOnValueThrows() {
            ErrorsOr<Integer> eo = ErrorsOr.lift(7);
            IllegalStateException ex = assertThrows(IllegalStateException.class, eo::errorsOrThrow);
            assertTrue(ex.getMessage().contains("7"));
        }
    }
}
