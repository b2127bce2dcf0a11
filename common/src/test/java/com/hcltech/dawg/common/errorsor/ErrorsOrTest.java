package com.hcltech.dawg.common.errorsor;

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
        void errorCreatesError() {
            ErrorsOr<String> eo = ErrorsOr.error("boom");
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
        void liftRejectsNull() {
            assertThrows(NullPointerException.class, () -> ErrorsOr.lift(null));
        }

        @Test
        void errorWithExceptionFormatsClassAndMessage() {
            ErrorsOr<String> eo = ErrorsOr.error("failed: {0}: {1}", new IllegalStateException("bad state"));
            assertEquals(List.of("failed: IllegalStateException: bad state"), eo.getErrors());
        }
    }

    @Nested
    class ExtractorsAndDefaults {
        @Test
        void valueOrThrowOnErrorThrows() {
            ErrorsOr<String> eo = ErrorsOr.error("nope");
            IllegalStateException ex = assertThrows(IllegalStateException.class, eo::valueOrThrow);
            assertTrue(ex.getMessage().contains("nope"));
        }

        @Test
        void errorsOrThrowOnValueThrows() {
            ErrorsOr<Integer> eo = ErrorsOr.lift(7);
            IllegalStateException ex = assertThrows(IllegalStateException.class, eo::errorsOrThrow);
            assertTrue(ex.getMessage().contains("7"));
        }

        @Test
        void addPrefixOnlyTouchesErrors() {
            assertEquals(List.of("load: x", "load: y"), ErrorsOr.errors(List.of("x", "y")).addPrefixIfError("load: ").getErrors());
            assertEquals(Optional.of(1), ErrorsOr.lift(1).addPrefixIfError("load: ").getValue());
        }

        @Test
        void foldPicksTheMatchingBranch() {
            assertEquals("v=3", ErrorsOr.lift(3).fold(v -> "v=" + v, errs -> "e=" + errs));
            assertEquals("e=[bad]", ErrorsOr.<Integer>error("bad").fold(v -> "v=" + v, errs -> "e=" + errs));
        }
    }

    @Nested
    class FunctionalHelpers {
        @Test
        void mapAppliesOnValueAndPassesThroughError() {
            assertEquals("n=10", ErrorsOr.lift(10).map(n -> "n=" + n).valueOrThrow());
            ErrorsOr<String> mapped = ErrorsOr.<Integer>error("bad").map(Object::toString);
            assertEquals(List.of("bad"), mapped.getErrors());
        }

        @Test
        void flatMapChains() {
            assertEquals(10, ErrorsOr.lift(5).flatMap(n -> ErrorsOr.lift(n * 2)).valueOrThrow());
            assertEquals(List.of("oops 5"), ErrorsOr.lift(5).<Integer>flatMap(n -> ErrorsOr.error("oops " + n)).getErrors());
        }

        @Test
        void tryingCapturesExceptions() {
            assertEquals(3, ErrorsOr.trying(() -> 3).valueOrThrow());
            ErrorsOr<Integer> failed = ErrorsOr.trying(() -> {
                throw new java.io.IOException("disk gone");
            });
            assertEquals(List.of("Evaluation error: IOException: disk gone"), failed.getErrors());
        }

        @Test
        void mapTryCapturesExceptions() {
            ErrorsOr<Integer> failed = ErrorsOr.lift("x").mapTry(Integer::parseInt);
            assertTrue(failed.isError());
            assertTrue(failed.getErrors().get(0).startsWith("Evaluation error: NumberFormatException"));
            assertEquals(12, ErrorsOr.lift("12").mapTry(Integer::parseInt).valueOrThrow());
        }
    }
}
