package com.logicsynth.facts;

import com.logicsynth.ir.CompositeKind;
import com.logicsynth.ir.Term;
import com.logicsynth.schema.ValueType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LoosePromotionTest {

    @Nested
    @DisplayName("Strings")
    class Strings {

        @Test
        void slashPrefixed_isAName() {
            assertEquals(Term.name("/alice"), LoosePromotion.promote("/alice", null));
        }

        @Test
        void bareIdentifier_isPromotedToAName() {
            assertEquals(Term.name("/alice"), LoosePromotion.promote("alice", null));
        }

        @Test
        void textWithSpaces_staysText() {
            assertEquals(Term.text("alice bob"), LoosePromotion.promote("alice bob", null));
        }

        @Test
        void capitalisedWord_staysText() {
            assertEquals(Term.text("Alice"), LoosePromotion.promote("Alice", null));
        }

        @Test
        void stringBound_suppressesPromotion() {
            assertEquals(Term.text("alice"), LoosePromotion.promote("alice", ValueType.STRING));
            assertEquals(Term.text("/alice"), LoosePromotion.promote("/alice", ValueType.STRING));
        }

        @Test
        void nameBound_forcesPromotion() {
            assertEquals(Term.name("/Alice"), LoosePromotion.promote("Alice", ValueType.NAME));
        }
    }

    @Nested
    @DisplayName("Other JSON values")
    class Others {

        @Test
        void integers_areNumbers() {
            assertEquals(Term.number(42), LoosePromotion.promote(42, null));
            assertEquals(Term.number(5_000_000_000L), LoosePromotion.promote(5_000_000_000L, null));
        }

        @Test
        void oversizedInteger_isRejected() {
            assertThrows(ArithmeticException.class,
                () -> LoosePromotion.promote(BigInteger.TEN.pow(30), null));
        }

        @Test
        void decimals_areFloats() {
            assertEquals(Term.float64(2.5), LoosePromotion.promote(2.5, null));
        }

        @Test
        void booleans_areNames() {
            assertEquals(Term.name("/true"), LoosePromotion.promote(true, null));
            assertEquals(Term.name("/false"), LoosePromotion.promote(false, null));
        }

        @Test
        void lists_promoteTheirElements() {
            assertEquals(new Term.Composite(CompositeKind.LIST, List.of(Term.name("/a"), Term.number(1))),
                LoosePromotion.promote(List.of("a", 1), null));
        }

        @Test
        void objects_becomeJsonText() {
            assertEquals(Term.text("{\"k\":1}"), LoosePromotion.promote(Map.of("k", 1), null));
        }

        @Test
        void null_isRejected() {
            assertThrows(IllegalArgumentException.class, () -> LoosePromotion.promote(null, null));
        }
    }
}
