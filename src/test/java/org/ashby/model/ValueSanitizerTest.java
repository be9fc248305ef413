package org.ashby.model;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Covers:
 * - SanitizedValue (construction, equality, missing singleton)
 * - ValueSanitizer (numbers, text, approximation markers, junk)
 */
public class ValueSanitizerTest {

    private final ValueSanitizer sanitizer = new ValueSanitizer();

    @Nested
    class SanitizedValueTests {

        @Test
        void of_rejectsNonFinite() {
            assertThrows(IllegalArgumentException.class, () -> SanitizedValue.of(Double.NaN));
            assertThrows(IllegalArgumentException.class, () -> SanitizedValue.of(Double.POSITIVE_INFINITY));
        }

        @Test
        void missing_isSingletonAndHasNoValue() {
            assertSame(SanitizedValue.missing(), SanitizedValue.missing());
            assertTrue(SanitizedValue.missing().isMissing());
            assertFalse(SanitizedValue.missing().isNumber());
            assertThrows(IllegalStateException.class, () -> SanitizedValue.missing().value());
            assertTrue(SanitizedValue.missing().asOptional().isEmpty());
        }

        @Test
        void equality_followsNumericValue_andFoldsNegativeZero() {
            assertEquals(SanitizedValue.of(1.5), SanitizedValue.of(1.5));
            assertEquals(SanitizedValue.of(0.0), SanitizedValue.of(-0.0));
            assertEquals(SanitizedValue.of(0.0).hashCode(), SanitizedValue.of(-0.0).hashCode());
            assertNotEquals(SanitizedValue.of(1.0), SanitizedValue.missing());
        }

        @Test
        void toString_isReadable() {
            assertEquals("Number(2.5)", SanitizedValue.of(2.5).toString());
            assertEquals("Missing", SanitizedValue.missing().toString());
        }
    }

    @Nested
    class NumberInputTests {

        @Test
        void numbers_passThrough() {
            assertEquals(SanitizedValue.of(7800.0), sanitizer.sanitize(7800.0));
            assertEquals(SanitizedValue.of(42.0), sanitizer.sanitize(42));
            assertEquals(SanitizedValue.of(42.0), sanitizer.sanitize(42L));
            assertEquals(SanitizedValue.of(0.25), sanitizer.sanitize(new BigDecimal("0.25")));
        }

        @Test
        void nonFiniteNumbers_areMissing() {
            assertTrue(sanitizer.sanitize(Double.NaN).isMissing());
            assertTrue(sanitizer.sanitize(Double.NEGATIVE_INFINITY).isMissing());
        }

        @Test
        void nullAndBooleans_areMissing() {
            assertTrue(sanitizer.sanitize(null).isMissing());
            assertTrue(sanitizer.sanitize(Boolean.TRUE).isMissing());
            assertTrue(sanitizer.sanitize(Boolean.FALSE).isMissing());
        }

        @Test
        void alreadySanitized_isReturnedAsIs() {
            SanitizedValue v = SanitizedValue.of(3.0);
            assertSame(v, sanitizer.sanitize(v));
        }
    }

    @Nested
    class TextInputTests {

        @Test
        void plainDecimalText_parses() {
            assertEquals(3.5, sanitizer.sanitize("3.5").value());
            assertEquals(-0.5, sanitizer.sanitize("-0.5").value());
            assertEquals(12.0, sanitizer.sanitize("+12").value());
            assertEquals(0.5, sanitizer.sanitize(".5").value());
            assertEquals(5.0, sanitizer.sanitize("5.").value());
            assertEquals(1.2e-4, sanitizer.sanitize("1.2E-4").value(), 1e-18);
        }

        @Test
        void surroundingWhitespace_isIgnored() {
            assertEquals(210.0, sanitizer.sanitize("  210 \t").value());
        }

        @Test
        void approximationMarker_isStripped() {
            assertEquals(8000.0, sanitizer.sanitize("~8000").value());
            assertEquals(8000.0, sanitizer.sanitize(" ~ 8000 ").value());
            assertEquals(0.3, sanitizer.sanitize("~0.3").value());
        }

        @Test
        void onlyOneLeadingMarker_isStripped() {
            assertTrue(sanitizer.sanitize("~~5").isMissing());
            assertTrue(sanitizer.sanitize("5~").isMissing());
            assertTrue(sanitizer.sanitize("~").isMissing());
        }

        @Test
        void junkText_isMissing() {
            assertTrue(sanitizer.sanitize("").isMissing());
            assertTrue(sanitizer.sanitize("   ").isMissing());
            assertTrue(sanitizer.sanitize("n/a").isMissing());
            assertTrue(sanitizer.sanitize("12 MPa").isMissing());
            assertTrue(sanitizer.sanitize("1,5").isMissing());
            assertTrue(sanitizer.sanitize("-").isMissing());
        }

        @Test
        void javaOnlyNumberSpellings_areRejected() {
            assertTrue(sanitizer.sanitize("NaN").isMissing());
            assertTrue(sanitizer.sanitize("Infinity").isMissing());
            assertTrue(sanitizer.sanitize("0x1p3").isMissing());
            assertTrue(sanitizer.sanitize("2d").isMissing());
            assertTrue(sanitizer.sanitize("3f").isMissing());
        }

        @Test
        void overflowingText_isMissing() {
            assertTrue(sanitizer.sanitize("1e999").isMissing());
        }
    }

    @Nested
    class ConfigurationTests {

        @Test
        void customMarkers_areHonored() {
            ValueSanitizer s = new ValueSanitizer(List.of("~", "ca."));
            assertEquals(40.0, s.sanitize("ca. 40").value());
            assertEquals(40.0, s.sanitize("~40").value());
        }

        @Test
        void noMarkers_meansTildeIsJunk() {
            ValueSanitizer s = new ValueSanitizer(List.of());
            assertTrue(s.sanitize("~40").isMissing());
        }

        @Test
        void emptyMarker_isRejected() {
            assertThrows(IllegalArgumentException.class, () -> new ValueSanitizer(List.of("")));
            assertThrows(NullPointerException.class, () -> new ValueSanitizer(null));
        }
    }
}
