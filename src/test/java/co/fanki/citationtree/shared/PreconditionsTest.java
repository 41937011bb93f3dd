package co.fanki.citationtree.shared;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for Preconditions utility.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PreconditionsTest {

    @Test
    void whenRequireNonNull_givenNonNullValue_shouldReturnValue() {
        final String value = "test";

        final String result = Preconditions.requireNonNull(value, "message");

        assertEquals(value, result);
    }

    @Test
    void whenRequireNonNull_givenNullValue_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonNull(null, "Value is null"));
    }

    @Test
    void whenRequireNonBlank_givenBlankString_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonBlank("  ", "String is blank"));
    }

    @Test
    void whenRequire_givenFalseCondition_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.require(false, "Condition is false"));
    }

    @Test
    void whenRequirePositive_givenZero_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requirePositive(0, "Not positive"));
    }

    @Test
    void whenRequireNonNegative_givenZero_shouldReturnZero() {
        final int result = Preconditions.requireNonNegative(0, "message");

        assertEquals(0, result);
    }

    @Test
    void whenRequireFinite_givenNaN_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireFinite(Double.NaN, "NaN"));
    }

    @Test
    void whenRequireFinite_givenInfinity_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireFinite(
                        Double.POSITIVE_INFINITY, "Infinite"));
    }

    @Test
    void whenRequireIdentifier_givenTableName_shouldReturnIt() {
        assertEquals("citation_nodes_v2", Preconditions.requireIdentifier(
                "citation_nodes_v2", "message"));
    }

    @Test
    void whenRequireIdentifier_givenSqlFragment_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireIdentifier(
                        "nodes; DROP TABLE tree_edges", "Not an identifier"));
    }

    @Test
    void whenRequireIdentifier_givenLeadingDigit_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireIdentifier("1nodes", "Invalid"));
    }

}
