package co.fanki.citationtree.shared;

/**
 * Utility class for argument validation and precondition checks.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Preconditions {

    private Preconditions() {
        // Utility class, not instantiable
    }

    /**
     * Ensures that an object reference is not null.
     *
     * @param reference the object reference to check
     * @param message the exception message if null
     * @param <T> the type of the reference
     * @return the non-null reference
     * @throws IllegalArgumentException if reference is null
     */
    public static <T> T requireNonNull(final T reference, final String message) {
        if (reference == null) {
            throw new IllegalArgumentException(message);
        }
        return reference;
    }

    /**
     * Ensures that a string is not null or blank.
     *
     * @param value the string to check
     * @param message the exception message if null or blank
     * @return the non-blank string
     * @throws IllegalArgumentException if value is null or blank
     */
    public static String requireNonBlank(final String value,
            final String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Ensures that a condition is true.
     *
     * @param condition the condition to check
     * @param message the exception message if false
     * @throws IllegalArgumentException if condition is false
     */
    public static void require(final boolean condition, final String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Ensures that a number is positive.
     *
     * @param value the number to check
     * @param message the exception message if not positive
     * @return the positive number
     * @throws IllegalArgumentException if value is not positive
     */
    public static int requirePositive(final int value, final String message) {
        if (value <= 0) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Ensures that a number is non-negative.
     *
     * @param value the number to check
     * @param message the exception message if negative
     * @return the non-negative number
     * @throws IllegalArgumentException if value is negative
     */
    public static int requireNonNegative(final int value, final String message) {
        if (value < 0) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Ensures that a coordinate is a finite number.
     *
     * @param value the coordinate to check
     * @param message the exception message if NaN or infinite
     * @return the finite value
     * @throws IllegalArgumentException if value is NaN or infinite
     */
    public static double requireFinite(final double value,
            final String message) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Ensures that a string is a plain SQL identifier.
     *
     * <p>Identifiers cannot be bound as statement parameters, so any table
     * name that reaches a query template must pass this check first.</p>
     *
     * @param value the identifier to check
     * @param message the exception message if invalid
     * @return the identifier
     * @throws IllegalArgumentException if value is not a plain identifier
     */
    public static String requireIdentifier(final String value,
            final String message) {
        if (value == null || !value.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

}
