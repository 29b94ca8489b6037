package com.tessera.database.relation;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.regex.Pattern;
import org.bson.types.ObjectId;

/**
 * Canonical dictionary keys for matching related models to parents.
 *
 * <p>Integral numbers of any width, integral floating values and integer strings all map to the same
 * decimal string, so {@code 1}, {@code 1L}, {@code 1.0} and {@code "1"} match each other.
 * {@link ObjectId}s map to their hex form. Null never matches anything.
 */
public final class RelationKeys {

    private static final Pattern INTEGER = Pattern.compile("-?\\d+");

    private RelationKeys() {
        // utility class
    }

    /** Canonical key, or null for a null value. */
    public static String normalize(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte
                || value instanceof BigInteger) {
            return value.toString();
        }
        if (value instanceof Number number) {
            return normalizeDecimal(number);
        }
        if (value instanceof ObjectId objectId) {
            return objectId.toHexString();
        }
        if (value instanceof String text && INTEGER.matcher(text).matches()) {
            return new BigInteger(text).toString();
        }
        return value.toString();
    }

    private static String normalizeDecimal(Number number) {
        BigDecimal decimal;
        if (number instanceof BigDecimal big) {
            decimal = big;
        } else {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return Double.toString(d);
            }
            decimal = BigDecimal.valueOf(d);
        }
        BigDecimal stripped = decimal.stripTrailingZeros();
        if (stripped.scale() <= 0) {
            return stripped.toBigIntegerExact().toString();
        }
        return stripped.toPlainString();
    }
}
