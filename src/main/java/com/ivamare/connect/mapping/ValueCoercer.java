package com.ivamare.connect.mapping;

import com.ivamare.connect.exception.CoercionException;
import com.ivamare.connect.model.FieldType;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Coerces resolved raw values to a {@link FieldType}.
 *
 * <ul>
 *   <li>string: any scalar stringified</li>
 *   <li>int/long: integral numbers and integer strings, range checked</li>
 *   <li>boolean: booleans; "true"/"1"/"yes" and "false"/"0" (case-insensitive); numbers by truthiness</li>
 *   <li>bytes: byte arrays and buffers; strings are UTF-8 encoded</li>
 * </ul>
 */
public final class ValueCoercer {

    private ValueCoercer() {
        // Utility class - no instantiation
    }

    /**
     * Coerce a non-null value.
     *
     * @param targetField field name for error reporting
     * @param type target type
     * @param value raw value, never null
     * @return the coerced value
     * @throws CoercionException if the value cannot satisfy the type
     */
    public static Object coerce(String targetField, FieldType type, Object value) {
        if (value == null) {
            throw new CoercionException(targetField, "value is null but field is not nullable (type=" + type.getValue() + ")");
        }
        return switch (type) {
            case STRING -> toStringValue(value);
            case INT -> toInt(targetField, value);
            case LONG -> toLong(targetField, value);
            case BOOLEAN -> toBoolean(targetField, value);
            case BYTES -> toBytes(targetField, value);
        };
    }

    private static String toStringValue(Object value) {
        if (value instanceof byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return String.valueOf(value);
    }

    private static Integer toInt(String targetField, Object value) {
        long longValue = toLong(targetField, value);
        if (longValue < Integer.MIN_VALUE || longValue > Integer.MAX_VALUE) {
            throw new CoercionException(targetField, "value " + longValue + " out of int range");
        }
        return (int) longValue;
    }

    private static Long toLong(String targetField, Object value) {
        if (value instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big) {
            try {
                return big.longValueExact();
            } catch (ArithmeticException e) {
                throw new CoercionException(targetField, "value " + big + " out of long range", e);
            }
        }
        if (value instanceof Number number) {
            // Fractional numbers truncate toward zero
            BigDecimal decimal = decimalOf(targetField, number);
            try {
                return decimal.toBigInteger().longValueExact();
            } catch (ArithmeticException e) {
                throw new CoercionException(targetField, "value " + number + " out of long range", e);
            }
        }
        if (value instanceof CharSequence text) {
            String trimmed = text.toString().trim();
            try {
                return Long.parseLong(trimmed);
            } catch (NumberFormatException e) {
                throw new CoercionException(targetField, "cannot parse '" + trimmed + "' as integer", e);
            }
        }
        throw new CoercionException(targetField, "cannot coerce " + value.getClass().getSimpleName() + " to integer");
    }

    private static Boolean toBoolean(String targetField, Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number number) {
            return decimalOf(targetField, number).signum() != 0;
        }
        if (value instanceof CharSequence text) {
            String normalized = text.toString().trim().toLowerCase();
            return switch (normalized) {
                case "true", "1", "yes" -> true;
                case "false", "0" -> false;
                default -> throw new CoercionException(targetField, "cannot parse '" + text + "' as boolean");
            };
        }
        throw new CoercionException(targetField, "cannot coerce " + value.getClass().getSimpleName() + " to boolean");
    }

    private static BigDecimal decimalOf(String targetField, Number number) {
        try {
            return new BigDecimal(number.toString());
        } catch (NumberFormatException e) {
            throw new CoercionException(targetField, "value " + number + " is not a finite number", e);
        }
    }

    private static byte[] toBytes(String targetField, Object value) {
        if (value instanceof byte[] bytes) {
            return bytes;
        }
        if (value instanceof ByteBuffer buffer) {
            ByteBuffer copy = buffer.duplicate();
            byte[] bytes = new byte[copy.remaining()];
            copy.get(bytes);
            return bytes;
        }
        if (value instanceof CharSequence text) {
            return text.toString().getBytes(StandardCharsets.UTF_8);
        }
        throw new CoercionException(targetField, "cannot coerce " + value.getClass().getSimpleName() + " to bytes");
    }
}
