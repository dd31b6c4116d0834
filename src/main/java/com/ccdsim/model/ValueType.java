package com.ccdsim.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Value types a parameter or flag can take, with lenient coercion from the
 * shapes that config files, the command line and FITS headers produce.
 */
public enum ValueType {
    INTEGER,
    LONG,
    DOUBLE,
    DOUBLE_LIST,
    STRING,
    BOOLEAN;

    /**
     * Coerces a raw value into this type.
     *
     * @param key the setting name, used in the fault message
     * @param raw a {@link Number}, {@link Boolean}, {@link String} or {@link List}
     * @return the typed value ({@link Integer}, {@link Long}, {@link Double},
     *         unmodifiable {@code List<Double>}, {@link String} or {@link Boolean})
     * @throws CcdSimException with {@link Fault#INVALID_VALUE} if the value does not fit
     */
    public Object coerce(String key, Object raw) {
        if (raw == null) {
            throw invalid(key, raw);
        }
        try {
            switch (this) {
                case INTEGER:
                    return Integer.valueOf(Math.toIntExact(toWholeNumber(key, raw).longValue()));
                case LONG:
                    return Long.valueOf(toWholeNumber(key, raw).longValue());
                case DOUBLE:
                    return Double.valueOf(toDouble(key, raw));
                case DOUBLE_LIST:
                    return toDoubleList(key, raw);
                case STRING:
                    if (raw instanceof List) throw invalid(key, raw);
                    return raw.toString().trim();
                case BOOLEAN:
                    return toBoolean(key, raw);
                default:
                    throw invalid(key, raw);
            }
        } catch (NumberFormatException e) {
            throw new CcdSimException(Fault.INVALID_VALUE,
                    "Expected key \"" + key + "\" with value " + raw + " to have type " + this, e);
        } catch (ArithmeticException e) {
            throw new CcdSimException(Fault.INVALID_VALUE,
                    "Value " + raw + " for key \"" + key + "\" is out of range for type " + this, e);
        }
    }

    /** Renders a typed value the way the settings listing and FITS HISTORY show it. */
    public String format(Object value) {
        if (value instanceof List) {
            List<String> parts = new ArrayList<>();
            for (Object o : (List<?>) value) parts.add(String.valueOf(o));
            return "[" + String.join(", ", parts) + "]";
        }
        return String.valueOf(value);
    }

    private static Number toWholeNumber(String key, Object raw) {
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short) {
            return (Number) raw;
        }
        if (raw instanceof Number) {
            double d = ((Number) raw).doubleValue();
            if (d != Math.rint(d)) throw invalid(key, raw);
            // (long) saturates instead of failing
            if (d >= 0x1p63 || d < -0x1p63) throw new ArithmeticException("long overflow");
            return Long.valueOf((long) d);
        }
        if (raw instanceof String) {
            String s = ((String) raw).trim();
            if (s.contains(".") || s.toLowerCase(Locale.ROOT).contains("e")) {
                return toWholeNumber(key, Double.valueOf(s));
            }
            return Long.valueOf(s);
        }
        throw invalid(key, raw);
    }

    private static double toDouble(String key, Object raw) {
        if (raw instanceof Number) return ((Number) raw).doubleValue();
        if (raw instanceof String) return Double.parseDouble(((String) raw).trim());
        throw invalid(key, raw);
    }

    private static List<Double> toDoubleList(String key, Object raw) {
        List<Double> values = new ArrayList<>();
        if (raw instanceof List) {
            for (Object o : (List<?>) raw) values.add(toDouble(key, o));
        } else if (raw instanceof Number) {
            values.add(((Number) raw).doubleValue());
        } else if (raw instanceof String) {
            // JSON-style "[5.5, 5.5]" or bare "5.5,5.5" / "5.5 5.5"
            String s = ((String) raw).trim();
            if (s.startsWith("[") && s.endsWith("]")) s = s.substring(1, s.length() - 1);
            for (String part : s.split("[,\\s]+")) {
                if (!part.isEmpty()) values.add(Double.parseDouble(part));
            }
        } else {
            throw invalid(key, raw);
        }
        if (values.isEmpty()) throw invalid(key, raw);
        return Collections.unmodifiableList(values);
    }

    private static Boolean toBoolean(String key, Object raw) {
        if (raw instanceof Boolean) return (Boolean) raw;
        if (raw instanceof String) {
            String s = ((String) raw).trim().toLowerCase(Locale.ROOT);
            switch (s) {
                case "true": case "t": case "yes": case "on": case "1":
                    return Boolean.TRUE;
                case "false": case "f": case "no": case "off": case "0":
                    return Boolean.FALSE;
                default:
                    break;
            }
        }
        throw invalid(key, raw);
    }

    private static CcdSimException invalid(String key, Object raw) {
        String type = raw == null ? "null" : raw.getClass().getSimpleName();
        return new CcdSimException(Fault.INVALID_VALUE,
                "Cannot interpret value " + raw + " (" + type + ") for key \"" + key + "\"");
    }
}
