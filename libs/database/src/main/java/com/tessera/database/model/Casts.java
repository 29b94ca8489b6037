package com.tessera.database.model;

import com.tessera.database.exception.ConfigurationException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import org.bson.types.Decimal128;

/** Built-in {@link AttributeCast}s. */
public final class Casts {

    public static final AttributeCast STRING = of("string", Casts::toStringValue, Casts::toStringValue);
    public static final AttributeCast INTEGER = of("integer", Casts::toInteger, Casts::toInteger);
    public static final AttributeCast LONG = of("long", Casts::toLong, Casts::toLong);
    public static final AttributeCast DOUBLE = of("double", Casts::toDouble, Casts::toDouble);
    public static final AttributeCast DECIMAL = of("decimal", Casts::toDecimal, Casts::toDecimal);
    public static final AttributeCast BOOLEAN = of("boolean", Casts::toBoolean, Casts::toBoolean);
    public static final AttributeCast JSON = of("json", ModelJson::write, Casts::fromJson);
    public static final AttributeCast ARRAY = of("array", Casts::arrayToJson, Casts::jsonToList);
    public static final AttributeCast DATE = of("date", Casts::toLocalDate, Casts::toLocalDate);
    public static final AttributeCast DATETIME = of("datetime", Casts::toLocalDateTime, Casts::toLocalDateTime);

    private static final Map<String, AttributeCast> BY_NAME = Map.ofEntries(
            Map.entry("string", STRING),
            Map.entry("integer", INTEGER),
            Map.entry("int", INTEGER),
            Map.entry("long", LONG),
            Map.entry("double", DOUBLE),
            Map.entry("float", DOUBLE),
            Map.entry("decimal", DECIMAL),
            Map.entry("boolean", BOOLEAN),
            Map.entry("bool", BOOLEAN),
            Map.entry("json", JSON),
            Map.entry("object", JSON),
            Map.entry("array", ARRAY),
            Map.entry("date", DATE),
            Map.entry("datetime", DATETIME));

    private Casts() {
        // utility class
    }

    /**
     * Looks up a built-in cast by name (case-insensitive).
     *
     * @throws ConfigurationException for an unknown name
     */
    public static AttributeCast named(String name) {
        AttributeCast cast = name == null ? null : BY_NAME.get(name.toLowerCase(Locale.ROOT));
        if (cast == null) {
            throw new ConfigurationException("Unknown cast '%s'".formatted(name), Map.of("cast", String.valueOf(name)));
        }
        return cast;
    }

    private static AttributeCast of(String name, Function<Object, Object> encode, Function<Object, Object> decode) {
        return new AttributeCast() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Object encode(Object value) {
                return value == null ? null : encode.apply(value);
            }

            @Override
            public Object decode(Object value) {
                return value == null ? null : decode.apply(value);
            }

            @Override
            public String toString() {
                return "cast:" + name;
            }
        };
    }

    private static Object toStringValue(Object value) {
        return value.toString();
    }

    private static Object toInteger(Object value) {
        if (value instanceof Integer) {
            return value;
        }
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value instanceof Boolean b) {
            return b ? 1 : 0;
        }
        return Integer.parseInt(value.toString().trim());
    }

    private static Object toLong(Object value) {
        if (value instanceof Long) {
            return value;
        }
        if (value instanceof Number n) {
            return n.longValue();
        }
        return Long.parseLong(value.toString().trim());
    }

    private static Object toDouble(Object value) {
        if (value instanceof Double) {
            return value;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        return Double.parseDouble(value.toString().trim());
    }

    private static Object toDecimal(Object value) {
        if (value instanceof BigDecimal) {
            return value;
        }
        if (value instanceof Decimal128 d) {
            return d.bigDecimalValue();
        }
        return new BigDecimal(value.toString().trim());
    }

    private static Object toBoolean(Object value) {
        if (value instanceof Boolean) {
            return value;
        }
        if (value instanceof Number n) {
            return n.intValue() != 0;
        }
        String text = value.toString().trim().toLowerCase(Locale.ROOT);
        return switch (text) {
            case "1", "true", "yes", "on" -> Boolean.TRUE;
            case "0", "false", "no", "off", "" -> Boolean.FALSE;
            default -> throw new IllegalArgumentException("Not a boolean: " + value);
        };
    }

    private static Object fromJson(Object value) {
        if (value instanceof String json) {
            return ModelJson.read(json);
        }
        if (value instanceof byte[] bytes) {
            return ModelJson.read(new String(bytes, StandardCharsets.UTF_8));
        }
        if (value instanceof Map<?, ?> || value instanceof Collection<?> || value instanceof Number
                || value instanceof Boolean) {
            return value;
        }
        // driver wrappers such as PGobject render their JSON text
        return ModelJson.read(value.toString());
    }

    private static Object arrayToJson(Object value) {
        if (value instanceof Object[] array) {
            return ModelJson.write(Arrays.asList(array));
        }
        if (value instanceof Collection<?> collection) {
            return ModelJson.write(List.copyOf(collection));
        }
        throw new IllegalArgumentException("array cast expects a collection or array, got " + value.getClass().getName());
    }

    private static Object jsonToList(Object value) {
        Object decoded = fromJson(value);
        if (!(decoded instanceof List<?>)) {
            throw new IllegalArgumentException("array cast expects a JSON array");
        }
        return decoded;
    }

    private static Object toLocalDate(Object value) {
        if (value instanceof LocalDate) {
            return value;
        }
        if (value instanceof java.sql.Date sqlDate) {
            return sqlDate.toLocalDate();
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (value instanceof Date || value instanceof Instant || value instanceof OffsetDateTime
                || value instanceof ZonedDateTime) {
            return ((LocalDateTime) toLocalDateTime(value)).toLocalDate();
        }
        String text = value.toString().trim();
        return LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
    }

    private static Object toLocalDateTime(Object value) {
        if (value instanceof LocalDateTime) {
            return value;
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toLocalDateTime();
        }
        if (value instanceof java.sql.Date sqlDate) {
            return sqlDate.toLocalDate().atStartOfDay();
        }
        if (value instanceof Date date) {
            return LocalDateTime.ofInstant(date.toInstant(), ZoneOffset.UTC);
        }
        if (value instanceof Instant instant) {
            return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
        }
        if (value instanceof OffsetDateTime offset) {
            return offset.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        }
        if (value instanceof ZonedDateTime zoned) {
            return zoned.withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
        }
        if (value instanceof LocalDate date) {
            return date.atStartOfDay();
        }
        return LocalDateTime.parse(value.toString().trim().replace(' ', 'T'));
    }
}
