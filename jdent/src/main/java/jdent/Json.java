package jdent;

import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.net.URL;
import java.nio.file.Path;
import java.time.ZoneId;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalAmount;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Currency;
import java.util.Date;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.Queue;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.Spliterators;
import java.util.TimeZone;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;
import java.util.stream.BaseStream;
import jdent.JsonException.ConversionException;
import jdent.JsonException.WriteException;
import lombok.Builder;
import lombok.Singular;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry points for printing Java values as JSON and for reading JSON, whole or piece by piece.
 *
 * <p> Reading is push-style: {@link #forEachArrayElement} and {@link #forEachObjectField} hand
 * every element to a consumer as it is found, and {@link #parse(Cursor, Type)} is itself built on
 * them. No document tree is built unless {@code Object} is asked for.
 *
 * @since 0.1.0
 */
public final class Json {

    private static final Logger LOGGER = LoggerFactory.getLogger(Json.class);

    private static final List<Printer> printers = loadPrinters();

    private static final Writer defaultWriter = Writer.builder().build();
    private static final Reader defaultReader = Reader.builder().build();
    private static final PrettyPrinter defaultPrettyPrinter = PrettyPrinter.builder().build();

    private Json() {
        throw new UnsupportedOperationException();
    }

    // ============================================================
    // Public API
    // ============================================================

    /**
     * Print a Java value as compact JSON.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * Json.stringify(Map.of("xs", List.of(1, 2)));  // -> {"xs":[1,2]}
     * Json.stringify(Optional.empty());             // -> null
     * }</pre>
     *
     * @param o any value, may be {@code null}
     * @return non-null JSON text
     * @throws WriteException if some part of {@code o} has no JSON form
     */
    public static String stringify(@Nullable Object o) {
        return defaultWriter.write(o);
    }

    /**
     * Print a Java value, handing {@code context} to every {@link JsonPrintable} and
     * {@link Printer} on the way down.
     */
    public static String stringify(@Nullable Object o, @Nullable Object context) {
        return defaultWriter.write(o, context);
    }

    /**
     * Parse JSON text into a target type described by a {@link Type} token.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * List<Integer> xs = Json.parse("[1,2,3]", new Json.Type<List<Integer>>() {});
     * }</pre>
     *
     * @param json JSON text holding exactly one value, not {@code null}
     * @param type target type token, not {@code null}
     * @return parsed instance (maybe {@code null} if json is "null")
     */
    public static <T> T parse(String json, Type<T> type) {
        Objects.requireNonNull(json, "json");
        Objects.requireNonNull(type, "type");
        return defaultReader.read(json, type);
    }

    /**
     * Parse JSON text into a target class.
     *
     * <p> This is a convenience overload of {@link #parse(String, Type)}
     */
    public static <T> T parse(String json, Class<T> clazz) {
        Objects.requireNonNull(clazz, "clazz");
        return parse(json, Type.of(clazz));
    }

    /**
     * Parse the next value at {@code cursor} into {@code type}, leaving the cursor just after it.
     */
    public static <T> T parse(Cursor cursor, Type<T> type) {
        return defaultReader.read(cursor, type);
    }

    public static <T> T parse(Cursor cursor, Class<T> clazz) {
        return defaultReader.read(cursor, Type.of(clazz));
    }

    /**
     * @see PushParser#parseArray(Cursor, ElementConsumer)
     */
    public static void forEachArrayElement(Cursor cursor, ElementConsumer consumer) {
        PushParser.parseArray(cursor, consumer);
    }

    /**
     * @see PushParser#parseObject(Cursor, FieldConsumer)
     */
    public static void forEachObjectField(Cursor cursor, FieldConsumer consumer) {
        PushParser.parseObject(cursor, consumer);
    }

    /**
     * @see Cursor#classify()
     */
    public static JsonType classify(Cursor cursor) {
        return cursor.classify();
    }

    /**
     * Re-indent a single JSON value with the default {@link PrettyPrinter} settings.
     */
    public static String prettyPrint(String json) {
        return defaultPrettyPrinter.print(json);
    }

    public static String prettyPrint(String json, int indentWidth, NumberMode numberMode) {
        return PrettyPrinter.builder()
                .indentWidth(indentWidth)
                .numberMode(numberMode)
                .build()
                .print(json);
    }

    // ============================================================
    // Extension point
    // ============================================================

    /**
     * Prints values of types that cannot implement {@link JsonPrintable} themselves.
     *
     * <p> Printers are passed to {@link Writer.WriterBuilder#printer(Printer)} or registered in
     * {@code META-INF/services/jdent.Json$Printer}. They are consulted in that order, after
     * {@link JsonPrintable} and before any built-in rule.
     */
    public interface Printer {
        boolean canPrint(Object o);

        void print(JsonOutput out, Object o, @Nullable Object context);
    }

    /**
     * Reads one value of a fixed type from a cursor; used by {@link Reader}.
     */
    @FunctionalInterface
    public interface Decoder<T> {
        T decode(Cursor cursor);
    }

    // ============================================================
    // Type token
    // ============================================================

    public abstract static class Type<T> {
        private final java.lang.reflect.Type type;

        protected Type() {
            Class<?> c = findTypeSubclass(getClass());
            var p = (ParameterizedType) c.getGenericSuperclass();
            this.type = p.getActualTypeArguments()[0];
        }

        private Type(java.lang.reflect.Type t) {
            this.type = t;
        }

        public static <T> Type<T> of(Class<T> clazz) {
            return new Type<>(clazz) {};
        }

        public java.lang.reflect.Type getType() {
            return type;
        }

        private static Class<?> findTypeSubclass(Class<?> child) {
            Class<?> parent = child.getSuperclass();
            if (parent == Type.class) return child;
            if (parent == Object.class) throw new IllegalStateException("Expected Json.Type superclass");
            return findTypeSubclass(parent);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Type<?> t && Objects.equals(type, t.type);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(type);
        }

        @Override
        public String toString() {
            return "Type{" + type + '}';
        }
    }

    // ============================================================
    // Writer
    // ============================================================

    /**
     * Prints Java values as compact JSON by a fixed precedence of shapes: {@link JsonPrintable},
     * configured and discovered {@link Printer}s, {@link Binding}, string-like values, scalars,
     * enums, optionals and references, pairs, maps, then sequences. Anything else is a
     * {@link WriteException}.
     *
     * <p> Instances are immutable and may be shared between threads.
     */
    @Builder(toBuilder = true)
    public static final class Writer {

        @Singular("printer")
        private final List<Printer> printers;

        public String write(@Nullable Object o) {
            return write(o, null);
        }

        public String write(@Nullable Object o, @Nullable Object context) {
            var sb = new StringBuilder();
            write(sb, o, context);
            return sb.toString();
        }

        /**
         * Print straight to {@code out}, without building the text in memory first.
         */
        public void write(Appendable out, @Nullable Object o, @Nullable Object context) {
            new JsonOutput(out, this, context).value(o, context);
        }

        @SuppressWarnings("unchecked")
        void print(JsonOutput out, @Nullable Object o, @Nullable Object context) {
            if (o == null) {
                out.nullValue();
                return;
            }
            if (o instanceof JsonPrintable<?> p) {
                ((JsonPrintable<Object>) p).printJson(out, context);
                return;
            }
            for (var printer : this.printers) {
                if (printer.canPrint(o)) {
                    printer.print(out, o, context);
                    return;
                }
            }
            for (var printer : Json.printers) {
                if (printer.canPrint(o)) {
                    printer.print(out, o, context);
                    return;
                }
            }
            if (o instanceof Binding<?, ?> b) {
                out.value(b.value(), b.context());
                return;
            }
            if (writeStringLike(out, o)) return;
            if (writeScalar(out, o)) return;
            if (o instanceof Enum<?> e) {
                out.string(e.name());
                return;
            }
            if (writeIndirection(out, o, context)) return;
            if (o instanceof Field<?, ?> f) {
                writeField(out, f.name(), f.value(), context);
                return;
            }
            if (o instanceof Map.Entry<?, ?> en) {
                writeField(out, en.getKey(), en.getValue(), context);
                return;
            }
            if (o instanceof Map<?, ?> m) {
                writeMap(out, m, context);
                return;
            }
            if (writeArray(out, o, context)) return;
            if (o instanceof Iterable<?> it) {
                writeIterator(out, it.iterator(), context);
                return;
            }
            if (o instanceof BaseStream<?, ?> stream) {
                try (var s = stream) {
                    writeIterator(out, Spliterators.iterator(s.spliterator()), context);
                }
                return;
            }
            throw new WriteException("No JSON form for " + o.getClass().getName()
                    + ": implement JsonPrintable or register a Json.Printer");
        }

        static boolean writeStringLike(JsonOutput out, Object o) {
            if (o instanceof CharSequence s) out.string(s);
            else if (o instanceof Character c) out.string(String.valueOf(c));
            else if (o instanceof char[] chars) out.string(new String(chars));
            else if (o instanceof Date d) out.string(d.toInstant().toString());
            else if (o instanceof TemporalAccessor && !(o instanceof Enum<?>)) out.string(o.toString());
            else if (o instanceof TemporalAmount || o instanceof ZoneId) out.string(o.toString());
            else if (o instanceof UUID || o instanceof URI || o instanceof URL || o instanceof Path)
                out.string(o.toString());
            else if (o instanceof Pattern p) out.string(p.pattern());
            else if (o instanceof Locale l) out.string(l.toLanguageTag());
            else if (o instanceof Currency c) out.string(c.getCurrencyCode());
            else if (o instanceof TimeZone tz) out.string(tz.getID());
            else return false;
            return true;
        }

        static boolean writeScalar(JsonOutput out, Object o) {
            if (o instanceof Boolean b) out.raw(b ? "true" : "false");
            else if (o instanceof AtomicBoolean b) out.raw(b.get() ? "true" : "false");
            else if (o instanceof Decimal d) out.raw(d.toString());
            else if (o instanceof Number n) out.raw(numberLiteral(n));
            else return false;
            return true;
        }

        static String numberLiteral(Number n) {
            if (n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte
                    || n instanceof BigInteger || n instanceof BigDecimal
                    || n instanceof AtomicInteger || n instanceof AtomicLong) {
                return n.toString();
            }
            // Avoid NaN/Infinity (not valid in JSON)
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d))
                throw new WriteException("Cannot serialize NaN or Infinity as JSON number: " + n);
            return n instanceof Double || n instanceof Float ? n.toString() : Double.toString(d);
        }

        static boolean writeIndirection(JsonOutput out, Object o, @Nullable Object context) {
            if (o instanceof Optional<?> optional) out.value(optional.orElse(null), context);
            else if (o instanceof AtomicReference<?> ref) out.value(ref.get(), context);
            else if (o instanceof OptionalInt oi) {
                if (oi.isPresent()) out.raw(Integer.toString(oi.getAsInt()));
                else out.nullValue();
            } else if (o instanceof OptionalLong ol) {
                if (ol.isPresent()) out.raw(Long.toString(ol.getAsLong()));
                else out.nullValue();
            } else if (o instanceof OptionalDouble od) {
                if (od.isPresent()) out.raw(numberLiteral(od.getAsDouble()));
                else out.nullValue();
            } else return false;
            return true;
        }

        static void writeField(JsonOutput out, @Nullable Object name, @Nullable Object value, @Nullable Object context) {
            out.string(keyOf(name)).raw(":").value(value, context);
        }

        static void writeMap(JsonOutput out, Map<?, ?> map, @Nullable Object context) {
            try (var o = out.object()) {
                for (var en : map.entrySet()) {
                    o.field(keyOf(en.getKey()), en.getValue(), context);
                }
            }
        }

        static String keyOf(@Nullable Object key) {
            if (key instanceof Enum<?> e) return e.name();
            return String.valueOf(key); // JSON keys must be strings
        }

        static void writeIterator(JsonOutput out, Iterator<?> it, @Nullable Object context) {
            try (var a = out.array()) {
                while (it.hasNext()) a.element(it.next(), context);
            }
        }

        // char[] is taken as text by writeStringLike before this is reached
        static boolean writeArray(JsonOutput out, Object o, @Nullable Object context) {
            if (o instanceof Object[] arr) {
                writeIterator(out, Arrays.asList(arr).iterator(), context);
            } else if (o instanceof int[] arr) {
                try (var a = out.array()) {
                    for (int v : arr) a.element(v);
                }
            } else if (o instanceof long[] arr) {
                try (var a = out.array()) {
                    for (long v : arr) a.element(v);
                }
            } else if (o instanceof double[] arr) {
                try (var a = out.array()) {
                    for (double v : arr) a.element(v);
                }
            } else if (o instanceof float[] arr) {
                try (var a = out.array()) {
                    for (float v : arr) a.element(v);
                }
            } else if (o instanceof short[] arr) {
                try (var a = out.array()) {
                    for (short v : arr) a.element(v);
                }
            } else if (o instanceof byte[] arr) {
                try (var a = out.array()) {
                    for (byte v : arr) a.element(v);
                }
            } else if (o instanceof boolean[] arr) {
                try (var a = out.array()) {
                    for (boolean v : arr) a.element(v);
                }
            } else return false;
            return true;
        }
    }

    // ============================================================
    // Reader
    // ============================================================

    /**
     * Reads JSON into typed Java values on top of the push parser: containers are filled by the
     * array and object consumers as their elements arrive.
     *
     * <p> Supported targets: {@code Object} (maps, lists, strings, {@link Decimal}s, booleans and
     * {@code null}), strings and characters, booleans, all numeric primitives and boxes,
     * {@link BigInteger}, {@link BigDecimal}, {@link Number} (as {@link BigDecimal}),
     * {@link Decimal}, enums by name, {@link Optional}, arrays, collections, maps with string,
     * integer or enum keys, and records. {@link Decoder}s given to the builder win over all of it.
     *
     * <p> Instances are immutable and may be shared between threads.
     */
    @Builder(toBuilder = true)
    public static final class Reader {

        @Singular("decoder")
        private final Map<Class<?>, Decoder<?>> decoders;

        public <T> T read(String json, Class<T> clazz) {
            return read(json, Type.of(clazz));
        }

        /**
         * Read {@code json}, which must hold exactly one value and nothing after it but whitespace.
         */
        public <T> T read(String json, Type<T> type) {
            var cursor = Cursor.of(json);
            T value = read(cursor, type);
            cursor.expectEndOfInput();
            return value;
        }

        @SuppressWarnings("unchecked")
        public <T> T read(Cursor cursor, Type<T> type) {
            return (T) read(cursor, type.getType());
        }

        @SuppressWarnings({"unchecked", "rawtypes"})
        public @Nullable Object read(Cursor cursor, java.lang.reflect.Type targetType) {
            // Normalize reflective type, obtain raw class
            targetType = canonicalize(targetType);
            Class<?> raw = raw(targetType);

            Decoder<?> decoder = decoders.get(raw);
            if (decoder != null) return decoder.decode(cursor);

            JsonType type = cursor.classify();
            if (type == JsonType.END_OF_INPUT) throw cursor.unexpected(Cursor.EOF, "a JSON value");

            if (raw == Object.class) return readUntyped(cursor, type);

            if (raw == Optional.class) {
                if (type == JsonType.NULL) {
                    PushParser.parseNull(cursor);
                    return Optional.empty();
                }
                return Optional.ofNullable(read(cursor, typeArgument(targetType, 0)));
            }

            if (type == JsonType.NULL) {
                if (raw.isPrimitive()) throw new ConversionException("Cannot assign null to a primitive", targetType);
                PushParser.parseNull(cursor);
                return null;
            }

            if (raw == String.class || raw == CharSequence.class) {
                expectType(cursor, type, JsonType.STRING, targetType);
                return PushParser.parseString(cursor);
            }
            if (raw == char.class || raw == Character.class) {
                expectType(cursor, type, JsonType.STRING, targetType);
                String s = PushParser.parseString(cursor);
                if (s.length() != 1)
                    throw new ConversionException(
                            "Cannot convert string to char: expected length 1, got " + s.length() + " (\"" + s + "\")",
                            targetType);
                return s.charAt(0);
            }
            if (raw == boolean.class || raw == Boolean.class) {
                expectType(cursor, type, JsonType.BOOLEAN, targetType);
                return PushParser.parseBoolean(cursor);
            }
            if (raw == Decimal.class || Number.class.isAssignableFrom(raw) || (raw.isPrimitive() && raw != void.class)) {
                expectType(cursor, type, JsonType.NUMBER, targetType);
                return toNumber(PushParser.parseNumber(cursor), raw, targetType);
            }
            if (raw.isEnum()) {
                expectType(cursor, type, JsonType.STRING, targetType);
                return toEnum(PushParser.parseString(cursor), (Class<? extends Enum>) raw, targetType);
            }
            if (raw.isArray()) {
                expectType(cursor, type, JsonType.ARRAY, targetType);
                return readArray(cursor, targetType, raw);
            }
            if (Collection.class.isAssignableFrom(raw)) {
                expectType(cursor, type, JsonType.ARRAY, targetType);
                Collection<Object> collection = newCollection(raw, targetType);
                var elementType = typeArgument(targetType, 0);
                PushParser.parseArray(cursor, c -> collection.add(read(c, elementType)));
                return collection;
            }
            if (Map.class.isAssignableFrom(raw)) {
                expectType(cursor, type, JsonType.OBJECT, targetType);
                Map<Object, Object> map = newMap(raw, targetType);
                var keyType = typeArgument(targetType, 0);
                var valueType = typeArgument(targetType, 1);
                PushParser.parseObject(cursor, (c, name) -> map.put(toKey(name, keyType), read(c, valueType)));
                return map;
            }
            if (raw.isRecord()) {
                expectType(cursor, type, JsonType.OBJECT, targetType);
                return readRecord(cursor, raw);
            }
            throw new ConversionException(
                    "No decoder for this type; pass one to Json.Reader.builder().decoder(..)", targetType);
        }

        static @Nullable Object readUntyped(Cursor cursor, JsonType type) {
            return switch (type) {
                case OBJECT -> {
                    var map = new LinkedHashMap<String, Object>();
                    PushParser.parseObject(cursor, (c, name) -> map.put(name, readUntyped(c, c.classify())));
                    yield map;
                }
                case ARRAY -> {
                    var list = new ArrayList<Object>();
                    PushParser.parseArray(cursor, c -> list.add(readUntyped(c, c.classify())));
                    yield list;
                }
                case STRING -> PushParser.parseString(cursor);
                case NUMBER -> PushParser.parseNumber(cursor);
                case BOOLEAN -> PushParser.parseBoolean(cursor);
                case NULL -> {
                    PushParser.parseNull(cursor);
                    yield null;
                }
                case END_OF_INPUT -> throw cursor.unexpected(Cursor.EOF, "a JSON value");
            };
        }

        static void expectType(Cursor cursor, JsonType actual, JsonType expected, java.lang.reflect.Type targetType) {
            if (actual != expected)
                throw new ConversionException(
                        "Expected " + expected + " but found " + actual + " at line " + cursor.line() + ", column "
                                + cursor.column(),
                        targetType);
        }

        static Object toNumber(Decimal d, Class<?> raw, java.lang.reflect.Type targetType) {
            try {
                if (raw == Decimal.class) return d;
                if (raw == int.class || raw == Integer.class) return d.intValueExact();
                if (raw == long.class || raw == Long.class) return d.longValueExact();
                if (raw == short.class || raw == Short.class) return d.toBigDecimal().shortValueExact();
                if (raw == byte.class || raw == Byte.class) return d.toBigDecimal().byteValueExact();
                if (raw == double.class || raw == Double.class) return d.toDouble();
                if (raw == float.class || raw == Float.class) return d.toBigDecimal().floatValue();
                if (raw == BigInteger.class) return d.toBigIntegerExact();
                if (raw == BigDecimal.class || raw == Number.class) return d.toBigDecimal();
            } catch (ArithmeticException e) {
                throw new ConversionException("Number " + d + " does not fit " + raw.getSimpleName(), targetType, e);
            }
            throw new ConversionException("Unsupported number type", targetType);
        }

        @SuppressWarnings({"unchecked", "rawtypes"})
        static Object toEnum(String name, Class<? extends Enum> raw, java.lang.reflect.Type targetType) {
            try {
                return Enum.valueOf(raw, name);
            } catch (IllegalArgumentException e) {
                throw new ConversionException("Unknown constant '" + name + "'", targetType, e);
            }
        }

        Object readArray(Cursor cursor, java.lang.reflect.Type targetType, Class<?> raw) {
            java.lang.reflect.Type componentType = targetType instanceof GenericArrayType ga
                    ? ga.getGenericComponentType()
                    : raw.getComponentType();
            var elements = new ArrayList<Object>();
            PushParser.parseArray(cursor, c -> elements.add(read(c, componentType)));
            Object array = Array.newInstance(raw(canonicalize(componentType)), elements.size());
            for (int i = 0; i < elements.size(); i++) Array.set(array, i, elements.get(i));
            return array;
        }

        Object readRecord(Cursor cursor, Class<?> raw) {
            RecordComponent[] components = raw.getRecordComponents();
            Map<String, Integer> index = new HashMap<>(mapCap(components.length));
            for (int i = 0; i < components.length; i++) index.put(components[i].getName(), i);
            Object[] args = new Object[components.length];
            boolean[] present = new boolean[components.length];
            PushParser.parseObject(cursor, (c, name) -> {
                Integer i = index.get(name);
                if (i == null) {
                    PushParser.parseValue(c); // unknown member
                    return;
                }
                args[i] = read(c, components[i].getGenericType());
                present[i] = true;
            });
            Class<?>[] types = new Class<?>[components.length];
            for (int i = 0; i < components.length; i++) {
                types[i] = components[i].getType();
                if (!present[i]) args[i] = defaultValue(types[i]);
            }
            try {
                Constructor<?> ctor = raw.getDeclaredConstructor(types);
                ctor.setAccessible(true);
                return ctor.newInstance(args);
            } catch (ReflectiveOperationException e) {
                var cause = e.getCause() != null ? e.getCause() : e;
                throw new ConversionException("Failed to create record: " + cause.getMessage(), raw, cause);
            }
        }

        static @Nullable Object defaultValue(Class<?> type) {
            if (type == Optional.class) return Optional.empty();
            // zero value of a primitive, null otherwise
            return type.isPrimitive() ? Array.get(Array.newInstance(type, 1), 0) : null;
        }

        static Collection<Object> newCollection(Class<?> raw, java.lang.reflect.Type targetType) {
            if (raw.isInterface() || Modifier.isAbstract(raw.getModifiers())) {
                if (raw.isAssignableFrom(ArrayList.class)) return new ArrayList<>();
                if (raw.isAssignableFrom(TreeSet.class) && SortedSet.class.isAssignableFrom(raw)) return new TreeSet<>();
                if (raw.isAssignableFrom(LinkedHashSet.class) && Set.class.isAssignableFrom(raw))
                    return new LinkedHashSet<>();
                if (raw.isAssignableFrom(ArrayDeque.class) && Queue.class.isAssignableFrom(raw)) return new ArrayDeque<>();
                throw new ConversionException("Unsupported collection type", targetType);
            }
            return newInstance(raw, targetType);
        }

        static Map<Object, Object> newMap(Class<?> raw, java.lang.reflect.Type targetType) {
            if (raw.isInterface() || Modifier.isAbstract(raw.getModifiers())) {
                if (raw.isAssignableFrom(LinkedHashMap.class)) return new LinkedHashMap<>();
                if (raw.isAssignableFrom(TreeMap.class) && SortedMap.class.isAssignableFrom(raw)) return new TreeMap<>();
                throw new ConversionException("Unsupported map type", targetType);
            }
            return newInstance(raw, targetType);
        }

        @SuppressWarnings("unchecked")
        static <T> T newInstance(Class<?> raw, java.lang.reflect.Type targetType) {
            try {
                return (T) raw.getDeclaredConstructor().newInstance();
            } catch (ReflectiveOperationException e) {
                throw new ConversionException("Cannot instantiate " + raw.getName(), targetType, e);
            }
        }

        @SuppressWarnings({"unchecked", "rawtypes"})
        static Object toKey(String name, java.lang.reflect.Type keyType) {
            Class<?> raw = raw(keyType);
            if (raw == String.class || raw == CharSequence.class || raw == Object.class) return name;
            try {
                if (raw == Integer.class) return Integer.valueOf(name);
                if (raw == Long.class) return Long.valueOf(name);
            } catch (NumberFormatException e) {
                throw new ConversionException("Invalid map key '" + name + "'", keyType, e);
            }
            if (raw.isEnum()) return toEnum(name, (Class<? extends Enum>) raw, keyType);
            throw new ConversionException("Unsupported map key type", keyType);
        }
    }

    // ============================================================
    // Type utils
    // ============================================================

    static List<Printer> loadPrinters() {
        var loaded = new ArrayList<Printer>();
        var it = ServiceLoader.load(Printer.class).iterator();
        while (true) {
            try {
                if (!it.hasNext()) break;
                var printer = it.next();
                LOGGER.debug("Loaded JSON printer {}", printer.getClass().getName());
                loaded.add(printer);
            } catch (ServiceConfigurationError | LinkageError e) {
                // an optional printer whose library is missing from the class path
                LOGGER.debug("Skipping JSON printer that failed to load", e);
            }
        }
        return List.copyOf(loaded);
    }

    static java.lang.reflect.Type typeArgument(java.lang.reflect.Type t, int index) {
        if (t instanceof ParameterizedType p) return canonicalize(p.getActualTypeArguments()[index]);
        return Object.class;
    }

    static Class<?> raw(java.lang.reflect.Type t) {
        if (t instanceof Class<?> c) return c;
        if (t instanceof ParameterizedType p) return (Class<?>) p.getRawType();
        if (t instanceof GenericArrayType ga) {
            var comp = raw(ga.getGenericComponentType());
            return Array.newInstance(comp, 0).getClass();
        }
        if (t instanceof TypeVariable<?> tv) return raw(erasureOf(tv));
        if (t instanceof WildcardType w) return raw(erasureOf(w));
        throw new IllegalArgumentException("Unsupported type: " + t);
    }

    static boolean isClassPresent(String name) {
        try {
            Class.forName(name);
            return true;
        } catch (ClassNotFoundException e) {
            return false;
        }
    }

    static int mapCap(int size) {
        return (int) (size / 0.75f) + 1;
    }

    static java.lang.reflect.Type canonicalize(java.lang.reflect.Type t) {
        if (t instanceof WildcardType w) return erasureOf(w);
        if (t instanceof TypeVariable<?> tv) return erasureOf(tv);
        return t;
    }

    static java.lang.reflect.Type erasureOf(WildcardType w) {
        var uppers = w.getUpperBounds();
        return uppers.length == 0 ? Object.class : uppers[0];
    }

    static java.lang.reflect.Type erasureOf(TypeVariable<?> tv) {
        var uppers = tv.getBounds();
        return uppers.length == 0 ? Object.class : uppers[0];
    }
}
