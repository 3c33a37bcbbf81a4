package jdent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertAll;

import java.io.StringWriter;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.net.URI;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.MonthDay;
import java.time.OffsetDateTime;
import java.time.Period;
import java.time.Year;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Currency;
import java.util.Date;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.TimeZone;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import jdent.JsonException.WriteException;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class WriterTest {

    enum Color {
        RED,
        GREEN
    }

    enum Style {
        FRACTION,
        DECIMAL
    }

    /**
     * Prints as an object by default, or as a number when the context asks for decimals.
     */
    record Rational(long numerator, long denominator) implements JsonPrintable<Style> {

        @Override
        public void printJson(JsonOutput out, @Nullable Style style) {
            if (style == Style.DECIMAL) {
                out.value(BigDecimal.valueOf(numerator).divide(BigDecimal.valueOf(denominator), 6, RoundingMode.HALF_EVEN)
                        .stripTrailingZeros());
                return;
            }
            try (var o = out.object()) {
                o.field("num", numerator).field("den", denominator);
            }
        }
    }

    record Point(int x, int y) {}

    @Nested
    class BuiltInShapes {

        @Test
        void stringify() throws Exception {
            var linked = new LinkedHashMap<String, Object>();
            linked.put("b", 1);
            linked.put("a", List.of());

            // @spotless:off
            var table = new Object[][] {
                    // null
                    {null, "null"},

                    // string-like
                    {"hello", "\"hello\""},
                    {"", "\"\""},
                    {"line\nbreak \"q\"", "\"line\\nbreak \\\"q\\\"\""},
                    {"é😀", "\"\\u00e9\\ud83d\\ude00\""},
                    {new StringBuilder("sb"), "\"sb\""},
                    {'A', "\"A\""},
                    {new char[] {'h', 'i'}, "\"hi\""},

                    // scalars
                    {true, "true"},
                    {false, "false"},
                    {new AtomicBoolean(true), "true"},
                    {42, "42"},
                    {42L, "42"},
                    {(short) 7, "7"},
                    {(byte) -3, "-3"},
                    {new AtomicInteger(42), "42"},
                    {new AtomicLong(10000000000L), "10000000000"},
                    {new BigInteger("123456789012345678901234567890"), "123456789012345678901234567890"},
                    {new BigDecimal("1.50"), "1.50"},
                    {Decimal.of(1250, -2), "12.50"},
                    {Decimal.of(5, 3), "5E+3"},
                    {3.14, "3.14"},
                    {-0.01, "-0.01"},
                    {1.5f, "1.5"},
                    {1e20, "1.0E20"},

                    // enums
                    {Color.RED, "\"RED\""},
                    {DayOfWeek.MONDAY, "\"MONDAY\""},

                    // optional and pointer indirection
                    {Optional.of(1), "1"},
                    {Optional.of("str"), "\"str\""},
                    {Optional.empty(), "null"},
                    {OptionalInt.of(3), "3"},
                    {OptionalInt.empty(), "null"},
                    {OptionalLong.of(4L), "4"},
                    {OptionalDouble.of(2.5), "2.5"},
                    {OptionalDouble.empty(), "null"},
                    {new AtomicReference<>("hello"), "\"hello\""},
                    {new AtomicReference<>(null), "null"},
                    {new AtomicReference<>(Optional.of(List.of(1))), "[1]"},

                    // pairs
                    {Map.entry("k", 1), "\"k\":1"},
                    {Field.of("k", List.of(1, 2)), "\"k\":[1,2]"},
                    {Field.of(Color.GREEN, null), "\"GREEN\":null"},
                    {Pair.of(1, "x"), "{\"first\":1,\"second\":\"x\"}"},

                    // associative
                    {Map.of(), "{}"},
                    {Map.of("key", "value"), "{\"key\":\"value\"}"},
                    {linked, "{\"b\":1,\"a\":[]}"},
                    {new TreeMap<>(Map.of("z", 1, "a", 2)), "{\"a\":2,\"z\":1}"},
                    {Map.of(1, "one"), "{\"1\":\"one\"}"},
                    {Map.of(Color.RED, 1), "{\"RED\":1}"},
                    {new HashMap<>() {{ put(null, "null"); }}, "{\"null\":\"null\"}"},
                    {Map.of("nested", Map.of("deep", List.of(Optional.empty()))), "{\"nested\":{\"deep\":[null]}}"},

                    // sequential
                    {List.of(), "[]"},
                    {List.of(1, 2, 3), "[1,2,3]"},
                    {new TreeSet<>(List.of(3, 1, 2)), "[1,2,3]"},
                    {new String[] {"a", null}, "[\"a\",null]"},
                    {new int[] {1, 2}, "[1,2]"},
                    {new long[] {}, "[]"},
                    {new double[] {0.5}, "[0.5]"},
                    {new float[] {0.25f}, "[0.25]"},
                    {new short[] {1}, "[1]"},
                    {new byte[] {1, -1}, "[1,-1]"},
                    {new boolean[] {true, false}, "[true,false]"},
                    {new int[][] {{1}, {}}, "[[1],[]]"},
                    {Stream.of(Optional.empty(), Optional.of(1), Optional.of("str")), "[null,1,\"str\"]"},
                    {IntStream.range(0, 3), "[0,1,2]"},

                    // text forms of value types
                    {Date.from(Instant.parse("2024-03-15T10:15:30Z")), "\"2024-03-15T10:15:30Z\""},
                    {Instant.parse("2024-03-15T10:15:30Z"), "\"2024-03-15T10:15:30Z\""},
                    {LocalDate.parse("2023-01-01"), "\"2023-01-01\""},
                    {LocalTime.parse("09:00:30"), "\"09:00:30\""},
                    {LocalDateTime.parse("2024-01-01T09:00:30"), "\"2024-01-01T09:00:30\""},
                    {ZonedDateTime.parse("2024-01-01T09:00:00+08:00[Asia/Shanghai]"), "\"2024-01-01T09:00+08:00[Asia/Shanghai]\""},
                    {OffsetDateTime.parse("2024-01-01T09:00:00+08:00"), "\"2024-01-01T09:00+08:00\""},
                    {Duration.ofHours(2), "\"PT2H\""},
                    {Year.of(2024), "\"2024\""},
                    {YearMonth.of(2024, 3), "\"2024-03\""},
                    {MonthDay.of(12, 25), "\"--12-25\""},
                    {Period.ofDays(5), "\"P5D\""},
                    {ZoneOffset.ofHours(8), "\"+08:00\""},
                    {ZoneId.of("Asia/Shanghai"), "\"Asia/Shanghai\""},
                    {UUID.fromString("550e8400-e29b-41d4-a716-446655440000"), "\"550e8400-e29b-41d4-a716-446655440000\""},
                    {Locale.US, "\"en-US\""},
                    {Currency.getInstance("USD"), "\"USD\""},
                    {TimeZone.getTimeZone("Asia/Shanghai"), "\"Asia/Shanghai\""},
                    {URI.create("https://example.com/a?b=c"), "\"https://example.com/a?b=c\""},
                    {URI.create("https://example.com").toURL(), "\"https://example.com\""},
                    {Path.of("b.json"), "\"b.json\""},
                    {Pattern.compile("[a-z]+"), "\"[a-z]+\""},
            };
            // @spotless:on

            assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> {
                var row = table[i];
                var input = row[0];
                var expected = (String) row[1];
                var actual = Json.stringify(input);
                assertThat(actual).as("Case %d: input=%s", i, input).isEqualTo(expected);
            }));
        }

        @Test
        void unprintableValues() {
            // @spotless:off
            var table = new Object[][] {
                    {Double.NaN, "NaN"},
                    {Double.POSITIVE_INFINITY, "Infinity"},
                    {Float.NEGATIVE_INFINITY, "Infinity"},
                    {List.of(1, Double.NaN), "NaN"},
                    {OptionalDouble.of(Double.NaN), "NaN"},
                    {new Object(), "No JSON form for java.lang.Object"},
                    {new Point(1, 2), "No JSON form for jdent.WriterTest$Point"},
                    {Map.of("p", new Point(1, 2)), "No JSON form for jdent.WriterTest$Point"},
            };
            // @spotless:on

            assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> assertThatThrownBy(() -> Json.stringify(table[i][0]))
                    .as("Case %d", i)
                    .isInstanceOf(WriteException.class)
                    .hasMessageContaining((String) table[i][1])));
        }
    }

    @Nested
    class UserAggregates {

        @Test
        void printsThroughItsOwnPrinter() {
            assertThat(Json.stringify(new Rational(1, 4))).isEqualTo("{\"num\":1,\"den\":4}");
            assertThat(Json.stringify(List.of(new Rational(1, 2), new Rational(3, 1))))
                    .isEqualTo("[{\"num\":1,\"den\":2},{\"num\":3,\"den\":1}]");
        }

        @Test
        void contextReachesNestedValues() {
            var r = new Rational(1, 4);

            assertThat(Json.stringify(r, Style.DECIMAL)).isEqualTo("0.25");
            assertThat(Json.stringify(List.of(List.of(r)), Style.DECIMAL)).isEqualTo("[[0.25]]");
            assertThat(Json.stringify(Map.of("r", Optional.of(r)), Style.DECIMAL)).isEqualTo("{\"r\":0.25}");
        }

        @Test
        void bindingReplacesContextForItsSubtreeOnly() {
            var r = new Rational(1, 4);
            var values = new ArrayList<Object>();
            values.add(r);
            values.add(Binding.of(List.of(r), Style.DECIMAL));
            values.add(r);

            assertThat(Json.stringify(values, Style.FRACTION))
                    .isEqualTo("[{\"num\":1,\"den\":4},[0.25],{\"num\":1,\"den\":4}]");
        }

        @Test
        void objectWriterTracksSeparatorsAndClosesOnce() {
            JsonPrintable<Object> printable = (out, ctx) -> {
                var o = out.object();
                o.field("a", 1).field("b", List.of(true), Style.DECIMAL).field("c", null);
                o.close();
                o.close();
                assertThatThrownBy(() -> o.field("d", 1)).isInstanceOf(IllegalStateException.class);
            };

            assertThat(Json.stringify(printable)).isEqualTo("{\"a\":1,\"b\":[true],\"c\":null}");
        }

        @Test
        void arrayWriterWithPerElementContext() {
            var r = new Rational(1, 2);
            JsonPrintable<Object> printable = (out, ctx) -> {
                try (var a = out.array()) {
                    a.element(r).element(r, Style.DECIMAL).element("x");
                }
            };

            assertThat(Json.stringify(printable)).isEqualTo("[{\"num\":1,\"den\":2},0.5,\"x\"]");
        }
    }

    @Nested
    class Configuration {

        @Test
        void configuredPrintersComeBeforeBuiltInRules() {
            var writer = Json.Writer.builder()
                    .printer(new Json.Printer() {
                        @Override
                        public boolean canPrint(Object o) {
                            return o instanceof Point;
                        }

                        @Override
                        public void print(JsonOutput out, Object o, @Nullable Object context) {
                            var p = (Point) o;
                            out.value(List.of(p.x(), p.y()));
                        }
                    })
                    .printer(new Json.Printer() {
                        @Override
                        public boolean canPrint(Object o) {
                            return o instanceof LocalDate;
                        }

                        @Override
                        public void print(JsonOutput out, Object o, @Nullable Object context) {
                            out.value(((LocalDate) o).toEpochDay());
                        }
                    })
                    .build();

            assertThat(writer.write(Map.of("p", new Point(1, 2)))).isEqualTo("{\"p\":[1,2]}");
            assertThat(writer.write(LocalDate.ofEpochDay(3))).isEqualTo("3");
            assertThat(Json.stringify(LocalDate.ofEpochDay(3))).isEqualTo("\"1970-01-04\"");
        }

        @Test
        void toBuilderKeepsPrinters() {
            Json.Printer lowerCase = new Json.Printer() {
                @Override
                public boolean canPrint(Object o) {
                    return o instanceof Color;
                }

                @Override
                public void print(JsonOutput out, Object o, @Nullable Object context) {
                    out.string(((Color) o).name().toLowerCase(Locale.ROOT));
                }
            };
            var writer = Json.Writer.builder().printer(lowerCase).build().toBuilder().build();

            assertThat(writer.write(List.of(Color.RED))).isEqualTo("[\"red\"]");
        }

        @Test
        void writesStraightToAnAppendable() {
            var out = new StringWriter();
            Json.Writer.builder().build().write(out, Map.of("r", new Rational(1, 8)), Style.DECIMAL);

            assertThat(out).hasToString("{\"r\":0.125}");
        }
    }
}
