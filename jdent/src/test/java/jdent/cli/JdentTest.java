package jdent.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.Data;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JdentTest {

    @Data
    static class Result {
        private final int status;
        private final String out;
        private final String err;
    }

    static Result run(byte[] stdin, String... args) {
        var out = new ByteArrayOutputStream();
        var err = new ByteArrayOutputStream();
        int status = Jdent.run(
                args,
                new ByteArrayInputStream(stdin),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        return new Result(status, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
    }

    static Result run(String stdin, String... args) {
        return run(stdin.getBytes(StandardCharsets.UTF_8), args);
    }

    @Nested
    class StandardInput {

        @Test
        void formatsWithTheRequestedIndent() {
            var result = run("{\"x\":[1,2]}", "-i", "2");

            assertThat(result.getStatus()).isEqualTo(Jdent.EXIT_OK);
            assertThat(result.getOut()).isEqualTo("{\n  \"x\": [\n    1,\n    2\n  ]\n}\n");
            assertThat(result.getErr()).isEmpty();
        }

        @Test
        void everyValueIsPrintedOnItsOwn() {
            var result = run("1 \"a\"\n[]", "--indent=0");

            assertThat(result.getOut()).isEqualTo("1\n\"a\"\n[]\n");
        }

        @Test
        void emptyInputPrintsNothing() {
            var result = run("  \n");

            assertThat(result.getStatus()).isEqualTo(Jdent.EXIT_OK);
            assertThat(result.getOut()).isEmpty();
        }

        @Test
        void numberModes() {
            assertThat(run("[1.50]", "--float", "--indent", "0").getOut()).isEqualTo("[\n1.5\n]\n");
            assertThat(run("[1.50]", "-f", "-d", "-i", "0").getOut()).isEqualTo("[\n1.50\n]\n");
        }

        @Test
        void byteOrderMarkIsSkipped() {
            var bom = new byte[] {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, '[', ']'};

            assertThat(run(bom).getOut()).isEqualTo("[]\n");
            assertThat(run(new byte[] {'7'}).getOut()).isEqualTo("7\n");
        }

        @Test
        void nonAsciiIsEscaped() {
            assertThat(run("\"é😀\"", "-").getOut()).isEqualTo("\"\\u00e9\\ud83d\\ude00\"\n");
        }

        @Test
        void malformedUtf8IsReported() {
            var result = run(new byte[] {'"', (byte) 0xC3, 0x28, '"'});

            assertThat(result.getStatus()).isEqualTo(Jdent.EXIT_FAILED);
            assertThat(result.getErr()).startsWith("jdent: -: ").contains("Illegal byte 0x28");
        }
    }

    @Nested
    class FileInputs {

        @Test
        void failingInputDoesNotStopTheOthers(@TempDir Path dir) throws Exception {
            var good = Files.writeString(dir.resolve("good.json"), "[1]");
            var bad = Files.writeString(dir.resolve("bad.json"), "[1,");
            var other = Files.writeString(dir.resolve("other.json"), "{\"a\":true}");

            var result = run("", "-i", "1", good.toString(), bad.toString(), other.toString());

            assertThat(result.getStatus()).isEqualTo(Jdent.EXIT_FAILED);
            assertThat(result.getOut()).startsWith("[\n 1\n]\n").endsWith("{\n \"a\": true\n}\n");
            assertThat(result.getErr())
                    .isEqualTo("jdent: " + bad + ": Expected a JSON value but found end of input at line 1, column 4"
                            + System.lineSeparator());
        }

        @Test
        void missingFile(@TempDir Path dir) {
            var missing = dir.resolve("missing.json").toString();

            var result = run("", missing);

            assertThat(result.getStatus()).isEqualTo(Jdent.EXIT_FAILED);
            assertThat(result.getErr()).contains("jdent: " + missing + ": No such file");
        }

        @Test
        void dashMixesStandardInputWithFiles(@TempDir Path dir) throws Exception {
            var file = Files.writeString(dir.resolve("f.json"), "2");

            var result = run("1", "-", file.toString());

            assertThat(result.getStatus()).isEqualTo(Jdent.EXIT_OK);
            assertThat(result.getOut()).isEqualTo("1\n2\n");
        }
    }

    @Nested
    class Usage {

        @Test
        void help() {
            var result = run("", "--help");

            assertThat(result.getStatus()).isEqualTo(Jdent.EXIT_OK);
            assertThat(result.getOut()).startsWith("usage: jdent");
        }

        @Test
        void badOptions() {
            var table = new String[][] {
                {"--bogus"}, {"-i"}, {"-i", "x"}, {"--indent=-1"},
            };

            for (var args : table) {
                var result = run("[]", args);
                assertThat(result.getStatus()).as("args=%s", String.join(" ", args)).isEqualTo(Jdent.EXIT_USAGE);
                assertThat(result.getErr()).contains("usage: jdent");
                assertThat(result.getOut()).isEmpty();
            }
        }

        @Test
        void doubleDashEndsOptions(@TempDir Path dir) throws Exception {
            var file = Files.writeString(dir.resolve("-odd.json"), "3");

            var result = run("", "--", file.toString());

            assertThat(result.getOut()).isEqualTo("3\n");
        }
    }
}
