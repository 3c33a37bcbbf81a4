package jdent.cli;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.PushbackInputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import jdent.Cursor;
import jdent.JsonException;
import jdent.NumberMode;
import jdent.PrettyPrinter;
import jdent.Utf8;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line pretty-printer.
 *
 * <pre>
 * jdent [-d|--decimal] [-f|--float] [-i N|--indent N|--indent=N] [-h|--help] [file ...]
 * </pre>
 *
 * <p> Reads standard input when no file or {@code -} is given. Every top-level value of every
 * input is printed on its own, followed by a newline. A failing input is reported on standard
 * error and the remaining inputs are still processed.
 *
 * <p> Exit status: 0 on success, 1 if any input failed, 2 on a usage error.
 */
public final class Jdent {

    private static final Logger LOGGER = LoggerFactory.getLogger(Jdent.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE =
            "usage: jdent [-d|--decimal] [-f|--float] [-i N|--indent N|--indent=N] [-h|--help] [file ...]";

    private static final byte[] BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    private Jdent() {
        throw new UnsupportedOperationException();
    }

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    record Options(PrettyPrinter printer, List<String> inputs, boolean help) {}

    static final class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }

    static int run(String[] args, InputStream stdin, PrintStream stdout, PrintStream stderr) {
        Options options;
        try {
            options = parseOptions(args);
        } catch (UsageException e) {
            stderr.println("jdent: " + e.getMessage());
            stderr.println(USAGE);
            return EXIT_USAGE;
        }
        if (options.help()) {
            stdout.println(USAGE);
            return EXIT_OK;
        }

        var out = Utf8.encoder(stdout);
        int status = EXIT_OK;
        for (String name : options.inputs()) {
            LOGGER.debug("Formatting {}", name);
            try {
                if (name.equals("-")) {
                    format(options.printer(), stdin, out);
                } else {
                    try (var in = Files.newInputStream(Path.of(name))) {
                        format(options.printer(), in, out);
                    }
                }
            } catch (JsonException | IOException | UncheckedIOException e) {
                flushQuietly(out);
                LOGGER.debug("Failed to format {}", name, e);
                stderr.println("jdent: " + name + ": " + describe(e));
                status = EXIT_FAILED;
            }
        }
        flushQuietly(out);
        return status;
    }

    static Options parseOptions(String[] args) throws UsageException {
        var builder = PrettyPrinter.builder();
        var inputs = new ArrayList<String>();
        boolean help = false;
        boolean onlyFiles = false;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (onlyFiles || arg.equals("-") || !arg.startsWith("-")) {
                inputs.add(arg);
                continue;
            }
            switch (arg) {
                case "--" -> onlyFiles = true;
                case "-d", "--decimal" -> builder.numberMode(NumberMode.DECIMAL);
                case "-f", "--float" -> builder.numberMode(NumberMode.FLOAT);
                case "-h", "--help" -> help = true;
                case "-i", "--indent" -> {
                    if (i + 1 == args.length) throw new UsageException("option " + arg + " needs a value");
                    builder.indentWidth(indentWidth(args[++i]));
                }
                default -> {
                    if (!arg.startsWith("--indent=")) throw new UsageException("unknown option " + arg);
                    builder.indentWidth(indentWidth(arg.substring("--indent=".length())));
                }
            }
        }
        if (inputs.isEmpty()) inputs.add("-");
        return new Options(builder.build(), List.copyOf(inputs), help);
    }

    static int indentWidth(String value) throws UsageException {
        try {
            int width = Integer.parseInt(value);
            if (width < 0) throw new UsageException("indent must not be negative: " + value);
            return width;
        } catch (NumberFormatException e) {
            throw new UsageException("indent is not a number: " + value);
        }
    }

    /**
     * Print every value of {@code in}, each followed by a newline.
     */
    static void format(PrettyPrinter printer, InputStream in, Appendable out) throws IOException {
        var cursor = Cursor.of(skipBom(in));
        while (printer.print(cursor, out)) {
            out.append('\n');
        }
    }

    static InputStream skipBom(InputStream in) throws IOException {
        var pushback = new PushbackInputStream(new BufferedInputStream(in), BOM.length);
        byte[] head = new byte[BOM.length];
        int n = pushback.readNBytes(head, 0, head.length);
        if (n == BOM.length && head[0] == BOM[0] && head[1] == BOM[1] && head[2] == BOM[2]) return pushback;
        if (n > 0) pushback.unread(head, 0, n);
        return pushback;
    }

    static String describe(Exception e) {
        if (e instanceof java.nio.file.NoSuchFileException) return "No such file";
        if (e instanceof UncheckedIOException u) return String.valueOf(u.getCause().getMessage());
        return String.valueOf(e.getMessage());
    }

    private static void flushQuietly(Utf8.Encoder out) {
        try {
            out.flush();
        } catch (IOException e) {
            LOGGER.warn("Failed to flush standard output", e);
        }
    }
}
