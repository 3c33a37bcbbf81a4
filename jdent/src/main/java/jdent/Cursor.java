package jdent;

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.function.IntSupplier;
import jdent.JsonException.SyntaxException;

/**
 * Single-character lookahead over a blocking character source, plus the lexical primitives the
 * {@link PushParser} is built from.
 *
 * <p> A cursor is owned by one caller at a time and is never shared between threads. It only
 * keeps the one lookahead character, whatever the size of the input.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * Cursor cursor = Cursor.of("  [1, 2]");
 * cursor.classify();   // -> ARRAY, nothing consumed but the whitespace
 * cursor.expect('[');
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Cursor {

    /** Returned by {@link #peek()} and {@link #advance()} once the source is exhausted. */
    public static final int EOF = -1;

    private static final int NONE = -2;

    private final IntSupplier source;
    private int lookahead = NONE;
    private int line = 1;
    private int column = 1;

    private Cursor(IntSupplier source) {
        this.source = source;
    }

    public static Cursor of(String json) {
        Objects.requireNonNull(json, "json");
        int[] i = {0};
        return new Cursor(() -> i[0] < json.length() ? json.charAt(i[0]++) : EOF);
    }

    public static Cursor of(Reader reader) {
        Objects.requireNonNull(reader, "reader");
        Reader in = reader instanceof BufferedReader ? reader : new BufferedReader(reader);
        return new Cursor(() -> {
            try {
                return in.read();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    /**
     * A cursor over UTF-8 encoded bytes. Malformed byte runs surface as
     * {@link JsonException.MalformedEncodingException} when they are reached.
     */
    public static Cursor of(InputStream in) {
        Objects.requireNonNull(in, "in");
        return new Cursor(Utf8.decoder(in instanceof BufferedInputStream ? in : new BufferedInputStream(in)));
    }

    /**
     * A cursor over any source of UTF-16 code units that returns {@code -1} at end of input.
     */
    public static Cursor of(IntSupplier source) {
        return new Cursor(Objects.requireNonNull(source, "source"));
    }

    // ============================================================
    // Characters
    // ============================================================

    /**
     * @return the next character without consuming it, or {@link #EOF}
     */
    public int peek() {
        if (lookahead == NONE) lookahead = source.getAsInt();
        return lookahead;
    }

    /**
     * Consume exactly one character.
     *
     * @return the consumed character, or {@link #EOF} if there was none
     */
    public int advance() {
        int c = peek();
        if (c != EOF) {
            lookahead = NONE;
            if (c == '\n') {
                line++;
                column = 1;
            } else column++;
        }
        return c;
    }

    /**
     * Consume JSON whitespace (space, tab, carriage return, line feed).
     *
     * @return the next significant character, not consumed, or {@link #EOF}
     */
    public int skipWhitespace() {
        int c = peek();
        while (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
            advance();
            c = peek();
        }
        return c;
    }

    // ============================================================
    // Lexical primitives
    // ============================================================

    /**
     * Skip whitespace, then consume {@code expected}.
     *
     * @throws SyntaxException if the next significant character is anything else
     */
    public void expect(char expected) {
        int c = skipWhitespace();
        if (c != expected) throw unexpected(c, "'" + expected + "'");
        advance();
    }

    /**
     * Consume exactly {@code text.length()} characters that must spell {@code text}.
     *
     * @throws SyntaxException at the first mismatch
     */
    public void matchLiteral(String text) {
        for (int i = 0; i < text.length(); i++) {
            int c = peek();
            if (c != text.charAt(i)) throw unexpected(c, "'" + text + "'");
            advance();
        }
    }

    /**
     * Look at the first significant character and tell which kind of value starts there.
     * Only whitespace is consumed.
     *
     * @throws SyntaxException if no JSON value can start with that character
     */
    public JsonType classify() {
        int c = skipWhitespace();
        JsonType type = JsonType.ofLeadingChar(c);
        if (type == null) throw unexpected(c, "start of a JSON value");
        return type;
    }

    /**
     * Skip trailing whitespace and require the source to be exhausted.
     *
     * @throws SyntaxException if anything but whitespace follows
     */
    public void expectEndOfInput() {
        int c = skipWhitespace();
        if (c != EOF) throw unexpected(c, "end of input");
    }

    /** Line of the next character, starting at 1. */
    public int line() {
        return line;
    }

    /** Column of the next character, starting at 1. */
    public int column() {
        return column;
    }

    SyntaxException unexpected(int found, String expected) {
        return error("Expected " + expected + " but found " + describe(found));
    }

    SyntaxException error(String message) {
        return new SyntaxException(message, line, column);
    }

    static String describe(int c) {
        if (c == EOF) return "end of input";
        if (c < 0x20 || c == 0x7F) return String.format("control character U+%04X", c);
        return "'" + (char) c + "'";
    }
}
