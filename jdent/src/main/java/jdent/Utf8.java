package jdent;

import java.io.ByteArrayInputStream;
import java.io.Flushable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.function.IntSupplier;
import jdent.JsonException.MalformedEncodingException;

/**
 * Conversion between code points, UTF-8 byte runs and JSON string escapes.
 *
 * <p> Encoding always picks the shortest form for a code point. Decoding checks every
 * continuation byte for the {@code 10xxxxxx} pattern and rejects overlong forms, truncated runs
 * and values above {@code U+10FFFF}. Surrogate code points are passed through in both directions,
 * since {@code &#92;uXXXX} escapes may produce lone surrogates.
 *
 * @since 0.1.0
 */
public final class Utf8 {

    public static final int MAX_CODE_POINT = 0x10FFFF;

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    /** Smallest code point that needs the given number of bytes, indexed by byte count. */
    private static final int[] MIN_CODE_POINT = {0, 0, 0x80, 0x800, 0x10000};

    private Utf8() {
        throw new UnsupportedOperationException();
    }

    // ============================================================
    // Code point <-> UTF-8
    // ============================================================

    /**
     * Encode a code point in its minimal UTF-8 form.
     *
     * <pre>{@code
     * Utf8.encode('A');      // -> [0x41]
     * Utf8.encode(0x20AC);   // -> [0xe2, 0x82, 0xac]
     * }</pre>
     *
     * @param codePoint a value in {@code 0..0x10FFFF}
     * @return 1 to 4 bytes
     */
    public static byte[] encode(int codePoint) {
        if (codePoint < 0 || codePoint > MAX_CODE_POINT)
            throw new MalformedEncodingException(String.format("Code point out of range: 0x%x", codePoint));
        if (codePoint < 0x80) return new byte[] {(byte) codePoint};
        int count = codePoint < 0x800 ? 2 : codePoint < 0x10000 ? 3 : 4;
        byte[] bytes = new byte[count];
        int value = codePoint;
        for (int i = count - 1; i > 0; i--) {
            bytes[i] = (byte) (0x80 | (value & 0x3F));
            value >>>= 6;
        }
        // lead byte: 'count' one-bits, a zero-bit, then the remaining high bits
        bytes[0] = (byte) ((0xFF00 >> count) | value);
        return bytes;
    }

    /**
     * Decode exactly one complete UTF-8 sequence.
     *
     * @param sequence the bytes of a single encoded code point
     * @return the code point
     * @throws MalformedEncodingException if the bytes are not exactly one well-formed sequence
     */
    public static int decode(byte[] sequence) {
        if (sequence.length == 0) throw new MalformedEncodingException("Empty UTF-8 sequence");
        int[] pos = {1};
        int cp = decode(sequence[0] & 0xFF, () -> pos[0] < sequence.length ? sequence[pos[0]++] & 0xFF : -1);
        if (pos[0] != sequence.length)
            throw new MalformedEncodingException(
                    (sequence.length - pos[0]) + " trailing byte(s) after UTF-8 sequence");
        return cp;
    }

    /**
     * Decode one code point given its lead byte, pulling continuation bytes from {@code next}.
     *
     * <p> The number of leading one-bits of the lead byte is the total byte count of the run.
     *
     * @param lead the lead byte, {@code 0..255}
     * @param next supplies the following bytes as {@code 0..255}, or {@code -1} at end of input
     */
    static int decode(int lead, IntSupplier next) {
        if (lead < 0x80) return lead;
        int count = 0;
        int value = lead;
        for (int mask = 0x80; (value & mask) != 0; mask >>= 1) {
            count++;
            value &= ~mask;
        }
        if (count == 1 || count > 4)
            throw new MalformedEncodingException(String.format("Invalid UTF-8 lead byte 0x%02x", lead));
        for (int i = 1; i < count; i++) {
            int b = next.getAsInt();
            if (b == -1) throw new MalformedEncodingException("Truncated UTF-8 sequence: expected " + count + " bytes, got " + i);
            if ((b & 0xC0) != 0x80)
                throw new MalformedEncodingException(
                        String.format("Illegal byte 0x%02x in multibyte UTF-8 sequence", b));
            value = (value << 6) | (b & 0x3F);
        }
        if (value < MIN_CODE_POINT[count])
            throw new MalformedEncodingException(String.format("Overlong %d-byte UTF-8 encoding of 0x%x", count, value));
        if (value > MAX_CODE_POINT)
            throw new MalformedEncodingException(String.format("Code point out of range: 0x%x", value));
        return value;
    }

    /**
     * Character source over a UTF-8 byte stream, suitable for {@link Cursor}.
     *
     * @return a supplier of UTF-16 code units, {@code -1} at end of input; code points above
     *     {@code U+FFFF} are delivered as two consecutive surrogates
     */
    public static IntSupplier decoder(InputStream in) {
        return new Decoder(in);
    }

    /**
     * An {@link Appendable} writing UTF-8 to {@code out}. Surrogate pairs split across two calls
     * are joined; the caller flushes.
     */
    public static Encoder encoder(OutputStream out) {
        return new Encoder(out);
    }

    private static final class Decoder implements IntSupplier {
        private final InputStream in;
        private int pendingLowSurrogate = -1;

        Decoder(InputStream in) {
            this.in = in;
        }

        @Override
        public int getAsInt() {
            if (pendingLowSurrogate != -1) {
                int low = pendingLowSurrogate;
                pendingLowSurrogate = -1;
                return low;
            }
            int lead = readByte();
            if (lead == -1) return -1;
            int cp = decode(lead, this::readByte);
            if (Character.isSupplementaryCodePoint(cp)) {
                pendingLowSurrogate = Character.lowSurrogate(cp);
                return Character.highSurrogate(cp);
            }
            return cp;
        }

        private int readByte() {
            try {
                return in.read();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }

    public static final class Encoder implements Appendable, Flushable {
        private final OutputStream out;
        private int pendingHighSurrogate = -1;

        Encoder(OutputStream out) {
            this.out = out;
        }

        @Override
        public Encoder append(CharSequence csq) throws IOException {
            return append(csq, 0, csq.length());
        }

        @Override
        public Encoder append(CharSequence csq, int start, int end) throws IOException {
            for (int i = start; i < end; i++) append(csq.charAt(i));
            return this;
        }

        @Override
        public Encoder append(char c) throws IOException {
            if (pendingHighSurrogate != -1) {
                int high = pendingHighSurrogate;
                pendingHighSurrogate = -1;
                if (Character.isLowSurrogate(c)) {
                    out.write(encode(Character.toCodePoint((char) high, c)));
                    return this;
                }
                out.write(encode(high));
            }
            if (Character.isHighSurrogate(c)) pendingHighSurrogate = c;
            else out.write(encode(c));
            return this;
        }

        @Override
        public void flush() throws IOException {
            if (pendingHighSurrogate != -1) {
                out.write(encode(pendingHighSurrogate));
                pendingHighSurrogate = -1;
            }
            out.flush();
        }
    }

    // ============================================================
    // JSON string escapes
    // ============================================================

    /**
     * Escape text for use inside a JSON string literal, without the surrounding quotes.
     *
     * <pre>{@code
     * Utf8.escape("a\"b\n€");  // -> a\"b\n&#92;u20ac
     * }</pre>
     */
    public static String escape(CharSequence s) {
        var out = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) escapeChar(out, s.charAt(i));
        return out.toString();
    }

    /**
     * Same as {@link #escape(CharSequence)}, but starting from raw UTF-8 bytes.
     *
     * @throws MalformedEncodingException if {@code utf8} is not well-formed
     */
    public static String escape(byte[] utf8) {
        var out = new StringBuilder(utf8.length + 8);
        var units = decoder(new ByteArrayInputStream(utf8));
        for (int c = units.getAsInt(); c != -1; c = units.getAsInt()) escapeChar(out, (char) c);
        return out.toString();
    }

    public static void escapeTo(Appendable out, CharSequence s) throws IOException {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c >= 0x20 && c < 0x7F && c != '"' && c != '\\') out.append(c);
            else escapeChar(out, c);
        }
    }

    private static void escapeChar(StringBuilder out, char c) {
        try {
            escapeChar((Appendable) out, c);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    // Astral characters arrive here as two surrogates and leave as two escapes.
    private static void escapeChar(Appendable out, char c) throws IOException {
        switch (c) {
            case '"' -> out.append("\\\"");
            case '\\' -> out.append("\\\\");
            case '\b' -> out.append("\\b");
            case '\f' -> out.append("\\f");
            case '\n' -> out.append("\\n");
            case '\r' -> out.append("\\r");
            case '\t' -> out.append("\\t");
            default -> {
                if (c >= 0x20 && c < 0x7F) {
                    out.append(c);
                } else {
                    out.append('\\').append('u');
                    out.append(HEX[(c >> 12) & 0xF]).append(HEX[(c >> 8) & 0xF]);
                    out.append(HEX[(c >> 4) & 0xF]).append(HEX[c & 0xF]);
                }
            }
        }
    }
}
