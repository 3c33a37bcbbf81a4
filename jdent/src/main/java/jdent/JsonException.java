package jdent;

/**
 * Exception thrown when JSON parsing, printing, or type conversion fails.
 * This is the base exception for all jdent errors.
 *
 * <p> None of these are recoverable for the value being processed: the call that raised it is
 * aborted and the cursor it was reading from is left at an unspecified position.
 *
 * @since 0.1.0
 */
public class JsonException extends RuntimeException {

    public JsonException(String message) {
        super(message);
    }

    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Thrown when the input violates the JSON grammar: an unexpected character, an unterminated
     * string, a bad literal, a mismatched bracket.
     */
    public static class SyntaxException extends JsonException {
        private final int line;
        private final int column;

        public SyntaxException(String message, int line, int column) {
            super(String.format("%s at line %d, column %d", message, line, column));
            this.line = line;
            this.column = column;
        }

        public int getLine() {
            return line;
        }

        public int getColumn() {
            return column;
        }
    }

    /**
     * Thrown when a UTF-8 byte run or a code point violates the codec's structural rules.
     */
    public static class MalformedEncodingException extends JsonException {
        public MalformedEncodingException(String message) {
            super(message);
        }
    }

    /**
     * Thrown when a Java value cannot be printed as JSON.
     */
    public static class WriteException extends JsonException {
        public WriteException(String message) {
            super(message);
        }

        public WriteException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Thrown when well-formed JSON cannot be converted to the requested Java type.
     */
    public static class ConversionException extends JsonException {
        private final java.lang.reflect.Type targetType;

        public ConversionException(String message, java.lang.reflect.Type targetType) {
            super(message + " (target: " + targetType.getTypeName() + ")");
            this.targetType = targetType;
        }

        public ConversionException(String message, java.lang.reflect.Type targetType, Throwable cause) {
            super(message + " (target: " + targetType.getTypeName() + ")", cause);
            this.targetType = targetType;
        }

        public java.lang.reflect.Type getTargetType() {
            return targetType;
        }
    }
}
