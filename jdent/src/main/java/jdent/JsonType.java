package jdent;

import org.jspecify.annotations.Nullable;

/**
 * The kind of JSON value that starts at the cursor, decided from a single lookahead character.
 *
 * @see Cursor#classify()
 */
public enum JsonType {
    ARRAY,
    OBJECT,
    STRING,
    NUMBER,
    BOOLEAN,
    NULL,
    END_OF_INPUT;

    /**
     * @param c the first significant character of a value, or {@link Cursor#EOF}
     * @return the type starting with {@code c}, or {@code null} if no JSON value starts with it
     */
    static @Nullable JsonType ofLeadingChar(int c) {
        return switch (c) {
            case '{' -> OBJECT;
            case '[' -> ARRAY;
            case '"' -> STRING;
            case '-', '0', '1', '2', '3', '4', '5', '6', '7', '8', '9' -> NUMBER;
            case 't', 'f' -> BOOLEAN;
            case 'n' -> NULL;
            case Cursor.EOF -> END_OF_INPUT;
            default -> null;
        };
    }
}
