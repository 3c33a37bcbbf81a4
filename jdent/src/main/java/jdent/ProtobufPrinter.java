package jdent;

import static jdent.Json.isClassPresent;

import com.google.protobuf.BoolValueOrBuilder;
import com.google.protobuf.ByteString;
import com.google.protobuf.BytesValueOrBuilder;
import com.google.protobuf.Descriptors;
import com.google.protobuf.DoubleValueOrBuilder;
import com.google.protobuf.DurationOrBuilder;
import com.google.protobuf.EmptyOrBuilder;
import com.google.protobuf.FieldMaskOrBuilder;
import com.google.protobuf.FloatValueOrBuilder;
import com.google.protobuf.Int32ValueOrBuilder;
import com.google.protobuf.Int64ValueOrBuilder;
import com.google.protobuf.ListValueOrBuilder;
import com.google.protobuf.MessageOrBuilder;
import com.google.protobuf.ProtocolMessageEnum;
import com.google.protobuf.StringValueOrBuilder;
import com.google.protobuf.StructOrBuilder;
import com.google.protobuf.TimestampOrBuilder;
import com.google.protobuf.UInt32ValueOrBuilder;
import com.google.protobuf.UInt64ValueOrBuilder;
import com.google.protobuf.ValueOrBuilder;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Prints Protocol Buffers messages, builders and enums.
 *
 * <p> Registered in {@code META-INF/services/jdent.Json$Printer} and only active when
 * {@code protobuf-java} is on the class path. Messages are walked through their descriptors:
 * only set fields are printed, keyed by their JSON names, in field number order. Well-known
 * types print in their canonical JSON forms, e.g. a {@code Timestamp} as
 * {@code "2024-01-01T00:00:00Z"}.
 */
public final class ProtobufPrinter implements Json.Printer {

    private static final boolean PROTOBUF_PRESENT = isClassPresent("com.google.protobuf.Message");

    public ProtobufPrinter() {}

    @Override
    public boolean canPrint(Object o) {
        return PROTOBUF_PRESENT
                && (o instanceof MessageOrBuilder
                        || o instanceof ProtocolMessageEnum
                        || o instanceof Descriptors.EnumValueDescriptor);
    }

    @Override
    public void print(JsonOutput out, Object o, @Nullable Object context) {
        if (o instanceof MessageOrBuilder message) writeMessage(out, message);
        else if (o instanceof ProtocolMessageEnum e) writeEnum(out, e.getValueDescriptor());
        else if (o instanceof Descriptors.EnumValueDescriptor e) writeEnum(out, e);
        else throw new JsonException.WriteException("Not a protobuf message or enum: " + o.getClass().getName());
    }

    static void writeMessage(JsonOutput out, MessageOrBuilder message) {
        if (writeWellKnown(out, message)) return;
        try (var o = out.object()) {
            // getAllFields holds only set fields, sorted by field number
            for (var entry : message.getAllFields().entrySet()) {
                var field = entry.getKey();
                o.field(field.getJsonName(), new FieldValue(field, entry.getValue()));
            }
        }
    }

    static boolean writeWellKnown(JsonOutput out, MessageOrBuilder message) {
        if (message instanceof TimestampOrBuilder t) {
            out.string(Instant.ofEpochSecond(t.getSeconds(), t.getNanos()).toString());
        } else if (message instanceof DurationOrBuilder d) {
            out.string(Duration.ofSeconds(d.getSeconds(), d.getNanos()).toString());
        } else if (message instanceof StringValueOrBuilder s) {
            out.string(s.getValue());
        } else if (message instanceof BytesValueOrBuilder b) {
            out.string(base64(b.getValue()));
        } else if (message instanceof BoolValueOrBuilder b) {
            out.value(b.getValue());
        } else if (message instanceof DoubleValueOrBuilder d) {
            out.value(d.getValue());
        } else if (message instanceof FloatValueOrBuilder f) {
            out.value(f.getValue());
        } else if (message instanceof Int32ValueOrBuilder i) {
            out.value(i.getValue());
        } else if (message instanceof UInt32ValueOrBuilder u32) {
            out.raw(Integer.toUnsignedString(u32.getValue()));
        } else if (message instanceof Int64ValueOrBuilder i64) {
            out.value(i64.getValue());
        } else if (message instanceof UInt64ValueOrBuilder u64) {
            out.raw(Long.toUnsignedString(u64.getValue()));
        } else if (message instanceof FieldMaskOrBuilder mask) {
            out.string(String.join(",", mask.getPathsList()));
        } else if (message instanceof StructOrBuilder struct) {
            writeStruct(out, struct);
        } else if (message instanceof ListValueOrBuilder list) {
            writeList(out, list);
        } else if (message instanceof ValueOrBuilder value) {
            writeValue(out, value);
        } else if (message instanceof EmptyOrBuilder) {
            out.raw("{}");
        } else {
            return false;
        }
        return true;
    }

    static void writeEnum(JsonOutput out, Descriptors.EnumValueDescriptor e) {
        if (e.getType().getFullName().equals("google.protobuf.NullValue")) out.nullValue();
        else out.string(e.getName());
    }

    static void writeStruct(JsonOutput out, StructOrBuilder struct) {
        try (var o = out.object()) {
            for (var entry : struct.getFieldsMap().entrySet()) {
                var value = entry.getValue();
                o.field(entry.getKey(), (JsonPrintable<Object>) (w, ctx) -> writeValue(w, value));
            }
        }
    }

    static void writeList(JsonOutput out, ListValueOrBuilder list) {
        try (var a = out.array()) {
            for (var v : list.getValuesList()) a.element((JsonPrintable<Object>) (w, ctx) -> writeValue(w, v));
        }
    }

    static void writeValue(JsonOutput out, ValueOrBuilder value) {
        switch (value.getKindCase()) {
            case NUMBER_VALUE -> out.value(value.getNumberValue());
            case STRING_VALUE -> out.string(value.getStringValue());
            case BOOL_VALUE -> out.value(value.getBoolValue());
            case STRUCT_VALUE -> writeStruct(out, value.getStructValue());
            case LIST_VALUE -> writeList(out, value.getListValue());
            case NULL_VALUE, KIND_NOT_SET -> out.nullValue();
        }
    }

    static String mapKey(Descriptors.FieldDescriptor keyField, Object key) {
        return switch (keyField.getType()) {
            case UINT32, FIXED32 -> Integer.toUnsignedString((Integer) key);
            case UINT64, FIXED64 -> Long.toUnsignedString((Long) key);
            default -> String.valueOf(key);
        };
    }

    static String base64(ByteString bytes) {
        return Base64.getEncoder().encodeToString(bytes.toByteArray());
    }

    /**
     * The value of one set field, printed according to its descriptor.
     */
    record FieldValue(Descriptors.FieldDescriptor field, Object value) implements JsonPrintable<Object> {

        @Override
        public void printJson(JsonOutput out, @Nullable Object context) {
            if (field.isMapField()) {
                var keyField = field.getMessageType().findFieldByNumber(1);
                var valueField = field.getMessageType().findFieldByNumber(2);
                try (var o = out.object()) {
                    for (var item : (List<?>) value) {
                        var entry = (MessageOrBuilder) item;
                        o.field(
                                mapKey(keyField, entry.getField(keyField)),
                                new SingleValue(valueField, entry.getField(valueField)));
                    }
                }
            } else if (field.isRepeated()) {
                try (var a = out.array()) {
                    for (var item : (List<?>) value) a.element(new SingleValue(field, item));
                }
            } else {
                new SingleValue(field, value).printJson(out, context);
            }
        }
    }

    /** One element of a field: the field itself, or an entry of a repeated or map field. */
    record SingleValue(Descriptors.FieldDescriptor field, Object value) implements JsonPrintable<Object> {

        @Override
        public void printJson(JsonOutput out, @Nullable Object context) {
            switch (field.getType()) {
                case UINT32, FIXED32 -> out.raw(Integer.toUnsignedString((Integer) value));
                case UINT64, FIXED64 -> out.raw(Long.toUnsignedString((Long) value));
                case BYTES -> out.string(base64((ByteString) value));
                case ENUM -> writeEnum(out, (Descriptors.EnumValueDescriptor) value);
                case MESSAGE, GROUP -> writeMessage(out, (MessageOrBuilder) value);
                default -> out.value(value);
            }
        }
    }
}
