package com.jsearch.document;

import com.jsearch.common.io.IndexInput;
import com.jsearch.common.schema.Field;
import com.jsearch.common.schema.Schema;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binary form of a document's stored fields.
 *
 * Layout: field count, then per field its ordinal, value count and values.
 * Strings are length-prefixed UTF-8, i64 values are 8-byte longs and f64
 * values the 8-byte IEEE bits. Counts and lengths are vints.
 */
public final class StoredDocumentCodec {
    private StoredDocumentCodec() {
    }

    public static byte[] encode(Map<Field, List<Object>> storedValues) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            writeVInt(out, storedValues.size());
            for (Map.Entry<Field, List<Object>> entry : storedValues.entrySet()) {
                Field field = entry.getKey();
                writeVInt(out, field.getOrdinal());
                writeVInt(out, entry.getValue().size());
                for (Object value : entry.getValue()) {
                    switch (field.getType()) {
                        case TEXT, STRING -> {
                            byte[] utf8 = ((String) value).getBytes(StandardCharsets.UTF_8);
                            writeVInt(out, utf8.length);
                            out.write(utf8);
                        }
                        case I64 -> out.writeLong(((Number) value).longValue());
                        case F64 -> out.writeLong(Double.doubleToLongBits(((Number) value).doubleValue()));
                    }
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("In-memory write failed", e);
        }
        return bytes.toByteArray();
    }

    /**
     * Decodes a payload into field name to values, in schema order of the
     * encoded fields.
     *
     * @param source Path reported if the payload turns out to be corrupt
     */
    public static Map<String, List<Object>> decode(Schema schema, byte[] payload, Path source) throws IOException {
        IndexInput in = new IndexInput(source, ByteBuffer.wrap(payload));
        int fieldCount = in.readVInt();
        Map<String, List<Object>> result = new LinkedHashMap<>();
        for (int i = 0; i < fieldCount; i++) {
            Field field = schema.getField(in.readVInt());
            int valueCount = in.readVInt();
            List<Object> values = new ArrayList<>(valueCount);
            for (int v = 0; v < valueCount; v++) {
                switch (field.getType()) {
                    case TEXT, STRING -> values.add(in.readString());
                    case I64 -> values.add(in.readLong());
                    case F64 -> values.add(Double.longBitsToDouble(in.readLong()));
                }
            }
            result.put(field.getName(), values);
        }
        return result;
    }

    private static void writeVInt(DataOutputStream out, int value) throws IOException {
        while ((value & ~0x7F) != 0) {
            out.writeByte((value & 0x7F) | 0x80);
            value >>>= 7;
        }
        out.writeByte(value);
    }
}
