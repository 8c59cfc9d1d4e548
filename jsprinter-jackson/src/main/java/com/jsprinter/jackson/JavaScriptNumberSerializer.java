package com.jsprinter.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/**
 * Writes literal values the way JSON.stringify does: integral doubles without a
 * decimal point, NaN and infinities as null.
 */
public class JavaScriptNumberSerializer extends JsonSerializer<Object> {

    // 2^53: beyond it a double no longer holds every integer
    private static final double MAX_SAFE_INTEGER = 9007199254740992.0;

    @Override
    public void serialize(Object value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (value instanceof Double d) {
            if (d.isNaN() || d.isInfinite()) {
                gen.writeNull();
            } else if (d == Math.floor(d) && Math.abs(d) <= MAX_SAFE_INTEGER) {
                gen.writeNumber(d.longValue());
            } else {
                gen.writeNumber(d);
            }
        } else if (value == null) {
            gen.writeNull();
        } else {
            // Strings, booleans, integers and regex objects keep their default form
            serializers.defaultSerializeValue(value, gen);
        }
    }
}
