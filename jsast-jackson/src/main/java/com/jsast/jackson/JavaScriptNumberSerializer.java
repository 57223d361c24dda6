package com.jsast.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Writes literal values the way {@code JSON.stringify} prints JavaScript numbers:
 * integral doubles have no fraction, {@code NaN} and infinities become {@code null}.
 */
public class JavaScriptNumberSerializer extends StdSerializer<Number> {

    /** 2^53, the largest double below which every integer is exact. */
    private static final double MAX_SAFE = 9007199254740992.0;

    /** JavaScript switches to exponent notation from here on. */
    private static final double EXPONENT_THRESHOLD = 1e21;

    public JavaScriptNumberSerializer() {
        super(Number.class);
    }

    @Override
    public void serialize(Number value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        if (value instanceof Double d) {
            writeDouble(d, gen);
        } else if (value instanceof BigInteger big) {
            gen.writeNumber(big);
        } else if (value instanceof Long || value instanceof Integer) {
            gen.writeNumber(value.longValue());
        } else {
            writeDouble(value.doubleValue(), gen);
        }
    }

    private static void writeDouble(double d, JsonGenerator gen) throws IOException {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            gen.writeNull();
        } else if (d != Math.rint(d)) {
            gen.writeNumber(d);
        } else if (Math.abs(d) <= MAX_SAFE) {
            gen.writeNumber((long) d);
        } else if (Math.abs(d) < EXPONENT_THRESHOLD) {
            // beyond 2^53: the exact binary value, e.g. 1e20 is 100000000000000000000
            gen.writeNumber(new BigDecimal(d).toBigInteger());
        } else {
            gen.writeNumber(d);
        }
    }
}
