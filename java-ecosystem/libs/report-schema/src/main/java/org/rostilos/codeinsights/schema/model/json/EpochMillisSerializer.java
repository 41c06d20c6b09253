package org.rostilos.codeinsights.schema.model.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.time.Instant;

/**
 * Writes an {@link Instant} as epoch milliseconds, the timestamp format of the Code Insights API.
 */
public class EpochMillisSerializer extends StdSerializer<Instant> {

    public EpochMillisSerializer() {
        super(Instant.class);
    }

    @Override
    public void serialize(Instant value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeNumber(value.toEpochMilli());
    }
}
