/*
 * Copyright (c) "Neo4j"
 * Neo4j Sweden AB [https://neo4j.com]
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.graphhttp.driver.internal.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.graphhttp.driver.Value;
import io.graphhttp.driver.internal.InternalEntity;
import io.graphhttp.driver.types.Entity;
import io.graphhttp.driver.types.Path;
import java.io.IOException;
import java.io.Serial;

/**
 * Writes a {@link Value} as a statement parameter. Nodes and relationships are written as their property maps and paths as lists of
 * alternating property maps, the same shape lean results use.
 */
public class ValueSerializer extends StdSerializer<Value> {
    @Serial
    private static final long serialVersionUID = -6130316389471227158L;

    public ValueSerializer() {
        super(Value.class);
    }

    @Override
    public void serialize(Value value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        switch (value.type()) {
            case NULL -> gen.writeNull();
            case BOOLEAN -> gen.writeBoolean(value.asBoolean());
            case INTEGER -> gen.writeNumber(value.asLong());
            case FLOAT -> gen.writeNumber(value.asDouble());
            case STRING -> gen.writeString(value.asString());
            case LIST -> {
                gen.writeStartArray();
                for (var element : value.values()) {
                    serialize(element, gen, provider);
                }
                gen.writeEndArray();
            }
            case MAP -> {
                gen.writeStartObject();
                for (var key : value.keys()) {
                    gen.writeFieldName(key);
                    serialize(value.get(key), gen, provider);
                }
                gen.writeEndObject();
            }
            case NODE, RELATIONSHIP -> writeProperties(value.asEntity(), gen, provider);
            case PATH -> writePath(value.asPath(), gen, provider);
        }
    }

    private void writePath(Path path, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartArray();
        writeProperties(path.start(), gen, provider);
        for (var segment : path) {
            writeProperties(segment.relationship(), gen, provider);
            writeProperties(segment.end(), gen, provider);
        }
        gen.writeEndArray();
    }

    private void writeProperties(Entity entity, JsonGenerator gen, SerializerProvider provider) throws IOException {
        if (entity instanceof InternalEntity internalEntity) {
            serialize(internalEntity.propertiesValue(), gen, provider);
        } else {
            gen.writeStartObject();
            for (var key : entity.keys()) {
                gen.writeFieldName(key);
                serialize(entity.get(key), gen, provider);
            }
            gen.writeEndObject();
        }
    }
}
