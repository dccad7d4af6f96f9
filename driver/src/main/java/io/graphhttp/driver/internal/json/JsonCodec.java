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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;

/**
 * Reads and writes request and response bodies. Instances are thread-safe.
 */
public class JsonCodec {
    private final ObjectMapper objectMapper = newObjectMapper();

    public byte[] write(Object payload) throws JsonProcessingException {
        return objectMapper.writeValueAsBytes(payload);
    }

    /**
     * Parse a body.
     *
     * @param body the body bytes
     * @return the root node, never {@code null}
     * @throws IOException if the body is empty or not a single JSON document
     */
    public JsonNode read(byte[] body) throws IOException {
        if (body.length == 0) {
            throw new IOException("Body is empty");
        }
        var node = objectMapper.readTree(body);
        if (node == null || node.isMissingNode()) {
            throw new IOException("Body contains no JSON document");
        }
        return node;
    }

    /**
     * Convert a tree to maps, lists and scalars.
     *
     * @param node the tree
     * @return the plain Java representation
     */
    public Object toPlainObject(JsonNode node) {
        return objectMapper.convertValue(node, Object.class);
    }

    public static ObjectMapper newObjectMapper() {
        var objectMapper = new ObjectMapper();
        objectMapper.registerModule(new GraphHttpModule());
        objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        objectMapper.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        return objectMapper;
    }
}
