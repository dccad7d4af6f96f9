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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.graphhttp.driver.Value;
import java.util.List;
import java.util.Map;

/**
 * The body of a request to a transaction endpoint.
 */
public class StatementPayload {
    private static final List<String> ROW_FORMAT = List.of("row");

    private final List<Statement> statements;

    public StatementPayload(List<Statement> statements) {
        this.statements = List.copyOf(statements);
    }

    @JsonProperty("statements")
    public List<Statement> statements() {
        return statements;
    }

    /**
     * One statement: the query text and its parameters, kept in separate fields.
     */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static class Statement {
        private final String text;
        private final Map<String, Value> parameters;

        public Statement(String text, Map<String, Value> parameters) {
            this.text = text;
            this.parameters = parameters;
        }

        @JsonProperty("statement")
        public String text() {
            return text;
        }

        @JsonProperty("parameters")
        public Map<String, Value> parameters() {
            return parameters;
        }

        @JsonProperty("resultDataContents")
        public List<String> resultDataContents() {
            return ROW_FORMAT;
        }
    }
}
