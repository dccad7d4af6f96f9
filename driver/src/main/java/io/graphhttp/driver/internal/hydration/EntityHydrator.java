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
package io.graphhttp.driver.internal.hydration;

import static java.lang.String.format;

import com.fasterxml.jackson.databind.JsonNode;
import io.graphhttp.driver.Outcome;
import io.graphhttp.driver.QueryResult;
import io.graphhttp.driver.Record;
import io.graphhttp.driver.Value;
import io.graphhttp.driver.Values;
import io.graphhttp.driver.exceptions.ProtocolException;
import io.graphhttp.driver.internal.InternalEntity;
import io.graphhttp.driver.internal.InternalNode;
import io.graphhttp.driver.internal.InternalPath;
import io.graphhttp.driver.internal.InternalQueryResult;
import io.graphhttp.driver.internal.InternalRecord;
import io.graphhttp.driver.internal.InternalRelationship;
import io.graphhttp.driver.internal.value.BooleanValue;
import io.graphhttp.driver.internal.value.FloatValue;
import io.graphhttp.driver.internal.value.IntegerValue;
import io.graphhttp.driver.internal.value.ListValue;
import io.graphhttp.driver.internal.value.MapValue;
import io.graphhttp.driver.internal.value.NodeValue;
import io.graphhttp.driver.internal.value.PathValue;
import io.graphhttp.driver.internal.value.RelationshipValue;
import io.graphhttp.driver.internal.value.StringValue;
import io.graphhttp.driver.types.Entity;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Turns result fragments of a response body into values.
 * <p>
 * Values carry no type tag, so entities are recognised by shape, in this order:
 * <ol>
 *     <li>a relationship has exactly the fields {@code id}, {@code type}, {@code startNode}, {@code endNode} and {@code properties}</li>
 *     <li>a node has exactly the fields {@code id}, {@code labels} and {@code properties}</li>
 *     <li>a path has exactly the fields {@code nodes} and {@code relationships}, holding connected nodes and relationships</li>
 * </ol>
 * Every field must also have the expected JSON type. Anything else is an ordinary map, list or scalar, and its elements are inspected the
 * same way.
 * <p>
 * In lean mode nodes and relationships become their property maps and paths become lists of alternating property maps.
 */
public class EntityHydrator {
    static final String ID = "id";
    static final String LABELS = "labels";
    static final String PROPERTIES = "properties";
    static final String TYPE = "type";
    static final String START_NODE = "startNode";
    static final String END_NODE = "endNode";
    static final String NODES = "nodes";
    static final String RELATIONSHIPS = "relationships";

    static final String COLUMNS = "columns";
    static final String DATA = "data";
    static final String ROW = "row";

    /**
     * Hydrate the {@code results} of a statement response, one {@link QueryResult} per statement.
     *
     * @param results the {@code results} array
     * @param leanFlags the lean flag of every submitted statement, in order
     * @return the results, or a protocol failure when a result does not have the expected structure
     */
    public Outcome<List<QueryResult>> hydrateResults(JsonNode results, List<Boolean> leanFlags) {
        try {
            var hydrated = new ArrayList<QueryResult>(leanFlags.size());
            for (var i = 0; i < leanFlags.size(); i++) {
                hydrated.add(hydrateResult(results.get(i), leanFlags.get(i), i));
            }
            return Outcome.success(hydrated);
        } catch (ProtocolException e) {
            return Outcome.failure(e);
        }
    }

    QueryResult hydrateResult(JsonNode result, boolean lean, int index) {
        if (result == null || !result.isObject()) {
            throw new ProtocolException(format("Result %d is not an object", index));
        }
        var columnsNode = result.get(COLUMNS);
        var dataNode = result.get(DATA);
        if (columnsNode == null || !columnsNode.isArray()) {
            throw new ProtocolException(format("Result %d has no columns", index));
        }
        if (dataNode == null || !dataNode.isArray()) {
            throw new ProtocolException(format("Result %d has no data", index));
        }

        var columns = new ArrayList<String>(columnsNode.size());
        for (var column : columnsNode) {
            if (!column.isTextual()) {
                throw new ProtocolException(format("Result %d has a column name that is not a string: %s", index, column));
            }
            columns.add(column.asText());
        }

        var records = new ArrayList<Record>(dataNode.size());
        for (var data : dataNode) {
            var row = data.get(ROW);
            if (row == null || !row.isArray() || row.size() != columns.size()) {
                throw new ProtocolException(format(
                        "Result %d has a row that does not match its %d columns", index, columns.size()));
            }
            var values = new Value[columns.size()];
            for (var i = 0; i < values.length; i++) {
                values[i] = hydrate(row.get(i), lean);
            }
            records.add(new InternalRecord(columns, values));
        }
        return new InternalQueryResult(columns, records);
    }

    /**
     * Hydrate a single value.
     *
     * @param node the raw value
     * @param lean whether entities should be reduced to their properties
     * @return the value
     */
    public Value hydrate(JsonNode node, boolean lean) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Values.NULL;
        }
        if (node.isObject()) {
            return hydrateObject(node, lean);
        }
        if (node.isArray()) {
            var values = new Value[node.size()];
            for (var i = 0; i < values.length; i++) {
                values[i] = hydrate(node.get(i), lean);
            }
            return new ListValue(values);
        }
        return scalar(node);
    }

    private Value hydrateObject(JsonNode node, boolean lean) {
        var relationship = asRelationship(node);
        if (relationship != null) {
            return lean ? relationship.propertiesValue() : new RelationshipValue(relationship);
        }
        var entityNode = asNode(node);
        if (entityNode != null) {
            return lean ? entityNode.propertiesValue() : new NodeValue(entityNode);
        }
        var path = asPath(node);
        if (path != null) {
            return lean ? leanPath(path) : new PathValue(new InternalPath(path));
        }
        var map = new LinkedHashMap<String, Value>();
        var fields = node.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            map.put(field.getKey(), hydrate(field.getValue(), lean));
        }
        return new MapValue(map);
    }

    private static Value leanPath(List<Entity> entities) {
        var values = new Value[entities.size()];
        for (var i = 0; i < values.length; i++) {
            values[i] = ((InternalEntity) entities.get(i)).propertiesValue();
        }
        return new ListValue(values);
    }

    private static InternalRelationship asRelationship(JsonNode node) {
        if (node.size() != 5 || !hasProperties(node) || !node.path(TYPE).isTextual()) {
            return null;
        }
        var id = id(node.get(ID));
        var start = id(node.get(START_NODE));
        var end = id(node.get(END_NODE));
        if (id.isEmpty() || start.isEmpty() || end.isEmpty()) {
            return null;
        }
        return new InternalRelationship(
                id.getAsLong(),
                start.getAsLong(),
                end.getAsLong(),
                node.get(TYPE).asText(),
                properties(node.get(PROPERTIES)));
    }

    private static InternalNode asNode(JsonNode node) {
        if (node.size() != 3 || !hasProperties(node)) {
            return null;
        }
        var id = id(node.get(ID));
        var labelsNode = node.get(LABELS);
        if (id.isEmpty() || labelsNode == null || !labelsNode.isArray()) {
            return null;
        }
        var labels = new ArrayList<String>(labelsNode.size());
        for (var label : labelsNode) {
            if (!label.isTextual()) {
                return null;
            }
            labels.add(label.asText());
        }
        return new InternalNode(id.getAsLong(), labels, properties(node.get(PROPERTIES)));
    }

    private static List<Entity> asPath(JsonNode node) {
        var nodesNode = node.get(NODES);
        var relationshipsNode = node.get(RELATIONSHIPS);
        if (node.size() != 2
                || nodesNode == null
                || relationshipsNode == null
                || !nodesNode.isArray()
                || !relationshipsNode.isArray()
                || nodesNode.size() != relationshipsNode.size() + 1) {
            return null;
        }
        var entities = new ArrayList<Entity>(nodesNode.size() + relationshipsNode.size());
        var previous = asNode(nodesNode.get(0));
        if (previous == null) {
            return null;
        }
        entities.add(previous);
        for (var i = 0; i < relationshipsNode.size(); i++) {
            var relationship = asRelationship(relationshipsNode.get(i));
            var next = asNode(nodesNode.get(i + 1));
            if (relationship == null
                    || next == null
                    || !InternalPath.isEndpoint(previous, relationship)
                    || !InternalPath.isEndpoint(next, relationship)) {
                return null;
            }
            entities.add(relationship);
            entities.add(next);
            previous = next;
        }
        return entities;
    }

    private static boolean hasProperties(JsonNode node) {
        var properties = node.get(PROPERTIES);
        return properties != null && properties.isObject();
    }

    private static OptionalLong id(JsonNode node) {
        if (node == null) {
            return OptionalLong.empty();
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return OptionalLong.of(node.asLong());
        }
        if (node.isTextual()) {
            try {
                return OptionalLong.of(Long.parseLong(node.asText()));
            } catch (NumberFormatException e) {
                return OptionalLong.empty();
            }
        }
        return OptionalLong.empty();
    }

    private static Map<String, Value> properties(JsonNode node) {
        var properties = new LinkedHashMap<String, Value>();
        var fields = node.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            properties.put(field.getKey(), plain(field.getValue()));
        }
        return properties;
    }

    // property values never hold entities
    private static Value plain(JsonNode node) {
        if (node == null || node.isNull()) {
            return Values.NULL;
        }
        if (node.isArray()) {
            var values = new Value[node.size()];
            for (var i = 0; i < values.length; i++) {
                values[i] = plain(node.get(i));
            }
            return new ListValue(values);
        }
        if (node.isObject()) {
            return new MapValue(properties(node));
        }
        return scalar(node);
    }

    private static Value scalar(JsonNode node) {
        if (node.isBoolean()) {
            return BooleanValue.fromBoolean(node.booleanValue());
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? new IntegerValue(node.longValue()) : new FloatValue(node.doubleValue());
        }
        if (node.isNumber()) {
            return new FloatValue(node.doubleValue());
        }
        if (node.isTextual()) {
            return new StringValue(node.textValue());
        }
        throw new ProtocolException("Unsupported JSON value: " + node.getNodeType());
    }
}
