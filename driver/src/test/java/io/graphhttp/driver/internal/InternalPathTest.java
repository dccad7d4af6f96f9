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
package io.graphhttp.driver.internal;

import static io.graphhttp.driver.testutil.TestUtil.asList;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.graphhttp.driver.types.Node;
import io.graphhttp.driver.types.Path;
import io.graphhttp.driver.types.Relationship;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InternalPathTest {
    // (Alice)-[:FOLLOWS]->(Bob)<-[:FOLLOWS]-(Carol)
    private static InternalPath followers() {
        return new InternalPath(
                new InternalNode(10),
                new InternalRelationship(100, 10, 20, "FOLLOWS", Map.of()),
                new InternalNode(20),
                new InternalRelationship(101, 30, 20, "FOLLOWS", Map.of()),
                new InternalNode(30));
    }

    @Test
    void shouldReportNumberOfRelationshipsAsLength() {
        assertThat(followers().length(), equalTo(2));
    }

    @Test
    void shouldCreatePathOfSingleNode() {
        // When
        var path = new InternalPath(new InternalNode(10));

        // Then
        assertThat(path.length(), equalTo(0));
        assertThat(path.start(), equalTo(path.end()));
        assertThat(asList(path.relationships()).size(), equalTo(0));
    }

    @Test
    void shouldIterateSegmentsAgainstRelationshipDirection() {
        // Given
        var path = followers();

        // When
        var segments = asList(path);

        // Then
        assertThat(
                segments,
                contains(
                        (Path.Segment) new InternalPath.SelfContainedSegment(
                                new InternalNode(10),
                                new InternalRelationship(100, 10, 20, "FOLLOWS", Map.of()),
                                new InternalNode(20)),
                        new InternalPath.SelfContainedSegment(
                                new InternalNode(20),
                                new InternalRelationship(101, 30, 20, "FOLLOWS", Map.of()),
                                new InternalNode(30))));
    }

    @Test
    void shouldExposeNodesAndRelationshipsInOrder() {
        // Given
        var path = followers();

        // Then
        assertThat(
                asList(path.nodes()),
                contains((Node) new InternalNode(10), new InternalNode(20), new InternalNode(30)));
        assertThat(
                asList(path.relationships()),
                contains(
                        (Relationship) new InternalRelationship(100, 10, 20, "FOLLOWS", Map.of()),
                        new InternalRelationship(101, 30, 20, "FOLLOWS", Map.of())));
        assertTrue(path.contains(new InternalNode(30)));
        assertFalse(path.contains(new InternalNode(40)));
    }

    @Test
    void shouldRecogniseEndpointsInBothDirections() {
        var relationship = new InternalRelationship(100, 10, 20, "FOLLOWS", Map.of());

        assertTrue(InternalPath.isEndpoint(new InternalNode(10), relationship));
        assertTrue(InternalPath.isEndpoint(new InternalNode(20), relationship));
        assertFalse(InternalPath.isEndpoint(new InternalNode(30), relationship));
    }

    @Test
    void shouldRejectEmptyPath() {
        assertThrows(IllegalArgumentException.class, InternalPath::new);
    }

    @Test
    void shouldRejectPathEndingInRelationship() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new InternalPath(new InternalNode(10), new InternalRelationship(100, 10, 20, "FOLLOWS", Map.of())));
    }

    @Test
    void shouldRejectNullEntity() {
        assertThrows(IllegalArgumentException.class, () -> new InternalPath((InternalNode) null));
    }

    @Test
    void shouldRejectDisconnectedNode() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new InternalPath(
                        new InternalNode(10), new InternalRelationship(100, 10, 20, "FOLLOWS", Map.of()), new InternalNode(30)));
    }

    @Test
    void shouldRejectDisconnectedRelationship() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new InternalPath(
                        new InternalNode(10), new InternalRelationship(100, 20, 30, "FOLLOWS", Map.of()), new InternalNode(20)));
    }

    @Test
    void shouldDescribeRelationshipByEndpointsAndType() {
        var relationship = new InternalRelationship(100, 10, 20, "FOLLOWS", Map.of());

        assertThat(relationship.toString(), equalTo("(10)-[100:FOLLOWS]->(20)"));
    }
}
