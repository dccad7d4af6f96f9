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
package io.graphhttp.driver.internal.request;

import io.graphhttp.driver.net.HttpRequest;
import java.util.List;

/**
 * A statement request ready to be sent, with the lean flag of every statement it carries.
 *
 * @param request the request
 * @param leanFlags the lean flags in statement order
 */
public record PreparedRequest(HttpRequest request, List<Boolean> leanFlags) {
    public PreparedRequest {
        leanFlags = List.copyOf(leanFlags);
    }

    public int statementCount() {
        return leanFlags.size();
    }
}
