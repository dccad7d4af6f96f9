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

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.graphhttp.driver.Value;
import java.io.Serial;

public class GraphHttpModule extends SimpleModule {
    @Serial
    private static final long serialVersionUID = 4520178419720935416L;

    public GraphHttpModule() {
        this.addSerializer(Value.class, new ValueSerializer());
    }
}
