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
package io.graphhttp.driver.internal.util;

import static java.lang.String.format;

import io.graphhttp.driver.GraphClient;

public class DriverInfoUtil {
    private DriverInfoUtil() {}

    /**
     * @return the default {@code User-Agent} value
     */
    public static String userAgent() {
        return format("graphhttp-java/%s", driverVersion());
    }

    /**
     * Extracts the driver version from the driver jar MANIFEST.MF file.
     */
    public static String driverVersion() {
        // any class of the root package works, the manifest is read per package
        var pkg = GraphClient.class.getPackage();
        if (pkg != null && pkg.getImplementationVersion() != null) {
            return pkg.getImplementationVersion();
        }

        // Not running from a jar file, but from raw compiled class files.
        return "dev";
    }
}
