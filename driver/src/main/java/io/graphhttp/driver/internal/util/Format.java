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

import java.util.Iterator;
import java.util.Map;

public final class Format {
    private Format() {
        throw new UnsupportedOperationException();
    }

    // formats map using ':' as key-value separator instead of default '='
    public static <V> String formatPairs(Map<String, V> entries) {
        var iterator = entries.entrySet().iterator();
        switch (entries.size()) {
            case 0 -> {
                return "{}";
            }
            case 1 -> {
                return String.format("{%s}", keyValueString(iterator.next()));
            }
            default -> {
                var builder = new StringBuilder();
                builder.append("{");
                builder.append(keyValueString(iterator.next()));
                while (iterator.hasNext()) {
                    builder.append(',');
                    builder.append(' ');
                    builder.append(keyValueString(iterator.next()));
                }
                builder.append("}");
                return builder.toString();
            }
        }
    }

    public static <V> String formatElements(Iterator<V> iterator) {
        var builder = new StringBuilder("[");
        while (iterator.hasNext()) {
            builder.append(iterator.next());
            if (iterator.hasNext()) {
                builder.append(", ");
            }
        }
        return builder.append("]").toString();
    }

    /**
     * Returns at most {@code maxLength} characters of the given text, marking truncation with an ellipsis.
     *
     * @param text the text or {@code null}
     * @param maxLength the maximum length
     * @return the excerpt or {@code null} when the text is {@code null}
     */
    public static String excerpt(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "...";
    }

    private static <V> String keyValueString(Map.Entry<String, V> entry) {
        return String.format("%s: %s", entry.getKey(), entry.getValue());
    }
}
