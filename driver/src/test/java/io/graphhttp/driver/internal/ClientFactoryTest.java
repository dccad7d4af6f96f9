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

import static io.graphhttp.driver.testutil.TestUtil.await;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.sameInstance;

import io.graphhttp.driver.Config;
import io.graphhttp.driver.Query;
import io.graphhttp.driver.net.Transport;
import io.graphhttp.driver.testutil.StubTransport;
import java.net.URI;
import org.junit.jupiter.api.Test;

class ClientFactoryTest {
    @Test
    void shouldCloseTransportItCreated() {
        // Given
        var factory = new ClientFactoryWithTransport(new StubTransport());
        var client = factory.newInstance(URI.create("http://localhost:7474"), null, null, null);

        // When
        await(client.closeAsync());
        await(client.closeAsync());

        // Then
        assertThat(factory.transport.closeCount(), equalTo(1));
        assertThat(factory.createdFor, equalTo(new HttpServerAddress("http", "localhost", 7474, "")));
    }

    @Test
    void shouldNotCloseProvidedTransport() {
        // Given
        var transport = new StubTransport();
        var client = new ClientFactory().newInstance(URI.create("http://localhost"), null, null, transport);

        // When
        client.close();

        // Then
        assertThat(transport.closeCount(), equalTo(0));
    }

    @Test
    void shouldUseDefaultsWhenConfigAndAuthAreMissing() {
        // Given
        var transport = new StubTransport()
                .respondJson(200, "{\"results\":[{\"columns\":[],\"data\":[]}],\"errors\":[]}");
        var client = new ClientFactory().newInstance(URI.create("http://localhost/"), null, null, transport);

        // When
        await(client.execute(new Query("RETURN 1")));

        // Then
        var request = transport.lastRequest();
        assertThat(request.path(), equalTo("/db/" + Config.DEFAULT_DATABASE + "/tx/commit"));
        assertThat(request.headers().containsKey("Authorization"), equalTo(false));
    }

    @Test
    void shouldPassConfigToCreatedTransport() {
        var config = Config.builder().withMaxConnectionPoolSize(3).build();
        var factory = new ClientFactoryWithTransport(new StubTransport());

        factory.newInstance(URI.create("https://secure.example.com"), null, config, null).close();

        assertThat(factory.createdWith, sameInstance(config));
        assertThat(factory.createdFor.port(), equalTo(HttpServerAddress.DEFAULT_HTTPS_PORT));
    }

    private static class ClientFactoryWithTransport extends ClientFactory {
        final StubTransport transport;
        HttpServerAddress createdFor;
        Config createdWith;

        ClientFactoryWithTransport(StubTransport transport) {
            this.transport = transport;
        }

        @Override
        protected Transport createTransport(HttpServerAddress address, Config config) {
            createdFor = address;
            createdWith = config;
            return transport;
        }
    }
}
