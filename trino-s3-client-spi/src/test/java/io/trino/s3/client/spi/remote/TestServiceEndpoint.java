/*
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
package io.trino.s3.client.spi.remote;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TestServiceEndpoint
{
    @Test
    public void testFromUri()
    {
        assertThat(ServiceEndpoint.fromUri(URI.create("https://s3.amazonaws.com"))).isEqualTo(new ServiceEndpoint("https", "s3.amazonaws.com"));
        assertThat(ServiceEndpoint.fromUri(URI.create("http://localhost:9000/"))).isEqualTo(new ServiceEndpoint("http", "localhost:9000"));
        assertThat(ServiceEndpoint.fromUri(URI.create("http://minio:80"))).isEqualTo(new ServiceEndpoint("http", "minio"));
        assertThat(ServiceEndpoint.fromUri(URI.create("https://storage.example.com:443"))).isEqualTo(new ServiceEndpoint("https", "storage.example.com"));
        assertThatThrownBy(() -> ServiceEndpoint.fromUri(URI.create("ftp://storage.example.com"))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testDefaulting()
    {
        ServiceEndpoint custom = new ServiceEndpoint("http", "localhost:9000");

        assertThat(ServiceEndpoint.orDefault(Optional.empty())).isEqualTo(ServiceEndpoint.DEFAULT);
        assertThat(ServiceEndpoint.orDefault(Optional.of(new ServiceEndpoint("https", "")))).isEqualTo(ServiceEndpoint.DEFAULT);
        assertThat(ServiceEndpoint.orDefault(Optional.of(custom))).isSameAs(custom);
        assertThat(ServiceEndpoint.DEFAULT.host()).isEqualTo("s3.amazonaws.com");
        assertThat(ServiceEndpoint.DEFAULT.scheme()).isEqualTo("https");
    }

    @Test
    public void testVirtualHost()
    {
        assertThat(new ServiceEndpoint("https", "s3.amazonaws.com").virtualHost("mybucket")).isEqualTo("mybucket.s3.amazonaws.com");
        assertThat(new ServiceEndpoint("http", "localhost:9000").virtualHost("b")).isEqualTo("b.localhost:9000");
    }

    @Test
    public void testWithMethodDoesNotMutate()
    {
        ServiceEndpoint endpoint = new ServiceEndpoint("https", "s3.amazonaws.com");
        ServiceEndpoint put = endpoint.withMethod("put");

        assertThat(put.method()).contains("PUT");
        assertThat(endpoint.method()).isEmpty();
        assertThat(put.host()).isEqualTo(endpoint.host());
        assertThat(put).isNotEqualTo(endpoint);
    }
}
