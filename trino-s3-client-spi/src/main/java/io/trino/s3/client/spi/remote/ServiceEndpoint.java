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

import com.google.common.base.Strings;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Where requests are sent: scheme and host (including any non-default port). An endpoint
 * handed to a query also records the HTTP method of that query, see {@link #withMethod(String)}.
 */
public final class ServiceEndpoint
{
    public static final String DEFAULT_HOST = "s3.amazonaws.com";
    public static final ServiceEndpoint DEFAULT = new ServiceEndpoint("https", DEFAULT_HOST, Optional.empty());

    private final String scheme;
    private final String host;
    private final Optional<String> method;

    public ServiceEndpoint(String scheme, String host)
    {
        this(scheme, host, Optional.empty());
    }

    private ServiceEndpoint(String scheme, String host, Optional<String> method)
    {
        this.scheme = requireNonNull(scheme, "scheme is null").toLowerCase(Locale.ROOT);
        this.host = requireNonNull(host, "host is null");
        this.method = requireNonNull(method, "method is null");
        checkArgument(this.scheme.equals("http") || this.scheme.equals("https"), "Unsupported scheme: %s", scheme);
    }

    public static ServiceEndpoint fromUri(URI uri)
    {
        requireNonNull(uri, "uri is null");
        String scheme = Objects.requireNonNullElse(uri.getScheme(), "https");
        String host = Strings.nullToEmpty(uri.getHost());
        int port = uri.getPort();
        if (port != -1 && !isDefaultPort(scheme, port)) {
            host += ":" + port;
        }
        return new ServiceEndpoint(scheme, host);
    }

    /**
     * Endpoint to use when none, or one without a host, was supplied
     */
    public static ServiceEndpoint orDefault(Optional<ServiceEndpoint> endpoint)
    {
        return endpoint.filter(ServiceEndpoint::hasHost).orElse(DEFAULT);
    }

    public String scheme()
    {
        return scheme;
    }

    public String host()
    {
        return host;
    }

    public boolean hasHost()
    {
        return !host.isEmpty();
    }

    /**
     * Virtual-hosted style host name: the bucket becomes the leading DNS label.
     * The bucket name is not validated and must already be DNS safe.
     */
    public String virtualHost(String bucket)
    {
        requireNonNull(bucket, "bucket is null");
        return bucket + "." + host;
    }

    public Optional<String> method()
    {
        return method;
    }

    public ServiceEndpoint withMethod(String method)
    {
        requireNonNull(method, "method is null");
        return new ServiceEndpoint(scheme, host, Optional.of(method.toUpperCase(Locale.ROOT)));
    }

    private static boolean isDefaultPort(String scheme, int port)
    {
        return (port == 80 && scheme.equalsIgnoreCase("http")) || (port == 443 && scheme.equalsIgnoreCase("https"));
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ServiceEndpoint that)) {
            return false;
        }
        return scheme.equals(that.scheme) && host.equals(that.host) && method.equals(that.method);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(scheme, host, method);
    }

    @Override
    public String toString()
    {
        return method.map(value -> value + " ").orElse("") + scheme + "://" + host;
    }
}
