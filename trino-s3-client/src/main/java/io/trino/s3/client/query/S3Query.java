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
package io.trino.s3.client.query;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;
import com.google.common.util.concurrent.ListenableFuture;
import io.airlift.log.Logger;
import io.trino.s3.client.signing.RequestAuthorization;
import io.trino.s3.client.signing.RequestSigner;
import io.trino.s3.client.spi.credentials.Credential;
import io.trino.s3.client.spi.remote.ServiceEndpoint;
import io.trino.s3.client.spi.timestamps.AwsTimestamp;
import io.trino.s3.client.transport.S3Response;
import io.trino.s3.client.transport.S3Transport;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static io.trino.s3.client.signing.AmzHeaders.metadataHeaderName;
import static io.trino.s3.client.signing.RequestSigner.AUTHORIZATION;
import static io.trino.s3.client.signing.RequestSigner.CONTENT_LENGTH;
import static io.trino.s3.client.signing.RequestSigner.CONTENT_MD5;
import static io.trino.s3.client.signing.RequestSigner.CONTENT_TYPE;
import static io.trino.s3.client.signing.RequestSigner.DATE;
import static java.util.Objects.requireNonNull;

public class S3Query
        implements Query
{
    private static final Logger log = Logger.get(S3Query.class);

    private final String action;
    private final Optional<String> bucket;
    private final Optional<String> objectName;
    private final byte[] data;
    private final Optional<String> contentType;
    private final Optional<Credential> credential;
    private final ServiceEndpoint endpoint;
    private final String date;
    private final Map<String, String> headers;
    private final S3Transport transport;

    public S3Query(QueryParameters parameters, Optional<Credential> credential, ServiceEndpoint endpoint, Instant requestTime, S3Transport transport)
    {
        requireNonNull(parameters, "parameters is null");
        this.action = parameters.action();
        this.bucket = parameters.bucket();
        this.objectName = parameters.objectName();
        this.data = parameters.data();
        this.credential = requireNonNull(credential, "credential is null");
        this.endpoint = ServiceEndpoint.orDefault(Optional.of(requireNonNull(endpoint, "endpoint is null"))).withMethod(action);
        this.date = AwsTimestamp.toHttpDateFormat(requireNonNull(requestTime, "requestTime is null"));
        this.transport = requireNonNull(transport, "transport is null");
        this.contentType = parameters.contentType().or(() -> objectName.flatMap(ContentTypes::guess));
        this.headers = buildHeaders(parameters.metadata());
    }

    @Override
    public String getHost()
    {
        return bucket.map(endpoint::virtualHost).orElse(endpoint.host());
    }

    @Override
    public String getPath()
    {
        return objectName
                .map(name -> name.startsWith("/") ? name : "/" + name)
                .orElse("/");
    }

    @Override
    public String getUri()
    {
        return endpoint.scheme() + "://" + getHost() + getPath();
    }

    @Override
    public Map<String, String> getHeaders()
    {
        return headers;
    }

    public String getAction()
    {
        return action;
    }

    public ServiceEndpoint getEndpoint()
    {
        return endpoint;
    }

    public Optional<String> getContentType()
    {
        return contentType;
    }

    /**
     * The request URI with the path escaped for the wire. The signature is computed over the unescaped path.
     */
    public URI getRequestUri()
    {
        try {
            return new URI(endpoint.scheme(), getHost(), getPath(), null, null);
        }
        catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid request URI: " + getUri(), e);
        }
    }

    @Override
    public ListenableFuture<S3Response> submit()
    {
        log.debug("Submitting query. Method: %s, URI: %s, Signed: %s", action, getUri(), credential.isPresent());
        return transport.performRequest(getRequestUri(), action, headers, data);
    }

    @VisibleForTesting
    @SuppressWarnings("deprecation")
    static String contentMd5(byte[] data)
    {
        return BaseEncoding.base64().encode(Hashing.md5().hashBytes(data).asBytes());
    }

    private Map<String, String> buildHeaders(Map<String, String> metadata)
    {
        // signing reads the headers assembled so far, so the order of the steps below matters
        Map<String, String> builder = new LinkedHashMap<>();
        builder.put(CONTENT_LENGTH, Integer.toString(data.length));
        builder.put(CONTENT_MD5, contentMd5(data));
        builder.put(DATE, date);
        metadata.forEach((key, value) -> builder.put(metadataHeaderName(key), value));
        contentType.ifPresent(type -> builder.put(CONTENT_TYPE, type));
        credential.ifPresent(signingCredential -> {
            RequestAuthorization authorization = RequestSigner.sign(signingCredential, action, builder, getPath());
            builder.put(AUTHORIZATION, authorization.authorization());
        });
        return ImmutableMap.copyOf(builder);
    }
}
