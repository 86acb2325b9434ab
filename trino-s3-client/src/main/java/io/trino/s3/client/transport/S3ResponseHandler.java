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
package io.trino.s3.client.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.io.ByteStreams;
import io.airlift.http.client.HttpStatus;
import io.airlift.http.client.Request;
import io.airlift.http.client.Response;
import io.airlift.http.client.ResponseHandler;
import io.airlift.log.Logger;
import io.trino.s3.client.S3ClientException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

class S3ResponseHandler
        implements ResponseHandler<S3Response, RuntimeException>
{
    private static final Logger log = Logger.get(S3ResponseHandler.class);
    private static final String REQUEST_ID_HEADER = "x-amz-request-id";

    private final XmlMapper xmlMapper;

    S3ResponseHandler(XmlMapper xmlMapper)
    {
        this.xmlMapper = requireNonNull(xmlMapper, "xmlMapper is null");
    }

    @Override
    public S3Response handleException(Request request, Exception exception)
    {
        log.debug(exception, "Request failed. Method: %s, URI: %s", request.getMethod(), request.getUri());
        if (exception instanceof S3ClientException clientException) {
            throw clientException;
        }
        throw new S3TransportException("Could not perform %s request to %s".formatted(request.getMethod(), request.getUri()), exception);
    }

    @Override
    public S3Response handle(Request request, Response response)
    {
        byte[] body;
        try (InputStream inputStream = response.getInputStream()) {
            body = ByteStreams.toByteArray(inputStream);
        }
        catch (IOException e) {
            throw new S3TransportException("Could not read response of %s request to %s".formatted(request.getMethod(), request.getUri()), e);
        }

        ImmutableListMultimap.Builder<String, String> headers = ImmutableListMultimap.builder();
        response.getHeaders().forEach((name, value) -> headers.put(name.toString(), value));

        int statusCode = response.getStatusCode();
        if (HttpStatus.familyForStatusCode(statusCode) != HttpStatus.Family.SUCCESSFUL) {
            log.debug("Request was not successful. Method: %s, URI: %s, Status: %s", request.getMethod(), request.getUri(), statusCode);
            throw errorFor(statusCode, body, response.getHeader(REQUEST_ID_HEADER));
        }
        return new S3Response(statusCode, headers.build(), body);
    }

    private S3ResponseException errorFor(int statusCode, byte[] body, String requestIdHeader)
    {
        Optional<JsonNode> error = parseErrorDocument(body);
        return new S3ResponseException(
                statusCode,
                error.flatMap(node -> text(node, "Code")),
                error.flatMap(node -> text(node, "Message")),
                error.flatMap(node -> text(node, "RequestId")).or(() -> Optional.ofNullable(requestIdHeader)));
    }

    private Optional<JsonNode> parseErrorDocument(byte[] body)
    {
        // HEAD responses and some proxies return no body at all
        if (body.length == 0) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(xmlMapper.readTree(body));
        }
        catch (IOException e) {
            log.debug(e, "Error response is not an S3 error document");
            return Optional.empty();
        }
    }

    private static Optional<String> text(JsonNode node, String field)
    {
        JsonNode value = node.path(field);
        return value.isValueNode() ? Optional.of(value.asText()) : Optional.empty();
    }
}
