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

import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.inject.Inject;
import io.airlift.http.client.HttpClient;
import io.airlift.http.client.Request;
import io.trino.s3.client.S3ClientModule.ForS3Client;

import java.net.URI;
import java.util.Map;

import static io.airlift.http.client.StaticBodyGenerator.createStaticBodyGenerator;
import static java.util.Objects.requireNonNull;

public class HttpS3Transport
        implements S3Transport
{
    private final HttpClient httpClient;
    private final XmlMapper xmlMapper;

    @Inject
    public HttpS3Transport(@ForS3Client HttpClient httpClient, XmlMapper xmlMapper)
    {
        this.httpClient = requireNonNull(httpClient, "httpClient is null");
        this.xmlMapper = requireNonNull(xmlMapper, "xmlMapper is null");
    }

    @Override
    public ListenableFuture<S3Response> performRequest(URI uri, String method, Map<String, String> headers, byte[] body)
    {
        requireNonNull(headers, "headers is null");
        requireNonNull(body, "body is null");
        Request.Builder requestBuilder = new Request.Builder()
                .setMethod(method)
                .setUri(uri);
        headers.forEach(requestBuilder::addHeader);
        if (body.length > 0) {
            requestBuilder.setBodyGenerator(createStaticBodyGenerator(body));
        }
        return httpClient.executeAsync(requestBuilder.build(), new S3ResponseHandler(xmlMapper));
    }
}
