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

import com.google.common.util.concurrent.ListenableFuture;
import io.trino.s3.client.transport.S3Response;

import java.util.Map;

/**
 * A single request to the storage service. Addressing and headers, including the
 * signature, are fixed once the query is created.
 */
public interface Query
{
    String getHost();

    String getPath();

    String getUri();

    Map<String, String> getHeaders();

    /**
     * Send the request. The returned future fails if the request could not be performed
     * or the service did not answer with a success status.
     */
    ListenableFuture<S3Response> submit();
}
