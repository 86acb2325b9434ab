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

import com.google.common.util.concurrent.ListenableFuture;

import java.net.URI;
import java.util.Map;

/**
 * Performs fully formed requests. Implementations report any non-success status as a failed future.
 */
public interface S3Transport
{
    ListenableFuture<S3Response> performRequest(URI uri, String method, Map<String, String> headers, byte[] body);
}
