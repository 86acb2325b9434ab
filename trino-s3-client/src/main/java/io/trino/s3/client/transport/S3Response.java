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

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Raw response of the storage service. Header names are lower-cased.
 */
public record S3Response(int statusCode, ListMultimap<String, String> headers, byte[] body)
{
    public S3Response
    {
        headers = lowercaseKeys(requireNonNull(headers, "headers is null"));
        requireNonNull(body, "body is null");
    }

    public List<String> headers(String name)
    {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    public Optional<String> header(String name)
    {
        return headers(name).stream().findFirst();
    }

    private static ImmutableListMultimap<String, String> lowercaseKeys(ListMultimap<String, String> headers)
    {
        ImmutableListMultimap.Builder<String, String> builder = ImmutableListMultimap.builder();
        headers.forEach((name, value) -> builder.put(name.toLowerCase(Locale.ROOT), value));
        return builder.build();
    }
}
