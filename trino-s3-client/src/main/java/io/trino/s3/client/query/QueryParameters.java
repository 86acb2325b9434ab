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

import com.google.common.collect.ImmutableMap;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * What a query operates on. The payload array and the metadata map are copied, so later
 * changes by the caller do not reach a query that is already built.
 */
public record QueryParameters(
        String action,
        Optional<String> bucket,
        Optional<String> objectName,
        byte[] data,
        Optional<String> contentType,
        Map<String, String> metadata)
{
    private static final byte[] EMPTY = new byte[0];

    public QueryParameters
    {
        action = requireNonNull(action, "action is null").toUpperCase(Locale.ROOT);
        requireNonNull(bucket, "bucket is null");
        requireNonNull(objectName, "objectName is null");
        data = requireNonNull(data, "data is null").clone();
        requireNonNull(contentType, "contentType is null");
        metadata = ImmutableMap.copyOf(requireNonNull(metadata, "metadata is null"));
        checkArgument(bucket.map(name -> !name.isEmpty()).orElse(true), "bucket is empty");
        checkArgument(objectName.isEmpty() || bucket.isPresent(), "objectName requires a bucket");
    }

    public static QueryParameters forService(String action)
    {
        return new QueryParameters(action, Optional.empty(), Optional.empty(), EMPTY, Optional.empty(), ImmutableMap.of());
    }

    public static QueryParameters forBucket(String action, String bucket)
    {
        return new QueryParameters(action, Optional.of(bucket), Optional.empty(), EMPTY, Optional.empty(), ImmutableMap.of());
    }

    public static QueryParameters forObject(String action, String bucket, String objectName)
    {
        return new QueryParameters(action, Optional.of(bucket), Optional.of(objectName), EMPTY, Optional.empty(), ImmutableMap.of());
    }

    public static QueryParameters forUpload(String bucket, String objectName, byte[] data, Optional<String> contentType, Map<String, String> metadata)
    {
        return new QueryParameters("PUT", Optional.of(bucket), Optional.of(objectName), data, contentType, metadata);
    }
}
