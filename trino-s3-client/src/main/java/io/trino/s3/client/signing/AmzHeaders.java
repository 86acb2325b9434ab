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
package io.trino.s3.client.signing;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Objects.requireNonNull;

/**
 * The {@code x-amz-} headers of a request in the canonical form used by the string to sign.
 * <p>
 * Two parts of the full canonicalization rules are not implemented: headers repeating the
 * same name are not combined into one comma separated entry, and folded (multi-line) values
 * are not unfolded.
 */
public final class AmzHeaders
{
    public static final String AMZ_HEADER_PREFIX = "x-amz-";
    public static final String METADATA_HEADER_PREFIX = "x-amz-meta-";

    private final List<Map.Entry<String, String>> lowercaseAmzHeaders;

    private AmzHeaders(List<Map.Entry<String, String>> lowercaseAmzHeaders)
    {
        this.lowercaseAmzHeaders = ImmutableList.copyOf(lowercaseAmzHeaders);
    }

    /**
     * Select the headers to canonicalize from all request headers.
     * Names are lower-cased and sorted, the sort is stable so equal names keep their order.
     */
    public static AmzHeaders build(Map<String, String> requestHeaders)
    {
        requireNonNull(requestHeaders, "requestHeaders is null");
        return new AmzHeaders(requestHeaders.entrySet().stream()
                .map(entry -> Map.entry(entry.getKey().toLowerCase(Locale.ROOT), entry.getValue()))
                .filter(entry -> entry.getKey().startsWith(AMZ_HEADER_PREFIX))
                .sorted(Map.Entry.comparingByKey())
                .collect(toImmutableList()));
    }

    public static String metadataHeaderName(String key)
    {
        requireNonNull(key, "key is null");
        return METADATA_HEADER_PREFIX + key;
    }

    public List<Map.Entry<String, String>> lowercaseHeaders()
    {
        return lowercaseAmzHeaders;
    }

    public String canonicalize()
    {
        StringBuilder builder = new StringBuilder();
        lowercaseAmzHeaders.forEach(entry -> builder.append(entry.getKey()).append(':').append(entry.getValue()).append('\n'));
        return builder.toString();
    }
}
