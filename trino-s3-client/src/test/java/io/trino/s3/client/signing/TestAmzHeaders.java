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

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class TestAmzHeaders
{
    @Test
    public void testSelectsAndSortsAmzHeaders()
    {
        Map<String, String> headers = ImmutableMap.of(
                "Content-MD5", "1B2M2Y8AsgTpgAmY7PhCfg==",
                "x-amz-meta-team", "data",
                "Date", "Mon, 06 May 2024 02:45:11 GMT",
                "X-Amz-Meta-Owner", "alice",
                "x-amz-acl", "private");

        AmzHeaders amzHeaders = AmzHeaders.build(headers);

        assertThat(amzHeaders.lowercaseHeaders())
                .containsExactly(
                        Map.entry("x-amz-acl", "private"),
                        Map.entry("x-amz-meta-owner", "alice"),
                        Map.entry("x-amz-meta-team", "data"));
        assertThat(amzHeaders.canonicalize()).isEqualTo("x-amz-acl:private\nx-amz-meta-owner:alice\nx-amz-meta-team:data\n");
    }

    @Test
    public void testNoAmzHeaders()
    {
        AmzHeaders amzHeaders = AmzHeaders.build(ImmutableMap.of("Content-Type", "text/plain", "amz-like", "value"));

        assertThat(amzHeaders.lowercaseHeaders()).isEmpty();
        assertThat(amzHeaders.canonicalize()).isEmpty();
    }

    @Test
    public void testSameNameInDifferentCaseIsNotMerged()
    {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("x-amz-meta-key", "first");
        headers.put("X-AMZ-META-KEY", "second");

        assertThat(AmzHeaders.build(headers).canonicalize()).isEqualTo("x-amz-meta-key:first\nx-amz-meta-key:second\n");
    }

    @Test
    public void testFoldedValueIsKeptVerbatim()
    {
        assertThat(AmzHeaders.build(ImmutableMap.of("x-amz-meta-note", "line one\n line two")).canonicalize())
                .isEqualTo("x-amz-meta-note:line one\n line two\n");
    }

    @Test
    public void testMetadataHeaderNamePreservesCase()
    {
        assertThat(AmzHeaders.metadataHeaderName("Owner")).isEqualTo("x-amz-meta-Owner");
    }
}
