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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class TestContentTypes
{
    @Test
    public void testKnownExtensions()
    {
        assertThat(ContentTypes.guess("report.pdf")).contains("application/pdf");
        assertThat(ContentTypes.guess("photos/2024/CAT.JPG")).contains("image/jpeg");
        assertThat(ContentTypes.guess("index.html")).contains("text/html");
        assertThat(ContentTypes.guess("archive.tar.gz")).contains("application/x-gzip");
    }

    @Test
    public void testNoExtension()
    {
        assertThat(ContentTypes.guess("README")).isEmpty();
        assertThat(ContentTypes.guess("trailing.")).isEmpty();
        assertThat(ContentTypes.guess("dir.d/file")).isEmpty();
    }
}
