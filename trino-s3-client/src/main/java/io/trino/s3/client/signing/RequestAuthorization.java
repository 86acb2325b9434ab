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

import static java.util.Objects.requireNonNull;

/**
 * Value of the {@code Authorization} header of a signed request: {@code AWS <access-key>:<signature>}
 */
public record RequestAuthorization(String accessKey, String signature)
{
    private static final String SIGNATURE_SCHEME = "AWS";

    public RequestAuthorization
    {
        requireNonNull(accessKey, "accessKey is null");
        requireNonNull(signature, "signature is null");
    }

    public String authorization()
    {
        return "%s %s:%s".formatted(SIGNATURE_SCHEME, accessKey, signature);
    }
}
