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
package io.trino.s3.client.spi.credentials;

import com.google.common.io.BaseEncoding;

import static com.google.common.base.Preconditions.checkArgument;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * An access key and its secret. The secret is only ever used as HMAC key material
 * and is never part of {@link #toString()}.
 */
public record Credential(String accessKey, String secretKey)
{
    public Credential
    {
        requireNonNull(accessKey, "accessKey is null");
        requireNonNull(secretKey, "secretKey is null");
        checkArgument(!accessKey.isBlank(), "accessKey is empty");
    }

    /**
     * Computes a keyed digest of {@code text} using the secret key
     *
     * @return the base64 encoded signature, suitable for an HTTP header
     */
    public String sign(String text, SigningAlgorithm algorithm)
    {
        requireNonNull(text, "text is null");
        requireNonNull(algorithm, "algorithm is null");
        byte[] signature = algorithm.hmac(secretKey.getBytes(UTF_8), text.getBytes(UTF_8));
        return BaseEncoding.base64().encode(signature);
    }

    @Override
    public String toString()
    {
        return "Credential{accessKey=" + accessKey + ", secretKey=****}";
    }
}
