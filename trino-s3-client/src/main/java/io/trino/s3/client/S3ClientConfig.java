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
package io.trino.s3.client;

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;
import io.airlift.configuration.ConfigSecuritySensitive;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;

import java.net.URI;
import java.util.Optional;

public class S3ClientConfig
{
    private URI endpoint = URI.create("https://s3.amazonaws.com");
    private Optional<String> accessKey = Optional.empty();
    private Optional<String> secretKey = Optional.empty();

    @NotNull
    public URI getEndpoint()
    {
        return endpoint;
    }

    @Config("s3-client.endpoint")
    @ConfigDescription("Scheme and host of the storage service, bucket names are prepended to the host")
    public S3ClientConfig setEndpoint(URI endpoint)
    {
        this.endpoint = endpoint;
        return this;
    }

    public Optional<String> getAccessKey()
    {
        return accessKey;
    }

    @Config("s3-client.access-key")
    public S3ClientConfig setAccessKey(String accessKey)
    {
        this.accessKey = Optional.ofNullable(accessKey);
        return this;
    }

    public Optional<String> getSecretKey()
    {
        return secretKey;
    }

    @ConfigSecuritySensitive
    @Config("s3-client.secret-key")
    public S3ClientConfig setSecretKey(String secretKey)
    {
        this.secretKey = Optional.ofNullable(secretKey);
        return this;
    }

    @AssertTrue(message = "s3-client.access-key and s3-client.secret-key must be set together")
    public boolean isCredentialPairValid()
    {
        return accessKey.isPresent() == secretKey.isPresent();
    }
}
