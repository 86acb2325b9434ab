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

import com.google.inject.Inject;
import io.trino.s3.client.S3ClientModule.ForS3Client;
import io.trino.s3.client.spi.credentials.Credential;
import io.trino.s3.client.spi.remote.ServiceEndpoint;
import io.trino.s3.client.transport.S3Transport;

import java.time.Clock;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

public class S3QueryFactory
        implements QueryFactory
{
    private final S3Transport transport;
    private final Clock clock;

    @Inject
    public S3QueryFactory(S3Transport transport, @ForS3Client Clock clock)
    {
        this.transport = requireNonNull(transport, "transport is null");
        this.clock = requireNonNull(clock, "clock is null");
    }

    @Override
    public Query create(QueryParameters parameters, Optional<Credential> credential, ServiceEndpoint endpoint)
    {
        return new S3Query(parameters, credential, endpoint, clock.instant(), transport);
    }
}
