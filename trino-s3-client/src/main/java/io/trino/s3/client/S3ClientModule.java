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

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Binder;
import com.google.inject.BindingAnnotation;
import com.google.inject.Provides;
import com.google.inject.Scopes;
import com.google.inject.Singleton;
import io.airlift.configuration.AbstractConfigurationAwareModule;
import io.airlift.log.Logger;
import io.trino.s3.client.query.QueryFactory;
import io.trino.s3.client.query.S3QueryFactory;
import io.trino.s3.client.spi.credentials.Credential;
import io.trino.s3.client.spi.remote.ServiceEndpoint;
import io.trino.s3.client.storage.BucketListingParser;
import io.trino.s3.client.storage.StorageClient;
import io.trino.s3.client.transport.HttpS3Transport;
import io.trino.s3.client.transport.S3Transport;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;
import java.time.Clock;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static io.airlift.configuration.ConfigBinder.configBinder;
import static io.airlift.http.client.HttpClientBinder.httpClientBinder;
import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

public class S3ClientModule
        extends AbstractConfigurationAwareModule
{
    private static final Logger log = Logger.get(S3ClientModule.class);

    public static final String S3_CLIENT_HTTP_CLIENT_NAME = "s3-client";

    @Retention(RUNTIME)
    @Target({FIELD, PARAMETER, METHOD})
    @BindingAnnotation
    public @interface ForS3Client {}

    @Override
    protected void setup(Binder binder)
    {
        configBinder(binder).bindConfig(S3ClientConfig.class);
        httpClientBinder(binder).bindHttpClient(S3_CLIENT_HTTP_CLIENT_NAME, ForS3Client.class);

        binder.bind(S3Transport.class).to(HttpS3Transport.class).in(Scopes.SINGLETON);
        binder.bind(QueryFactory.class).to(S3QueryFactory.class).in(Scopes.SINGLETON);
        binder.bind(BucketListingParser.class).in(Scopes.SINGLETON);
        binder.bind(Clock.class).annotatedWith(ForS3Client.class).toInstance(Clock.systemUTC());
    }

    @Provides
    @Singleton
    public StorageClient storageClient(S3ClientConfig config, QueryFactory queryFactory, BucketListingParser bucketListingParser)
    {
        ServiceEndpoint endpoint = ServiceEndpoint.fromUri(config.getEndpoint());
        Optional<Credential> credential = credential(config);
        log.info("Storage client endpoint: %s, signed requests: %s", endpoint, credential.isPresent());
        return new StorageClient(queryFactory, credential, endpoint, bucketListingParser);
    }

    @Provides
    public XmlMapper newXmlMapper()
    {
        // not a singleton, XmlMappers are mutable
        XmlMapper xmlMapper = new XmlMapper();
        xmlMapper.registerModule(new Jdk8Module());
        xmlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.UPPER_CAMEL_CASE);
        return xmlMapper;
    }

    @VisibleForTesting
    static Optional<Credential> credential(S3ClientConfig config)
    {
        checkArgument(config.getAccessKey().isPresent() == config.getSecretKey().isPresent(), "access key and secret key must be set together");
        return config.getAccessKey().map(accessKey -> new Credential(accessKey, config.getSecretKey().orElseThrow()));
    }
}
