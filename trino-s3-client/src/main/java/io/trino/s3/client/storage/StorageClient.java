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
package io.trino.s3.client.storage;

import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import io.trino.s3.client.query.Query;
import io.trino.s3.client.query.QueryFactory;
import io.trino.s3.client.query.QueryParameters;
import io.trino.s3.client.spi.credentials.Credential;
import io.trino.s3.client.spi.remote.ServiceEndpoint;
import io.trino.s3.client.spi.storage.Bucket;
import io.trino.s3.client.transport.S3Response;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.google.common.util.concurrent.MoreExecutors.directExecutor;
import static java.util.Objects.requireNonNull;

/**
 * Bucket and object operations of the storage service.
 * <p>
 * Every operation creates and submits its own {@link Query} and returns without blocking.
 * Failures, whether reported by the transport or found while parsing a response, complete
 * the returned future exceptionally. Nothing is retried. Operations are independent of each
 * other, so callers must wait for e.g. a bucket creation before uploading into that bucket.
 * <p>
 * Object names are signed as given but escaped on the wire, so names that need URI escaping
 * (spaces, {@code %}, non-ASCII characters) produce signatures the service rejects. Use names
 * made of unreserved characters and {@code /}.
 */
public class StorageClient
{
    private final QueryFactory queryFactory;
    private final Optional<Credential> credential;
    private final ServiceEndpoint endpoint;
    private final BucketListingParser bucketListingParser;

    public StorageClient(QueryFactory queryFactory, Optional<Credential> credential, ServiceEndpoint endpoint, BucketListingParser bucketListingParser)
    {
        this.queryFactory = requireNonNull(queryFactory, "queryFactory is null");
        this.credential = requireNonNull(credential, "credential is null");
        this.endpoint = requireNonNull(endpoint, "endpoint is null");
        this.bucketListingParser = requireNonNull(bucketListingParser, "bucketListingParser is null");
    }

    public ServiceEndpoint getEndpoint()
    {
        return endpoint;
    }

    /**
     * List all buckets owned by the credential, in the order returned by the service
     */
    public ListenableFuture<List<Bucket>> listBuckets()
    {
        ListenableFuture<S3Response> response = query(QueryParameters.forService("GET")).submit();
        return Futures.transform(response, value -> bucketListingParser.parse(value.body()), directExecutor());
    }

    public ListenableFuture<Void> createBucket(String bucket)
    {
        return discardResponse(query(QueryParameters.forBucket("PUT", bucket)).submit());
    }

    /**
     * Delete a bucket. The service rejects the request unless the bucket is empty.
     */
    public ListenableFuture<Void> deleteBucket(String bucket)
    {
        return discardResponse(query(QueryParameters.forBucket("DELETE", bucket)).submit());
    }

    public ListenableFuture<S3Response> putObject(String bucket, String objectName, byte[] data)
    {
        return putObject(bucket, objectName, data, Optional.empty(), ImmutableMap.of());
    }

    /**
     * Store an object, replacing any existing object of the same name.
     * The data is copied before this method returns.
     *
     * @param contentType type of the data, guessed from the object name when empty
     * @param metadata user metadata, each entry is sent as an {@code x-amz-meta-} header
     */
    public ListenableFuture<S3Response> putObject(String bucket, String objectName, byte[] data, Optional<String> contentType, Map<String, String> metadata)
    {
        return query(QueryParameters.forUpload(bucket, objectName, data, contentType, metadata)).submit();
    }

    public ListenableFuture<S3Response> getObject(String bucket, String objectName)
    {
        return query(QueryParameters.forObject("GET", bucket, objectName)).submit();
    }

    /**
     * Retrieve an object's headers without its content. The metadata headers are not
     * extracted, callers get the raw response like for {@link #getObject(String, String)}.
     */
    public ListenableFuture<S3Response> headObject(String bucket, String objectName)
    {
        return query(QueryParameters.forObject("HEAD", bucket, objectName)).submit();
    }

    /**
     * Delete an object. Deleted objects cannot be restored.
     */
    public ListenableFuture<S3Response> deleteObject(String bucket, String objectName)
    {
        return query(QueryParameters.forObject("DELETE", bucket, objectName)).submit();
    }

    private Query query(QueryParameters parameters)
    {
        return queryFactory.create(parameters, credential, endpoint);
    }

    private static ListenableFuture<Void> discardResponse(ListenableFuture<S3Response> response)
    {
        return Futures.transform(response, ignored -> null, directExecutor());
    }
}
