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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.trino.s3.client.spi.storage.Bucket;
import io.trino.s3.client.spi.timestamps.AwsTimestamp;

import java.io.IOException;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Reads the {@code Name} and {@code CreationDate} of each {@code Buckets/Bucket} entry of a
 * {@code ListAllMyBucketsResult} document, in document order.
 */
public class BucketListingParser
{
    private final XmlMapper xmlMapper;

    @Inject
    public BucketListingParser(XmlMapper xmlMapper)
    {
        this.xmlMapper = requireNonNull(xmlMapper, "xmlMapper is null");
    }

    public List<Bucket> parse(byte[] xml)
    {
        requireNonNull(xml, "xml is null");
        JsonNode root;
        try {
            root = xmlMapper.readTree(xml);
        }
        catch (IOException e) {
            throw new BucketListingParseException("Malformed bucket listing", e);
        }
        if (root == null) {
            throw new BucketListingParseException("Empty bucket listing");
        }

        JsonNode buckets = root.path("Buckets");
        if (buckets.isMissingNode()) {
            throw new BucketListingParseException("Bucket listing has no Buckets element");
        }

        // a single entry is read as an object, repeated entries as an array
        JsonNode entries = buckets.path("Bucket");
        ImmutableList.Builder<Bucket> result = ImmutableList.builder();
        if (entries.isArray()) {
            entries.forEach(entry -> result.add(toBucket(entry)));
        }
        else if (entries.isObject()) {
            result.add(toBucket(entries));
        }
        else if (!entries.isMissingNode()) {
            throw new BucketListingParseException("Bucket entry has no Name or CreationDate");
        }
        return result.build();
    }

    private static Bucket toBucket(JsonNode entry)
    {
        String name = requiredText(entry, "Name");
        String creationDate = requiredText(entry, "CreationDate");
        Instant created;
        try {
            created = AwsTimestamp.fromIso8601Timestamp(creationDate);
        }
        catch (DateTimeException e) {
            throw new BucketListingParseException("Invalid CreationDate for bucket %s: %s".formatted(name, creationDate), e);
        }
        return new Bucket(name, created);
    }

    private static String requiredText(JsonNode entry, String field)
    {
        JsonNode value = entry.path(field);
        if (!value.isValueNode()) {
            throw new BucketListingParseException("Bucket entry is missing " + field);
        }
        return value.asText();
    }
}
