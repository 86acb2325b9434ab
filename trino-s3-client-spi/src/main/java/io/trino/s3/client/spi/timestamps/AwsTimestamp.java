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
package io.trino.s3.client.spi.timestamps;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

public final class AwsTimestamp
{
    public static final ZoneId ZONE = ZoneId.of("Z");
    // RFC 1123 with a fixed two digit day, as required for the HTTP Date header
    private static final DateTimeFormatter HTTP_DATE_FORMAT = DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US).withZone(ZONE);

    public static String toHttpDateFormat(Instant instant)
    {
        return HTTP_DATE_FORMAT.format(instant);
    }

    /**
     * Parses timestamps as returned in S3 listings, e.g. {@code 2006-02-03T16:45:09.000Z}
     */
    public static Instant fromIso8601Timestamp(String timestamp)
    {
        return OffsetDateTime.parse(timestamp.trim()).toInstant();
    }

    private AwsTimestamp() {}
}
