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
package io.trino.s3.client.transport;

import io.trino.s3.client.S3ClientException;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * The service answered with a non-success status. Error details are present when the
 * response carried an S3 error document.
 */
public class S3ResponseException
        extends S3ClientException
{
    private final int statusCode;
    private final Optional<String> errorCode;
    private final Optional<String> errorMessage;
    private final Optional<String> requestId;

    public S3ResponseException(int statusCode, Optional<String> errorCode, Optional<String> errorMessage, Optional<String> requestId)
    {
        super(buildMessage(statusCode, errorCode, errorMessage));
        this.statusCode = statusCode;
        this.errorCode = requireNonNull(errorCode, "errorCode is null");
        this.errorMessage = requireNonNull(errorMessage, "errorMessage is null");
        this.requestId = requireNonNull(requestId, "requestId is null");
    }

    public int getStatusCode()
    {
        return statusCode;
    }

    public Optional<String> getErrorCode()
    {
        return errorCode;
    }

    public Optional<String> getErrorMessage()
    {
        return errorMessage;
    }

    public Optional<String> getRequestId()
    {
        return requestId;
    }

    private static String buildMessage(int statusCode, Optional<String> errorCode, Optional<String> errorMessage)
    {
        StringBuilder message = new StringBuilder("S3 request failed with status ").append(statusCode);
        errorCode.ifPresent(code -> message.append(": ").append(code));
        errorMessage.ifPresent(text -> message.append(" (").append(text).append(")"));
        return message.toString();
    }
}
