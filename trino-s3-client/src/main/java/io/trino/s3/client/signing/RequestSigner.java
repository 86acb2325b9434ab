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

import io.airlift.log.Logger;
import io.trino.s3.client.spi.credentials.Credential;
import io.trino.s3.client.spi.credentials.SigningAlgorithm;

import java.util.Map;

import static com.google.common.base.Strings.nullToEmpty;
import static java.util.Objects.requireNonNull;

/**
 * Header based request signing for the S3 REST API, with the string to sign:
 * <pre>
 * HTTP-Verb + "\n" +
 * Content-MD5 + "\n" +
 * Content-Type + "\n" +
 * Date + "\n" +
 * CanonicalizedAmzHeaders +
 * CanonicalizedResource
 * </pre>
 */
public final class RequestSigner
{
    private static final Logger log = Logger.get(RequestSigner.class);

    public static final SigningAlgorithm SIGNING_ALGORITHM = SigningAlgorithm.HMAC_SHA1;

    public static final String CONTENT_LENGTH = "Content-Length";
    public static final String CONTENT_MD5 = "Content-MD5";
    public static final String CONTENT_TYPE = "Content-Type";
    public static final String DATE = "Date";
    public static final String AUTHORIZATION = "Authorization";

    private RequestSigner() {}

    public static String stringToSign(String httpMethod, Map<String, String> headers, String path)
    {
        requireNonNull(httpMethod, "httpMethod is null");
        requireNonNull(headers, "headers is null");
        requireNonNull(path, "path is null");
        return httpMethod + "\n" +
                nullToEmpty(headers.get(CONTENT_MD5)) + "\n" +
                nullToEmpty(headers.get(CONTENT_TYPE)) + "\n" +
                nullToEmpty(headers.get(DATE)) + "\n" +
                AmzHeaders.build(headers).canonicalize() +
                path;
    }

    public static RequestAuthorization sign(Credential credential, String httpMethod, Map<String, String> headers, String path)
    {
        requireNonNull(credential, "credential is null");
        String stringToSign = stringToSign(httpMethod, headers, path);
        RequestAuthorization authorization = new RequestAuthorization(credential.accessKey(), credential.sign(stringToSign, SIGNING_ALGORITHM));
        log.debug("Signed request. AccessKey: %s, Method: %s, Path: %s", credential.accessKey(), httpMethod, path);
        return authorization;
    }
}
