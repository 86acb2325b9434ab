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

import com.google.common.collect.ImmutableMap;
import com.google.common.net.MediaType;

import java.net.FileNameMap;
import java.net.URLConnection;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Best effort content type guessing from an object name's extension.
 * <p>
 * Only the last extension is considered and no content encoding is derived, so
 * {@code archive.tar.gz} is {@code application/x-gzip} rather than a tar archive
 * with gzip encoding.
 */
public final class ContentTypes
{
    private static final Map<String, MediaType> EXTENSIONS = ImmutableMap.<String, MediaType>builder()
            .put("bmp", MediaType.BMP)
            .put("css", MediaType.CSS_UTF_8)
            .put("csv", MediaType.CSV_UTF_8)
            .put("gif", MediaType.GIF)
            .put("gz", MediaType.GZIP)
            .put("htm", MediaType.HTML_UTF_8)
            .put("html", MediaType.HTML_UTF_8)
            .put("ico", MediaType.ICO)
            .put("jpeg", MediaType.JPEG)
            .put("jpg", MediaType.JPEG)
            .put("js", MediaType.JAVASCRIPT_UTF_8)
            .put("json", MediaType.JSON_UTF_8)
            .put("mp4", MediaType.MP4_VIDEO)
            .put("pdf", MediaType.PDF)
            .put("png", MediaType.PNG)
            .put("svg", MediaType.SVG_UTF_8)
            .put("tar", MediaType.TAR)
            .put("txt", MediaType.PLAIN_TEXT_UTF_8)
            .put("webp", MediaType.WEBP)
            .put("xml", MediaType.XML_UTF_8)
            .put("zip", MediaType.ZIP)
            .buildOrThrow();

    private static final FileNameMap FILE_NAME_MAP = URLConnection.getFileNameMap();

    private ContentTypes() {}

    public static Optional<String> guess(String objectName)
    {
        return extension(objectName).flatMap(extension -> Optional.ofNullable(EXTENSIONS.get(extension))
                .map(mediaType -> mediaType.withoutParameters().toString())
                .or(() -> Optional.ofNullable(FILE_NAME_MAP.getContentTypeFor(objectName))));
    }

    private static Optional<String> extension(String objectName)
    {
        String fileName = objectName.substring(objectName.lastIndexOf('/') + 1);
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
