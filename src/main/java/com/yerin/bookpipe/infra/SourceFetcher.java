package com.yerin.bookpipe.infra;

import com.yerin.bookpipe.config.BookpipeProperties;
import com.yerin.bookpipe.global.exception.AppException;
import com.yerin.bookpipe.global.exception.code.BookErrorCode;
import com.yerin.bookpipe.global.exception.code.CommonErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;

/**
 * Downloads a book source from an http(s) URL, refusing anything larger than the upload limit.
 */
@Slf4j
@Component
public class SourceFetcher {

    public record FetchedSource(byte[] content, String fileName, String contentType) {}

    private final RestClient restClient;
    private final BookpipeProperties properties;

    public SourceFetcher(@Qualifier("sourceRestClient") RestClient restClient, BookpipeProperties properties) {
        this.restClient = restClient;
        this.properties = properties;
    }

    public FetchedSource fetch(String sourceUrl) {
        URI uri = parse(sourceUrl);
        long maxBytes = properties.getGateway().getMaxInputSize().toBytes();

        try {
            FetchedSource source = restClient.get().uri(uri).exchange((request, response) -> {
                if (!response.getStatusCode().is2xxSuccessful()) {
                    throw new AppException(BookErrorCode.SOURCE_FETCH_FAILED
                            .withDetail("원본 URL 응답이 실패했습니다. status=" + response.getStatusCode().value()));
                }
                long declared = response.getHeaders().getContentLength();
                if (declared > maxBytes) {
                    throw tooLarge(maxBytes);
                }
                byte[] content;
                try (InputStream body = response.getBody()) {
                    content = body.readNBytes((int) Math.min(maxBytes + 1, Integer.MAX_VALUE - 8));
                }
                if (content.length > maxBytes) {
                    throw tooLarge(maxBytes);
                }
                MediaType type = response.getHeaders().getContentType();
                return new FetchedSource(content, fileNameOf(uri), type == null ? null : type.toString());
            });
            log.info("[SourceFetcher] fetched url={}, bytes={}", uri, source.content().length);
            return source;
        } catch (RestClientException e) {
            log.warn("[SourceFetcher] fetch failed url={}, err={}", uri, e.toString());
            throw new AppException(BookErrorCode.SOURCE_FETCH_FAILED
                    .withDetail("원본 URL에 접근할 수 없습니다: " + e.getMessage()), e);
        }
    }

    static URI parse(String sourceUrl) {
        try {
            URI uri = new URI(sourceUrl.trim());
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                    || uri.getHost() == null) {
                throw invalidUrl();
            }
            return uri;
        } catch (URISyntaxException e) {
            throw invalidUrl();
        }
    }

    /** Last path segment, or {@code null} when the URL has none. */
    static String fileNameOf(URI uri) {
        String path = uri.getPath();
        if (path == null || path.isEmpty() || path.endsWith("/")) {
            return null;
        }
        return path.substring(path.lastIndexOf('/') + 1);
    }

    private static AppException invalidUrl() {
        return new AppException(CommonErrorCode.INVALID_PARAMETER
                .withDetail("sourceUrl 은 http(s) URL 이어야 합니다."));
    }

    private static AppException tooLarge(long maxBytes) {
        return new AppException(BookErrorCode.INPUT_TOO_LARGE
                .withDetail("업로드 가능한 최대 크기를 초과했습니다. max=" + maxBytes + " bytes"));
    }
}
