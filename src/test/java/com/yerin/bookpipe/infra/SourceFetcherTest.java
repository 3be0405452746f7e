package com.yerin.bookpipe.infra;

import com.yerin.bookpipe.config.BookpipeProperties;
import com.yerin.bookpipe.global.exception.AppException;
import com.yerin.bookpipe.global.exception.code.BookErrorCode;
import com.yerin.bookpipe.global.exception.code.CommonErrorCode;
import com.yerin.bookpipe.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.util.unit.DataSize;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("URL 원본 다운로드 테스트")
class SourceFetcherTest {

    BookpipeProperties props = TestFixtures.properties("ingest");
    MockRestServiceServer server;
    SourceFetcher sut;

    @BeforeEach
    void setUp() {
        props.getGateway().setMaxInputSize(DataSize.ofBytes(16));
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        sut = new SourceFetcher(builder.build(), props);
    }

    static String codeOf(Throwable t) {
        assertThat(t).isInstanceOf(AppException.class);
        return ((AppException) t).getErrorCode().getCode();
    }

    @Test
    @DisplayName("내려받은 내용, URL 경로의 파일명, Content-Type을 반환")
    void fetches_body_name_and_type() {
        server.expect(requestTo("https://books.example.com/shelf/100227-01.md"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("# Hi", MediaType.TEXT_MARKDOWN));

        SourceFetcher.FetchedSource source = sut.fetch("https://books.example.com/shelf/100227-01.md");

        assertThat(new String(source.content(), StandardCharsets.UTF_8)).isEqualTo("# Hi");
        assertThat(source.fileName()).isEqualTo("100227-01.md");
        assertThat(source.contentType()).startsWith("text/markdown");
        server.verify();
    }

    @Test
    @DisplayName("최대 크기를 넘는 응답은 INPUT_TOO_LARGE")
    void oversized_body_is_rejected() {
        server.expect(requestTo("https://books.example.com/big.txt"))
                .andRespond(withSuccess("0123456789abcdefXYZ", MediaType.TEXT_PLAIN));

        Throwable t = catchThrowable(() -> sut.fetch("https://books.example.com/big.txt"));

        assertThat(codeOf(t)).isEqualTo(BookErrorCode.INPUT_TOO_LARGE.getCode());
    }

    @Test
    @DisplayName("원본 서버가 실패 응답이면 SOURCE_FETCH_FAILED")
    void upstream_error_status_is_reported() {
        server.expect(requestTo("https://books.example.com/missing.md"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        Throwable t = catchThrowable(() -> sut.fetch("https://books.example.com/missing.md"));

        assertThat(codeOf(t)).isEqualTo(BookErrorCode.SOURCE_FETCH_FAILED.getCode());
        assertThat(t.getMessage()).contains("404");
    }

    @Test
    @DisplayName("http(s)가 아닌 URL은 요청 없이 INVALID_PARAMETER")
    void non_http_urls_are_rejected() {
        assertThat(codeOf(catchThrowable(() -> sut.fetch("file:///etc/passwd"))))
                .isEqualTo(CommonErrorCode.INVALID_PARAMETER.getCode());
        assertThat(codeOf(catchThrowable(() -> sut.fetch("not a url"))))
                .isEqualTo(CommonErrorCode.INVALID_PARAMETER.getCode());
        server.verify();
    }

    @Test
    @DisplayName("경로가 없거나 /로 끝나면 파일명은 null")
    void file_name_from_path() {
        assertThat(SourceFetcher.fileNameOf(URI.create("https://h/a/b.epub"))).isEqualTo("b.epub");
        assertThat(SourceFetcher.fileNameOf(URI.create("https://h/a/"))).isNull();
        assertThat(SourceFetcher.fileNameOf(URI.create("https://h"))).isNull();
    }
}
