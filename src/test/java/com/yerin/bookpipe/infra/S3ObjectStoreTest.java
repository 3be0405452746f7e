package com.yerin.bookpipe.infra;

import com.yerin.bookpipe.config.BookpipeProperties;
import com.yerin.bookpipe.global.exception.ArtifactNotFoundException;
import com.yerin.bookpipe.support.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("S3 호환 오브젝트 스토어 어댑터 테스트")
class S3ObjectStoreTest {

    S3Client s3 = mock(S3Client.class);

    S3ObjectStore store(String prefix) {
        BookpipeProperties props = TestFixtures.properties("ingest");
        props.getStorage().setBucket(" books-bucket ");
        props.getStorage().setPathPrefix(prefix);
        props.getClient().setBaseBackoff(java.time.Duration.ofMillis(1));
        props.getClient().setBackoffCap(java.time.Duration.ofMillis(2));
        return new S3ObjectStore(s3, props);
    }

    @Test
    @DisplayName("키는 정규화된 경로 접두사 아래에 놓임")
    void keys_are_prefixed() {
        assertThat(store("/tenant/books/").resolve("/j1/input/a.md")).isEqualTo("tenant/books/j1/input/a.md");
        assertThat(store("  ").resolve("j1/output/a.md")).isEqualTo("books/j1/output/a.md");
    }

    @Test
    @DisplayName("put은 버킷과 접두사가 붙은 키로 업로드")
    void put_uses_bucket_and_prefix() {
        store("books").put("j1/input/a.md", new byte[]{1, 2, 3}, "text/markdown");

        ArgumentCaptor<PutObjectRequest> captor = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3).putObject(captor.capture(), any(RequestBody.class));
        assertThat(captor.getValue().bucket()).isEqualTo("books-bucket");
        assertThat(captor.getValue().key()).isEqualTo("books/j1/input/a.md");
        assertThat(captor.getValue().contentLength()).isEqualTo(3L);
    }

    @Test
    @DisplayName("없는 키 조회는 ArtifactNotFound로 변환")
    void missing_key_is_not_found() {
        when(s3.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenThrow(NoSuchKeyException.builder().statusCode(404).message("no such key").build());

        assertThatThrownBy(() -> store("books").get("j1/output/x.md"))
                .isInstanceOf(ArtifactNotFoundException.class);
    }

    @Test
    @DisplayName("5xx, 429, 클라이언트 I/O 오류만 일시적 오류로 분류")
    void transient_classification() {
        assertThat(S3ObjectStore.isTransient(S3Exception.builder().statusCode(503).build())).isTrue();
        assertThat(S3ObjectStore.isTransient(S3Exception.builder().statusCode(429).build())).isTrue();
        assertThat(S3ObjectStore.isTransient(SdkClientException.create("timeout"))).isTrue();
        assertThat(S3ObjectStore.isTransient(S3Exception.builder().statusCode(403).build())).isFalse();
        assertThat(S3ObjectStore.isTransient(new IllegalStateException())).isFalse();
    }

    @Test
    @DisplayName("ping은 headBucket 실패 시 false")
    void ping_reports_failure() {
        when(s3.headBucket(any(HeadBucketRequest.class))).thenThrow(SdkClientException.create("refused"));

        assertThat(store("books").ping()).isFalse();
    }
}
