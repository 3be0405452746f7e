package com.yerin.bookpipe.application.stage;

import com.yerin.bookpipe.application.ArtifactKeys;
import com.yerin.bookpipe.application.PipelineEngine;
import com.yerin.bookpipe.application.StageContext;
import com.yerin.bookpipe.application.StageFailedException;
import com.yerin.bookpipe.application.StageRegistry;
import com.yerin.bookpipe.application.TextNormalizingConverter;
import com.yerin.bookpipe.config.BookpipeProperties;
import com.yerin.bookpipe.domain.BookpipeMetrics;
import com.yerin.bookpipe.domain.JobRecord;
import com.yerin.bookpipe.domain.JobStatus;
import com.yerin.bookpipe.service.Checksums;
import com.yerin.bookpipe.support.InMemoryJobStateStore;
import com.yerin.bookpipe.support.InMemoryObjectStore;
import com.yerin.bookpipe.support.MutableClock;
import com.yerin.bookpipe.support.TestFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("기본 스테이지 구성 테스트")
class BookStagesTest {

    InMemoryObjectStore objects = new InMemoryObjectStore();

    static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("ingest: 빈 입력과 체크섬 불일치는 실패, 정상이면 입력 키를 그대로 반환")
    void ingest_checks_input() {
        var ingest = new IngestStage(objects);
        objects.put("j1/input/a.md", utf8("hello"), "text/markdown");
        objects.put("j1/input/empty.md", new byte[0], "text/markdown");
        String sha = Checksums.sha256Hex(utf8("hello"));

        assertThat(ingest.execute("j1/input/a.md", ctx("ingest", 0, sha))).isEqualTo("j1/input/a.md");
        assertThatThrownBy(() -> ingest.execute("j1/input/a.md", ctx("ingest", 0, "deadbeef")))
                .isInstanceOf(StageFailedException.class)
                .hasMessageContaining("checksum mismatch");
        assertThatThrownBy(() -> ingest.execute("j1/input/empty.md", ctx("ingest", 0, null)))
                .isInstanceOf(StageFailedException.class)
                .hasMessageContaining("empty");
    }

    @Test
    @DisplayName("validate: 공백뿐인 결과는 실패")
    void validate_rejects_blank() {
        var validate = new ValidateStage(objects);
        objects.put("j1/stages/1-convert", utf8(" \n\n "), "text/markdown");

        assertThatThrownBy(() -> validate.execute("j1/stages/1-convert", ctx("validate", 2, null)))
                .isInstanceOf(StageFailedException.class)
                .hasMessageContaining("blank");
    }

    @Test
    @DisplayName("publish: productCode가 없으면 jobId 이름으로 최종 키에 복사")
    void publish_uses_job_id_without_product_code() {
        var publish = new PublishStage(objects);
        objects.put("j1/stages/3-package", utf8("doc"), "text/markdown");

        String out = publish.execute("j1/stages/3-package", ctx("publish", 4, null));

        assertThat(out).isEqualTo("j1/output/j1.md");
        assertThat(objects.get(out)).isEqualTo(utf8("doc"));
    }

    @Test
    @DisplayName("10KB 문서가 다섯 스테이지를 모두 거쳐 최종 Markdown으로 게시됨")
    void full_pipeline_over_ten_kilobytes() {
        var clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        var store = new InMemoryJobStateStore(clock);
        BookpipeProperties props = TestFixtures.properties("ingest", "convert", "validate", "package", "publish");
        var registry = new StageRegistry(List.of(
                new IngestStage(objects),
                new ConvertStage(objects, new TextNormalizingConverter()),
                new ValidateStage(objects),
                new PackageStage(objects),
                new PublishStage(objects)), props);
        var engine = new PipelineEngine(store, registry, new SimpleAsyncTaskExecutor("stage-test-"),
                new BookpipeMetrics(new SimpleMeterRegistry()), props, clock);

        StringBuilder sb = new StringBuilder("# Sample Book\r\n\r\n\r\n\r\n");
        while (sb.length() < 10 * 1024) {
            sb.append("Paragraph text with trailing spaces   \r\n\r\n");
        }
        byte[] input = utf8(sb.toString());
        String inputKey = ArtifactKeys.inputKey("job-10k", "100227-01_sample.md");
        objects.put(inputKey, input, "text/markdown");
        store.create(JobRecord.queued("job-10k", inputKey, "100227-01_sample.md", "100227-01", "text/markdown",
                input.length, "ingest", clock.instant()).withChecksum(Checksums.sha256Hex(input)));

        JobRecord running = TestFixtures.claim(store, clock, "job-10k", "w1", Duration.ofSeconds(10));
        assertThat(engine.run(running, "w1")).isEqualTo(PipelineEngine.Outcome.SUCCEEDED);

        JobRecord done = store.get("job-10k");
        assertThat(done.status()).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(done.outputRef()).isEqualTo("job-10k/output/100227-01.md");
        String markdown = new String(objects.get(done.outputRef()), StandardCharsets.UTF_8);
        assertThat(markdown)
                .startsWith("---\ntitle: \"Sample Book\"\nproduct_code: \"100227-01\"\n")
                .contains("checksum: \"sha256:" + done.checksum() + "\"")
                .contains("# Sample Book\n\nParagraph text with trailing spaces\n\n")
                .doesNotContain("\r")
                .doesNotContain("   \n")
                .doesNotContain("\n\n\n");
        assertThat(objects.keys()).contains(
                "job-10k/stages/1-convert",
                "job-10k/stages/3-package",
                "job-10k/output/100227-01.md");
    }

    private static StageContext ctx(String stage, int index, String checksum) {
        return new StageContext("j1", index, stage, "a.md", null, "text/markdown", checksum);
    }
}
