package com.yerin.bookpipe.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("아티팩트 키 규칙 테스트")
class ArtifactKeysTest {

    @Test
    @DisplayName("입력/스테이지/출력 키 레이아웃")
    void layout() {
        assertThat(ArtifactKeys.inputKey("j1", "100227-01.md")).isEqualTo("j1/input/100227-01.md");
        assertThat(ArtifactKeys.stageKey("j1", 1, "convert")).isEqualTo("j1/stages/1-convert");
        assertThat(ArtifactKeys.outputKey("j1", "100227-01")).isEqualTo("j1/output/100227-01.md");
    }

    @Test
    @DisplayName("업로드 파일명의 경로와 특수문자는 키에 섞이지 않음")
    void sanitizes_file_names() {
        assertThat(ArtifactKeys.inputKey("j1", "../../etc/passwd")).isEqualTo("j1/input/passwd");
        assertThat(ArtifactKeys.inputKey("j1", "C:\\books\\내 책 1.md")).isEqualTo("j1/input/____1.md");
        assertThat(ArtifactKeys.inputKey("j1", "..")).isEqualTo("j1/input/source");
        assertThat(ArtifactKeys.inputKey("j1", null)).isEqualTo("j1/input/source");
    }
}
