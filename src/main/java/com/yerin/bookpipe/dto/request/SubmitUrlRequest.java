package com.yerin.bookpipe.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

public record SubmitUrlRequest(
        @NotBlank(message = "sourceUrl 은 필수입니다.")
        @Schema(example = "https://example.com/books/100227-01.md")
        String sourceUrl,
        @Schema(description = "상품 코드 (생략 시 파일명에서 추출)", example = "100227-01")
        String productCode,
        @Schema(description = "저장할 파일명 (생략 시 URL 경로에서 추출)")
        String fileName
) {
}
