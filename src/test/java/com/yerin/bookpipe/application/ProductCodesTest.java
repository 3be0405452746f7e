package com.yerin.bookpipe.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("상품 코드 추출 테스트")
class ProductCodesTest {

    @Test
    @DisplayName("파일명 앞의 6자리-2자리 코드를 추출")
    void extracts_leading_code() {
        assertThat(ProductCodes.fromFileName("100227-01_the_book.epub")).contains("100227-01");
        assertThat(ProductCodes.fromFileName("100227-01.md")).contains("100227-01");
    }

    @Test
    @DisplayName("코드가 앞에 없으면 비어 있음")
    void no_code() {
        assertThat(ProductCodes.fromFileName("book-100227-01.md")).isEmpty();
        assertThat(ProductCodes.fromFileName("10022-01.md")).isEmpty();
        assertThat(ProductCodes.fromFileName(null)).isEmpty();
    }

    @Test
    @DisplayName("명시 코드 형식 검사")
    void validates_explicit_code() {
        assertThat(ProductCodes.isValid("123456-78")).isTrue();
        assertThat(ProductCodes.isValid("123456-789")).isFalse();
        assertThat(ProductCodes.isValid(null)).isFalse();
    }
}
