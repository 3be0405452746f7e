package com.yerin.bookpipe.controller;

import com.yerin.bookpipe.dto.request.SubmitUrlRequest;
import com.yerin.bookpipe.dto.response.JobResultResponse;
import com.yerin.bookpipe.dto.response.JobStatusResponse;
import com.yerin.bookpipe.dto.response.SubmitResponse;
import com.yerin.bookpipe.global.dto.DataResponse;
import com.yerin.bookpipe.global.exception.AppException;
import com.yerin.bookpipe.global.exception.code.BookErrorCode;
import com.yerin.bookpipe.global.exception.code.CommonErrorCode;
import com.yerin.bookpipe.service.BookJobService;
import io.swagger.v3.oas.annotations.Parameter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

@RestController
@RequestMapping("/books")
@RequiredArgsConstructor
public class BookJobController {

    private static final MediaType TEXT_MARKDOWN = MediaType.parseMediaType("text/markdown;charset=UTF-8");

    private final BookJobService bookJobService;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<DataResponse<SubmitResponse>> submit(
            @RequestPart("file") MultipartFile file,
            @RequestParam(value = "productCode", required = false)
            @Parameter(description = "상품 코드 (생략 시 파일명에서 추출)", example = "100227-01")
            String productCode
    ) {
        if (file.isEmpty()) {
            throw new AppException(BookErrorCode.EMPTY_INPUT);
        }
        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            throw new AppException(CommonErrorCode.BAD_REQUEST.withDetail("업로드 파일을 읽을 수 없습니다."), e);
        }

        String jobId = bookJobService.submit(content, file.getOriginalFilename(), productCode, file.getContentType());
        return ResponseEntity.status(HttpStatus.CREATED).body(DataResponse.from(new SubmitResponse(jobId)));
    }

    @PostMapping(value = "/url", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<DataResponse<SubmitResponse>> submitFromUrl(@Valid @RequestBody SubmitUrlRequest request) {
        String jobId = bookJobService.submitFromUrl(request.sourceUrl(), request.fileName(), request.productCode());
        return ResponseEntity.status(HttpStatus.CREATED).body(DataResponse.from(new SubmitResponse(jobId)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<DataResponse<JobStatusResponse>> get(@PathVariable String id) {
        return ResponseEntity.ok(DataResponse.from(JobStatusResponse.from(bookJobService.getStatus(id))));
    }

    @GetMapping("/{id}/result")
    public ResponseEntity<DataResponse<JobResultResponse>> result(@PathVariable String id) {
        return ResponseEntity.ok(DataResponse.from(bookJobService.getResult(id)));
    }

    @GetMapping("/{id}/result/content")
    public ResponseEntity<byte[]> resultContent(@PathVariable String id) {
        byte[] content = bookJobService.readResultContent(id);
        return ResponseEntity.ok().contentType(TEXT_MARKDOWN).body(content);
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<DataResponse<JobStatusResponse>> cancel(@PathVariable String id) {
        return ResponseEntity.ok(DataResponse.from(JobStatusResponse.from(bookJobService.cancel(id))));
    }
}
