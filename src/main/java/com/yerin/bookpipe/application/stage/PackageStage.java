package com.yerin.bookpipe.application.stage;

import com.yerin.bookpipe.application.PipelineStage;
import com.yerin.bookpipe.application.StageContext;
import com.yerin.bookpipe.domain.ObjectStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Prefixes the Markdown body with a front-matter block describing the book.
 */
@Component
@RequiredArgsConstructor
public class PackageStage implements PipelineStage {

    private static final Pattern HEADING_MARK = Pattern.compile("^#+\\s*");
    private static final Pattern INLINE_MARK = Pattern.compile("[`*_]");

    private final ObjectStore objectStore;

    @Override
    public String name() {
        return "package";
    }

    @Override
    public String execute(String inputRef, StageContext context) {
        String body = new String(objectStore.get(inputRef), StandardCharsets.UTF_8);

        StringBuilder doc = new StringBuilder();
        doc.append("---\n");
        doc.append("title: ").append(quote(title(body, context.fileName()))).append('\n');
        if (context.productCode() != null) {
            doc.append("product_code: ").append(quote(context.productCode())).append('\n');
        }
        if (context.fileName() != null) {
            doc.append("source: ").append(quote(context.fileName())).append('\n');
        }
        if (context.checksum() != null) {
            doc.append("checksum: ").append(quote("sha256:" + context.checksum())).append('\n');
        }
        doc.append("job_id: ").append(quote(context.jobId())).append('\n');
        doc.append("---\n\n");
        doc.append(body);

        String key = context.stageKey();
        objectStore.put(key, doc.toString().getBytes(StandardCharsets.UTF_8), "text/markdown; charset=utf-8");
        return key;
    }

    /** First line without Markdown markers; falls back to the file name. */
    static String title(String body, String fileName) {
        String firstLine = body.lines().map(String::strip).filter(l -> !l.isEmpty()).findFirst().orElse("");
        String plain = INLINE_MARK.matcher(HEADING_MARK.matcher(firstLine).replaceFirst("")).replaceAll("").strip();
        if (!plain.isEmpty()) {
            return plain;
        }
        if (fileName == null || fileName.isBlank()) {
            return "untitled";
        }
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
