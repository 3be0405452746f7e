package com.yerin.bookpipe.application;

import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Default converter for text and Markdown uploads: strict UTF-8 decode, LF line endings,
 * trailing whitespace removed, runs of blank lines collapsed, empty fenced blocks dropped.
 * Images without alt text get a default label.
 */
@Component
public class TextNormalizingConverter implements BookConverter {

    private static final Pattern TRAILING_SPACE = Pattern.compile("[ \\t]+(?=\\n)");
    private static final Pattern BLANK_RUNS = Pattern.compile("\\n{3,}");
    private static final Pattern EMPTY_FENCE = Pattern.compile("```\\s+```");
    private static final Pattern EMPTY_IMAGE_ALT = Pattern.compile("!\\[\\]\\(([^)]+)\\)");
    private static final String DEFAULT_IMAGE_ALT = "图片";

    @Override
    public String convert(byte[] source, StageContext context) {
        String text = decodeUtf8(source, context.stageName());
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        text = text.replace("\r\n", "\n").replace('\r', '\n');
        text = TRAILING_SPACE.matcher(text).replaceAll("");
        text = EMPTY_IMAGE_ALT.matcher(text).replaceAll("![" + DEFAULT_IMAGE_ALT + "]($1)");
        text = EMPTY_FENCE.matcher(text).replaceAll("");
        text = BLANK_RUNS.matcher(text).replaceAll("\n\n");
        return text.strip() + "\n";
    }

    public static String decodeUtf8(byte[] source, String stage) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(source))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new StageFailedException(stage, "input is not valid UTF-8 text", e);
        }
    }
}
