package com.yerin.bookpipe.application;

/**
 * Turns the submitted document into Markdown text. Format-specific converters plug in here.
 */
public interface BookConverter {
    String convert(byte[] source, StageContext context);
}
