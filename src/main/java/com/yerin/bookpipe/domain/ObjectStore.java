package com.yerin.bookpipe.domain;

/**
 * Byte blobs in durable storage. Keys are relative to the configured path prefix.
 */
public interface ObjectStore {

    void put(String key, byte[] content, String contentType);

    /** @throws com.yerin.bookpipe.global.exception.ArtifactNotFoundException if absent */
    byte[] get(String key);

    /** @throws com.yerin.bookpipe.global.exception.ArtifactNotFoundException if absent */
    long size(String key);

    void delete(String key);

    void copy(String sourceKey, String targetKey);

    boolean ping();
}
