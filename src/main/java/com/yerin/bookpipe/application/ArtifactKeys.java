package com.yerin.bookpipe.application;

import java.util.regex.Pattern;

/**
 * Object-store layout of one job, relative to the configured path prefix.
 */
public final class ArtifactKeys {

    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9._-]");

    private ArtifactKeys() {}

    public static String inputKey(String jobId, String fileName) {
        return jobId + "/input/" + safeName(fileName);
    }

    public static String stageKey(String jobId, int stageIndex, String stageName) {
        return jobId + "/stages/" + stageIndex + "-" + stageName;
    }

    public static String outputKey(String jobId, String baseName) {
        return jobId + "/output/" + safeName(baseName) + ".md";
    }

    static String safeName(String name) {
        if (name == null || name.isBlank()) {
            return "source";
        }
        String base = name.replace('\\', '/');
        base = base.substring(base.lastIndexOf('/') + 1);
        String cleaned = UNSAFE.matcher(base).replaceAll("_");
        if (cleaned.isEmpty() || cleaned.chars().allMatch(c -> c == '.')) {
            return "source";
        }
        return cleaned;
    }
}
