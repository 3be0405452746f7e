package com.yerin.bookpipe.application;

import com.yerin.bookpipe.domain.JobRecord;

public record StageContext(
        String jobId,
        int stageIndex,
        String stageName,
        String fileName,
        String productCode,
        String contentType,
        String checksum
) {
    public static StageContext of(JobRecord job, int stageIndex, String stageName) {
        return new StageContext(job.id(), stageIndex, stageName, job.fileName(), job.productCode(),
                job.contentType(), job.checksum());
    }

    /** Key for the artifact this stage writes. */
    public String stageKey() {
        return ArtifactKeys.stageKey(jobId, stageIndex, stageName);
    }
}
