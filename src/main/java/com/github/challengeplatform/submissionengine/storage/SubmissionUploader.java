package com.github.challengeplatform.submissionengine.storage;

import com.github.challengeplatform.submissionengine.domain.UploadContext;
import com.github.challengeplatform.submissionengine.domain.UploadResult;

/**
 * Validates a submission file and stores it durably.
 *
 * @author timo.buechert
 */
public interface SubmissionUploader {

    /**
     * Never throws for invalid input; rejections are reported through {@link UploadResult#ok()}.
     */
    UploadResult uploadAndValidate(byte[] content, String filename, UploadContext context);

}
