package com.github.challengeplatform.submissionengine.storage;

import com.github.challengeplatform.submissionengine.domain.DatasetRecord;
import com.github.challengeplatform.submissionengine.domain.UploadContext;
import com.github.challengeplatform.submissionengine.domain.UploadResult;
import com.github.challengeplatform.submissionengine.util.TextUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * @author timo.buechert
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JsonSubmissionUploader implements SubmissionUploader {

    static final String SUBMISSIONS_PREFIX = "submissions/";

    private final SubmissionFileValidator validator;

    private final ObjectStorageService objectStorageService;

    @Override
    public UploadResult uploadAndValidate(final byte[] content, final String filename, final UploadContext context) {
        final List<DatasetRecord> records;
        try {
            records = validator.validate(content, filename);
        } catch (final SubmissionValidationException e) {
            log.warn("JSON validation failed for file {} of submission {}: {}", filename, context.submissionId(),
                    e.getMessage());
            return UploadResult.failure(e.getMessage());
        }

        final String objectKey = objectKeyFor(context);
        try {
            final String url = objectStorageService.store(objectKey, content, MediaType.APPLICATION_JSON_VALUE,
                    Map.of("original-filename", filename, "submission-id", context.submissionId()));
            log.info("File {} of submission {} stored at {}", filename, context.submissionId(), url);
            return UploadResult.success("File uploaded successfully", url, records);
        } catch (final StorageException e) {
            log.error("Upload failed for file {} of submission {}", filename, context.submissionId(), e);
            return UploadResult.failure("Upload failed: " + e.getMessage());
        }
    }

    static String objectKeyFor(final UploadContext context) {
        return SUBMISSIONS_PREFIX + TextUtil.sanitizeForStorageKey(context.challengeName()) + "/"
                + UUID.randomUUID() + ".json";
    }

}
