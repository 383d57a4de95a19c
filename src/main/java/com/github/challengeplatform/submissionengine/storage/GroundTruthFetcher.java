package com.github.challengeplatform.submissionengine.storage;

import com.github.challengeplatform.submissionengine.domain.DatasetRecord;

import java.util.List;

/**
 * @author timo.buechert
 */
public interface GroundTruthFetcher {

    /**
     * Downloads and parses the {@code {filename, label}} records of a challenge's reference dataset.
     *
     * @throws StorageException if the dataset cannot be downloaded or parsed
     */
    List<DatasetRecord> fetch(String referenceUrl);

}
