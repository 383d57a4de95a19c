package com.github.challengeplatform.submissionengine.storage;

import java.util.Map;

/**
 * @author timo.buechert
 */
public interface ObjectStorageService {

    /**
     * Stores the content under the given key.
     *
     * @return the URL the object can be fetched from
     * @throws StorageException if the object could not be written
     */
    String store(String objectKey, byte[] content, String contentType, Map<String, String> metadata);

}
