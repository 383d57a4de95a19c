package com.github.challengeplatform.submissionengine.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.challengeplatform.submissionengine.domain.DatasetRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.net.URI;
import java.util.List;

/**
 * @author timo.buechert
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HttpGroundTruthFetcher implements GroundTruthFetcher {

    private final RestClient restClient;

    private final ObjectMapper objectMapper;

    @Override
    public List<DatasetRecord> fetch(final String referenceUrl) {
        if (referenceUrl == null || referenceUrl.isBlank()) {
            throw new StorageException("No ground truth URL configured");
        }

        final byte[] body;
        try {
            body = restClient.get().uri(URI.create(referenceUrl)).retrieve().body(byte[].class);
        } catch (final RestClientException | IllegalArgumentException e) {
            log.error("HTTP error downloading {}", referenceUrl, e);
            throw new StorageException("Could not download ground truth from " + referenceUrl + ": " + e.getMessage(), e);
        }

        if (body == null || body.length == 0) {
            throw new StorageException("Ground truth at " + referenceUrl + " is empty");
        }

        try {
            final JsonNode root = objectMapper.readTree(body);
            final List<DatasetRecord> records = DatasetJson.toRecords(root, DatasetRecord.LABEL_FIELD);
            log.info("Downloaded {} ground truth records from {}", records.size(), referenceUrl);
            return records;
        } catch (final IOException e) {
            log.error("JSON parsing error for {}", referenceUrl, e);
            throw new StorageException("Ground truth at " + referenceUrl + " is not valid JSON: " + e.getMessage(), e);
        }
    }

}
