package com.github.challengeplatform.submissionengine.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.challengeplatform.submissionengine.domain.DatasetRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Checks that an uploaded prediction file is a JSON document of {@code {filename, prediction}} records.
 *
 * @author timo.buechert
 */
@Component
@Slf4j
public class SubmissionFileValidator {

    static final List<String> REQUIRED_COLUMNS = List.of(DatasetRecord.KEY_FIELD, DatasetRecord.PREDICTION_FIELD);

    private final ObjectMapper objectMapper;

    private final DataSize maxFileSize;

    public SubmissionFileValidator(final ObjectMapper objectMapper,
                                   @Value("${submission.upload.max-size:50MB}") final DataSize maxFileSize) {
        this.objectMapper = objectMapper;
        this.maxFileSize = maxFileSize;
    }

    public List<DatasetRecord> validate(final byte[] content, final String filename)
            throws SubmissionValidationException {
        if (filename == null || !filename.toLowerCase(Locale.ROOT).endsWith(".json")) {
            throw new SubmissionValidationException("Only JSON files are allowed");
        }
        if (content.length == 0) {
            throw new SubmissionValidationException("File is empty");
        }
        if (content.length > maxFileSize.toBytes()) {
            throw new SubmissionValidationException("File size exceeds " + maxFileSize.toMegabytes() + "MB limit");
        }

        final JsonNode root = parse(decode(content));
        validateStructure(root);
        return DatasetJson.toRecords(root, DatasetRecord.PREDICTION_FIELD);
    }

    private static String decode(final byte[] content) throws SubmissionValidationException {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
        } catch (final CharacterCodingException e) {
            throw new SubmissionValidationException("File encoding error: " + e.getMessage());
        }
    }

    private JsonNode parse(final String json) throws SubmissionValidationException {
        try {
            return objectMapper.readTree(json);
        } catch (final JsonProcessingException e) {
            throw new SubmissionValidationException("Invalid JSON format: " + e.getOriginalMessage());
        }
    }

    private static void validateStructure(final JsonNode root) throws SubmissionValidationException {
        if (root == null || !(root.isArray() || root.isObject())) {
            throw new SubmissionValidationException("JSON must be either an object or a list of objects");
        }
        if (root.isArray() && root.isEmpty()) {
            throw new SubmissionValidationException("JSON file is empty");
        }

        final List<JsonNode> records = DatasetJson.asRecordList(root);
        if (!records.get(0).isObject()) {
            throw new SubmissionValidationException("JSON must be either an object or a list of objects");
        }

        final List<String> missingColumns = new ArrayList<>();
        for (final String column : REQUIRED_COLUMNS) {
            if (!records.get(0).has(column)) {
                missingColumns.add(column);
            }
        }
        if (!missingColumns.isEmpty()) {
            throw new SubmissionValidationException("Missing required columns: " + String.join(", ", missingColumns));
        }

        for (int i = 1; i < records.size(); i++) {
            final JsonNode record = records.get(i);
            if (!record.isObject()) {
                throw new SubmissionValidationException("Record " + (i + 1) + " is not an object");
            }
            for (final String column : REQUIRED_COLUMNS) {
                if (!record.has(column)) {
                    throw new SubmissionValidationException("Record " + (i + 1) + " is missing required column: " + column);
                }
            }
        }
    }

}
