package com.github.challengeplatform.submissionengine.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.challengeplatform.submissionengine.domain.DatasetRecord;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@code [{"filename": ..., "<valueField>": ...}]} documents. A single object is treated as a list of one.
 *
 * @author timo.buechert
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
class DatasetJson {

    static List<JsonNode> asRecordList(final JsonNode root) {
        final List<JsonNode> nodes = new ArrayList<>();
        if (root.isArray()) {
            root.forEach(nodes::add);
        } else {
            nodes.add(root);
        }
        return nodes;
    }

    static List<DatasetRecord> toRecords(final JsonNode root, final String valueField) {
        return asRecordList(root).stream()
                .map(node -> new DatasetRecord(textOrNull(node, DatasetRecord.KEY_FIELD), textOrNull(node, valueField)))
                .toList();
    }

    private static String textOrNull(final JsonNode node, final String field) {
        final JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }

}
