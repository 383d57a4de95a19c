package com.github.challengeplatform.submissionengine.domain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressStatusTest {

    @Test
    void toSubmissionStatus_intermediateStatesAreProcessing() {
        assertThat(ProgressStatus.PENDING.toSubmissionStatus()).isEqualTo(SubmissionStatus.PENDING);
        assertThat(ProgressStatus.UPLOADING.toSubmissionStatus()).isEqualTo(SubmissionStatus.PROCESSING);
        assertThat(ProgressStatus.VALIDATING.toSubmissionStatus()).isEqualTo(SubmissionStatus.PROCESSING);
        assertThat(ProgressStatus.EVALUATING.toSubmissionStatus()).isEqualTo(SubmissionStatus.PROCESSING);
        assertThat(ProgressStatus.COMPLETED.toSubmissionStatus()).isEqualTo(SubmissionStatus.COMPLETED);
        assertThat(ProgressStatus.FAILED.toSubmissionStatus()).isEqualTo(SubmissionStatus.FAILED);
    }

    @Test
    void isFinal() {
        assertThat(ProgressStatus.COMPLETED.isFinal()).isTrue();
        assertThat(ProgressStatus.FAILED.isFinal()).isTrue();
        assertThat(ProgressStatus.EVALUATING.isFinal()).isFalse();
    }

    @Test
    void submissionStatus_finalStatesAndWireValues() {
        assertThat(SubmissionStatus.COMPLETED.isFinal()).isTrue();
        assertThat(SubmissionStatus.FAILED.isFinal()).isTrue();
        assertThat(SubmissionStatus.PENDING.isFinal()).isFalse();
        assertThat(SubmissionStatus.PROCESSING.isFinal()).isFalse();
        assertThat(SubmissionStatus.PROCESSING.value()).isEqualTo("processing");
    }

    @Test
    void json_writtenAsLowerCaseName() throws JsonProcessingException {
        // given
        final ObjectMapper objectMapper = new ObjectMapper();

        // when
        final String json = objectMapper.writeValueAsString(ProgressStatus.UPLOADING);

        // then
        assertThat(json).isEqualTo("\"uploading\"");
        assertThat(ProgressStatus.FAILED.value()).isEqualTo("failed");
    }

    @Test
    void submissionTask_copiesFileContent() {
        // given
        final byte[] content = {1, 2, 3};
        final SubmissionTask task = new SubmissionTask("s1", content, "f.json", "u", "m", "c", "url");

        // when
        content[0] = 9;

        // then
        assertThat(task.fileContent()).containsExactly(1, 2, 3);
        assertThat(task.priority()).isEqualTo(SubmissionTask.DEFAULT_PRIORITY);
    }

}
