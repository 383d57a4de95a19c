package com.github.challengeplatform.submissionengine.domain;

/**
 * One entry of a ground truth or prediction file: the item key (the file name) and its text.
 *
 * @author timo.buechert
 */
public record DatasetRecord(String key, String value) {

    public static final String KEY_FIELD = "filename";

    public static final String LABEL_FIELD = "label";

    public static final String PREDICTION_FIELD = "prediction";

}
