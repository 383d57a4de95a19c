package com.github.challengeplatform.submissionengine.evaluation;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Unicode NFC composition with whitespace runs collapsed to a single space.
 *
 * @author timo.buechert
 */
@Component
public class UnicodeTextNormalizer implements TextNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    @Override
    public String normalize(final String text) {
        final String composed = Normalizer.normalize(text, Normalizer.Form.NFC);
        return WHITESPACE.matcher(composed).replaceAll(" ").trim();
    }

}
