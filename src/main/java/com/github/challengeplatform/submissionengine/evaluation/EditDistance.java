package com.github.challengeplatform.submissionengine.evaluation;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Objects;

/**
 * Levenshtein distance with unit costs for substitution, deletion and insertion.
 *
 * @author timo.buechert
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class EditDistance {

    public static <T> int between(final List<T> reference, final List<T> hypothesis) {
        if (reference.isEmpty()) {
            return hypothesis.size();
        }
        if (hypothesis.isEmpty()) {
            return reference.size();
        }

        int[] previous = new int[hypothesis.size() + 1];
        int[] current = new int[hypothesis.size() + 1];
        for (int j = 0; j <= hypothesis.size(); j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= reference.size(); i++) {
            current[0] = i;
            final T referenceToken = reference.get(i - 1);
            for (int j = 1; j <= hypothesis.size(); j++) {
                final int substitutionCost = Objects.equals(referenceToken, hypothesis.get(j - 1)) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1),
                        previous[j - 1] + substitutionCost);
            }
            final int[] swap = previous;
            previous = current;
            current = swap;
        }

        return previous[hypothesis.size()];
    }

    /**
     * Distance divided by the reference length, capped at 1.0.
     */
    public static <T> double rate(final List<T> reference, final List<T> hypothesis) {
        if (reference.isEmpty()) {
            return hypothesis.isEmpty() ? 0.0 : 1.0;
        }
        return Math.min(1.0, (double) between(reference, hypothesis) / reference.size());
    }

}
