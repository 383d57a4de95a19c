package com.github.challengeplatform.submissionengine.domain;

import java.util.Map;

/**
 * @author timo.buechert
 */
public record CacheStats(int totalEntries, Map<String, Integer> byStatus, int activeSubmissions) {
}
