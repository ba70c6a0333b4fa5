package com.casesentinel.core.config;

import com.casesentinel.core.model.Severity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Settings for one keyword-scanning detector: which cases qualify, which words
 * to look for, which of those words escalate severity, and how many matching
 * cases a business unit needs before an alert is raised.
 *
 * <p>
 * Keywords are stored lowercase and de-duplicated, keeping configuration
 * order.
 * </p>
 *
 * @since 1.0.0
 */
public final class KeywordRules {

    private final List<String> keywords;
    private final Set<String> criticalKeywords;
    private final Set<Severity> qualifyingSeverities;
    private final int minCaseCount;

    /**
     * @throws ConfigurationException if a keyword is blank, no severity
     *                                qualifies, or {@code minCaseCount} &lt; 1
     */
    public KeywordRules(Collection<String> keywords,
            Collection<String> criticalKeywords,
            Collection<Severity> qualifyingSeverities,
            int minCaseCount) {
        Objects.requireNonNull(keywords, "keywords must not be null");
        Objects.requireNonNull(criticalKeywords, "criticalKeywords must not be null");
        Objects.requireNonNull(qualifyingSeverities, "qualifyingSeverities must not be null");

        this.keywords = Collections.unmodifiableList(new ArrayList<>(normalise(keywords)));
        this.criticalKeywords = Collections.unmodifiableSet(normalise(criticalKeywords));

        if (qualifyingSeverities.isEmpty()) {
            throw new ConfigurationException("At least one qualifying severity is required");
        }
        this.qualifyingSeverities = Collections.unmodifiableSet(EnumSet.copyOf(qualifyingSeverities));

        if (minCaseCount < 1) {
            throw new ConfigurationException("minCaseCount must be >= 1, got: " + minCaseCount);
        }
        this.minCaseCount = minCaseCount;
    }

    /**
     * @return lowercase keywords in configuration order
     */
    public List<String> getKeywords() {
        return keywords;
    }

    /**
     * @return lowercase keywords that escalate severity on their own
     */
    public Set<String> getCriticalKeywords() {
        return criticalKeywords;
    }

    public Set<Severity> getQualifyingSeverities() {
        return qualifyingSeverities;
    }

    public int getMinCaseCount() {
        return minCaseCount;
    }

    /**
     * @return {@code true} if any of {@code matched} is a critical keyword
     */
    public boolean containsCritical(Collection<String> matched) {
        for (String keyword : matched) {
            if (criticalKeywords.contains(keyword.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> normalise(Collection<String> words) {
        Set<String> result = new LinkedHashSet<>();
        for (String word : words) {
            if (word == null || word.isBlank()) {
                throw new ConfigurationException("Keywords must not be null or blank");
            }
            result.add(word.trim().toLowerCase(Locale.ROOT));
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof KeywordRules that))
            return false;
        return minCaseCount == that.minCaseCount
                && keywords.equals(that.keywords)
                && criticalKeywords.equals(that.criticalKeywords)
                && qualifyingSeverities.equals(that.qualifyingSeverities);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keywords, criticalKeywords, qualifyingSeverities, minCaseCount);
    }

    @Override
    public String toString() {
        return "KeywordRules{" +
                "keywords=" + keywords.size() +
                ", criticalKeywords=" + criticalKeywords +
                ", qualifyingSeverities=" + qualifyingSeverities +
                ", minCaseCount=" + minCaseCount +
                '}';
    }
}
