package com.casesentinel.core.detection;

import com.casesentinel.core.model.CaseRecord;

import java.util.List;
import java.util.Objects;

/**
 * A case together with the keywords found in its summary.
 *
 * @since 1.0.0
 */
public final class KeywordMatch {

    private final CaseRecord caseRecord;
    private final List<String> matchedKeywords;

    public KeywordMatch(CaseRecord caseRecord, List<String> matchedKeywords) {
        this.caseRecord = Objects.requireNonNull(caseRecord, "caseRecord must not be null");
        this.matchedKeywords = List.copyOf(Objects.requireNonNull(matchedKeywords,
                "matchedKeywords must not be null"));
    }

    public CaseRecord getCaseRecord() {
        return caseRecord;
    }

    public List<String> getMatchedKeywords() {
        return matchedKeywords;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof KeywordMatch that)) {
            return false;
        }
        return caseRecord.equals(that.caseRecord) && matchedKeywords.equals(that.matchedKeywords);
    }

    @Override
    public int hashCode() {
        return Objects.hash(caseRecord, matchedKeywords);
    }

    @Override
    public String toString() {
        return "KeywordMatch{case=" + caseRecord.getId() + ", keywords=" + matchedKeywords + '}';
    }
}
