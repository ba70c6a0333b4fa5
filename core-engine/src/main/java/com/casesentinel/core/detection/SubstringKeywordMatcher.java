package com.casesentinel.core.detection;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Case-insensitive substring matching. Word boundaries are not enforced, so
 * {@code "harm"} also matches {@code "pharmacy"}.
 *
 * @since 1.0.0
 */
public class SubstringKeywordMatcher implements KeywordMatcher {

    @Override
    public List<String> match(String text, List<String> keywords) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        String haystack = text.toLowerCase(Locale.ROOT);
        List<String> matched = new ArrayList<>();
        for (String keyword : keywords) {
            if (haystack.contains(keyword.toLowerCase(Locale.ROOT))) {
                matched.add(keyword);
            }
        }
        return matched;
    }
}
