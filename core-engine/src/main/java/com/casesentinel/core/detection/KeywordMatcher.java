package com.casesentinel.core.detection;

import java.util.List;

/**
 * Finds which configured keywords occur in a case summary.
 *
 * @since 1.0.0
 */
public interface KeywordMatcher {

    /**
     * @param text     case summary; may be empty
     * @param keywords lowercase keywords in configuration order
     * @return the keywords found in {@code text}, in {@code keywords} order;
     *         empty when none match
     */
    List<String> match(String text, List<String> keywords);
}
