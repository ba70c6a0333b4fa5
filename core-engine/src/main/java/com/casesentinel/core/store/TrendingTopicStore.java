package com.casesentinel.core.store;

import com.casesentinel.core.model.TrendingTopic;

import java.util.List;

/**
 * Append-only sink for trending topics.
 *
 * @since 1.0.0
 */
public interface TrendingTopicStore {

    /**
     * @param topics fully populated topics with identifiers
     * @throws DataAccessException if the batch could not be written
     */
    void insertTopics(List<TrendingTopic> topics);
}
