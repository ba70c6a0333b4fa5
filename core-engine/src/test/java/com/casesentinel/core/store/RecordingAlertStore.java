package com.casesentinel.core.store;

import com.casesentinel.core.model.Alert;
import com.casesentinel.core.model.TrendingTopic;

import java.util.ArrayList;
import java.util.List;

/**
 * Records every insert call, for tests.
 */
public class RecordingAlertStore implements AlertStore, TrendingTopicStore {

    private final List<List<Alert>> alertBatches = new ArrayList<>();
    private final List<List<TrendingTopic>> topicBatches = new ArrayList<>();

    @Override
    public synchronized void insertAlerts(List<Alert> alerts) {
        alertBatches.add(List.copyOf(alerts));
    }

    @Override
    public synchronized void insertTopics(List<TrendingTopic> topics) {
        topicBatches.add(List.copyOf(topics));
    }

    public synchronized List<List<Alert>> getAlertBatches() {
        return List.copyOf(alertBatches);
    }

    public synchronized List<Alert> getAlerts() {
        List<Alert> all = new ArrayList<>();
        alertBatches.forEach(all::addAll);
        return all;
    }

    public synchronized List<List<TrendingTopic>> getTopicBatches() {
        return List.copyOf(topicBatches);
    }
}
