/**
 * Storage contracts. The engine reads cases through
 * {@link com.casesentinel.core.store.CaseStore} and appends through
 * {@link com.casesentinel.core.store.AlertStore} and
 * {@link com.casesentinel.core.store.TrendingTopicStore}.
 */
package com.casesentinel.core.store;
