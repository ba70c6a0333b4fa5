/**
 * Trend scoring, trending-topic computation from case summaries, and
 * predicted risks derived from trending topics.
 */
package com.casesentinel.core.trend;
