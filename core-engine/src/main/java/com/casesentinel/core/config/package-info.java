/**
 * Alert engine configuration.
 *
 * <p>
 * {@link com.casesentinel.core.config.AlertConfig} is an immutable value
 * handed to each detector. It can be built in code or read from YAML by
 * {@link com.casesentinel.core.config.AlertConfigLoader}; invalid values raise
 * {@link com.casesentinel.core.config.ConfigurationException} at load time.
 * </p>
 *
 * @since 1.0.0
 */
package com.casesentinel.core.config;
