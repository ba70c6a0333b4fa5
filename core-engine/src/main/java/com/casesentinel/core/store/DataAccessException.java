package com.casesentinel.core.store;

/**
 * The case, alert or trending-topic store could not be reached or rejected a
 * query. Fatal to the detector invocation that hit it; retrying is the
 * caller's decision.
 *
 * @since 1.0.0
 */
public class DataAccessException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DataAccessException(String message) {
        super(message);
    }

    public DataAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
