/**
 * Window arithmetic.
 */
package com.casesentinel.core.window;
