/**
 * Alert pipeline: formatting detection results into alerts and appending
 * them to the alert store.
 */
package com.casesentinel.core.alert;
