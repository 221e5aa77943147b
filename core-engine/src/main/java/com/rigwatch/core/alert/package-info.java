/**
 * Alert creation, deduplication and delivery.
 *
 * <p>
 * {@link com.rigwatch.core.alert.AlertDispatcher} is the entry point;
 * delivery channels implement {@link com.rigwatch.core.alert.AlertSink}.
 * </p>
 */
package com.rigwatch.core.alert;
