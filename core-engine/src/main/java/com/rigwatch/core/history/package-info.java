/**
 * Per-device bounded telemetry history.
 *
 * @since 1.0.0
 */
package com.rigwatch.core.history;
