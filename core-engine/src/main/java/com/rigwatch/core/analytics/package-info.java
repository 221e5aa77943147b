/**
 * Fleet and per-device analytics built on top of the processor state.
 */
package com.rigwatch.core.analytics;
