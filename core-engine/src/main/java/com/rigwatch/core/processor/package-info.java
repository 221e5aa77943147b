/**
 * Event orchestration: {@link com.rigwatch.core.processor.StreamProcessor}
 * and its error types.
 */
package com.rigwatch.core.processor;
