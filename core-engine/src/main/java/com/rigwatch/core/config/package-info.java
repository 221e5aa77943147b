/**
 * Pipeline configuration loading and validation.
 *
 * <p>
 * The configuration is defined in YAML and loaded by
 * {@link com.rigwatch.core.config.ConfigLoader} into a
 * {@link com.rigwatch.core.config.PipelineConfig} instance, validated right
 * after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.rigwatch.core.config;
