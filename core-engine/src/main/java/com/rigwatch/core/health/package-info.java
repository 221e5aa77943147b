/**
 * Device health scoring.
 */
package com.rigwatch.core.health;
