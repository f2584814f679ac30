/**
 * Merges presets and explicit overrides into the active rule set.
 *
 * @since 1.0.0
 */
package com.lintsentinel.core.resolution;
