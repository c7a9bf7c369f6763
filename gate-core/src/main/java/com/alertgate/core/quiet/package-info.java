/**
 * Quiet-hours evaluation and the per-channel holding queues that release
 * notifications once a quiet window ends.
 *
 * @since 1.0.0
 */
package com.alertgate.core.quiet;
