/**
 * Alert lifecycle: deduplication, resolution, retention and the critical
 * notification side channel.
 *
 * @since 1.0.0
 */
package com.hostsentinel.core.alert;
