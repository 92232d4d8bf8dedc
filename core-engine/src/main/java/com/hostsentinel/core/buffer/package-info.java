/**
 * Bounded snapshot history.
 */
package com.hostsentinel.core.buffer;
