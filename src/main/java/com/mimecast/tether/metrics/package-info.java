/**
 * Micrometer counters for connection attempts and certificate exchanges.
 */
package com.mimecast.tether.metrics;
