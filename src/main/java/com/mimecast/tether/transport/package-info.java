/**
 * Message transport to the desktop.
 *
 * <p>Frames are length prefixed JSON carrying setup, keepalive, fire-and-forget and request-response messages.
 *
 * @see com.mimecast.tether.transport.SocketTransport
 */
package com.mimecast.tether.transport;
