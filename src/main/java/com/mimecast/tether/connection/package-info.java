/**
 * Connection lifecycle.
 *
 * <p>The {@link com.mimecast.tether.connection.ConnectionStateMachine} owns the connection and runs every
 * <br>state change on one {@link com.mimecast.tether.connection.EventLoop} thread.
 */
package com.mimecast.tether.connection;
