package com.mimecast.tether.transport;

import javax.net.ssl.SSLContext;
import java.time.Duration;

/**
 * Connection setup parameters.
 *
 * <p>A null SSL context means a plain unauthenticated connection.
 */
public class SetupParameters {

    private String host = "localhost";
    private int port;
    private SSLContext sslContext;
    private String payload = "{}";
    private Responder responder;
    private Duration keepalive = Duration.ofSeconds(10);
    private Duration connectTimeout = Duration.ofSeconds(5);
    private ConnectionEvents events;

    public String getHost() {
        return host;
    }

    /**
     * Sets host.
     *
     * @param host Host name or address.
     * @return Self.
     */
    public SetupParameters setHost(String host) {
        this.host = host;
        return this;
    }

    public int getPort() {
        return port;
    }

    /**
     * Sets port.
     *
     * @param port Port number.
     * @return Self.
     */
    public SetupParameters setPort(int port) {
        this.port = port;
        return this;
    }

    public SSLContext getSslContext() {
        return sslContext;
    }

    /**
     * Sets SSL context for a mutually authenticated connection.
     *
     * @param sslContext SSLContext instance.
     * @return Self.
     */
    public SetupParameters setSslContext(SSLContext sslContext) {
        this.sslContext = sslContext;
        return this;
    }

    /**
     * Is secure.
     *
     * @return Boolean.
     */
    public boolean isSecure() {
        return sslContext != null;
    }

    public String getPayload() {
        return payload;
    }

    /**
     * Sets setup payload.
     *
     * @param payload Payload string.
     * @return Self.
     */
    public SetupParameters setPayload(String payload) {
        this.payload = payload;
        return this;
    }

    public Responder getResponder() {
        return responder;
    }

    /**
     * Sets responder for inbound messages.
     *
     * @param responder Responder instance or null to ignore inbound messages.
     * @return Self.
     */
    public SetupParameters setResponder(Responder responder) {
        this.responder = responder;
        return this;
    }

    public Duration getKeepalive() {
        return keepalive;
    }

    /**
     * Sets keepalive interval.
     *
     * @param keepalive Duration, zero disables keepalive frames.
     * @return Self.
     */
    public SetupParameters setKeepalive(Duration keepalive) {
        this.keepalive = keepalive;
        return this;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    /**
     * Sets connect timeout.
     *
     * @param connectTimeout Duration.
     * @return Self.
     */
    public SetupParameters setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
        return this;
    }

    public ConnectionEvents getEvents() {
        return events;
    }

    /**
     * Sets connection events handler.
     *
     * @param events ConnectionEvents instance.
     * @return Self.
     */
    public SetupParameters setEvents(ConnectionEvents events) {
        this.events = events;
        return this;
    }

    /**
     * Gets address for logging.
     *
     * @return Host and port string.
     */
    public String getAddress() {
        return host + ":" + port;
    }
}
