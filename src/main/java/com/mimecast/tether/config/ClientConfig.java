package com.mimecast.tether.config;

import com.mimecast.tether.device.DeviceIdentity;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * Client configuration container.
 *
 * <p>This class provides type safe access to the bridge client configuration.
 * <p>Every value has a default so an empty configuration connects to a desktop on localhost.
 *
 * <p><b>Example:</b>
 * <pre>
 * {
 *   host: "localhost",
 *   securePort: 8088,
 *   insecurePort: 8089,
 *   privateAppDirectory: "/data/data/com.example.app/files",
 *   device: { os: "Android", device: "Pixel", app: "Example", appId: "com.example.app" }
 * }
 * </pre>
 *
 * @see ConfigFoundation
 */
public class ClientConfig extends ConfigFoundation {

    public static final String DEFAULT_HOST = "localhost";
    public static final long DEFAULT_SECURE_PORT = 8088L;
    public static final long DEFAULT_INSECURE_PORT = 8089L;
    public static final long DEFAULT_KEEPALIVE_SECONDS = 10L;
    public static final long DEFAULT_RECONNECT_INTERVAL_MILLIS = 2000L;
    public static final long DEFAULT_CONNECT_TIMEOUT_MILLIS = 5000L;
    public static final long DEFAULT_REQUEST_TIMEOUT_MILLIS = 30000L;
    public static final long DEFAULT_BOOTSTRAP_THRESHOLD = 2L;
    public static final String DEFAULT_PRODUCT = "tether";

    /**
     * Constructs a new ClientConfig instance with defaults only.
     */
    public ClientConfig() {
        super();
    }

    /**
     * Constructs a new ClientConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public ClientConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new ClientConfig instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public ClientConfig(String path) throws IOException {
        super(path);
    }

    /**
     * Gets desktop host.
     *
     * @return Host string.
     */
    public String getHost() {
        return getStringProperty("host", DEFAULT_HOST);
    }

    /**
     * Gets port for mutually authenticated connections.
     *
     * @return Port number.
     */
    public int getSecurePort() {
        return Math.toIntExact(getLongProperty("securePort", DEFAULT_SECURE_PORT));
    }

    /**
     * Gets port for certificate bootstrap connections.
     *
     * @return Port number.
     */
    public int getInsecurePort() {
        return Math.toIntExact(getLongProperty("insecurePort", DEFAULT_INSECURE_PORT));
    }

    /**
     * Gets keepalive interval.
     *
     * @return Duration.
     */
    public Duration getKeepalive() {
        return Duration.ofSeconds(getLongProperty("keepaliveSeconds", DEFAULT_KEEPALIVE_SECONDS));
    }

    /**
     * Gets fixed delay between connection attempts.
     *
     * @return Duration.
     */
    public Duration getReconnectInterval() {
        return Duration.ofMillis(getLongProperty("reconnectIntervalMillis", DEFAULT_RECONNECT_INTERVAL_MILLIS));
    }

    /**
     * Gets socket connect timeout.
     *
     * @return Duration.
     */
    public Duration getConnectTimeout() {
        return Duration.ofMillis(getLongProperty("connectTimeoutMillis", DEFAULT_CONNECT_TIMEOUT_MILLIS));
    }

    /**
     * Gets how long to wait for the desktop to answer a certificate request.
     *
     * @return Duration.
     */
    public Duration getRequestTimeout() {
        return Duration.ofMillis(getLongProperty("requestTimeoutMillis", DEFAULT_REQUEST_TIMEOUT_MILLIS));
    }

    /**
     * Gets number of consecutive failures after which certificates are requested again.
     *
     * @return Threshold.
     */
    public int getBootstrapThreshold() {
        return Math.toIntExact(getLongProperty("bootstrapThreshold", DEFAULT_BOOTSTRAP_THRESHOLD));
    }

    /**
     * Gets product name.
     * <p>Names the credential directory and the root certificate file.
     *
     * @return Product string.
     */
    public String getProduct() {
        return getStringProperty("product", DEFAULT_PRODUCT);
    }

    /**
     * Gets application private directory.
     * <p>Defaults to the user home directory.
     *
     * @return Directory path string.
     */
    public String getPrivateAppDirectory() {
        return getStringProperty("privateAppDirectory", System.getProperty("user.home"));
    }

    /**
     * Gets device identity.
     *
     * @return DeviceIdentity instance.
     */
    public DeviceIdentity getDevice() {
        return DeviceIdentity.fromMap(getMapProperty("device"));
    }
}
