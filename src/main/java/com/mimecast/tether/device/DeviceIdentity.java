package com.mimecast.tether.device;

import com.google.gson.JsonObject;
import org.apache.commons.lang3.StringUtils;

import java.util.Map;
import java.util.Objects;

/**
 * Immutable identity of the device and application running the bridge.
 *
 * <p>Sent to the desktop as the connection setup payload.
 * <br>The app id doubles as the common name of the certificate signing request.
 */
public final class DeviceIdentity {

    private final String os;
    private final String device;
    private final String deviceId;
    private final String app;
    private final String appId;

    /**
     * Constructs a new DeviceIdentity instance.
     *
     * @param os       Operating system name.
     * @param device   Device model.
     * @param deviceId Device serial or unique id, may be null.
     * @param app      Application name.
     * @param appId    Application id.
     */
    public DeviceIdentity(String os, String device, String deviceId, String app, String appId) {
        this.os = Objects.requireNonNull(os, "os");
        this.device = Objects.requireNonNull(device, "device");
        this.deviceId = StringUtils.trimToNull(deviceId);
        this.app = Objects.requireNonNull(app, "app");
        this.appId = Objects.requireNonNull(appId, "appId");
    }

    /**
     * Builds identity from a configuration map.
     * <p>Missing values fall back to the host JVM properties.
     *
     * @param map Configuration map.
     * @return DeviceIdentity instance.
     */
    public static DeviceIdentity fromMap(Map<String, Object> map) {
        String app = value(map, "app", "tether");
        return new DeviceIdentity(
                value(map, "os", System.getProperty("os.name")),
                value(map, "device", System.getProperty("os.arch")),
                value(map, "deviceId", null),
                app,
                value(map, "appId", app)
        );
    }

    private static String value(Map<String, Object> map, String key, String defaultValue) {
        Object value = map != null ? map.get(key) : null;
        return value != null ? String.valueOf(value) : defaultValue;
    }

    public String getOs() {
        return os;
    }

    public String getDevice() {
        return device;
    }

    /**
     * Gets device id.
     *
     * @return Device id or null if unknown.
     */
    public String getDeviceId() {
        return deviceId;
    }

    public String getApp() {
        return app;
    }

    public String getAppId() {
        return appId;
    }

    /**
     * Setup payload for certificate bootstrap connections.
     *
     * @return JsonObject with os, device and app.
     */
    public JsonObject toInsecureSetup() {
        JsonObject payload = new JsonObject();
        payload.addProperty("os", os);
        payload.addProperty("device", device);
        payload.addProperty("app", app);
        return payload;
    }

    /**
     * Setup payload for mutually authenticated connections.
     * <p>Adds the device id when known.
     *
     * @return JsonObject with os, device, device_id and app.
     */
    public JsonObject toSecureSetup() {
        JsonObject payload = new JsonObject();
        payload.addProperty("os", os);
        payload.addProperty("device", device);
        if (deviceId != null) {
            payload.addProperty("device_id", deviceId);
        }
        payload.addProperty("app", app);
        return payload;
    }

    @Override
    public String toString() {
        return "DeviceIdentity{os=" + os + ", device=" + device + ", deviceId=" + deviceId
                + ", app=" + app + ", appId=" + appId + "}";
    }
}
