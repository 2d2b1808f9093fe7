package com.radiusproxy.backend;

/**
 * Thrown when backend settings are malformed or incomplete, or when a
 * configuration change would violate a store invariant.
 */
public class BackendConfigurationException extends Exception {

    private final String settingName;

    public BackendConfigurationException(String message) {
        super(message);
        this.settingName = null;
    }

    public BackendConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.settingName = null;
    }

    /**
     * Creates an exception for a specific setting.
     *
     * @param settingName the offending setting key
     * @param message what is wrong with it
     */
    public BackendConfigurationException(String settingName, String message) {
        super("Invalid setting '" + settingName + "': " + message);
        this.settingName = settingName;
    }

    /**
     * Gets the name of the setting that failed validation.
     *
     * @return setting name, or null if the problem is not setting-specific
     */
    public String getSettingName() {
        return settingName;
    }

    public static BackendConfigurationException missing(String settingName) {
        return new BackendConfigurationException(settingName, "required setting is missing");
    }
}
