package io.watson.datasource;

/**
 * One provider configuration value as the host hands it over.
 *
 * <p>A host can know that a value will exist without knowing it yet (for example when it depends
 * on something not created so far). Such a value is {@link #unknownValue()} and blocks configuration.
 * An unset value falls back to the environment.
 *
 * @param value the configured value, {@code null} when unset or unknown
 * @param unknown whether the host marked the value as not yet known
 */
public record Setting(String value, boolean unknown) {

    private static final Setting UNSET = new Setting(null, false);
    private static final Setting UNKNOWN = new Setting(null, true);

    public Setting {
        if (unknown && value != null) {
            throw new IllegalArgumentException("an unknown setting has no value");
        }
    }

    public static Setting of(String value) {
        return value == null ? UNSET : new Setting(value, false);
    }

    public static Setting unset() {
        return UNSET;
    }

    public static Setting unknownValue() {
        return UNKNOWN;
    }
}
