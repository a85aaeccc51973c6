package hasync.core.model.pairing;

import java.util.Locale;

/**
 * Kind of device being paired. Unknown values are normalised to {@link #OTHER}.
 */
public enum DeviceType {
    MOBILE("mobile"),
    TABLET("tablet"),
    DESKTOP("desktop"),
    OTHER("other");

    private final String value;

    DeviceType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static DeviceType fromValue(String value) {
        if (value == null) {
            return OTHER;
        }
        final var normalized = value.trim().toLowerCase(Locale.ROOT);
        for (DeviceType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        return OTHER;
    }
}
