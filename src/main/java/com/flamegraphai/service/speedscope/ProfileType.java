package com.flamegraphai.service.speedscope;

/**
 * The two profile encodings a document can carry, keyed by their wire value.
 */
public enum ProfileType {
    SAMPLED("sampled"),
    EVENTED("evented");

    private final String wireValue;

    ProfileType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }

    public static ProfileType fromWireValue(String value) {
        for (ProfileType type : values()) {
            if (type.wireValue.equals(value)) {
                return type;
            }
        }
        return null;
    }
}
