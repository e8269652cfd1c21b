package com.flamegraphai.service.speedscope;

/**
 * Open/close markers of an evented profile ("O" / "C" on the wire).
 */
public enum EventType {
    OPEN("O"),
    CLOSE("C");

    private final String wireValue;

    EventType(String wireValue) {
        this.wireValue = wireValue;
    }

    public static EventType fromWireValue(String value) {
        for (EventType type : values()) {
            if (type.wireValue.equals(value)) {
                return type;
            }
        }
        return null;
    }
}
