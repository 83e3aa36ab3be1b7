package com.postqueue.connector.instagram;

public enum ContainerStatusCode {
    IN_PROGRESS,
    FINISHED,
    ERROR,
    EXPIRED,
    PUBLISHED,
    UNKNOWN;

    public static ContainerStatusCode from(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (ContainerStatusCode code : values()) {
            if (code.name().equalsIgnoreCase(value)) {
                return code;
            }
        }
        return UNKNOWN;
    }
}
