package com.postqueue.connector.instagram;

import lombok.Value;

@Value
public class ContainerStatus {
    ContainerStatusCode code;
    String detail;

    public static ContainerStatus of(ContainerStatusCode code) {
        return new ContainerStatus(code, null);
    }
}
