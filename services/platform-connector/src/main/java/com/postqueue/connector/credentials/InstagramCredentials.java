package com.postqueue.connector.credentials;

import lombok.ToString;
import lombok.Value;

@Value
public class InstagramCredentials {
    String accountRef;
    String businessAccountId;
    @ToString.Exclude
    String accessToken;
}
