package com.postqueue.connector.credentials;

import lombok.ToString;
import lombok.Value;

/**
 * User-context bearer token; the auth service handles OAuth exchange and refresh.
 */
@Value
public class TwitterCredentials {
    String accountRef;
    @ToString.Exclude
    String bearerToken;
}
