package com.postqueue.connector.credentials;

/**
 * Supplies already-acquired platform credentials for an account reference.
 * Acquiring and refreshing them is the job of the external auth service.
 */
public interface AccountCredentialsProvider {

    /**
     * @throws com.postqueue.connector.error.ProtocolException if the account has no usable credentials
     */
    InstagramCredentials instagram(String accountRef);

    /**
     * @throws com.postqueue.connector.error.ProtocolException if the account has no usable credentials
     */
    TwitterCredentials twitter(String accountRef);
}
