package com.postqueue.connector.credentials;

import com.postqueue.connector.error.ProtocolException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

/**
 * Reads the tokens the auth service caches in Redis.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RedisAccountCredentialsProvider implements AccountCredentialsProvider {

    static final String INSTAGRAM_TOKEN_KEY = "instagram:token:";
    static final String INSTAGRAM_USER_ID_KEY = "instagram:user_id:";
    static final String TWITTER_TOKEN_KEY = "twitter:token:";

    private final StringRedisTemplate redisTemplate;

    @Override
    public InstagramCredentials instagram(String accountRef) {
        String token = redisTemplate.opsForValue().get(INSTAGRAM_TOKEN_KEY + accountRef);
        if (token == null || token.isBlank()) {
            throw new ProtocolException("No valid Instagram access token for account: " + accountRef);
        }

        String igUserId = redisTemplate.opsForValue().get(INSTAGRAM_USER_ID_KEY + accountRef);
        if (igUserId == null || igUserId.isBlank()) {
            throw new ProtocolException("No Instagram business account ID found for account: " + accountRef);
        }

        return new InstagramCredentials(accountRef, igUserId, token);
    }

    @Override
    public TwitterCredentials twitter(String accountRef) {
        String token = redisTemplate.opsForValue().get(TWITTER_TOKEN_KEY + accountRef);
        if (token == null || token.isBlank()) {
            throw new ProtocolException("No valid Twitter access token for account: " + accountRef);
        }
        log.debug("Resolved Twitter credentials for account {}", accountRef);
        return new TwitterCredentials(accountRef, token);
    }
}
