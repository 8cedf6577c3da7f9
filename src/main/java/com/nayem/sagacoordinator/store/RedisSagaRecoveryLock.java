package com.nayem.sagacoordinator.store;

import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * Redis-backed lease using {@code SET NX PX} with the owner id as value.
 */
public class RedisSagaRecoveryLock implements SagaRecoveryLock {

    private final StringRedisTemplate redisTemplate;
    private final String lockPrefix;

    public RedisSagaRecoveryLock(StringRedisTemplate redisTemplate, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.lockPrefix = keyPrefix + "lock:";
    }

    @Override
    public boolean acquireLock(String transactionId, String ownerId, Duration leaseDuration) {
        String key = lockPrefix + transactionId;
        Boolean success = redisTemplate.opsForValue().setIfAbsent(key, ownerId, leaseDuration);
        if (success != null && success) {
            return true;
        }
        // re-acquiring our own lease counts as success
        return renewLock(transactionId, ownerId, leaseDuration);
    }

    @Override
    public boolean renewLock(String transactionId, String ownerId, Duration leaseDuration) {
        String key = lockPrefix + transactionId;
        if (!ownerId.equals(redisTemplate.opsForValue().get(key))) {
            return false;
        }
        Boolean extended = redisTemplate.expire(key, leaseDuration);
        return extended != null && extended;
    }

    @Override
    public void releaseLock(String transactionId, String ownerId) {
        String key = lockPrefix + transactionId;
        if (ownerId.equals(redisTemplate.opsForValue().get(key))) {
            redisTemplate.delete(key);
        }
    }
}
