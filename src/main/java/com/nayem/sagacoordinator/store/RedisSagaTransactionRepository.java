package com.nayem.sagacoordinator.store;

import com.nayem.sagacoordinator.saga.PersistenceException;
import com.nayem.sagacoordinator.saga.SagaStateSerializer;
import com.nayem.sagacoordinator.saga.SagaTransaction;
import com.nayem.sagacoordinator.saga.TransactionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Redis-backed implementation of {@link SagaTransactionRepository}.
 * <p>
 * Layout, under the configured key prefix:
 * - {@code txn:<id>}: the record as JSON
 * - {@code txn:status:<status>}: set of ids per status
 * - {@code txn:deadlines}: sorted set of pending/running ids scored by
 *   {@code timeout_at} epoch millis
 * </p>
 */
public class RedisSagaTransactionRepository implements SagaTransactionRepository {

    private static final Logger log = LoggerFactory.getLogger(RedisSagaTransactionRepository.class);

    private final StringRedisTemplate redisTemplate;
    private final SagaStateSerializer serializer;
    private final String recordPrefix;
    private final String statusPrefix;
    private final String deadlinesKey;

    public RedisSagaTransactionRepository(StringRedisTemplate redisTemplate, SagaStateSerializer serializer,
            String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.serializer = serializer;
        this.recordPrefix = keyPrefix + "txn:";
        this.statusPrefix = keyPrefix + "txn:status:";
        this.deadlinesKey = keyPrefix + "txn:deadlines";
    }

    @Override
    public void save(SagaTransaction transaction) {
        String id = transaction.transactionId();
        String json = serializer.writeTransaction(transaction);
        try {
            redisTemplate.opsForValue().set(recordPrefix + id, json);

            redisTemplate.opsForSet().add(statusPrefix + transaction.status().wireValue(), id);
            for (TransactionStatus other : TransactionStatus.values()) {
                if (other != transaction.status()) {
                    redisTemplate.opsForSet().remove(statusPrefix + other.wireValue(), id);
                }
            }

            if (hasDeadline(transaction)) {
                redisTemplate.opsForZSet().add(deadlinesKey, id, transaction.timeoutAt().toEpochMilli());
            } else {
                redisTemplate.opsForZSet().remove(deadlinesKey, id);
            }
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to save saga transaction " + id, e);
        }
    }

    @Override
    public Optional<SagaTransaction> findById(String transactionId) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(recordPrefix + transactionId);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load saga transaction " + transactionId, e);
        }
        return json == null ? Optional.empty() : Optional.of(serializer.readTransaction(json));
    }

    @Override
    public List<SagaTransaction> findByStatus(Set<TransactionStatus> statuses, int limit) {
        Set<String> ids = new LinkedHashSet<>();
        try {
            for (TransactionStatus status : statuses) {
                Set<String> members = redisTemplate.opsForSet().members(statusPrefix + status.wireValue());
                if (members != null) {
                    ids.addAll(members);
                }
            }
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to query saga transactions by status " + statuses, e);
        }
        return loadAll(ids, statuses, limit);
    }

    @Override
    public List<SagaTransaction> findTimedOut(Instant now, Set<TransactionStatus> statuses, int limit) {
        Set<String> ids;
        try {
            ids = redisTemplate.opsForZSet().rangeByScore(deadlinesKey, 0, now.toEpochMilli() - 1, 0, limit);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to query timed out saga transactions", e);
        }
        if (ids == null) {
            return List.of();
        }
        return loadAll(ids, statuses, limit).stream()
                .filter(transaction -> transaction.isTimedOut(now))
                .toList();
    }

    private List<SagaTransaction> loadAll(Collection<String> ids, Set<TransactionStatus> statuses, int limit) {
        if (ids.isEmpty()) {
            return List.of();
        }
        List<String> keys = ids.stream().map(id -> recordPrefix + id).toList();
        List<String> jsons;
        try {
            jsons = redisTemplate.opsForValue().multiGet(keys);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load saga transactions", e);
        }

        List<SagaTransaction> results = new ArrayList<>();
        if (jsons != null) {
            for (String json : jsons) {
                if (json == null) {
                    continue;
                }
                try {
                    SagaTransaction transaction = serializer.readTransaction(json);
                    // index entries may lag behind the record between writes
                    if (statuses.contains(transaction.status())) {
                        results.add(transaction);
                    }
                } catch (PersistenceException e) {
                    log.error("Skipping unreadable saga transaction record", e);
                }
                if (results.size() >= limit) {
                    break;
                }
            }
        }
        return results;
    }

    private boolean hasDeadline(SagaTransaction transaction) {
        return transaction.timeoutAt() != null
                && (transaction.status() == TransactionStatus.PENDING
                        || transaction.status() == TransactionStatus.RUNNING);
    }
}
