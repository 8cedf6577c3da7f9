package com.nayem.sagacoordinator.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nayem.sagacoordinator.client.ServiceClient;
import com.nayem.sagacoordinator.client.ServiceClientRegistry;
import com.nayem.sagacoordinator.engine.SagaCoordinator;
import com.nayem.sagacoordinator.engine.SagaMetrics;
import com.nayem.sagacoordinator.saga.SagaStateSerializer;
import com.nayem.sagacoordinator.store.InMemorySagaTransactionRepository;
import com.nayem.sagacoordinator.store.NoOpSagaRecoveryLock;
import com.nayem.sagacoordinator.store.RedisSagaRecoveryLock;
import com.nayem.sagacoordinator.store.RedisSagaTransactionRepository;
import com.nayem.sagacoordinator.store.SagaRecoveryLock;
import com.nayem.sagacoordinator.store.SagaTransactionRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
@EnableConfigurationProperties(SagaCoordinatorProperties.class)
@ConditionalOnProperty(name = "saga.enabled", havingValue = "true", matchIfMissing = true)
public class SagaCoordinatorAutoConfiguration {

    @Bean
    public SagaStateSerializer sagaStateSerializer(ObjectProvider<ObjectMapper> objectMapperProvider) {
        ObjectMapper mapper = objectMapperProvider.getIfAvailable();
        return mapper == null ? new SagaStateSerializer() : new SagaStateSerializer(mapper);
    }

    @Bean
    public SagaTransactionRepository sagaTransactionRepository(
            SagaCoordinatorProperties properties,
            SagaStateSerializer serializer,
            ObjectProvider<StringRedisTemplate> redisTemplateProvider) {

        String stateStore = properties.getStateStore();
        return switch (stateStore.toLowerCase()) {
            case "memory" -> new InMemorySagaTransactionRepository();
            case "redis" -> {
                StringRedisTemplate redis = redisTemplateProvider.getIfAvailable();
                if (redis == null) {
                    throw new IllegalStateException("Redis is required for the Redis saga transaction store");
                }
                yield new RedisSagaTransactionRepository(redis, serializer, properties.getRedis().getKeyPrefix());
            }
            default -> {
                LoggerFactory.getLogger(SagaCoordinatorAutoConfiguration.class)
                        .warn("Unknown saga state store '{}', falling back to memory", stateStore);
                yield new InMemorySagaTransactionRepository();
            }
        };
    }

    @Bean
    public SagaMetrics sagaMetrics(ObjectProvider<MeterRegistry> registryProvider) {
        return new SagaMetrics(registryProvider.getIfAvailable());
    }

    @Bean
    public SagaRecoveryLock sagaRecoveryLock(
            SagaCoordinatorProperties properties,
            ObjectProvider<StringRedisTemplate> redisTemplateProvider) {

        if (properties.getRecovery().isDistributedLocking()) {
            StringRedisTemplate redis = redisTemplateProvider.getIfAvailable();
            if (redis == null) {
                throw new IllegalStateException("Redis is required for distributed saga leases");
            }
            return new RedisSagaRecoveryLock(redis, properties.getRedis().getKeyPrefix());
        } else {
            return new NoOpSagaRecoveryLock();
        }
    }

    /**
     * Every {@link ServiceClient} bean, registered under its bean name.
     */
    @Bean
    public ServiceClientRegistry serviceClientRegistry(ListableBeanFactory beanFactory) {
        return new ServiceClientRegistry(beanFactory.getBeansOfType(ServiceClient.class));
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public SagaCoordinator sagaCoordinator(
            SagaTransactionRepository repository,
            ServiceClientRegistry serviceClientRegistry,
            SagaCoordinatorProperties properties,
            SagaMetrics sagaMetrics,
            SagaRecoveryLock recoveryLock,
            SagaStateSerializer serializer) {
        return new SagaCoordinator(repository, serviceClientRegistry, properties, sagaMetrics, recoveryLock,
                serializer);
    }
}
