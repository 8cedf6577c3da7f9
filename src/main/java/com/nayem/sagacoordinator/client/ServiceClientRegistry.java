package com.nayem.sagacoordinator.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps logical service names to {@link ServiceClient} implementations.
 */
public class ServiceClientRegistry {

    private static final Logger log = LoggerFactory.getLogger(ServiceClientRegistry.class);

    private final Map<String, ServiceClient> clients = new ConcurrentHashMap<>();

    public ServiceClientRegistry() {
    }

    public ServiceClientRegistry(Map<String, ? extends ServiceClient> clients) {
        clients.forEach(this::register);
    }

    public void register(String serviceName, ServiceClient client) {
        Objects.requireNonNull(serviceName, "serviceName");
        Objects.requireNonNull(client, "client");
        ServiceClient previous = clients.put(serviceName, client);
        if (previous != null && previous != client) {
            log.warn("Replaced service client for {}", serviceName);
        } else {
            log.info("Registered service client for {}", serviceName);
        }
    }

    public Optional<ServiceClient> find(String serviceName) {
        return serviceName == null ? Optional.empty() : Optional.ofNullable(clients.get(serviceName));
    }

    /**
     * @throws IllegalStateException if no client is registered under the name
     */
    public ServiceClient require(String serviceName) {
        return find(serviceName).orElseThrow(
                () -> new IllegalStateException("No client registered for service " + serviceName));
    }

    public boolean isRegistered(String serviceName) {
        return find(serviceName).isPresent();
    }

    public Set<String> serviceNames() {
        return Set.copyOf(clients.keySet());
    }
}
