package com.acme.delivery.worker.config;

import com.acme.delivery.config.ConsumerConfig;
import com.acme.delivery.registry.BoundHandler;
import com.acme.delivery.registry.HandlerRegistry;
import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs effective configuration on application startup for visibility and troubleshooting.
 * Disabled in test environment.
 */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<StartupEvent> {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);

    private final ConsumerConfig consumerConfig;
    private final HandlerRegistry registry;
    private final List<QueueProperties> queues;

    @Property(name = "redisson.address", defaultValue = "(disabled)")
    private String redisAddress;

    @Property(name = "consumers.enabled", defaultValue = "true")
    private boolean consumersEnabled;

    public ConfigurationLogger(ConsumerConfig consumerConfig, HandlerRegistry registry, List<QueueProperties> queues) {
        this.consumerConfig = consumerConfig;
        this.registry = registry;
        this.queues = queues;
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        LOG.info("━━━ Redis ━━━");
        LOG.info("  Address:            {}", redisAddress);
        LOG.info("");

        LOG.info("━━━ Stream Consumers ━━━");
        LOG.info("  Enabled:            {}", consumersEnabled ? "ENABLED" : "DISABLED");
        LOG.info("  Namespace:          {} (prefix of every durable consumer name)", consumerConfig.getNamespace());
        LOG.info("  Batch Size:         {} (messages requested per pull)", consumerConfig.getBatchSize());
        LOG.info("  Ack Wait:           {} (redelivery delay of unacked messages)", consumerConfig.getTimeout());
        LOG.info("  Redeliver On Error: {}", consumerConfig.isRedeliverOnError());
        for (BoundHandler handler : registry.handlers()) {
            LOG.info("  Handler:            {} ({} middleware)", handler.topic(), handler.middleware().size());
        }
        LOG.info("");

        LOG.info("━━━ Work Queues ━━━");
        for (QueueProperties queue : queues) {
            LOG.info("  {}: retries={} backoff={} poll-retries={} poll-interval={}",
                    queue.getName(), queue.getRetries(), queue.getBackoff(),
                    queue.getPollRetries(), queue.getPollInterval());
        }
        LOG.info("");
    }
}
