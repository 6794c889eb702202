package com.acme.delivery.worker.config;

import com.acme.delivery.config.ConsumerConfig;
import com.acme.delivery.redis.RedisStreamBroker;
import com.acme.delivery.redis.RedissonJobStore;
import com.acme.delivery.registry.ConsumerRegistrar;
import com.acme.delivery.registry.HandlerRegistry;
import com.acme.delivery.retry.RetryRunner;
import com.acme.delivery.spi.JobStore;
import com.acme.delivery.spi.StreamBroker;
import com.acme.delivery.stream.StreamConsumers;
import io.micronaut.context.BeanContext;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.util.List;
import org.redisson.api.RedissonClient;

/**
 * Factory for the delivery beans.
 *
 * <p>Bridges the framework-free core POJOs and Micronaut's dependency injection. The core module
 * stays free of framework dependencies; this module does the wiring.
 */
@Factory
public class DeliveryBeansFactory {

  /** Creates ConsumerConfig bean populated from application.yml consumers.* properties */
  @Singleton
  @ConfigurationProperties("consumers")
  public ConsumerConfig consumerConfig() {
    return new ConsumerConfig();
  }

  @Singleton
  public RetryRunner retryRunner() {
    return new RetryRunner();
  }

  @Singleton
  @Requires(beans = RedissonClient.class)
  public JobStore jobStore(RedissonClient redisson) {
    return new RedissonJobStore(redisson);
  }

  @Singleton
  @Requires(beans = RedissonClient.class)
  public StreamBroker streamBroker(RedissonClient redisson) {
    return new RedisStreamBroker(redisson);
  }

  /**
   * Builds the handler registry from every {@link ConsumerRegistrar} bean. Consumer instances are
   * the beans of the declared consumer types.
   */
  @Singleton
  public HandlerRegistry handlerRegistry(BeanContext beanContext, List<ConsumerRegistrar> registrars) {
    return HandlerRegistry.builder(beanContext::getBean).register(registrars).build();
  }

  @Singleton
  public StreamConsumers streamConsumers(HandlerRegistry registry) {
    return new StreamConsumers(registry);
  }
}
