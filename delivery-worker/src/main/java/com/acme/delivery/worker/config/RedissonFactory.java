package com.acme.delivery.worker.config;

import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;

@Factory
@Requires(property = "redisson.enabled", value = "true", defaultValue = "true")
public class RedissonFactory {

  /** One client shared by every queue and stream subscription. */
  @Singleton
  @Bean(preDestroy = "shutdown")
  @Requires(property = "redisson.address")
  public RedissonClient redissonClient(
      @Property(name = "redisson.address") String address,
      @Property(name = "redisson.password", defaultValue = "") String password,
      @Property(name = "redisson.database", defaultValue = "0") int database,
      @Property(name = "redisson.connection-pool-size", defaultValue = "64") int poolSize) {
    Config config = new Config();
    SingleServerConfig server =
        config.useSingleServer().setAddress(address).setDatabase(database).setConnectionPoolSize(poolSize);
    if (!password.isEmpty()) {
      server.setPassword(password);
    }
    return Redisson.create(config);
  }
}
