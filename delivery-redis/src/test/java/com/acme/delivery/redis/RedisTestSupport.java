package com.acme.delivery.redis;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.utility.DockerImageName;

/** One Redis container shared by the integration tests of this module. */
final class RedisTestSupport {

  static final GenericContainer<?> REDIS =
      new GenericContainer<>(DockerImageName.parse("redis:7-alpine")).withExposedPorts(6379);

  private RedisTestSupport() {}

  static RedissonClient connect() {
    if (!REDIS.isRunning()) {
      REDIS.start();
    }
    Config config = new Config();
    config.useSingleServer().setAddress("redis://" + REDIS.getHost() + ":" + REDIS.getFirstMappedPort());
    RedissonClient redisson = Redisson.create(config);
    redisson.getKeys().flushall();
    return redisson;
  }
}
