package com.acme.delivery.worker.config;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.acme.delivery.config.ConsumerConfig;
import com.acme.delivery.redis.RedisStreamBroker;
import com.acme.delivery.redis.RedissonJobStore;
import com.acme.delivery.registry.BoundHandler;
import com.acme.delivery.registry.HandlerRegistry;
import com.acme.delivery.stream.StreamConsumers;
import com.acme.delivery.worker.sample.UserEvents;
import com.acme.delivery.worker.sample.UserService;
import io.micronaut.context.BeanContext;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.redisson.api.RedissonClient;

@DisplayName("Delivery Beans Factory Tests")
class DeliveryBeansFactoryTest {

  private DeliveryBeansFactory factory;

  @BeforeEach
  void setUp() {
    factory = new DeliveryBeansFactory();
  }

  @Test
  @DisplayName("Should create ConsumerConfig bean with default values")
  void shouldCreateConsumerConfig() {
    ConsumerConfig config = factory.consumerConfig();

    assertThat(config.getBatchSize()).isEqualTo(100);
    assertThat(config.getTimeout()).isEqualTo(Duration.ofMinutes(1));
    assertThat(config.isRedeliverOnError()).isFalse();
  }

  @Test
  @DisplayName("Should create Redis-backed store and broker")
  void shouldCreateRedisBeans() {
    RedissonClient redisson = mock(RedissonClient.class);

    assertThat(factory.jobStore(redisson)).isInstanceOf(RedissonJobStore.class);
    assertThat(factory.streamBroker(redisson)).isInstanceOf(RedisStreamBroker.class);
    verifyNoInteractions(redisson);
  }

  @Nested
  @DisplayName("Handler registry")
  class HandlerRegistryTests {

    private final BeanContext beanContext = mock(BeanContext.class);
    private final UserEvents userEvents = new UserEvents(new UserService());

    @Test
    @DisplayName("Should register the handlers declared by every registrar")
    void shouldBuildRegistryFromRegistrars() {
      when(beanContext.getBean(UserEvents.class)).thenReturn(userEvents);

      HandlerRegistry registry = factory.handlerRegistry(beanContext, List.of(userEvents));

      assertThat(registry.handlers())
          .extracting(BoundHandler::topic)
          .containsExactly("users.created", "users.*.deleted");
      verify(beanContext, times(1)).getBean(UserEvents.class);
    }

    @Test
    @DisplayName("Should subscribe every registered topic")
    void shouldCreateConsumersForRegistry() {
      when(beanContext.getBean(UserEvents.class)).thenReturn(userEvents);
      HandlerRegistry registry = factory.handlerRegistry(beanContext, List.of(userEvents));

      StreamConsumers consumers = factory.streamConsumers(registry);

      assertThat(consumers.streams()).containsExactly("users");
      assertThat(consumers.topics()).containsExactly("users.created", "users.*.deleted");
    }

    @Test
    @DisplayName("Should build an empty registry without registrars")
    void shouldBuildEmptyRegistry() {
      assertThat(factory.handlerRegistry(beanContext, List.of()).isEmpty()).isTrue();
      verifyNoInteractions(beanContext);
    }
  }
}
