package com.acme.delivery.redis;

import com.acme.delivery.core.StreamNotFoundException;
import com.acme.delivery.core.Subjects;
import com.acme.delivery.spi.PullOptions;
import com.acme.delivery.spi.PullSubscription;
import com.acme.delivery.spi.StreamBroker;
import java.time.Duration;
import java.util.List;
import org.redisson.api.RScript;
import org.redisson.api.RStream;
import org.redisson.api.RedissonClient;
import org.redisson.api.StreamMessageId;
import org.redisson.api.stream.StreamCreateGroupArgs;
import org.redisson.client.codec.StringCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stream broker on Redis Streams.
 *
 * <p>A stream is a Redis stream keyed by its name; every entry carries the fields {@code subject},
 * {@code data} and {@code msg-id}. A durable pull subscription is a consumer group named after
 * the durable, so a restarted consumer resumes where it stopped. Publishing the same msg-id twice
 * within {@link #DEDUP_WINDOW} stores the entry once.
 */
public class RedisStreamBroker implements StreamBroker {
  private static final Logger LOG = LoggerFactory.getLogger(RedisStreamBroker.class);

  public static final Duration DEDUP_WINDOW = Duration.ofMinutes(2);

  static final String SUBJECT = "subject";
  static final String DATA = "data";
  static final String MSG_ID = "msg-id";

  private static final String INIT_GROUP = "stream-init";

  // 1 = stored, 0 = duplicate msg-id, -1 = no such stream
  private static final String PUBLISH =
      "if redis.call('exists', KEYS[1]) == 0 then return -1 end "
          + "if not redis.call('set', KEYS[2], '1', 'NX', 'PX', ARGV[4]) then return 0 end "
          + "redis.call('xadd', KEYS[1], '*', 'subject', ARGV[1], 'data', ARGV[2], 'msg-id', ARGV[3]) "
          + "return 1";

  private final RedissonClient redisson;

  public RedisStreamBroker(RedissonClient redisson) {
    this.redisson = redisson;
  }

  @Override
  public boolean streamExists(String stream) {
    return stream(stream).isExists();
  }

  /** Create an empty stream if it does not exist yet. */
  public void createStream(String stream) {
    if (streamExists(stream)) {
      return;
    }
    RStream<String, String> rs = stream(stream);
    rs.createGroup(StreamCreateGroupArgs.name(INIT_GROUP).id(StreamMessageId.NEWEST).makeStream());
    rs.removeGroup(INIT_GROUP);
    LOG.info("Created stream {}", stream);
  }

  @Override
  public PullSubscription pullSubscribe(String subject, PullOptions options) {
    String stream = Subjects.streamOf(subject);
    if (!streamExists(stream)) {
      throw new StreamNotFoundException(stream);
    }
    return new RedisPullSubscription(stream(stream), options);
  }

  @Override
  public void publish(String subject, String payload, String msgId) {
    String stream = Subjects.streamOf(subject);
    Long result =
        redisson
            .getScript(StringCodec.INSTANCE)
            .eval(
                RScript.Mode.READ_WRITE,
                PUBLISH,
                RScript.ReturnType.INTEGER,
                List.<Object>of(stream, dedupKey(stream, msgId)),
                subject,
                payload,
                msgId,
                String.valueOf(DEDUP_WINDOW.toMillis()));
    if (result == null || result < 0) {
      throw new StreamNotFoundException(stream);
    }
    if (result == 0) {
      LOG.debug("Duplicate msg-id {} on {}, not stored", msgId, subject);
    }
  }

  static String dedupKey(String stream, String msgId) {
    return stream + ":dedup:" + msgId;
  }

  private RStream<String, String> stream(String name) {
    return redisson.getStream(name, StringCodec.INSTANCE);
  }
}
