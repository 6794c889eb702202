package com.acme.delivery.redis;

import com.acme.delivery.spi.JobStore;
import java.util.ArrayList;
import java.util.List;
import org.redisson.api.RMap;
import org.redisson.api.RScript;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;

/**
 * Job storage on Redis: each queue is a list (RPUSH to append, LPOP to take) and each
 * dead-letter store is a hash of backup key to payload.
 */
public class RedissonJobStore implements JobStore {

  /** HVALS, DEL and RPUSH in one script so no client sees a half-moved dead-letter hash. */
  private static final String MOVE_DEAD_LETTERS =
      "local jobs = redis.call('hvals', KEYS[1]) "
          + "if #jobs == 0 then return 0 end "
          + "redis.call('del', KEYS[1]) "
          + "for i = 1, #jobs, 1000 do "
          + "  redis.call('rpush', KEYS[2], unpack(jobs, i, math.min(i + 999, #jobs))) "
          + "end "
          + "return #jobs";

  private final RedissonClient redisson;

  public RedissonJobStore(RedissonClient redisson) {
    this.redisson = redisson;
  }

  @Override
  public void append(String queue, List<String> items) {
    if (items.isEmpty()) {
      return;
    }
    redisson.<String>getList(queue, StringCodec.INSTANCE).addAll(items);
  }

  @Override
  public String pop(String queue) {
    return redisson.<String>getQueue(queue, StringCodec.INSTANCE).poll();
  }

  @Override
  public long length(String queue) {
    return redisson.getList(queue, StringCodec.INSTANCE).size();
  }

  @Override
  public void putDeadLetter(String deadLetter, String key, String payload) {
    deadLetterMap(deadLetter).fastPut(key, payload);
  }

  @Override
  public void removeDeadLetter(String deadLetter, String key) {
    deadLetterMap(deadLetter).fastRemove(key);
  }

  @Override
  public List<String> deadLetters(String deadLetter) {
    return new ArrayList<>(deadLetterMap(deadLetter).readAllValues());
  }

  @Override
  public int moveDeadLetters(String deadLetter, String queue) {
    Long moved =
        redisson
            .getScript(StringCodec.INSTANCE)
            .eval(
                RScript.Mode.READ_WRITE,
                MOVE_DEAD_LETTERS,
                RScript.ReturnType.INTEGER,
                List.<Object>of(deadLetter, queue));
    return moved == null ? 0 : moved.intValue();
  }

  private RMap<String, String> deadLetterMap(String deadLetter) {
    return redisson.getMap(deadLetter, StringCodec.INSTANCE);
  }
}
