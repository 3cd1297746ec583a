package com.codeheadsystems.vionex.server.store;

import com.codeheadsystems.vionex.server.error.StoreUnavailableException;
import io.lettuce.core.Range;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.RedisURI;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link KeyValueStore} backed by Redis through the Lettuce synchronous API.
 * <p>
 * A single thread-safe connection is shared by all callers. Every command is bounded by the
 * connection's command timeout; timeouts and connection failures surface as
 * {@link StoreUnavailableException}.
 */
public class RedisKeyValueStore implements KeyValueStore, AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(RedisKeyValueStore.class);

  public static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(2);

  private final RedisCommands<String, String> commands;
  private final StatefulRedisConnection<String, String> connection;
  private final RedisClient client;

  /**
   * Wraps an existing command set. The caller owns the underlying connection.
   */
  public RedisKeyValueStore(RedisCommands<String, String> commands) {
    this(commands, null, null);
  }

  private RedisKeyValueStore(RedisCommands<String, String> commands,
                             StatefulRedisConnection<String, String> connection,
                             RedisClient client) {
    this.commands = commands;
    this.connection = connection;
    this.client = client;
  }

  /**
   * Connects to Redis. The returned store owns the connection and must be closed.
   *
   * @param redisUri       e.g. {@code redis://localhost:6379/0}
   * @param commandTimeout upper bound on every command
   * @throws StoreUnavailableException if the initial connection fails
   */
  public static RedisKeyValueStore connect(String redisUri, Duration commandTimeout) {
    RedisURI uri = RedisURI.create(redisUri);
    uri.setTimeout(commandTimeout);
    RedisClient client = RedisClient.create(uri);
    try {
      StatefulRedisConnection<String, String> connection = client.connect();
      log.info("Connected to Redis at {}:{} (command timeout {})", uri.getHost(), uri.getPort(), commandTimeout);
      return new RedisKeyValueStore(connection.sync(), connection, client);
    } catch (RedisException e) {
      client.shutdown();
      throw new StoreUnavailableException("Unable to connect to Redis", e);
    }
  }

  @Override
  public void sortedSetAdd(String key, long score, String member) {
    call("ZADD", () -> commands.zadd(key, (double) score, member));
  }

  @Override
  public long sortedSetRemoveUpTo(String key, long maxScoreInclusive) {
    Range<Long> range = Range.from(Range.Boundary.unbounded(), Range.Boundary.including(maxScoreInclusive));
    return call("ZREMRANGEBYSCORE", () -> commands.zremrangebyscore(key, range));
  }

  @Override
  public long sortedSetCountAbove(String key, long minScoreExclusive) {
    Range<Long> range = Range.from(Range.Boundary.excluding(minScoreExclusive), Range.Boundary.unbounded());
    return call("ZCOUNT", () -> commands.zcount(key, range));
  }

  @Override
  public void expire(String key, Duration ttl) {
    call("PEXPIRE", () -> commands.pexpire(key, ttl.toMillis()));
  }

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(call("GET", () -> commands.get(key)));
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    call("PSETEX", () -> commands.psetex(key, ttl.toMillis(), value));
  }

  @Override
  public void delete(String key) {
    call("DEL", () -> commands.del(key));
  }

  @Override
  public void ping() {
    String reply = call("PING", commands::ping);
    if (!"PONG".equalsIgnoreCase(reply)) {
      throw new StoreUnavailableException("Unexpected PING reply: " + reply, null);
    }
  }

  @Override
  public void close() {
    if (connection != null) {
      connection.close();
    }
    if (client != null) {
      client.shutdown();
    }
  }

  private <T> T call(String command, Supplier<T> supplier) {
    try {
      return supplier.get();
    } catch (RedisException e) {
      log.error("Redis {} failed: {}", command, e.getMessage());
      throw new StoreUnavailableException("Redis " + command + " failed", e);
    }
  }
}
