package com.acme.enginesync.redis;

import static org.assertj.core.api.Assertions.*;

import com.acme.enginesync.config.WatcherConfig;
import com.acme.enginesync.spi.IdGenerator;
import com.acme.enginesync.watcher.EngineHttpResponse;
import com.acme.enginesync.watcher.EngineResponseWatcher;
import com.redis.testcontainers.RedisContainer;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/** Two watchers, each with its own Redis connection, exchanging results over a real Redis. */
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class RedisResponseWatcherIntegrationTest {

  @Container
  static RedisContainer redis =
      new RedisContainer(DockerImageName.parse("redis:7-alpine")).withExposedPorts(6379);

  private RedissonClient nodeA;
  private RedissonClient nodeB;
  private EngineResponseWatcher watcherA;
  private EngineResponseWatcher watcherB;

  @BeforeAll
  void connect() {
    nodeA = client();
    nodeB = client();
  }

  @AfterAll
  void disconnect() {
    nodeA.shutdown();
    nodeB.shutdown();
  }

  @BeforeEach
  void startWatchers() {
    WatcherConfig config = new WatcherConfig();
    config.setWebhookTimeout(Duration.ofMillis(1500));
    watcherA = new EngineResponseWatcher(new RedissonPubSub(nodeA), IdGenerator.uuid(), config);
    watcherB = new EngineResponseWatcher(new RedissonPubSub(nodeB), IdGenerator.uuid(), config);
    watcherA.init();
    watcherB.init();
  }

  @AfterEach
  void stopWatchers() {
    watcherA.shutdown();
    watcherB.shutdown();
  }

  private RedissonClient client() {
    Config config = new Config();
    config
        .useSingleServer()
        .setAddress("redis://" + redis.getHost() + ":" + redis.getFirstMappedPort());
    return Redisson.create(config);
  }

  @Test
  @DisplayName("result published from node B reaches the wait on node A")
  void testCrossNodeDelivery() throws Exception {
    EngineHttpResponse result = new EngineHttpResponse(200, Map.of("ok", true), Map.of("x-a", "1"));
    CompletableFuture<EngineHttpResponse> waitOnA = watcherA.listen("req-42", true);
    CompletableFuture<EngineHttpResponse> waitOnB = watcherB.listen("req-42", true);

    watcherB.publish("req-42", watcherA.getHandlerId(), result);

    assertThat(waitOnA.get(1, TimeUnit.SECONDS)).isEqualTo(result);
    assertThat(waitOnB.get(3, TimeUnit.SECONDS)).isEqualTo(EngineHttpResponse.noContent());
  }

  @Test
  @DisplayName("duplicate publishes are delivered once")
  void testDuplicatePublish() throws Exception {
    CompletableFuture<EngineHttpResponse> wait = watcherA.listen("req-7", false);

    watcherB.publish("req-7", watcherA.getHandlerId(), new EngineHttpResponse(201, "first", Map.of()));
    watcherB.publish("req-7", watcherA.getHandlerId(), new EngineHttpResponse(500, "second", Map.of()));

    assertThat(wait.get(2, TimeUnit.SECONDS).body()).isEqualTo("first");
    Thread.sleep(200);
    assertThat(watcherA.pendingCount()).isZero();
  }

  @Test
  @DisplayName("publish to a handler nobody subscribes to is silently lost")
  void testPublishToUnknownHandler() {
    assertThatCode(
            () -> watcherB.publish("req-1", "no-such-handler", EngineHttpResponse.noContent()))
        .doesNotThrowAnyException();
  }
}
