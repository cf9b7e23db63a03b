package com.wiligsi.turnstile.core.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.wiligsi.turnstile.core.store.InMemoryLockStore;
import com.wiligsi.turnstile.core.store.LockStore;
import com.wiligsi.turnstile.core.store.RedisLockStore;
import java.util.Collections;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.mockito.Mockito;
import org.redisson.api.RedissonClient;

public class WorkerPolicyTests {

  @Test
  public void itShouldUseOneWorkerByDefault() {
    assertThat(WorkerPolicy.numberOfWorkers(sharedStore(), Collections.emptyMap()))
        .isEqualTo(1);
  }

  @ParameterizedTest
  @MethodSource("provideWorkerSettings")
  public void itShouldOnlyAllowManyWorkersWithASharedStore(
      String rawWorkers,
      int withSharedStore,
      int withLocalStore
  ) {
    final Map<String, String> environment = Map.of(WorkerPolicy.WORKERS_ENV, rawWorkers);

    assertThat(WorkerPolicy.numberOfWorkers(sharedStore(), environment))
        .isEqualTo(withSharedStore);
    assertThat(WorkerPolicy.numberOfWorkers(new InMemoryLockStore(), environment))
        .isEqualTo(withLocalStore);
    assertThat(WorkerPolicy.numberOfWorkers(null, environment))
        .isEqualTo(withLocalStore);
  }

  private static LockStore sharedStore() {
    return new RedisLockStore(
        Mockito.mock(RedissonClient.class), "lock:", LockStoreConfig.defaults()
    );
  }

  private static Stream<Arguments> provideWorkerSettings() {
    return Stream.of(
        Arguments.of("1", 1, 1),
        Arguments.of("4", 4, 1),
        Arguments.of(" 2 ", 2, 1),
        Arguments.of("0", 1, 1),
        Arguments.of("-4", 1, 1),
        Arguments.of("many", 1, 1)
    );
  }
}
