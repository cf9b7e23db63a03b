package com.wiligsi.turnstile.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class LockStoreConfigTests {

  @Test
  public void itShouldUseTheDefaults() {
    final LockStoreConfig config = LockStoreConfig.defaults();

    assertThat(config.getLockLifetime()).isEqualTo(Duration.ofSeconds(60));
    assertThat(config.getWaitTime()).isEqualTo(Duration.ofSeconds(1));
    assertThat(config.getMaxWriteAttempts()).isEqualTo(25);
  }

  @Test
  public void itShouldReadTheLockLifetimeFromTheEnvironment() {
    final LockStoreConfig config = LockStoreConfig.fromEnvironment(
        Map.of(LockStoreConfig.LOCK_LIFETIME_ENV, "2.5")
    ).build();

    assertThat(config.getLockLifetime()).isEqualTo(Duration.ofMillis(2500));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "soon", "0", "-3", "Infinity", "NaN"})
  public void itShouldIgnoreUnusableLifetimes(String rawLifetime) {
    final LockStoreConfig config = LockStoreConfig.fromEnvironment(
        Map.of(LockStoreConfig.LOCK_LIFETIME_ENV, rawLifetime)
    ).build();

    assertThat(config.getLockLifetime()).isEqualTo(LockStoreConfig.DEFAULT_LOCK_LIFETIME);
  }

  @Test
  public void itShouldKeepSettingsWhenCopied() {
    final LockStoreConfig config = LockStoreConfig.newBuilder()
        .setWaitTime(Duration.ofMillis(250))
        .setMaxWriteAttempts(3)
        .build();

    final LockStoreConfig copy = config.toBuilder().setLockLifetime(Duration.ofSeconds(5)).build();

    assertThat(copy.getWaitTime()).isEqualTo(Duration.ofMillis(250));
    assertThat(copy.getMaxWriteAttempts()).isEqualTo(3);
    assertThat(copy.getLockLifetime()).isEqualTo(Duration.ofSeconds(5));
    assertThat(config.getLockLifetime()).isEqualTo(LockStoreConfig.DEFAULT_LOCK_LIFETIME);
  }

  @Test
  public void itShouldRejectUnusableSettings() {
    final LockStoreConfig.Builder builder = LockStoreConfig.newBuilder();

    assertThatThrownBy(() -> builder.setWaitTime(Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> builder.setLockLifetime(Duration.ofSeconds(-1)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> builder.setMaxWriteAttempts(0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> builder.setClock(null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
