package com.wiligsi.turnstile.core.assertion;

import com.wiligsi.turnstile.core.lock.ConversationLock;
import org.assertj.core.api.InstanceOfAssertFactories;

public class TurnstileAssertions implements InstanceOfAssertFactories {

  protected TurnstileAssertions() {
  }

  public static ConversationLockAssert assertThat(ConversationLock actual) {
    return new ConversationLockAssert(actual);
  }
}
