package com.wiligsi.turnstile.core.config;

import com.wiligsi.turnstile.core.StoreUnavailableException;
import com.wiligsi.turnstile.core.store.LockStore;

/**
 * Creates a lock store for an endpoint. Registered with a {@link LockStoreFactory} under a type
 * name.
 *
 * @author Steven Miller
 */
@FunctionalInterface
public interface LockStoreProvider {

  LockStore create(LockStoreEndpoint endpoint, LockStoreConfig config)
      throws StoreUnavailableException;
}
