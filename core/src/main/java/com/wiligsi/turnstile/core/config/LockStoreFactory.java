package com.wiligsi.turnstile.core.config;

import com.wiligsi.turnstile.core.StoreUnavailableException;
import com.wiligsi.turnstile.core.store.InMemoryLockStore;
import com.wiligsi.turnstile.core.store.LockStore;
import com.wiligsi.turnstile.core.store.RedisLockStore;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Turns an endpoint into a lock store. The built-in backends are registered up front and custom
 * backends are added with {@link #register(String, LockStoreProvider)} before the store is
 * created. Resolution happens once, at startup.
 *
 * @author Steven Miller
 */
public class LockStoreFactory {

  private static final Logger LOG = Logger.getLogger(LockStoreFactory.class.getName());

  private final Map<String, LockStoreProvider> providers;

  private LockStoreFactory() {
    providers = new TreeMap<>();
  }

  /**
   * Create a factory that knows the in-memory and redis backends.
   *
   * @return a new factory
   */
  public static LockStoreFactory withDefaults() {
    final LockStoreFactory factory = new LockStoreFactory();
    factory.register(
        LockStoreKind.IN_MEMORY.getTypeName(),
        (endpoint, config) -> new InMemoryLockStore(config)
    );
    factory.register(LockStoreKind.REDIS.getTypeName(), RedisLockStore::connect);
    return factory;
  }

  /**
   * Register a backend under a type name, replacing any backend already registered under it.
   *
   * @param typeName - the name used in endpoint files
   * @param provider - creates the store
   * @return this factory
   */
  public LockStoreFactory register(String typeName, LockStoreProvider provider) {
    if (typeName == null || typeName.isBlank()) {
      throw new IllegalArgumentException("Lock store type name must not be blank");
    }
    final String key = typeName.trim().toLowerCase(Locale.ROOT);
    if (providers.put(key, provider) != null) {
      LOG.info(String.format("Replaced lock store provider for type '%s'", key));
    }
    return this;
  }

  public boolean isRegistered(String typeName) {
    return typeName != null && providers.containsKey(typeName.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Create the store an endpoint asks for. A null endpoint means the in-memory store.
   *
   * @param endpoint - the configured endpoint, or null
   * @param config   - settings shared by all stores
   * @return the new lock store
   * @throws IllegalArgumentException  if no backend is registered for the endpoint's type
   * @throws StoreUnavailableException if the backend could not be reached
   */
  public LockStore create(LockStoreEndpoint endpoint, LockStoreConfig config)
      throws StoreUnavailableException {
    final LockStoreEndpoint effectiveEndpoint =
        endpoint == null ? LockStoreEndpoint.inMemory() : endpoint;
    final Optional<LockStoreProvider> provider = Optional.ofNullable(
        providers.get(effectiveEndpoint.getType())
    );

    if (provider.isEmpty()) {
      throw new IllegalArgumentException(
          String.format(
              "Lock store type '%s' is not available. The following types are available: %s",
              effectiveEndpoint.getType(), providers.keySet()
          )
      );
    }

    final LockStore store = provider.get().create(effectiveEndpoint, config);
    LOG.info(
        String.format(
            "Using lock store '%s' for endpoint %s",
            store.getClass().getSimpleName(), effectiveEndpoint
        )
    );
    return store;
  }
}
