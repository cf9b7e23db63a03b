package com.wiligsi.turnstile.core;

/**
 * Work that has to run while a conversation is locked.
 *
 * @param <T> the result of the work
 * @param <E> the checked exception the work may throw
 */
@FunctionalInterface
public interface LockedRegion<T, E extends Exception> {

  T run() throws E;
}
