/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcpdelegation.exchange;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mcpdelegation.util.Assert;
import io.mcpdelegation.util.Utils;

/**
 * Process-wide cache of exchanged credentials keyed by {@link ExchangeKey}.
 * <p>
 * An entry is live while the current time is before its expiry minus the safety
 * margin. Credentials without a known expiry are never stored.
 * <p>
 * Loads are coalesced per key: while a load is in flight, further requests for the same
 * key join it instead of starting another. Every caller receives its own future, so
 * cancelling one does not affect the load or the other waiters.
 */
public class ExchangeCache {

	private static final Logger logger = LoggerFactory.getLogger(ExchangeCache.class);

	private final Duration safetyMargin;

	private final LongSupplier currentTimeMillisSupplier;

	private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

	// guarded by lock
	private final Map<ExchangeKey, DownstreamCredential> entries = new HashMap<>();

	private final ConcurrentHashMap<ExchangeKey, CompletableFuture<DownstreamCredential>> inFlight = new ConcurrentHashMap<>();

	public ExchangeCache(Duration safetyMargin) {
		this(safetyMargin, System::currentTimeMillis);
	}

	public ExchangeCache(Duration safetyMargin, LongSupplier currentTimeMillisSupplier) {
		Assert.notNull(safetyMargin, "safetyMargin must not be null");
		Assert.isTrue(!safetyMargin.isNegative(), "safetyMargin must not be negative");
		Assert.notNull(currentTimeMillisSupplier, "currentTimeMillisSupplier must not be null");
		this.safetyMargin = safetyMargin;
		this.currentTimeMillisSupplier = currentTimeMillisSupplier;
	}

	/**
	 * Look up a live entry.
	 * @param key the cache key
	 * @return the cached credential if it is still live
	 */
	public Optional<DownstreamCredential> getLive(ExchangeKey key) {
		Instant now = now();
		lock.readLock().lock();
		try {
			DownstreamCredential credential = entries.get(key);
			if (credential != null && credential.isLive(now, safetyMargin)) {
				return Optional.of(credential);
			}
			return Optional.empty();
		}
		finally {
			lock.readLock().unlock();
		}
	}

	/**
	 * Return the live entry for {@code key}, joining or starting a load when there is
	 * none.
	 * @param key the cache key
	 * @param loader starts the load; called at most once per miss
	 * @return a future private to the caller
	 */
	public CompletableFuture<DownstreamCredential> getOrLoad(ExchangeKey key,
			Supplier<CompletableFuture<DownstreamCredential>> loader) {
		Optional<DownstreamCredential> cached = getLive(key);
		if (cached.isPresent()) {
			logger.debug("Exchange cache hit for scope {}", key.targetScope());
			return CompletableFuture.completedFuture(cached.get());
		}

		CompletableFuture<DownstreamCredential> created = new CompletableFuture<>();
		CompletableFuture<DownstreamCredential> existing = inFlight.putIfAbsent(key, created);
		if (existing != null) {
			logger.debug("Joining in-flight exchange for scope {}", key.targetScope());
			return existing.copy();
		}

		// a load for this key may have finished between the lookup and the registration
		Optional<DownstreamCredential> loaded = getLive(key);
		if (loaded.isPresent()) {
			inFlight.remove(key, created);
			created.complete(loaded.get());
			return CompletableFuture.completedFuture(loaded.get());
		}

		CompletableFuture<DownstreamCredential> load;
		try {
			load = loader.get();
		}
		catch (RuntimeException e) {
			load = CompletableFuture.failedFuture(e);
		}

		load.whenComplete((credential, ex) -> {
			if (ex == null) {
				put(key, credential);
			}
			inFlight.remove(key, created);
			if (ex != null) {
				created.completeExceptionally(Utils.unwrap(ex));
			}
			else {
				created.complete(credential);
			}
		});
		return created.copy();
	}

	private void put(ExchangeKey key, DownstreamCredential credential) {
		Instant now = now();
		if (!credential.isLive(now, safetyMargin)) {
			logger.debug("Not caching exchanged credential for scope {}: no usable expiry", key.targetScope());
			return;
		}
		lock.writeLock().lock();
		try {
			entries.values().removeIf(entry -> !entry.isLive(now, safetyMargin));
			entries.put(key, credential);
		}
		finally {
			lock.writeLock().unlock();
		}
	}

	/**
	 * @return the number of stored entries, live or not
	 */
	public int size() {
		lock.readLock().lock();
		try {
			return entries.size();
		}
		finally {
			lock.readLock().unlock();
		}
	}

	private Instant now() {
		return Instant.ofEpochMilli(currentTimeMillisSupplier.getAsLong());
	}

}
