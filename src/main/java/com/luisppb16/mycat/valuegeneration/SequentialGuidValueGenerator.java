/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.valuegeneration;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates UUIDs that sort in creation order, which keeps inserts into a UUID-keyed index
 * clustered at its end.
 *
 * <p>The high 64 bits carry a counter seeded from the clock in 100 ns ticks, laid out around the
 * version nibble so the hexadecimal form grows monotonically. The low 64 bits are random with the
 * IETF variant.
 */
public class SequentialGuidValueGenerator extends ValueGenerator<UUID> {

  private static final long TICKS_PER_MILLI = 10_000L;

  private final AtomicLong counter;

  public SequentialGuidValueGenerator() {
    this(Instant.now().toEpochMilli() * TICKS_PER_MILLI);
  }

  SequentialGuidValueGenerator(long seed) {
    this.counter = new AtomicLong(seed);
  }

  @Override
  public UUID next() {
    final long tick = counter.incrementAndGet();
    final long mostSigBits = ((tick >>> 12) << 16) | 0x4000L | (tick & 0x0FFFL);
    final long random = ThreadLocalRandom.current().nextLong();
    final long leastSigBits = (random & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L;
    return new UUID(mostSigBits, leastSigBits);
  }

  @Override
  public boolean generatesTemporaryValues() {
    return false;
  }
}
