/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.storage;

import static org.assertj.core.api.Assertions.*;

import java.sql.SQLException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class CancellationSignalTest {

  @Test
  void cancel_invokesRegisteredCanceller() {
    AtomicInteger calls = new AtomicInteger();
    CancellationSignal signal = new CancellationSignal();
    signal.onCancel(calls::incrementAndGet);

    signal.cancel();

    assertThat(calls).hasValue(1);
    assertThat(signal.isCancelled()).isTrue();
  }

  @Test
  void cancelBeforeRegistration_isReplayed() {
    AtomicInteger calls = new AtomicInteger();
    CancellationSignal signal = new CancellationSignal();

    signal.cancel();
    signal.onCancel(calls::incrementAndGet);

    assertThat(calls).hasValue(1);
  }

  @Test
  void clearedCanceller_isNotInvoked() {
    AtomicInteger calls = new AtomicInteger();
    CancellationSignal signal = new CancellationSignal();
    signal.onCancel(calls::incrementAndGet);

    signal.clear();
    signal.cancel();

    assertThat(calls).hasValue(0);
  }

  @Test
  void failingCanceller_doesNotPropagate() {
    CancellationSignal signal = new CancellationSignal();
    signal.onCancel(
        () -> {
          throw new SQLException("already closed");
        });

    assertThatCode(signal::cancel).doesNotThrowAnyException();
  }

  @Test
  void throwIfCancelled() {
    CancellationSignal signal = CancellationSignal.none();
    assertThatCode(signal::throwIfCancelled).doesNotThrowAnyException();

    signal.cancel();

    assertThatThrownBy(signal::throwIfCancelled).isInstanceOf(CancellationException.class);
  }
}
