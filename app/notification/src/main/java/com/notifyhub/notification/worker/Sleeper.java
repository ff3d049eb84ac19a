package com.notifyhub.notification.worker;

import java.time.Duration;

/** ワーカーループの待機。テストで実時間を待たないために差し替える。 */
@FunctionalInterface
interface Sleeper {

  Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
