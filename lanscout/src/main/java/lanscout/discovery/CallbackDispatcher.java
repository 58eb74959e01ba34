/*
 * Copyright 2014 WANdisco
 *
 *  WANdisco licenses this file to you under the Apache License,
 *  version 2.0 (the "License"); you may not use this file except in compliance
 *  with the License. You may obtain a copy of the License at:
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 *  WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 *  License for the specific language governing permissions and limitations
 *  under the License.
 */

package lanscout.discovery;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lanscout.interfaces.DiscoveryCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Bounded pool that runs discovery callbacks, so a slow callback never holds up the listener.
 * A full queue drops the submission rather than blocking the caller.
 */
public class CallbackDispatcher {
  private static final Logger LOG = LoggerFactory.getLogger(CallbackDispatcher.class);

  private static final long IDLE_WORKER_KEEP_ALIVE_SECONDS = 30;

  private final String name;
  private final ThreadPoolExecutor executor;

  public CallbackDispatcher(String name, int minWorkers, int maxWorkers, int queueDepth) {
    this.name = name;
    this.executor = new ThreadPoolExecutor(
        minWorkers,
        maxWorkers,
        IDLE_WORKER_KEEP_ALIVE_SECONDS, TimeUnit.SECONDS,
        new ArrayBlockingQueue<>(queueDepth),
        new ThreadFactoryBuilder()
            .setNameFormat(name + "-%d")
            .setDaemon(true)
            .build());
  }

  /**
   * Queue {@code callback} to be invoked with {@code device}.
   *
   * @return false if the task queue is full (or the pool is shut down) and nothing was queued
   */
  public boolean submit(DiscoveredDevice device, DiscoveryCallback callback) {
    try {
      executor.execute(() -> invoke(device, callback));
      return true;
    } catch (RejectedExecutionException e) {
      LOG.warn("Unable to enqueue discover callback for {} on {}; the task queue may be full",
          device.getIpAddress(), name);
      return false;
    }
  }

  private void invoke(DiscoveredDevice device, DiscoveryCallback callback) {
    try {
      callback.deviceDiscovered(device);
    } catch (RuntimeException e) {
      LOG.error("Discover callback threw while handling {}", device, e);
    }
  }

  public int getQueuedTaskCount() {
    return executor.getQueue().size();
  }

  public void shutdown() {
    executor.shutdown();
  }

  public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
    return executor.awaitTermination(timeout, unit);
  }
}
