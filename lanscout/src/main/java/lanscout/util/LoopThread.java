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

package lanscout.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for the engine's long running loop threads.  Subclasses report when their loop
 * has started, when it has finished, or that it died on an unexpected error; other threads
 * can block until startup has happened.
 */
public abstract class LoopThread extends Thread {
  private static final Logger LOG = LoggerFactory.getLogger(LoopThread.class);

  private final Object startLock = new Object();
  private boolean started;

  private volatile boolean stopped;
  private volatile Throwable crashCause;

  protected LoopThread(String name) {
    super(name);
    setDaemon(true);
  }

  /**
   * Subclasses call this once the loop is about to begin.
   */
  protected void notifyStarted() {
    LOG.debug("Thread {} started", getName());

    synchronized (startLock) {
      started = true;
      startLock.notifyAll();
    }
  }

  /**
   * Subclasses call this as the last thing the loop does.
   */
  protected void notifyStopped() {
    LOG.debug("Thread {} terminated", getName());

    stopped = true;
    synchronized (startLock) {
      started = true;
      startLock.notifyAll();
    }
  }

  /**
   * Subclasses call this when the loop died on something it didn't expect.
   */
  protected void notifyCrashed(Throwable cause) {
    LOG.error("Thread {} ***CRASHED***, shutting down", getName(), cause);

    crashCause = cause;
    notifyStopped();
  }

  /**
   * Wait until the loop has started (or already ended).
   */
  public void waitForStartup() throws InterruptedException {
    synchronized (startLock) {
      while (!started) {
        startLock.wait();
      }
    }
  }

  public boolean isStopped() {
    return stopped;
  }

  /**
   * @return what killed the loop, or null if it ended normally or is still running
   */
  public Throwable getCrashCause() {
    return crashCause;
  }
}
