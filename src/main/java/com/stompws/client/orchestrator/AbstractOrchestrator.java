package com.stompws.client.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Runs {@link #runOrchestrator()} on its own thread every loopDelay milliseconds until stopped. */
public abstract class AbstractOrchestrator {
  private Logger log;
  private final int LOOP_DELAY;
  private final int START_DELAY;

  private final Object sleepLock = new Object();
  private volatile boolean started;
  protected volatile Thread myThread;

  public AbstractOrchestrator(int loopDelay) {
    this(loopDelay, 0);
  }

  public AbstractOrchestrator(int loopDelay, int startDelay) {
    this.log = LoggerFactory.getLogger(getClass().getName());
    this.LOOP_DELAY = loopDelay;
    this.START_DELAY = startDelay;
  }

  public synchronized void start(boolean daemon) {
    if (isStarted()) {
      log.error("Cannot start: already started");
      return;
    }
    if (log.isDebugEnabled()) {
      log.debug("Starting... (loopDelay=" + LOOP_DELAY + "ms)");
    }
    this.started = true;
    this.myThread =
        new Thread(
            new Runnable() {
              @Override
              public void run() {
                if (START_DELAY > 0) {
                  doSleep(START_DELAY);
                }
                // a restarted orchestrator owns a new thread, this one must exit
                while (started && myThread == Thread.currentThread()) {
                  runOrchestrator();
                  doSleep(LOOP_DELAY);
                }

                // thread exiting
                if (log.isDebugEnabled()) {
                  log.debug("Ended.");
                }
              }
            },
            getClass().getSimpleName());
    this.myThread.setDaemon(daemon);
    this.myThread.start();
  }

  protected abstract void runOrchestrator();

  public synchronized void stop() {
    if (!isStarted()) {
      log.error("Cannot stop: not started");
      return;
    }
    if (log.isDebugEnabled()) {
      log.debug("Ending...");
    }
    this.started = false;
    synchronized (sleepLock) {
      sleepLock.notifyAll();
    }
  }

  private void doSleep(long timeToWait) {
    try {
      synchronized (sleepLock) {
        if (started) {
          sleepLock.wait(timeToWait);
        }
      }
    } catch (InterruptedException e) {
      log.warn("Interrupted, stopping");
      this.started = false;
    }
  }

  public boolean isStarted() {
    return started;
  }
}
