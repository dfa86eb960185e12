package com.stompws.client.orchestrator;

import com.stompws.client.session.StompSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Sends an EOL heartbeat on the session at a fixed rate, while the session is ACTIVE. */
public class HeartbeatScheduler extends AbstractOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(HeartbeatScheduler.class);

  private final StompSession session;
  private volatile long nbHeartbeats;
  private volatile long nbFailures;

  public HeartbeatScheduler(StompSession session, int heartbeatDelay) {
    // first heartbeat one interval after start
    super(heartbeatDelay, heartbeatDelay);
    this.session = session;
  }

  @Override
  protected void runOrchestrator() {
    try {
      if (session.transmitHeartbeat()) {
        nbHeartbeats++;
        if (log.isTraceEnabled()) {
          log.trace("heartbeat sent");
        }
      }
    } catch (Exception e) {
      nbFailures++;
      log.error("Error sending heartbeat: " + e.getMessage());
    }
  }

  public long getNbHeartbeats() {
    return nbHeartbeats;
  }

  public long getNbFailures() {
    return nbFailures;
  }
}
