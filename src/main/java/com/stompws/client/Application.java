package com.stompws.client;

import com.stompws.client.transport.TlsTrustPolicy;
import com.stompws.client.transport.tyrus.TyrusTransportService;
import com.stompws.client.utils.ClientUtils;
import com.stompws.client.utils.MessageListener;
import java.text.SimpleDateFormat;
import java.util.Arrays;
import java.util.Date;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;

/** Command-line client: publish one message, or subscribe and log incoming messages. */
@EnableAutoConfiguration
public class Application implements ApplicationRunner {
  private static final Logger log = LoggerFactory.getLogger(Application.class);
  private static final long SEND_GRACE_DELAY = 1000;

  private ApplicationArgs appArgs;
  private volatile boolean done = false;

  public static void main(String... args) {
    SpringApplication.run(Application.class, args);
  }

  @Override
  public void run(ApplicationArguments args) {
    this.appArgs = new ApplicationArgs(args);

    // enable debug logs with --debug
    if (appArgs.isDebug()) {
      ClientUtils.setLogLevel(Level.DEBUG.toString());
    }

    log.info("------------ stomp-ws-client ------------");
    log.info("Running stomp-ws-client {}", Arrays.toString(args.getSourceArgs()));
    StompClient client;
    String topic;
    try {
      topic = appArgs.getTopic();
      client = new StompClient(computeConfig());
    } catch (IllegalArgumentException e) {
      log.info("Invalid arguments: " + e.getMessage());
      log.info("Usage: stomp-ws-client " + ApplicationArgs.USAGE);
      return;
    }

    registerShutdownHook(client);
    try {
      log.info("Connecting to STOMP server at " + client.getUrl());
      if (!client.connect()) {
        log.error("Failed to connect to STOMP server");
        return;
      }
      String payload = appArgs.getSend();
      if (payload != null) {
        sendMessage(client, topic, payload, appArgs.isJson());
      } else {
        listenForMessages(client, topic);
      }
    } catch (InterruptedException e) {
      log.info("Shutdown requested by user");
      Thread.currentThread().interrupt();
    } catch (Exception e) {
      log.error("Error occurred: " + e.getMessage(), e);
    } finally {
      done = true;
      client.close();
      log.info("STOMP client shutdown complete");
    }
  }

  private StompClientConfig computeConfig() {
    String hostWithPort = appArgs.getHostWithPort();
    TlsTrustPolicy tlsTrustPolicy = appArgs.getTlsTrustPolicy();
    boolean insecure = appArgs.isSsl() && TlsTrustPolicy.TRUST_ALL.equals(tlsTrustPolicy);
    log.info(
        "Will connect using protocol="
            + (appArgs.isSsl() ? "wss" : "ws")
            + ", endpoint="
            + hostWithPort
            + ", sockjs="
            + appArgs.isSockjs()
            + (insecure ? " (accepting self-signed certificates)" : ""));
    if (insecure) {
      log.warn(
          "SSL certificate verification is disabled. This is insecure and should only be used"
              + " for testing!");
    }
    if (log.isDebugEnabled() && appArgs.getPassword() != null) {
      log.debug(
          "login="
              + appArgs.getUsername()
              + ", passcode="
              + ClientUtils.maskString(appArgs.getPassword()));
    }

    StompCredentials credentials =
        new StompCredentials(appArgs.getUsername(), appArgs.getPassword());
    return new StompClientConfig(
        new TyrusTransportService(),
        hostWithPort,
        appArgs.isSockjs(),
        appArgs.isSsl(),
        credentials,
        tlsTrustPolicy,
        appArgs.getHeartbeat() * 1000,
        StompClientConfig.CONNECT_TIMEOUT_DEFAULT);
  }

  private void sendMessage(StompClient client, String topic, String payload, boolean formatAsJson)
      throws Exception {
    if (formatAsJson) {
      payload = ClientUtils.formatJsonPayload(payload);
      log.info("Converted input to JSON format");
    }
    client.send(topic, payload);
    log.info("Message sent to topic: " + topic);
    log.info("Payload: " + payload);

    // give some time for the message to be delivered
    Thread.sleep(SEND_GRACE_DELAY);
  }

  private void listenForMessages(StompClient client, String topic) throws Exception {
    client.subscribe(topic, computeMessageHandler());
    log.info("Subscribed to topic: " + topic);
    log.info("Consumer started. Waiting for messages... (Press Ctrl+C to stop)");
    waitDone(client);
  }

  // logs every message received on the topic
  private MessageListener<String> computeMessageHandler() {
    return new MessageListener<String>() {
      @Override
      public void onMessage(String body) {
        String timestamp = new SimpleDateFormat("yyyy-MM-dd'T'HH:mm:ss.SSS").format(new Date());
        log.info("Message received at " + timestamp);
        log.info("Payload: " + ClientUtils.prettyJson(body));
        log.info(StringUtils.repeat('-', 80));
      }
    };
  }

  private void waitDone(StompClient client) throws InterruptedException {
    synchronized (this) {
      while (!done && client.isConnected()) {
        wait(1000);
      }
    }
    if (!done) {
      log.error("Connection to STOMP server lost (" + client.getState() + ")");
    }
  }

  private void registerShutdownHook(final StompClient client) {
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                new Runnable() {
                  @Override
                  public void run() {
                    if (!done) {
                      log.info("Shutdown requested by user");
                      done = true;
                      client.close();
                    }
                  }
                },
                "stomp-ws-client-shutdown"));
  }
}
