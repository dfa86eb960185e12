package com.stompws.client.transport;

public enum TlsTrustPolicy {
  /** Verify server certificate and hostname with the JVM defaults. */
  VERIFY,
  /** Accept any certificate (self-signed brokers). Testing only. */
  TRUST_ALL
}
