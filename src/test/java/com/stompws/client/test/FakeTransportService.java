package com.stompws.client.test;

import com.stompws.client.transport.ITransport;
import com.stompws.client.transport.ITransportService;

public class FakeTransportService implements ITransportService {
  private final FakeTransport transport;
  private int nbTransports;

  public FakeTransportService(FakeTransport transport) {
    this.transport = transport;
  }

  @Override
  public ITransport newTransport() {
    nbTransports++;
    return transport;
  }

  public int getNbTransports() {
    return nbTransports;
  }
}
