package com.stompws.client.transport.tyrus;

import com.stompws.client.transport.ITransport;
import com.stompws.client.transport.ITransportService;

public class TyrusTransportService implements ITransportService {

  @Override
  public ITransport newTransport() {
    return new TyrusTransport();
  }
}
