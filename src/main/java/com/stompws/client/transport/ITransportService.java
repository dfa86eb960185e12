package com.stompws.client.transport;

public interface ITransportService {
  ITransport newTransport();
}
