package com.stompws.client.transport;

public interface ITransportListener {

  void onTransportOpened();

  void onTransportMessage(String text);

  void onTransportError(Throwable error);

  /**
   * @param code close code, or null when unknown
   * @param reason close reason, or null
   */
  void onTransportClosed(Integer code, String reason);
}
