package com.stompws.client.utils;

public interface MessageListener<S> {
  void onMessage(S message);
}
