package com.scholary.whisper.gateway.transport;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;

/** Opens TCP sockets to the backend. Separated out so tests can observe dial attempts. */
@FunctionalInterface
public interface SocketConnector {

  /**
   * Dial the given address.
   *
   * @param address the backend address, resolved on every call
   * @param connectTimeoutMs how long a single dial may take
   * @return a connected socket
   * @throws IOException if the dial fails or times out
   */
  Socket connect(InetSocketAddress address, int connectTimeoutMs) throws IOException;

  /** Plain blocking socket with Nagle disabled and TCP keep-alive on. */
  static SocketConnector plain() {
    return (address, connectTimeoutMs) -> {
      Socket socket = new Socket();
      try {
        socket.setTcpNoDelay(true);
        socket.setKeepAlive(true);
        socket.connect(address, connectTimeoutMs);
        return socket;
      } catch (IOException e) {
        socket.close();
        throw e;
      }
    };
  }
}
