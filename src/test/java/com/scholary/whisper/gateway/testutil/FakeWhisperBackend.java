package com.scholary.whisper.gateway.testutil;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.whisper.gateway.transport.FrameCodec;
import java.io.BufferedInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process stand-in for the Whisper backend.
 *
 * <p>Listens on a loopback port, reads length-prefixed JSON requests and answers them one at a
 * time per connection, the way the real backend does. By default it behaves like the backend:
 * inline audio is "transcribed" to its UTF-8 text, files are checked for existence and {@code
 * list_models} reports the usual five models. Tests swap in a {@link Responder} to misbehave.
 *
 * <p>Also records what it saw: every request, how many connections were accepted and closed, and
 * whether a client ever sent a request before the previous one was answered.
 */
public final class FakeWhisperBackend implements AutoCloseable {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final ServerSocket serverSocket;
  private final ExecutorService executor;
  private final FrameCodec codec = new FrameCodec(64L * 1024 * 1024);
  private final List<JsonNode> requests = new CopyOnWriteArrayList<>();
  private final List<Socket> openSockets = new CopyOnWriteArrayList<>();
  private final Set<String> loadedModels = ConcurrentHashMap.newKeySet();
  private final AtomicInteger connectionsAccepted = new AtomicInteger();
  private final AtomicInteger connectionsClosed = new AtomicInteger();
  private final AtomicInteger activeExchanges = new AtomicInteger();
  private final AtomicInteger maxActiveExchanges = new AtomicInteger();
  private final AtomicInteger pipelinedRequests = new AtomicInteger();

  private volatile Responder responder = this::emulateBackend;
  private volatile long responseDelayMs;

  private FakeWhisperBackend() throws IOException {
    this.serverSocket = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
    this.executor =
        Executors.newCachedThreadPool(
            runnable -> {
              Thread thread = new Thread(runnable, "fake-whisper-backend");
              thread.setDaemon(true);
              return thread;
            });
    executor.submit(this::acceptLoop);
  }

  public static FakeWhisperBackend start() {
    try {
      return new FakeWhisperBackend();
    } catch (IOException e) {
      throw new UncheckedIOException("Could not start fake backend", e);
    }
  }

  /** A port nothing listens on, for unreachable-backend tests. */
  public static int unusedPort() {
    try (ServerSocket probe = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
      return probe.getLocalPort();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public String host() {
    return "127.0.0.1";
  }

  public int port() {
    return serverSocket.getLocalPort();
  }

  public void respondWith(Responder responder) {
    this.responder = responder;
  }

  /** Go back to behaving like the real backend. */
  public void emulateRealBackend() {
    this.responder = this::emulateBackend;
  }

  /** Sleep this long after reading each request, before answering it. */
  public void delayResponses(long millis) {
    this.responseDelayMs = millis;
  }

  public List<JsonNode> requests() {
    return List.copyOf(requests);
  }

  public JsonNode lastRequest() {
    return requests.get(requests.size() - 1);
  }

  public int connectionsAccepted() {
    return connectionsAccepted.get();
  }

  public int connectionsClosed() {
    return connectionsClosed.get();
  }

  /** Highest number of requests being handled at the same moment, across all connections. */
  public int maxActiveExchanges() {
    return maxActiveExchanges.get();
  }

  /** Requests whose successor had already arrived before they were answered. */
  public int pipelinedRequests() {
    return pipelinedRequests.get();
  }

  /** Wait until at least {@code count} connections have been accepted. */
  public void awaitConnectionsAccepted(int count, Duration timeout) throws InterruptedException {
    awaitCount(connectionsAccepted, count, timeout, "accepted");
  }

  /** Wait until at least {@code count} connections have ended on the server side. */
  public void awaitConnectionsClosed(int count, Duration timeout) throws InterruptedException {
    awaitCount(connectionsClosed, count, timeout, "closed");
  }

  private static void awaitCount(AtomicInteger counter, int count, Duration timeout, String what)
      throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (counter.get() < count) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError(
            "Expected " + count + " " + what + " connections, saw " + counter.get());
      }
      Thread.sleep(10);
    }
  }

  @Override
  public void close() {
    try {
      serverSocket.close();
    } catch (IOException e) {
      // shutting down anyway
    }
    for (Socket socket : openSockets) {
      closeQuietly(socket);
    }
    executor.shutdownNow();
  }

  private void acceptLoop() {
    while (!serverSocket.isClosed()) {
      try {
        Socket socket = serverSocket.accept();
        openSockets.add(socket);
        connectionsAccepted.incrementAndGet();
        executor.submit(() -> serve(socket));
      } catch (IOException e) {
        return;
      }
    }
  }

  private void serve(Socket socket) {
    try {
      InputStream in = new BufferedInputStream(socket.getInputStream());
      OutputStream out = socket.getOutputStream();
      Exchange exchange = new Exchange(socket, out);
      while (!socket.isClosed()) {
        byte[] payload;
        try {
          payload = codec.decode(in);
        } catch (EOFException e) {
          return;
        }
        handle(payload, in, exchange);
      }
    } catch (IOException | InterruptedException e) {
      // the client went away or the test closed the backend
    } finally {
      closeQuietly(socket);
      openSockets.remove(socket);
      connectionsClosed.incrementAndGet();
    }
  }

  private void handle(byte[] payload, InputStream in, Exchange exchange)
      throws IOException, InterruptedException {
    int active = activeExchanges.incrementAndGet();
    maxActiveExchanges.accumulateAndGet(active, Math::max);
    try {
      JsonNode request = MAPPER.readTree(payload);
      requests.add(request);
      if (responseDelayMs > 0) {
        Thread.sleep(responseDelayMs);
      }
      if (in.available() > 0) {
        pipelinedRequests.incrementAndGet();
      }
      responder.respond(request, exchange);
    } finally {
      activeExchanges.decrementAndGet();
    }
  }

  private void emulateBackend(JsonNode request, Exchange exchange) throws IOException {
    String command = request.path("command").asText();
    if ("transcribe".equals(command)) {
      exchange.reply(transcribe(request));
    } else if ("list_models".equals(command)) {
      exchange.reply(listModels());
    } else {
      exchange.replyError("Unknown command: " + command);
    }
  }

  private ObjectNode transcribe(JsonNode request) throws IOException {
    String text;
    if (request.hasNonNull("audio_data")) {
      byte[] audio = Base64.getDecoder().decode(request.get("audio_data").asText());
      text = new String(audio, StandardCharsets.UTF_8);
    } else if (request.hasNonNull("audio_path")) {
      Path audioFile = Path.of(request.get("audio_path").asText());
      if (!Files.exists(audioFile)) {
        return errorBody("Audio file not found: " + audioFile);
      }
      text = Files.readString(audioFile, StandardCharsets.UTF_8);
    } else {
      return errorBody("No audio data or path provided");
    }
    String model = request.path("model").asText("base");
    loadedModels.add(model);

    ObjectNode result = MAPPER.createObjectNode();
    result.put("text", text);
    result.put("language", request.path("language").asText("en"));
    ArrayNode segments = result.putArray("segments");
    ObjectNode segment = segments.addObject();
    segment.put("id", 0);
    segment.put("text", text);
    segment.put("start", 0.0);
    segment.put("end", 1.5);
    segment.putArray("tokens").add(50364).add(2425);
    result.put("processing_time", 0.25);
    return result;
  }

  private ObjectNode listModels() {
    ObjectNode result = MAPPER.createObjectNode();
    ObjectNode available = result.putObject("available_models");
    available.put("tiny", "Fastest, least accurate");
    available.put("base", "Fast, decent accuracy");
    available.put("small", "Balanced speed and accuracy");
    available.put("medium", "Slower, more accurate");
    available.put("large", "Slowest, most accurate");
    ArrayNode loaded = result.putArray("loaded_models");
    loadedModels.forEach(loaded::add);
    return result;
  }

  private static ObjectNode errorBody(String message) {
    ObjectNode body = MAPPER.createObjectNode();
    body.put("error", message);
    return body;
  }

  private static void closeQuietly(Socket socket) {
    try {
      socket.close();
    } catch (IOException e) {
      // already gone
    }
  }

  /** Decides how to answer one request. */
  @FunctionalInterface
  public interface Responder {
    void respond(JsonNode request, Exchange exchange) throws IOException;
  }

  /** The server side of one request, for a {@link Responder} to answer through. */
  public final class Exchange {

    private final Socket socket;
    private final OutputStream out;

    private Exchange(Socket socket, OutputStream out) {
      this.socket = socket;
      this.out = out;
    }

    public void reply(JsonNode body) throws IOException {
      replyPayload(MAPPER.writeValueAsBytes(body));
    }

    public void replyError(String message) throws IOException {
      reply(errorBody(message));
    }

    /** Send a well-formed frame around an arbitrary payload. */
    public void replyPayload(byte[] payload) throws IOException {
      codec.writeFrame(out, payload);
    }

    /** Send bytes as they are, frame header or not. */
    public void replyRaw(byte[] bytes) throws IOException {
      out.write(bytes);
      out.flush();
    }

    /** Close this connection from the server side. */
    public void hangUp() throws IOException {
      socket.close();
    }
  }
}
