package com.scholary.whisper.gateway.transport;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;

/**
 * Length-prefixed framing for the Whisper backend protocol.
 *
 * <p>Wire layout of one frame:
 *
 * <pre>
 * length (8 bytes, unsigned, big-endian) || payload (length bytes)
 * </pre>
 *
 * <p>The codec does not look at the payload. Decoding buffers the whole payload before returning
 * it; there is no chunked or streaming mode. A stream that ends before a frame is complete is a
 * fatal error for the connection and is never retried here.
 */
public class FrameCodec {

  /** Size of the length prefix in bytes. */
  public static final int HEADER_SIZE = 8;

  // Largest array most JVMs will allocate.
  private static final int MAX_ARRAY_SIZE = Integer.MAX_VALUE - 8;

  /** Largest payload {@link #encode} can put into a single frame array. */
  public static final int MAX_ENCODABLE_PAYLOAD = MAX_ARRAY_SIZE - HEADER_SIZE;

  private final long maxPayloadBytes;

  /**
   * @param maxPayloadBytes largest payload {@link #readFrame} will accept; capped at the largest
   *     array the JVM can allocate
   */
  public FrameCodec(long maxPayloadBytes) {
    if (maxPayloadBytes < 0) {
      throw new IllegalArgumentException("maxPayloadBytes must be >= 0");
    }
    this.maxPayloadBytes = Math.min(maxPayloadBytes, MAX_ARRAY_SIZE);
  }

  /**
   * Build a complete frame for the given payload.
   *
   * @param payload the payload bytes, possibly empty
   * @return header followed by the payload
   * @throws FrameTooLargeException if header and payload do not fit in one array
   */
  public byte[] encode(byte[] payload) throws FrameTooLargeException {
    checkEncodable(payload.length);
    ByteBuffer frame = ByteBuffer.allocate(HEADER_SIZE + payload.length);
    frame.putLong(payload.length);
    frame.put(payload);
    return frame.array();
  }

  /**
   * Read the next frame from the stream.
   *
   * @param in the stream to read from
   * @return the payload of the frame
   * @throws TruncatedFrameException if the stream ends inside the header or the payload
   * @throws FrameTooLargeException if the length prefix exceeds the configured maximum
   * @throws IOException if the underlying read fails
   */
  public byte[] decode(InputStream in) throws IOException {
    byte[] header = readExactly(in, HEADER_SIZE, "header");
    long length = ByteBuffer.wrap(header).getLong();

    // A negative long means the unsigned value has the top bit set, which is always too large.
    if (length < 0 || length > maxPayloadBytes) {
      throw new FrameTooLargeException(Long.toUnsignedString(length), maxPayloadBytes);
    }

    return readExactly(in, (int) length, "payload");
  }

  /**
   * Write one frame and flush the stream.
   *
   * @param out the stream to write to
   * @param payload the payload bytes
   * @throws IOException if the write fails
   */
  public void writeFrame(OutputStream out, byte[] payload) throws IOException {
    out.write(encode(payload));
    out.flush();
  }

  /**
   * Fail unless a payload of the given length can be framed by {@link #encode}.
   *
   * @throws FrameTooLargeException if the length exceeds {@link #MAX_ENCODABLE_PAYLOAD}
   */
  public static void checkEncodable(long payloadLength) throws FrameTooLargeException {
    if (payloadLength > MAX_ENCODABLE_PAYLOAD) {
      throw new FrameTooLargeException(Long.toString(payloadLength), MAX_ENCODABLE_PAYLOAD);
    }
  }

  public long maxPayloadBytes() {
    return maxPayloadBytes;
  }

  private static byte[] readExactly(InputStream in, int length, String part) throws IOException {
    byte[] buffer = in.readNBytes(length);
    if (buffer.length < length) {
      throw new TruncatedFrameException(part, length, buffer.length);
    }
    return buffer;
  }

  /** Thrown when the stream closes before a full frame arrived. */
  public static class TruncatedFrameException extends EOFException {

    private final boolean nothingRead;

    public TruncatedFrameException(String part, int expected, int actual) {
      super(
          String.format(
              "Stream closed while reading frame %s: expected %d bytes, got %d",
              part, expected, actual));
      this.nothingRead = "header".equals(part) && actual == 0;
    }

    /** The stream ended cleanly between frames, before any byte of this one arrived. */
    public boolean isNothingRead() {
      return nothingRead;
    }
  }

  /** Thrown when a payload is larger than the codec accepts, on either side of the wire. */
  public static class FrameTooLargeException extends IOException {

    public FrameTooLargeException(String announcedLength, long maxPayloadBytes) {
      super(
          String.format(
              "Frame length %s exceeds maximum of %d bytes", announcedLength, maxPayloadBytes));
    }
  }
}
