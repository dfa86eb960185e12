package com.stompws.client.frame;

import com.stompws.client.exception.StompProtocolException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/**
 * Converts STOMP frames to and from their text wire form.
 *
 * <p>Decoding is tolerant: header lines without a colon are dropped, and a trailing CR on the
 * command and header lines is ignored. One transport message is expected to carry exactly one
 * frame.
 */
public final class StompFrameCodec {
  private static final char LF = '\n';
  private static final char CR = '\r';
  private static final char NULL = '\u0000';

  private StompFrameCodec() {
    throw new UnsupportedOperationException("Do not instantiate libraries.");
  }

  public static String encode(StompFrame frame) {
    return encode(frame.getCommand(), frame.getHeaders(), frame.getBody());
  }

  /**
   * Encode a frame: command line, one {@code key:value} line per header, a blank line, the body if
   * any, then the NULL terminator.
   *
   * @param command frame command, not empty
   * @param headers headers in wire order, may be null
   * @param body frame body, null for none
   * @return wire text
   */
  public static String encode(String command, Map<String, String> headers, String body) {
    if (command == null || command.isEmpty()) {
      throw new IllegalArgumentException("command is required");
    }
    StringBuilder sb = new StringBuilder();
    sb.append(command).append(LF);
    if (headers != null) {
      for (Map.Entry<String, String> header : headers.entrySet()) {
        sb.append(header.getKey()).append(':').append(header.getValue()).append(LF);
      }
    }
    sb.append(LF);
    if (body != null) {
      sb.append(body);
    }
    sb.append(NULL);
    return sb.toString();
  }

  /** @return true when the message is an EOL-only heartbeat, not a frame */
  public static boolean isHeartbeat(String wire) {
    return wire != null && wire.indexOf(LF) >= 0 && StringUtils.containsOnly(wire, CR, LF, NULL);
  }

  public static StompFrame decode(byte[] wire) throws StompProtocolException {
    return decode(new String(wire, StandardCharsets.UTF_8));
  }

  public static StompFrame decode(String wire) throws StompProtocolException {
    if (wire == null) {
      throw new StompProtocolException("Invalid frame: null");
    }
    int length = wire.length();

    // command
    int eol = wire.indexOf(LF);
    String command = (eol < 0 ? wire : wire.substring(0, eol)).trim();
    if (command.isEmpty()) {
      throw new StompProtocolException("Invalid frame: missing command");
    }

    // headers, until the first empty line
    Map<String, String> headers = new LinkedHashMap<String, String>();
    int bodyStart = -1;
    int pos = eol < 0 ? length : eol + 1;
    while (pos < length) {
      int next = wire.indexOf(LF, pos);
      String line = stripCR(next < 0 ? wire.substring(pos) : wire.substring(pos, next));
      if (line.isEmpty()) {
        bodyStart = next < 0 ? length : next + 1;
        break;
      }
      int colon = line.indexOf(':');
      if (colon >= 0) {
        String key = line.substring(0, colon);
        // repeated header: first occurrence wins
        if (!headers.containsKey(key)) {
          headers.put(key, line.substring(colon + 1));
        }
      }
      pos = next < 0 ? length : next + 1;
    }

    String body = bodyStart < 0 ? null : parseBody(wire.substring(bodyStart), headers);
    return new StompFrame(command, headers, body);
  }

  private static String parseBody(String rest, Map<String, String> headers) {
    Integer contentLength = parseContentLength(headers.get(StompProtocol.HEADER_CONTENT_LENGTH));
    if (contentLength != null) {
      byte[] bytes = rest.getBytes(StandardCharsets.UTF_8);
      if (contentLength <= bytes.length && !isContinuationByte(bytes, contentLength)) {
        return new String(bytes, 0, contentLength, StandardCharsets.UTF_8);
      }
      // shorter than announced, or cut inside a UTF-8 sequence: use the NULL terminator
    }
    int end = rest.indexOf(NULL);
    String body = end < 0 ? rest : rest.substring(0, end);
    return body.isEmpty() ? null : body;
  }

  private static boolean isContinuationByte(byte[] bytes, int index) {
    return index < bytes.length && (bytes[index] & 0xC0) == 0x80;
  }

  private static Integer parseContentLength(String value) {
    if (value == null) {
      return null;
    }
    try {
      int contentLength = Integer.parseInt(value.trim());
      return contentLength >= 0 ? contentLength : null;
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static String stripCR(String line) {
    return line.endsWith(String.valueOf(CR)) ? line.substring(0, line.length() - 1) : line;
  }
}
