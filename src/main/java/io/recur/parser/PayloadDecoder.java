package io.recur.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.recur.ValidationIssue;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes the advanced schedule payload, which the platform sends either as a JSON object or as a
 * string holding one.
 */
public final class PayloadDecoder {
  private static final Logger logger = LoggerFactory.getLogger(PayloadDecoder.class);

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE =
      new TypeReference<LinkedHashMap<String, Object>>() {};

  private PayloadDecoder() {}

  /**
   * The outcome of decoding a payload.
   *
   * @param settings the decoded object, empty if decoding failed
   * @param undecoded the payload text when decoding failed, otherwise null
   */
  public record Decoded(Map<String, Object> settings, String undecoded) {
    /** Treats null settings as empty. */
    public Decoded {
      settings = settings == null ? Map.of() : settings;
    }

    static Decoded empty() {
      return new Decoded(Map.of(), null);
    }
  }

  /**
   * Decodes a payload. Failures are reported to the context and never thrown.
   *
   * @param payload a map, a JSON string, or null
   * @param ctx the context collecting issues
   * @return the decoded payload
   */
  public static Decoded decode(Object payload, ParseContext ctx) {
    if (!RawRecord.isTruthy(payload)) {
      return Decoded.empty();
    }
    if (payload instanceof Map) {
      return new Decoded(stringKeys((Map<?, ?>) payload), null);
    }
    String text = payload.toString();
    if (!(payload instanceof String)) {
      ctx.report(
          ValidationIssue.malformedJson(
              RawRecord.ADVANCED, payload, "expected an object, got " + describe(payload)));
      return new Decoded(Map.of(), text);
    }
    try {
      Map<String, Object> decoded = MAPPER.readValue(text, MAP_TYPE);
      if (decoded == null) {
        ctx.report(ValidationIssue.malformedJson(RawRecord.ADVANCED, payload, "null payload"));
        return new Decoded(Map.of(), text);
      }
      return new Decoded(decoded, null);
    } catch (JsonProcessingException e) {
      logger.debug("Keeping undecodable advanced schedule payload verbatim: {}", text, e);
      ctx.report(
          ValidationIssue.malformedJson(RawRecord.ADVANCED, payload, e.getOriginalMessage()));
      return new Decoded(Map.of(), text);
    }
  }

  private static Map<String, Object> stringKeys(Map<?, ?> map) {
    Map<String, Object> result = new LinkedHashMap<>();
    map.forEach((k, v) -> result.put(String.valueOf(k), v));
    return result;
  }

  private static String describe(Object value) {
    return value instanceof Iterable ? "an array" : value.getClass().getSimpleName();
  }
}
