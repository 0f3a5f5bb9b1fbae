package io.recur.parser;

import static org.junit.jupiter.api.Assertions.*;

import io.recur.ErrorKind;
import io.recur.ValidationIssue;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class PayloadDecoderTest {

  @Test
  void testMapIsUsedAsIs() {
    ParseContext ctx = new ParseContext();
    PayloadDecoder.Decoded d = PayloadDecoder.decode(Map.of("frequency", "DAILY"), ctx);
    assertEquals(Map.of("frequency", "DAILY"), d.settings());
    assertNull(d.undecoded());
    assertTrue(ctx.issues().isEmpty());
  }

  @Test
  void testJsonStringIsDecoded() {
    ParseContext ctx = new ParseContext();
    PayloadDecoder.Decoded d =
        PayloadDecoder.decode("{\"frequency\":\"WEEKLY\",\"daysOfWeek\":[1,3]}", ctx);
    assertEquals("WEEKLY", d.settings().get("frequency"));
    assertEquals(List.of(1, 3), d.settings().get("daysOfWeek"));
    assertTrue(ctx.issues().isEmpty());
  }

  @Test
  void testMalformedJsonIsKeptAndReported() {
    ParseContext ctx = new ParseContext();
    PayloadDecoder.Decoded d = PayloadDecoder.decode("{frequency: DAILY", ctx);
    assertTrue(d.settings().isEmpty());
    assertEquals("{frequency: DAILY", d.undecoded());

    List<ValidationIssue> issues = ctx.issues();
    assertEquals(1, issues.size());
    assertEquals(ErrorKind.MALFORMED_JSON, issues.get(0).kind());
    assertEquals("advancedScheduleJson", issues.get(0).field());
    assertEquals("{frequency: DAILY", issues.get(0).value());
  }

  @Test
  void testJsonArrayIsNotAnObject() {
    ParseContext ctx = new ParseContext();
    PayloadDecoder.Decoded d = PayloadDecoder.decode("[1, 2, 3]", ctx);
    assertTrue(d.settings().isEmpty());
    assertEquals("[1, 2, 3]", d.undecoded());
    assertEquals(ErrorKind.MALFORMED_JSON, ctx.issues().get(0).kind());
  }

  @Test
  void testJsonNullIsNotAnObject() {
    ParseContext ctx = new ParseContext();
    PayloadDecoder.Decoded d = PayloadDecoder.decode("null", ctx);
    assertEquals("null", d.undecoded());
    assertEquals(1, ctx.issues().size());
  }

  @Test
  void testNonStringPayloadIsReported() {
    ParseContext ctx = new ParseContext();
    PayloadDecoder.Decoded d = PayloadDecoder.decode(List.of(1, 2), ctx);
    assertEquals("[1, 2]", d.undecoded());
    assertTrue(ctx.issues().get(0).message().contains("an array"));
  }

  @Test
  void testEmptyPayload() {
    ParseContext ctx = new ParseContext();
    assertTrue(PayloadDecoder.decode(null, ctx).settings().isEmpty());
    assertTrue(PayloadDecoder.decode("", ctx).settings().isEmpty());
    assertNull(PayloadDecoder.decode(Map.of(), ctx).undecoded());
    assertTrue(ctx.issues().isEmpty());
  }
}
