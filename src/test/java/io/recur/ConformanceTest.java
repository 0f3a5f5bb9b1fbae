package io.recur;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.recur.model.Schedule;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.TestFactory;

/** Conformance tests loaded from fixtures.json. */
public class ConformanceTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<Map<String, Object>> MAP_TYPE =
      new TypeReference<Map<String, Object>>() {};
  private static JsonNode FIXTURES;

  @BeforeAll
  static void loadFixtures() throws IOException {
    try (InputStream in = ConformanceTest.class.getResourceAsStream("/fixtures.json")) {
      assertNotNull(in, "fixtures.json missing from the test classpath");
      FIXTURES = MAPPER.readTree(in);
    }
  }

  @TestFactory
  Stream<DynamicTest> classifyTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : FIXTURES.get("cases")) {
      Map<String, Object> raw = MAPPER.convertValue(tc.get("raw"), MAP_TYPE);
      String expected = tc.get("type").asText();
      tests.add(
          DynamicTest.dynamicTest(
              tc.get("name").asText(),
              () -> {
                assertEquals(expected, Schedules.determineScheduleType(raw).name());
                // Repeated calls agree
                assertEquals(
                    Schedules.determineScheduleType(raw), Schedules.determineScheduleType(raw));
              }));
    }
    return tests.stream();
  }

  @TestFactory
  Stream<DynamicTest> parseTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : FIXTURES.get("cases")) {
      Map<String, Object> raw = MAPPER.convertValue(tc.get("raw"), MAP_TYPE);
      tests.add(
          DynamicTest.dynamicTest(
              tc.get("name").asText(),
              () -> {
                Schedule s = Schedules.parse(raw);
                assertEquals(tc.get("type").asText(), s.scheduleType().name(), "scheduleType");
                assertEquals(tc.get("frequency").asText(), s.frequency().name(), "frequency");
                assertEquals(raw, s.raw(), "raw");
              }));
    }
    return tests.stream();
  }

  @TestFactory
  Stream<DynamicTest> describeTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : FIXTURES.get("cases")) {
      Map<String, Object> raw = MAPPER.convertValue(tc.get("raw"), MAP_TYPE);
      String expected = tc.get("description").asText();
      tests.add(
          DynamicTest.dynamicTest(
              tc.get("name").asText(),
              () -> assertEquals(expected, Schedules.describe(Schedules.parse(raw)))));
    }
    return tests.stream();
  }
}
