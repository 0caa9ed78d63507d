package io.cronmatch;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.TestFactory;

/** Conformance tests loaded from conformance.json on the test classpath. */
public class ConformanceTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static JsonNode CASES;

  @BeforeAll
  static void loadCases() throws IOException {
    try (InputStream in = ConformanceTest.class.getResourceAsStream("/conformance.json")) {
      assertNotNull(in, "conformance.json missing from test resources");
      CASES = MAPPER.readTree(in);
    }
  }

  // Parse tests

  @TestFactory
  Stream<DynamicTest> parseTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : CASES.get("parse").get("tests")) {
      String name = tc.get("name").asText();
      String input = tc.get("input").asText();
      String canonical = tc.get("canonical").asText();

      tests.add(
          DynamicTest.dynamicTest(
              "parse/" + name,
              () -> {
                CronExpression expr = CronExpression.parse(input);
                assertEquals(canonical, expr.rule(), "parse(" + input + ").rule()");

                // Roundtrip test
                CronExpression again = CronExpression.parse(canonical);
                assertEquals(
                    canonical, again.rule(), "roundtrip: parse(" + canonical + ").rule()");
              }));
    }
    return tests.stream();
  }

  @TestFactory
  Stream<DynamicTest> parseErrorTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : CASES.get("parse_errors").get("tests")) {
      String name = tc.get("name").asText();
      String input = tc.get("input").asText();
      ErrorKind kind = ErrorKind.valueOf(tc.get("kind").asText());

      tests.add(
          DynamicTest.dynamicTest(
              "parse_errors/" + name,
              () -> {
                CronException e =
                    assertThrows(
                        CronException.class,
                        () -> CronExpression.parse(input),
                        "expected parse error for: " + input);
                assertEquals(kind, e.kind(), "error kind for: " + input);
                assertFalse(CronExpression.validate(input));
              }));
    }
    return tests.stream();
  }

  // Match tests

  @TestFactory
  Stream<DynamicTest> matchesTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : CASES.get("matches").get("tests")) {
      String name = "matches/" + tc.get("name").asText();
      String expression = tc.get("expression").asText();
      String datetime = tc.get("datetime").asText();
      boolean expected = tc.get("expected").asBoolean();

      tests.add(
          DynamicTest.dynamicTest(
              name,
              () -> {
                CronExpression expr = CronExpression.parse(expression);
                assertEquals(
                    expected,
                    expr.matches(datetime),
                    "matches() for: " + expression + " at " + datetime);
              }));
    }
    return tests.stream();
  }

  @TestFactory
  Stream<DynamicTest> matchDetailTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : CASES.get("match_detail").get("tests")) {
      String name = "match_detail/" + tc.get("name").asText();
      String expression = tc.get("expression").asText();
      String datetime = tc.get("datetime").asText();
      int expected = tc.get("expected").asInt();

      tests.add(
          DynamicTest.dynamicTest(
              name,
              () -> {
                CronExpression expr = CronExpression.parse(expression);
                assertEquals(
                    expected,
                    expr.matchDetail(datetime),
                    "matchDetail() for: " + expression + " at " + datetime);
              }));
    }
    return tests.stream();
  }
}
