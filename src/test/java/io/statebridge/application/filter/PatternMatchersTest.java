package io.statebridge.application.filter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class PatternMatchersTest {

  @Test
  void exactPatternsMatchVerbatim() {
    PatternMatcher matcher = PatternMatchers.compile("light.kitchen");
    assertTrue(matcher.matches("light.kitchen"));
    assertFalse(matcher.matches("light.kitchen2"));
    assertFalse(matcher.matches("Light.Kitchen"));
  }

  @Test
  void starMatchesAnyRun() {
    PatternMatcher matcher = PatternMatchers.compile("binary_sensor.*_motion");
    assertTrue(matcher.matches("binary_sensor.hall_motion"));
    assertTrue(matcher.matches("binary_sensor._motion"));
    assertFalse(matcher.matches("binary_sensor.hall_motion_battery"));
  }

  @Test
  void questionMarkMatchesOneCharacter() {
    PatternMatcher matcher = PatternMatchers.compile("sensor.temp_?");
    assertTrue(matcher.matches("sensor.temp_1"));
    assertFalse(matcher.matches("sensor.temp_12"));
    assertFalse(matcher.matches("sensor.temp_"));
  }

  @Test
  void regexMetacharactersAreLiteral() {
    PatternMatcher matcher = PatternMatchers.compile("sensor.a+b(*)");
    assertTrue(matcher.matches("sensor.a+b(x)"));
    assertFalse(matcher.matches("sensor.aab(x)"));
    assertEquals("\\Qsensor.\\E.*", PatternMatchers.toRegex("sensor.*"));
  }

  @Test
  void anyOfCombinesExactAndGlob() {
    PatternMatcher matcher = PatternMatchers.anyOf(List.of("light.kitchen", "switch.*"));
    assertTrue(matcher.matches("light.kitchen"));
    assertTrue(matcher.matches("switch.fan"));
    assertFalse(matcher.matches("light.porch"));
  }

  @Test
  void emptyAnyOfMatchesNothing() {
    assertSame(PatternMatcher.NONE, PatternMatchers.anyOf(List.of()));
    assertFalse(PatternMatcher.NONE.matches("anything"));
  }
}
