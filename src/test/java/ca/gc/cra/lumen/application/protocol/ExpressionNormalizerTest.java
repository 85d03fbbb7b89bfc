package ca.gc.cra.lumen.application.protocol;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class ExpressionNormalizerTest {

  @Test
  void trailingMethodColonBecomesDot() {
    assertEquals("player.getName", ExpressionNormalizer.normalize(" player:getName "));
    assertEquals("world.player.hp", ExpressionNormalizer.normalize("world.player:hp"));
  }

  @Test
  void callsAreLeftAlone() {
    assertEquals("player:getName()", ExpressionNormalizer.normalize("player:getName()"));
  }

  @Test
  void colonBeforeLastDotIsKept() {
    assertEquals("a:b.c", ExpressionNormalizer.normalize("a:b.c"));
  }

  @Test
  void nullBecomesEmpty() {
    assertEquals("", ExpressionNormalizer.normalize(null));
  }
}
