package ca.gc.cra.imagine.application.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.imagine.application.port.MetricsPort;
import ca.gc.cra.imagine.config.ImagineConfig;
import ca.gc.cra.imagine.domain.call.CallArguments;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ImaginedTest {
  private ImagineEngine engine;
  private Imagined<Integer> f;

  @BeforeEach
  void setUp() {
    engine = new ImagineEngine(ImagineConfig.defaults(), MetricsPort.NO_OP);
    f = engine.wrap("f", args -> -args.<Integer>get(0));
  }

  private List<Integer> values() {
    return List.of(f.call(1), f.call(2), f.call(3));
  }

  @Test
  void callsOriginalWhenNothingIsActive() {
    assertEquals(List.of(-1, -2, -3), values());
    assertEquals(0, f.depth());
  }

  @Test
  void pointOverrideAppliesOnlyWhileActive() {
    SceneActivation<Integer> w = f.at(1).imagine(2);
    assertEquals(-1, f.call(1));
    try (Scope ignored = w.enter()) {
      assertEquals(List.of(2, -2, -3), values());
    }
    assertEquals(List.of(-1, -2, -3), values());
  }

  @Test
  void nestedScenesShadowOuterScenes() {
    assertEquals(List.of(-1, -2, -3), values());
    try (Scope outer = f.at(1).imagine(2).at(2).imagine(3).enter()) {
      assertEquals(List.of(2, 3, -3), values());
      try (Scope inner = f.at(1).imagine(3).enter()) {
        assertEquals(List.of(3, 3, -3), values());
        SceneActivation<Integer> w = f.at(1).imagine(4).at(3).imagine(6);
        assertEquals(List.of(3, 3, -3), values());
        try (Scope first = w.enter()) {
          assertEquals(List.of(4, 3, 6), values());
        }
        assertEquals(List.of(3, 3, -3), values());
        try (Scope second = w.enter()) {
          assertEquals(List.of(4, 3, 6), values());
        }
        assertEquals(List.of(3, 3, -3), values());
      }
      assertEquals(List.of(2, 3, -3), values());
    }
    assertEquals(List.of(-1, -2, -3), values());
    assertEquals(0, f.depth());
  }

  @Test
  void derivedActivationsNeverChangeTheirBase() {
    SceneActivation<Integer> w = f.at(1).imagine(2);
    SceneActivation<Integer> w1 = w.at(2).imagine(3);
    SceneActivation<Integer> w2 = w.at(3).imagine(4);

    assertEquals(List.of(-1, -2, -3), values());
    assertEquals(List.of(2, -2, -3), w.supply(this::values));
    assertEquals(List.of(2, 3, -3), w1.supply(this::values));
    assertEquals(List.of(2, -2, 4), w2.supply(this::values));
    assertEquals(List.of(2, -2, -3), w.supply(this::values));
    assertEquals(List.of(-1, -2, -3), values());
  }

  @Test
  void chainsAreCapturedWhenBuiltNotWhenEntered() {
    SceneActivation<Integer> w = f.at(1).imagine(2);
    SceneActivation<Integer> w1 = f.at(2).imagine(3);
    SceneActivation<Integer> w2 = f.at(3).imagine(4);

    try (Scope outer = w.enter()) {
      assertEquals(List.of(2, -2, -3), values());
      assertEquals(List.of(-1, 3, -3), w1.supply(this::values));
      assertEquals(List.of(-1, -2, 4), w2.supply(this::values));
      assertEquals(List.of(2, -2, -3), values());
    }
  }

  @Test
  void rebaseLayersOntoLiveOverrides() {
    SceneActivation<Integer> w = f.at(1).imagine(2);
    SceneActivation<Integer> w1 = f.at(2).imagine(3);
    SceneActivation<Integer> w2 = f.at(3).imagine(4);

    try (Scope outer = w.enter()) {
      SceneActivation<Integer> w11 = w1.rebase();
      assertEquals(List.of(2, 3, -3), w11.supply(this::values));
      SceneActivation<Integer> w21 = w2.rebase();
      assertEquals(List.of(2, -2, 4), w21.supply(this::values));
      assertEquals(List.of(-1, 3, -3), w1.supply(this::values));
      assertEquals(List.of(2, -2, -3), values());
    }
    assertEquals(List.of(-1, -2, -3), values());
  }

  @Test
  void rebaseWithNothingActiveReturnsSameActivation() {
    SceneActivation<Integer> w = f.at(2).imagine(3);
    assertSame(w, w.rebase());
  }

  @Test
  void universalOverrideIsShadowedByLaterPoint() {
    try (Scope constant = f.imagine(0).enter()) {
      assertEquals(List.of(0, 0, 0), values());
      assertEquals(0, f.call(5));
      try (Scope point = f.at(5).imagine(9).enter()) {
        assertEquals(9, f.call(5));
        assertEquals(0, f.call(4));
      }
      assertEquals(0, f.call(5));
    }
    assertEquals(-5, f.call(5));
  }

  @Test
  void laterUniversalOverrideWinsOverEarlierPoint() {
    SceneActivation<Integer> w = f.at(5).imagine(9).imagine(0);
    assertEquals(0, w.supply(() -> f.call(5)));
  }

  @Test
  void keywordPointsRequireExactKeywords() {
    Imagined<Integer> scaled = engine.wrap("scaled",
        args -> args.<Integer>get(0) * args.<Integer>keyword("scale", 1));
    SceneActivation<Integer> w = scaled.at(CallArguments.of(2).with("scale", 1)).imagine(100);

    try (Scope ignored = w.enter()) {
      assertEquals(100, scaled.call(CallArguments.of(2).with("scale", 1)));
      assertEquals(2, scaled.call(2));
      assertEquals(6, scaled.call(CallArguments.of(2).with("scale", 3)));
    }
  }

  @Test
  void guardedSubDomainOverride() {
    SceneActivation<Integer> w = f.when(args -> args.<Integer>get(0) > 2).imagine(0);
    assertEquals(List.of(-1, -2, 0), w.supply(this::values));
  }

  @Test
  void imaginedNullIsAValue() {
    Imagined<String> name = engine.wrap("name", args -> "computed");
    assertNull(name.at("x").imagine(null).supply(() -> name.call("x")));
  }

  @Test
  void pointBuilderCanBeBoundRepeatedly() {
    PointBuilder<Integer> at = f.at(3);
    for (int i = 0; i < 3; i++) {
      int expected = i;
      assertEquals(expected, at.imagine(i).supply(() -> f.call(3)));
    }
    assertEquals(-3, f.call(3));
  }

  @Test
  void arrayPointIsRejectedWhenImagined() {
    Imagined<Integer> length = engine.wrap("length", args -> ((int[]) args.get(0)).length);
    PointBuilder<Integer> at = length.at((Object) new int[] {1, 2});
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> at.imagine(5));
    assertTrue(ex.getMessage().contains("argument 0"));
  }

  @Test
  void computationFailurePropagatesUnchanged() {
    IllegalStateException boom = new IllegalStateException("boom");
    Imagined<Integer> failing = engine.wrap("failing", args -> {
      throw boom;
    });
    assertSame(boom, assertThrows(IllegalStateException.class, () -> failing.call(1)));
    assertEquals(7, failing.at(1).imagine(7).supply(() -> failing.call(1)));
  }

  @Test
  void scopeIsReleasedWhenBodyThrows() {
    SceneActivation<Integer> w = f.at(1).imagine(2);
    assertThrows(IllegalStateException.class, () -> w.run(() -> {
      assertEquals(2, f.call(1));
      throw new IllegalStateException("abandon");
    }));
    assertEquals(-1, f.call(1));
    assertEquals(0, f.depth());
    assertFalse(w.isActive());
  }

  @Test
  void callDoesNotMoveTheCursor() {
    AtomicInteger computed = new AtomicInteger();
    Imagined<Integer> counted = engine.wrap("counted", args -> computed.incrementAndGet());
    try (Scope ignored = counted.at(1).imagine(0).enter()) {
      counted.call(1);
      counted.call(2);
      assertEquals(1, counted.depth());
    }
    assertEquals(1, computed.get());
  }

  @Test
  void exitWithoutEnterIsRejected() {
    assertThrows(IllegalStateException.class, () -> f.at(1).imagine(2).exit());
  }

  @Test
  void scopeClosesOnlyOnce() {
    SceneActivation<Integer> w = f.at(1).imagine(2);
    Scope scope = w.enter();
    scope.close();
    scope.close();
    assertTrue(scope.isClosed());
    assertEquals(0, f.depth());
  }

  @Test
  void sameActivationCanNestInsideItself() {
    SceneActivation<Integer> w = f.at(1).imagine(2);
    try (Scope outer = w.enter()) {
      try (Scope inner = w.enter()) {
        assertEquals(2, f.depth());
        assertEquals(2, f.call(1));
      }
      assertEquals(2, f.call(1));
      assertEquals(1, f.depth());
    }
    assertEquals(-1, f.call(1));
  }

  @Test
  void backtrackSeesEarlierStates() {
    try (Scope outer = f.at(0).imagine(1).enter()) {
      try (Scope inner = f.at(0).imagine(5).enter()) {
        assertSame(f, f.backtrack(0));
        assertEquals(5, f.call(0));
        assertEquals(1, f.backtrack(1).call(0));
        assertEquals(0, f.backtrack(2).call(0));
        assertEquals(4, f.call(0) - f.backtrack(1).call(0));
        assertThrows(IllegalArgumentException.class, () -> f.backtrack(3));
        assertThrows(IllegalArgumentException.class, () -> f.backtrack(-1));
      }
    }
  }

  @Test
  void backtrackViewIsDetached() {
    try (Scope outer = f.at(0).imagine(1).enter()) {
      Imagined<Integer> before = f.backtrack(1);
      assertEquals(0, before.depth());
      try (Scope onView = before.at(0).imagine(42).enter()) {
        assertEquals(42, before.call(0));
        assertEquals(1, f.call(0));
        assertEquals(1, f.depth());
      }
    }
  }
}
