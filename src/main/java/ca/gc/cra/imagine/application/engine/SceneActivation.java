package ca.gc.cra.imagine.application.engine;

import ca.gc.cra.imagine.config.BalanceCheck;
import ca.gc.cra.imagine.domain.call.CallArguments;
import ca.gc.cra.imagine.domain.scene.Chains;
import ca.gc.cra.imagine.domain.scene.Guard;
import ca.gc.cra.imagine.domain.scene.Scene;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Activation of one override chain on one {@link Imagined} callable.
 * <p><strong>Why:</strong> The unit of "what if": entering it makes the chain visible to every caller of the target,
 * exiting restores what was visible before.</p>
 * <p><strong>Role:</strong> Produced by {@link PointBuilder#imagine(Object)} and {@link Imagined#imagine(Object)};
 * further overrides chain fluently: {@code f.at(0).imagine(2).at(1).imagine(3)}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Record the cursor's head on every entry and restore exactly that head on the matching exit.</li>
 *   <li>Report exits that happen while another chain is active for the target.</li>
 *   <li>Build derived activations without altering its own chain.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; see {@link Activation}.</p>
 * <p><strong>Observability:</strong> Counts {@code <prefix>.activation.entered}, {@code .exited},
 * {@code .unbalanced} and {@code .rebased}. Records the length of each entered chain in the
 * {@code <prefix>.activation.chain.length} histogram; logs entries and exits at DEBUG.</p>
 *
 * @param <R> result type of the target callable
 * @since 0.1.0
 */
public final class SceneActivation<R> implements Activation {
  private static final Logger log = LoggerFactory.getLogger(SceneActivation.class);

  private final Imagined<R> target;
  private final Scene<R> head;
  private final Deque<Entry<R>> entries = new ArrayDeque<>();

  SceneActivation(Imagined<R> target, Scene<R> head) {
    this.target = Objects.requireNonNull(target, "target");
    this.head = head;
  }

  /** Whether at least one entry is still open. */
  public boolean isActive() {
    return !entries.isEmpty();
  }

  /**
   * Starts a further point override on top of this activation's chain.
   *
   * @param positional positional components of the point
   * @return builder bound to this chain
   */
  public PointBuilder<R> at(Object... positional) {
    return at(CallArguments.of(positional));
  }

  /**
   * Starts a further point override, with keywords, on top of this activation's chain.
   *
   * @param point full point including keywords
   * @return builder bound to this chain
   */
  public PointBuilder<R> at(CallArguments point) {
    return PointBuilder.atPoint(target, head, point);
  }

  /**
   * Starts a further override on top of this chain that applies wherever {@code guard} matches.
   *
   * @param guard sub-domain predicate
   * @return builder bound to this chain
   */
  public PointBuilder<R> when(Guard guard) {
    return PointBuilder.where(target, head, guard);
  }

  /**
   * Extends this chain with an override for every input.
   *
   * @param value constant result
   * @return new activation; this one is unchanged
   */
  public SceneActivation<R> imagine(R value) {
    return new SceneActivation<>(target, new Scene<>(head, Guard.ALWAYS, value));
  }

  @Override
  public Scope enter() {
    Cursor<R> cursor = target.cursor();
    Scene<R> prior = cursor.active();
    int depth = cursor.push(head);
    entries.push(new Entry<>(prior, depth));
    ImagineEngine engine = target.engine();
    int scenes = Chains.length(head);
    engine.metrics().increment(engine.metric("activation.entered"));
    engine.metrics().observe(engine.metric("activation.chain.length"), scenes);
    log.debug("Entered {} scenes on {} (depth {})", scenes, target.name(), depth + 1);
    return new Scope(this);
  }

  @Override
  public void exit() {
    Entry<R> entry = entries.poll();
    if (entry == null) {
      throw new IllegalStateException("Activation on " + target.name() + " exited without a matching enter");
    }
    Cursor<R> cursor = target.cursor();
    boolean balanced = cursor.active() == head && cursor.depth() == entry.depth() + 1;
    cursor.restore(entry.prior(), entry.depth());
    ImagineEngine engine = target.engine();
    engine.metrics().increment(engine.metric("activation.exited"));
    log.debug("Exited scenes on {} (depth {})", target.name(), entry.depth());
    if (!balanced) {
      reportUnbalanced(engine);
    }
  }

  private void reportUnbalanced(ImagineEngine engine) {
    BalanceCheck mode = engine.config().balanceCheck();
    if (mode == BalanceCheck.OFF) {
      return;
    }
    engine.metrics().increment(engine.metric("activation.unbalanced"));
    String message = "Activation on " + target.name()
        + " exited while a later activation for the same callable was still active";
    if (mode == BalanceCheck.FAIL) {
      throw new UnbalancedActivationException(target.name(), message);
    }
    log.warn(message);
  }

  @Override
  public Activation combine(Activation other) {
    return new CompositeActivation(List.of(this, Objects.requireNonNull(other, "other")));
  }

  /**
   * Copies this chain on top of the target's currently active chain. Guards and values are shared; neither chain is
   * modified. Returns this activation when nothing is active.
   *
   * @return activation whose chain sees both the live overrides and this one's
   */
  @Override
  public SceneActivation<R> rebase() {
    Scene<R> live = target.cursor().active();
    if (live == null) {
      return this;
    }
    ImagineEngine engine = target.engine();
    engine.metrics().increment(engine.metric("activation.rebased"));
    if (log.isDebugEnabled()) {
      log.debug("Rebased {} scenes onto {} live scenes of {}",
          Chains.length(head), Chains.length(live), target.name());
    }
    return new SceneActivation<>(target, Chains.graft(head, live));
  }

  @Override
  public String toString() {
    return "SceneActivation[" + target.name() + ", " + Chains.length(head) + " scenes]";
  }

  private record Entry<R>(Scene<R> prior, int depth) {}
}
