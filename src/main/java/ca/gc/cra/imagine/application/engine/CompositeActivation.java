package ca.gc.cra.imagine.application.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Ordered group of activations entered and exited as one unit.
 * <p><strong>Why:</strong> What-if scenarios often override several callables at once:
 * <pre>{@code
 * f.at(0).imagine(g.call(0)).combine(g.at(0).imagine(f.call(0))).run(() -> ...);
 * }</pre>
 * <p><strong>Role:</strong> Flattens nested groups depth-first; leaves are entered left to right and exited right to
 * left, so several activations on the same callable restore correctly.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; see {@link Activation}.</p>
 *
 * <p>Targets are not required to be distinct; where two leaves override the same point, the later one wins while
 * both are active.
 *
 * @since 0.1.0
 */
public final class CompositeActivation implements Activation {
  private static final Logger log = LoggerFactory.getLogger(CompositeActivation.class);

  private final List<Activation> components;

  CompositeActivation(List<Activation> components) {
    this.components = List.copyOf(components);
  }

  /**
   * Non-composite activations in entry order.
   *
   * @return depth-first, left-to-right flattening
   */
  public List<Activation> leaves() {
    List<Activation> leaves = new ArrayList<>();
    Deque<Activation> work = new ArrayDeque<>();
    work.push(this);
    while (!work.isEmpty()) {
      Activation next = work.pop();
      if (next instanceof CompositeActivation composite) {
        List<Activation> children = composite.components;
        for (int i = children.size() - 1; i >= 0; i--) {
          work.push(children.get(i));
        }
      } else {
        leaves.add(next);
      }
    }
    return leaves;
  }

  /**
   * Enters every leaf in declared order. If one fails, the leaves already entered are exited in reverse before the
   * failure propagates.
   */
  @Override
  public Scope enter() {
    List<Activation> leaves = leaves();
    int entered = 0;
    try {
      for (Activation leaf : leaves) {
        leaf.enter();
        entered++;
      }
    } catch (RuntimeException ex) {
      for (int i = entered - 1; i >= 0; i--) {
        try {
          leaves.get(i).exit();
        } catch (RuntimeException rollback) {
          ex.addSuppressed(rollback);
        }
      }
      throw ex;
    }
    log.debug("Entered {} activations", leaves.size());
    return new Scope(this);
  }

  /**
   * Exits every leaf in reverse order. All leaves are exited even if one fails; the first failure is rethrown with
   * the others suppressed.
   */
  @Override
  public void exit() {
    List<Activation> leaves = leaves();
    RuntimeException failure = null;
    for (int i = leaves.size() - 1; i >= 0; i--) {
      try {
        leaves.get(i).exit();
      } catch (RuntimeException ex) {
        if (failure == null) {
          failure = ex;
        } else {
          failure.addSuppressed(ex);
        }
      }
    }
    log.debug("Exited {} activations", leaves.size());
    if (failure != null) {
      throw failure;
    }
  }

  @Override
  public Activation combine(Activation other) {
    return new CompositeActivation(List.of(this, Objects.requireNonNull(other, "other")));
  }

  /** Rebases every leaf onto its target's live chain, keeping the order. */
  @Override
  public Activation rebase() {
    List<Activation> rebased = new ArrayList<>();
    for (Activation leaf : leaves()) {
      rebased.add(leaf.rebase());
    }
    return new CompositeActivation(rebased);
  }

  @Override
  public String toString() {
    return "CompositeActivation" + components;
  }
}
