/**
 * <strong>Purpose:</strong> Persistent override chains: scenes, guards, and the algorithms walking them.
 * <p><strong>Concurrency:</strong> Everything here is immutable or stateless.
 * <p><strong>Performance:</strong> Lookups are linear in chain length; extension is O(1).
 *
 * @since 0.1.0
 */
package ca.gc.cra.imagine.domain.scene;
