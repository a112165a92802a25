/**
 * <strong>Purpose:</strong> Public entry point of the library; wraps functions and wires the default engine.
 *
 * @since 0.1.0
 */
package ca.gc.cra.imagine.api;
