/**
 * <strong>Purpose:</strong> Ports between the override engine and its collaborators: the original computation and
 * metrics backends.
 * <p><strong>Concurrency:</strong> Contracts note their own thread-safety expectations.
 *
 * @since 0.1.0
 */
package ca.gc.cra.imagine.application.port;
