/**
 * <strong>Purpose:</strong> Engine configuration: the settings record, its file loaders, and precedence merging.
 * <p><strong>Concurrency:</strong> Loaders are stateless; the config record is immutable.
 * <p><strong>Observability:</strong> Unknown keys are reported through SLF4J warnings.
 *
 * @since 0.1.0
 */
package ca.gc.cra.imagine.config;
