/**
 * YAML configuration loading.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code pool} - concurrency ceiling, ring buffer size and wait strategy</li>
 *   <li>{@code endpoint} - generation endpoint URL, path template and stream prefix</li>
 *   <li>{@code lifecycle} - retry budget of a round</li>
 *   <li>{@code generation} - metadata defaults, popular models, load time estimates</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * @see fr.lapetina.possibility.infrastructure.config.OrchestratorConfig
 * @see fr.lapetina.possibility.infrastructure.config.ConfigLoader
 */
package fr.lapetina.possibility.infrastructure.config;
