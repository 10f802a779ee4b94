/**
 * Possibility Orchestrator - fans one prompt out to many provider/model/temperature
 * combinations and streams every answer back under a fixed concurrency ceiling.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.possibility.pool.PossibilityPool} - bounded, cancellable streaming
 *       of the possibilities of a round, driven by a single Disruptor consumer</li>
 *   <li>{@link fr.lapetina.possibility.lifecycle.GenerationLifecycleStateMachine} - guarded
 *       state machine tracking the round</li>
 *   <li>{@link fr.lapetina.possibility.round.GenerationRound} - couples the two for one round</li>
 *   <li>{@link fr.lapetina.possibility.OrchestratorFactory} - wiring from YAML configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (OrchestratorFactory factory = OrchestratorFactory.create("config.yaml").start();
 *      GenerationRound round = factory.newRound()) {
 *     round.start(List.of(ChatMessage.user("Hello!")), settings);
 *     round.awaitTermination(Duration.ofMinutes(1));
 *     round.getCompletedPossibilities().forEach(r -> System.out.println(r.content()));
 * }
 * }</pre>
 *
 * @see fr.lapetina.possibility.OrchestratorFactory
 */
package fr.lapetina.possibility;
