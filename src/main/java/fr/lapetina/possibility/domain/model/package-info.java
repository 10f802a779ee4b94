/**
 * Immutable domain records of a generation round.
 *
 * <ul>
 *   <li>{@link fr.lapetina.possibility.domain.model.PossibilityMetadata} - what to generate</li>
 *   <li>{@link fr.lapetina.possibility.domain.model.PossibilityResult} - what was generated so far</li>
 *   <li>{@link fr.lapetina.possibility.domain.model.PossibilityStatus} - per-possibility lifecycle</li>
 *   <li>{@link fr.lapetina.possibility.domain.model.ErrorType} - failure taxonomy</li>
 * </ul>
 */
package fr.lapetina.possibility.domain.model;
