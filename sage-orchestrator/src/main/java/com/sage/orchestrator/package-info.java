/**
 * Research session state machine. {@link com.sage.orchestrator.ResearchOrchestrator} runs the
 * {@link com.sage.orchestrator.PhaseStep}s registered in a {@link com.sage.orchestrator.TransitionTable},
 * checkpointing after each transition.
 */
package com.sage.orchestrator;
