/**
 * Result collection and dispatch.
 *
 * <p>{@link com.ryuqq.testengine.core.result.ResultCollector} is the single funnel for all
 * lifecycle events: it builds {@link com.ryuqq.testengine.core.model.Outcome}s, owns the
 * per-test {@link com.ryuqq.testengine.core.result.CapturedOutput}, tracks sticky success
 * and stop flags, and fans events out to {@link com.ryuqq.testengine.core.result.ResultHandler}s.</p>
 *
 * <h2>Handler order</h2>
 * <p>User handlers first, then {@link com.ryuqq.testengine.core.result.CoreResultHandler}s;
 * each group sorted by class name. The order is cached until a handler is added.</p>
 *
 * <h2>Built-in handlers</h2>
 * <ul>
 *   <li>{@link com.ryuqq.testengine.core.result.SummaryResultHandler} - Run summary (OK / FAILED counts)</li>
 *   <li>{@link com.ryuqq.testengine.core.result.TimingResultHandler} - Slowest tests and duration statistics</li>
 *   <li>{@link com.ryuqq.testengine.core.result.CollectingResultHandler} - Keeps outcomes in report order (worker batches)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.testengine.core.result;
