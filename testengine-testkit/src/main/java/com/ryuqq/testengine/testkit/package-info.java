/**
 * Test fixtures for executor and handler tests.
 *
 * <ul>
 *   <li>{@link com.ryuqq.testengine.testkit.RecordingResultHandler} - Records every lifecycle event as a string</li>
 *   <li>{@link com.ryuqq.testengine.testkit.SampleSuites} - Ready-made groups covering each outcome and fixture failure</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.testengine.testkit;
