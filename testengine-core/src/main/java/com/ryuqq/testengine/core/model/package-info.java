/**
 * Test execution data model.
 *
 * <p>This package defines the immutable tree the engine executes and the records it produces:</p>
 *
 * <h2>Tree</h2>
 * <ul>
 *   <li>{@link com.ryuqq.testengine.core.model.SuiteNode} - Sealed interface (permits TestItem, TestSuite)</li>
 *   <li>{@link com.ryuqq.testengine.core.model.TestSuite} - Ordered, immutable, possibly nested container</li>
 *   <li>{@link com.ryuqq.testengine.core.model.TestItem} - Sealed leaf (permits RegisteredTest, ErrorPlaceholder)</li>
 * </ul>
 *
 * <h2>Registration</h2>
 * <ul>
 *   <li>{@link com.ryuqq.testengine.core.model.Namespace} - Module-like grouping with optional fixtures</li>
 *   <li>{@link com.ryuqq.testengine.core.model.Group} - Class-like grouping and explicit method table</li>
 *   <li>{@link com.ryuqq.testengine.core.model.TestRegistry} - Group lookup and suite construction</li>
 * </ul>
 *
 * <h2>Results</h2>
 * <ul>
 *   <li>{@link com.ryuqq.testengine.core.model.Outcome} - Immutable result of one item execution</li>
 *   <li>{@link com.ryuqq.testengine.core.model.TestStatus} - Completion status</li>
 *   <li>{@link com.ryuqq.testengine.core.model.TestDuration} - Start/stop interval</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.testengine.core.model;
