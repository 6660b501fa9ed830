/**
 * Fixture scope management.
 *
 * <p>{@link com.ryuqq.testengine.core.fixture.FixtureState} decides, item by item, when group and
 * namespace hooks run during a depth-first traversal. A failed setUp poisons its scope: the
 * items inside are not executed and the matching tearDown is never invoked.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.testengine.core.fixture;
