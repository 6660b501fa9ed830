package com.ryuqq.testengine.testkit;

import com.ryuqq.testengine.core.model.Group;
import com.ryuqq.testengine.core.model.Namespace;
import com.ryuqq.testengine.core.model.SkipTestException;
import com.ryuqq.testengine.core.model.TestRegistry;
import com.ryuqq.testengine.core.model.TestSuite;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ready-made groups and suites for executor tests.
 *
 * <p>Bodies and hooks append to a shared trace list so tests can assert what actually ran.
 * Traces are synchronized lists and may be shared with worker threads.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SampleSuites {

    public static final String NAMESPACE = "sample";
    public static final String SKIP_REASON = "disabled for maintenance";
    public static final String SETUP_FAILURE = "database unavailable";
    public static final String PRINTED_STDOUT = "hello from stdout";
    public static final String PRINTED_STDERR = "hello from stderr";

    private SampleSuites() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Creates an empty thread-safe trace.
     *
     * @return synchronized list
     */
    public static List<String> newTrace() {
        return Collections.synchronizedList(new ArrayList<>());
    }

    /**
     * One item per completion status, in this order:
     * passes, fails, errors, skipsItself, expectedToFail, unexpectedlyPasses.
     *
     * @param trace receives "MixedOutcomes.&lt;method&gt;" for every body that starts
     * @return group
     */
    public static Group mixedOutcomes(List<String> trace) {
        return Group.builder(Namespace.of(NAMESPACE), "MixedOutcomes")
            .test("passes", context -> trace.add("MixedOutcomes.passes"))
            .test("fails", context -> {
                trace.add("MixedOutcomes.fails");
                throw new AssertionError("expected 2 but was 3");
            })
            .test("errors", context -> {
                trace.add("MixedOutcomes.errors");
                throw new IllegalStateException("connection reset");
            })
            .test("skipsItself", context -> {
                trace.add("MixedOutcomes.skipsItself");
                throw new SkipTestException("not supported on this platform");
            })
            .expectedFailure("expectedToFail", context -> {
                trace.add("MixedOutcomes.expectedToFail");
                throw new AssertionError("known bug");
            })
            .expectedFailure("unexpectedlyPasses", context -> trace.add("MixedOutcomes.unexpectedlyPasses"))
            .build();
    }

    /**
     * A skip-flagged group whose hooks and bodies would trace if they ever ran.
     *
     * @param trace receives an entry for any hook or body that runs
     * @return group with two items
     */
    public static Group skippedGroup(List<String> trace) {
        return Group.builder(Namespace.of(NAMESPACE), "SkippedGroup")
            .skip(SKIP_REASON)
            .setUp(() -> trace.add("SkippedGroup.setUp"))
            .tearDown(() -> trace.add("SkippedGroup.tearDown"))
            .test("first", context -> trace.add("SkippedGroup.first"))
            .test("second", context -> trace.add("SkippedGroup.second"))
            .build();
    }

    /**
     * A group whose setUp always throws.
     *
     * @param trace receives an entry for any hook or body that runs
     * @return group with two items
     */
    public static Group failingSetUpGroup(List<String> trace) {
        return Group.builder(Namespace.of(NAMESPACE), "FailingSetUp")
            .setUp(() -> {
                trace.add("FailingSetUp.setUp");
                throw new IllegalStateException(SETUP_FAILURE);
            })
            .tearDown(() -> trace.add("FailingSetUp.tearDown"))
            .test("first", context -> trace.add("FailingSetUp.first"))
            .test("second", context -> trace.add("FailingSetUp.second"))
            .build();
    }

    /**
     * A group whose only item fails and whose afterEach hook then throws as well.
     *
     * @return group with one item producing a failure and an error
     */
    public static Group failingAfterEachGroup() {
        return Group.builder(Namespace.of(NAMESPACE), "FailingAfterEach")
            .afterEach(context -> {
                throw new IllegalStateException("cleanup failed");
            })
            .test("failsTwice", context -> {
                throw new AssertionError("body failed");
            })
            .build();
    }

    /**
     * A group whose only item writes to both output streams and then fails.
     *
     * @return group with one failing item
     */
    public static Group printingGroup() {
        return Group.builder(Namespace.of(NAMESPACE), "Printing")
            .test("printsAndFails", context -> {
                context.out().print(PRINTED_STDOUT);
                context.err().print(PRINTED_STDERR);
                throw new AssertionError("boom");
            })
            .build();
    }

    /**
     * Two namespaces with two groups each; every hook and body traces itself.
     *
     * <pre>
     * TestSuite
     *   TestSuite (alpha)
     *     TestSuite (alpha.First: one, two)
     *     TestSuite (alpha.Second: three)
     *   TestSuite (beta)
     *     TestSuite (beta.Third: four)
     * </pre>
     *
     * @param trace receives "&lt;scope&gt;.&lt;hook or method&gt;" entries
     * @return nested suite with four items
     */
    public static TestSuite tracingNamespaces(List<String> trace) {
        Namespace alpha = tracingNamespace("alpha", trace);
        Namespace beta = tracingNamespace("beta", trace);

        Group first = tracingGroup(alpha, "First", trace, "one", "two");
        Group second = tracingGroup(alpha, "Second", trace, "three");
        Group third = tracingGroup(beta, "Third", trace, "four");

        return TestSuite.of(
            TestSuite.of(first.suite(), second.suite()),
            TestSuite.of(third.suite())
        );
    }

    /**
     * Registry of trace-free groups that can be rebuilt in another JVM.
     *
     * @return registry with MixedOutcomes, Printing, SkippedGroup and FailingAfterEach
     */
    public static TestRegistry registry() {
        List<String> discarded = newTrace();
        return TestRegistry.builder()
            .register(mixedOutcomes(discarded))
            .register(printingGroup())
            .register(skippedGroup(discarded))
            .register(failingAfterEachGroup())
            .build();
    }

    private static Namespace tracingNamespace(String name, List<String> trace) {
        return Namespace.builder(name)
            .setUp(() -> trace.add(name + ".setUp"))
            .tearDown(() -> trace.add(name + ".tearDown"))
            .build();
    }

    private static Group tracingGroup(Namespace namespace, String name, List<String> trace, String... methods) {
        Group.Builder builder = Group.builder(namespace, name)
            .setUp(() -> trace.add(name + ".setUp"))
            .tearDown(() -> trace.add(name + ".tearDown"));
        for (String method : methods) {
            builder.test(method, context -> trace.add(name + "." + method));
        }
        return builder.build();
    }
}
