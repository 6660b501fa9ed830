package com.ryuqq.testengine.core.fixture;

import com.ryuqq.testengine.core.model.ErrorPlaceholder;
import com.ryuqq.testengine.core.model.FatalErrors;
import com.ryuqq.testengine.core.model.FixtureHook;
import com.ryuqq.testengine.core.model.Group;
import com.ryuqq.testengine.core.model.Namespace;
import com.ryuqq.testengine.core.model.SuiteNode;
import com.ryuqq.testengine.core.model.TestItem;
import com.ryuqq.testengine.core.result.ResultCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 그룹/네임스페이스 범위 setUp·tearDown 상태 머신.
 *
 * <p>실행 순서대로 다음 노드를 받아, 활성 그룹과 네임스페이스가 바뀔 때만
 * 이전 범위를 정리하고 새 범위를 준비합니다. 한 번에 최대 하나의 그룹과
 * 하나의 네임스페이스만 활성 상태입니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * setup(next)
 *   ↓
 * 하위 스위트 → true (상태 변경 없음)
 *   ↓
 * 네임스페이스 변경:
 *   1. 이전 그룹 tearDown (setUp 실패였다면 생략 + 실패 표시 해제)
 *   2. 이전 네임스페이스 tearDown (같은 규칙)
 *   3. 새 네임스페이스 setUp
 *   ↓
 * 그룹 변경:
 *   1. 이전 그룹 tearDown (같은 규칙)
 *   2. 새 그룹 setUp
 *      - skip 그룹이거나 네임스페이스 setUp 실패 → setUp 생략, 실패로 표시
 *   ↓
 * 그룹과 네임스페이스 모두 실패 표시가 없으면 true
 * </pre>
 *
 * <p>훅에서 발생한 예외는 다시 던지지 않고
 * {@code "<hookName> (<scope name>)"} 이름의 {@link ErrorPlaceholder} ERROR로
 * collector에 직접 보고합니다.</p>
 *
 * <p><strong>동시성:</strong> 하나의 실행 스레드에서만 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FixtureState {

    private static final Logger log = LoggerFactory.getLogger(FixtureState.class);

    static final String NAMESPACE_SET_UP = "namespaceSetUp";
    static final String NAMESPACE_TEAR_DOWN = "namespaceTearDown";
    static final String GROUP_SET_UP = "groupSetUp";
    static final String GROUP_TEAR_DOWN = "groupTearDown";

    private final ResultCollector collector;

    private Namespace activeNamespace;
    private Group activeGroup;
    private boolean namespaceSetupFailed;
    private boolean groupSetupFailed;

    /**
     * 생성자.
     *
     * @param collector 훅 실패를 보고할 수집기
     * @throws IllegalArgumentException collector가 null인 경우
     */
    public FixtureState(ResultCollector collector) {
        if (collector == null) {
            throw new IllegalArgumentException("collector cannot be null");
        }
        this.collector = collector;
    }

    /**
     * 다음 노드 실행 전 범위 준비.
     *
     * @param next 곧 실행할 노드
     * @return 활성 그룹과 네임스페이스의 setUp이 모두 실패하지 않았으면 true
     * @throws IllegalArgumentException next가 null인 경우
     */
    public boolean setup(SuiteNode next) {
        if (next == null) {
            throw new IllegalArgumentException("next cannot be null");
        }
        if (!(next instanceof TestItem)) {
            return true;
        }

        TestItem item = (TestItem) next;
        Namespace namespace = item.namespace();
        Group group = item.group();

        if (!namespace.equals(activeNamespace)) {
            tearDownGroup();
            tearDownNamespace();
            setUpNamespace(namespace);
        }
        if (!group.equals(activeGroup)) {
            tearDownGroup();
            setUpGroup(group);
        }
        return !(groupSetupFailed || namespaceSetupFailed);
    }

    /**
     * 남아 있는 그룹과 네임스페이스 정리.
     *
     * <p>setup이 한 번도 호출되지 않았다면 아무 일도 하지 않습니다.</p>
     */
    public void teardown() {
        tearDownGroup();
        tearDownNamespace();
    }

    public Namespace activeNamespace() {
        return activeNamespace;
    }

    public Group activeGroup() {
        return activeGroup;
    }

    public boolean isNamespaceSetupFailed() {
        return namespaceSetupFailed;
    }

    public boolean isGroupSetupFailed() {
        return groupSetupFailed;
    }

    private void setUpNamespace(Namespace namespace) {
        activeNamespace = namespace;
        log.debug("Set up namespace: {}", namespace.name());
        namespaceSetupFailed = !runHook(namespace.setUp(), NAMESPACE_SET_UP, namespace.name());
    }

    private void setUpGroup(Group group) {
        activeGroup = group;
        if (namespaceSetupFailed) {
            log.debug("Namespace setup failed; not setting up group {}", group.qualifiedName());
            groupSetupFailed = true;
            return;
        }
        if (group.isSkipped()) {
            log.debug("Group skipped; not setting up group {}", group.qualifiedName());
            groupSetupFailed = true;
            return;
        }
        log.debug("Set up group: {}", group.qualifiedName());
        groupSetupFailed = !runHook(group.setUp(), GROUP_SET_UP, group.name());
    }

    private void tearDownGroup() {
        Group group = activeGroup;
        if (group == null) {
            return;
        }
        activeGroup = null;
        if (groupSetupFailed) {
            log.debug("Group setup failed or skipped; not tearing down group {}", group.qualifiedName());
            groupSetupFailed = false;
            return;
        }
        log.debug("Tear down group: {}", group.qualifiedName());
        runHook(group.tearDown(), GROUP_TEAR_DOWN, group.name());
    }

    private void tearDownNamespace() {
        Namespace namespace = activeNamespace;
        if (namespace == null) {
            return;
        }
        activeNamespace = null;
        if (namespaceSetupFailed) {
            log.debug("Namespace setup failed; not tearing down namespace {}", namespace.name());
            namespaceSetupFailed = false;
            return;
        }
        log.debug("Tear down namespace: {}", namespace.name());
        runHook(namespace.tearDown(), NAMESPACE_TEAR_DOWN, namespace.name());
    }

    private boolean runHook(FixtureHook hook, String hookName, String scopeName) {
        try {
            hook.run();
            return true;
        } catch (Throwable e) {
            FatalErrors.rethrowIfFatal(e);
            log.debug("{} failed for {}", hookName, scopeName, e);
            ErrorPlaceholder placeholder = ErrorPlaceholder.of(hookName + " (" + scopeName + ")", e);
            collector.addError(placeholder, e);
            return false;
        }
    }
}
