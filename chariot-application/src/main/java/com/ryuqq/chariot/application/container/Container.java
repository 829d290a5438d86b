package com.ryuqq.chariot.application.container;

import com.ryuqq.chariot.application.orchestrator.RunOrchestrator;
import com.ryuqq.chariot.application.orchestrator.ShutdownOrchestrator;
import com.ryuqq.chariot.core.cancel.CancellationToken;
import com.ryuqq.chariot.core.cancel.Cancelled;
import com.ryuqq.chariot.core.cancel.Interrupted;
import com.ryuqq.chariot.core.graph.ActionInvoker;
import com.ryuqq.chariot.core.graph.ActionSpec;
import com.ryuqq.chariot.core.graph.Capabilities;
import com.ryuqq.chariot.core.graph.DependencyResolver;
import com.ryuqq.chariot.core.graph.GraphBuilder;
import com.ryuqq.chariot.core.graph.Registry;
import com.ryuqq.chariot.core.model.Initializer;
import com.ryuqq.chariot.core.model.Kind;
import com.ryuqq.chariot.core.spi.InterruptSource;
import com.ryuqq.chariot.core.statemachine.ContainerState;
import com.ryuqq.chariot.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 선언된 initializer들로부터 애플리케이션 컴포넌트 그래프를 구성하고 생명주기를 관리하는 컨테이너.
 *
 * <p><strong>생명주기:</strong></p>
 * <pre>
 * create(options)
 *   ↓ 신호 구독 → 그래프 구성 → 의존성 해석 → action 실행   (실패 시 자동 shutdown 후 예외 전파)
 * READY
 *   ↓ run()        RUNNING → READY (Runner 전부 종료 시)
 *   ↓ shutdown()   SHUT_DOWN (Shutdowner 역순 호출, root 토큰 취소)
 * </pre>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Container container = Container.create(new ContainerOptions()
 *     .withModules(configModule, serverModule)
 *     .withSignals("TERM"));
 * try {
 *     container.run();
 * } finally {
 *     container.shutdown();
 * }
 * </pre>
 *
 * <p><strong>Thread-safety:</strong> 레지스트리는 초기화 이후 불변이며 상태 전이는 CAS로 처리됩니다.
 * 동시에 두 번 run을 호출하면 두 번째 호출은 {@link IllegalStateException}으로 거부됩니다.</p>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
public final class Container {

    private static final Logger log = LoggerFactory.getLogger(Container.class);

    /**
     * 항상 구독하는 기본 신호.
     */
    public static final Set<String> DEFAULT_SIGNALS = Set.of("INT");

    private final CancellationToken root;
    private final Registry registry;
    private final RunOrchestrator runOrchestrator;
    private final ShutdownOrchestrator shutdownOrchestrator;
    private final InterruptSource.Subscription subscription;
    private final AtomicReference<ContainerState> state = new AtomicReference<>(ContainerState.READY);

    private Container(CancellationToken root, Registry registry, Capabilities capabilities,
                      InterruptSource.Subscription subscription) {
        this.root = root;
        this.registry = registry;
        this.runOrchestrator = new RunOrchestrator(root, capabilities.runners());
        this.shutdownOrchestrator = new ShutdownOrchestrator(root, capabilities.shutdowners());
        this.subscription = subscription;
    }

    /**
     * 기본 설정에 initializer만 지정하여 컨테이너 생성.
     *
     * @param initializers 선언 순서의 initializer
     * @return READY 상태의 컨테이너
     */
    public static Container create(Initializer... initializers) {
        return create(new ContainerOptions().withInitializers(initializers));
    }

    /**
     * 컨테이너 생성 및 초기화.
     *
     * <p>초기화가 어느 단계에서든 실패하면 그때까지 생성된 Shutdowner들을 역순으로 호출하고
     * 신호 구독을 해제한 뒤 원래 예외를 던집니다.</p>
     *
     * @param options 생성 설정
     * @return READY 상태의 컨테이너
     * @throws IllegalArgumentException options가 null이거나 신호 이름이 잘못된 경우
     * @throws com.ryuqq.chariot.core.exception.ChariotException 초기화 실패 시
     */
    public static Container create(ContainerOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }

        CancellationToken root = CancellationToken.root();
        Set<String> signals = new LinkedHashSet<>(DEFAULT_SIGNALS);
        signals.addAll(options.signals());
        InterruptSource.Subscription subscription = options.interruptSource()
            .subscribe(signals, signal -> root.cancel(new Interrupted(signal)));

        Registry registry = new Registry();
        Capabilities capabilities = new Capabilities();
        CancellationToken ambient = options.initToken() != null
            ? CancellationToken.linked(root, options.initToken())
            : root;

        try {
            registry.registerResolved(CancellationToken.KIND, ambient);
            List<ActionSpec> actions = new GraphBuilder(registry)
                .build(options.initializers(), options.components());
            new DependencyResolver(registry, capabilities).resolveAll();
            new ActionInvoker(registry).invokeAll(actions);
        } catch (RuntimeException | Error e) {
            log.error("Container assembly failed, shutting down {} constructed components",
                capabilities.shutdowners().size(), e);
            try {
                new ShutdownOrchestrator(root, capabilities.shutdowners())
                    .shutdown(ambient == root ? null : ambient);
            } finally {
                subscription.close();
            }
            throw e;
        } finally {
            if (ambient != root) {
                if (registry.contains(CancellationToken.KIND)) {
                    registry.replaceResolved(CancellationToken.KIND, root);
                }
                ambient.cancel(Cancelled.of("assembly finished"));
            }
        }

        Container container = new Container(root, registry, capabilities, subscription);
        log.info("Container ready: {} components, {} runners, {} shutdowners",
            registry.size(), capabilities.runners().size(), capabilities.shutdowners().size());
        return container;
    }

    /**
     * 컴포넌트 조회. 생성을 유발하지 않습니다.
     *
     * @param kind 조회할 Kind
     * @param <T> 컴포넌트 타입
     * @return 컴포넌트, 등록되지 않았으면 empty
     */
    public <T> Optional<T> lookup(Kind<T> kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        return registry.valueOf(kind);
    }

    /**
     * qualifier 없는 Kind로 컴포넌트 조회.
     */
    public <T> Optional<T> lookup(Class<T> type) {
        return lookup(Kind.of(type));
    }

    public boolean contains(Kind<?> kind) {
        return kind != null && registry.contains(kind);
    }

    /**
     * 기본 설정으로 모든 Runner 실행.
     *
     * @see #run(RunOptions)
     */
    public void run() {
        run(new RunOptions());
    }

    /**
     * 모든 Runner를 병렬 실행하고 전부 종료될 때까지 대기.
     *
     * @param options run 설정
     * @throws IllegalStateException 이미 실행 중이거나 종료된 컨테이너인 경우
     * @throws com.ryuqq.chariot.core.exception.RunFailureException Runner가 실패한 경우
     */
    public void run(RunOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        ContainerState current = state.get();
        StateTransition.validate(current, ContainerState.RUNNING);
        if (!state.compareAndSet(current, ContainerState.RUNNING)) {
            throw new IllegalStateException("Container state changed concurrently (expected: " + current
                + ", actual: " + state.get() + ")");
        }

        try {
            runOrchestrator.run(options.parentToken(), options.errorHandler());
        } finally {
            state.compareAndSet(ContainerState.RUNNING, ContainerState.READY);
        }
    }

    /**
     * 기본 설정으로 종료.
     *
     * @see #shutdown(ShutdownOptions)
     */
    public void shutdown() {
        shutdown(new ShutdownOptions());
    }

    /**
     * Shutdowner를 생성의 역순으로 호출하고 root 토큰을 취소.
     *
     * <p>두 번째 이후 호출은 아무 작업도 하지 않습니다.</p>
     *
     * @param options shutdown 설정
     */
    public void shutdown(ShutdownOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        while (true) {
            ContainerState current = state.get();
            if (current.isTerminal()) {
                log.debug("Container already shut down");
                return;
            }
            if (state.compareAndSet(current, StateTransition.transition(current, ContainerState.SHUT_DOWN))) {
                break;
            }
        }

        try {
            shutdownOrchestrator.shutdown(options.parentToken());
        } finally {
            subscription.close();
        }
        log.info("Container shut down");
    }

    /**
     * root 토큰 조회.
     *
     * @return 컨테이너 생애 동안 유지되는 root 토큰
     */
    public CancellationToken token() {
        return root;
    }

    public ContainerState state() {
        return state.get();
    }

    /**
     * 등록된 모든 Kind 조회 (등록 순서).
     */
    public List<Kind<?>> kinds() {
        return registry.kinds();
    }

    @Override
    public String toString() {
        return "Container{state=" + state.get() + ", kinds=" + registry.kinds() + "}";
    }
}
