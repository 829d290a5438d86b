package com.ryuqq.chariot.core.graph;

import com.ryuqq.chariot.core.cancel.CancellationToken;
import com.ryuqq.chariot.core.exception.DuplicateKindException;
import com.ryuqq.chariot.core.exception.ErrorCode;
import com.ryuqq.chariot.core.model.Component;
import com.ryuqq.chariot.core.model.Initializer;
import com.ryuqq.chariot.core.model.Kind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * GraphBuilder 테스트.
 *
 * <p>Kind 등록, action 분류, 중복 검출, failure slot, collector 확장을 검증합니다.</p>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
class GraphBuilderTest {

    private static final Kind<String> HOST = Kind.of(String.class, "host");
    private static final Kind<Integer> PORT = Kind.of(Integer.class, "port");
    private static final Kind<Exception> ERROR = Kind.of(Exception.class);

    private Registry registry;
    private GraphBuilder builder;

    @BeforeEach
    void setUp() {
        registry = new Registry();
        builder = new GraphBuilder(registry);
    }

    @Test
    void build_산출물마다_레코드를_등록_순서대로_생성함() {
        // given
        Initializer pair = Initializer.builder("pair")
            .produces(HOST, PORT)
            .body(args -> List.of("localhost", 8080))
            .build();

        // when
        List<ActionSpec> actions = builder.build(List.of(pair), List.of());

        // then
        assertThat(actions).isEmpty();
        assertThat(registry.kinds()).containsExactly(HOST, PORT);
        assertThat(registry.find(HOST)).hasValueSatisfying(record -> {
            assertThat(record.isResolved()).isFalse();
            assertThat(record.getProducerName()).isEqualTo("pair");
        });
    }

    @Test
    void build_산출물이_없는_initializer는_action으로_분류됨() {
        // given
        Initializer constructor = Initializer.of(HOST, () -> "localhost");
        Initializer action = Initializer.action(HOST, host -> { }).named("print host");

        // when
        List<ActionSpec> actions = builder.build(List.of(action, constructor), List.of());

        // then
        assertThat(actions).extracting(ActionSpec::getName).containsExactly("print host");
        assertThat(actions.get(0).getDependencies()).containsExactly(HOST);
        assertThat(registry.kinds()).containsExactly(HOST);
    }

    @Test
    void build_failure_slot만_선언하면_action으로_분류됨() {
        // given
        Initializer check = Initializer.builder("check")
            .produces(ERROR)
            .body(args -> Arrays.asList((Object) null))
            .build();

        // when
        List<ActionSpec> actions = builder.build(List.of(check), List.of());

        // then
        assertThat(actions).hasSize(1);
        assertThat(registry.size()).isZero();
    }

    @Test
    void build_미리_생성된_값은_initializer_뒤에_병합됨() {
        // given
        Initializer host = Initializer.of(HOST, () -> "localhost");

        // when
        builder.build(List.of(host), List.of(Component.of(PORT, 9090)));

        // then
        assertThat(registry.kinds()).containsExactly(HOST, PORT);
    }

    @Test
    void build_두_initializer가_같은_Kind를_선언하면_DuplicateKindException() {
        // given
        Initializer first = Initializer.of(HOST, () -> "a").named("first");
        Initializer second = Initializer.of(HOST, () -> "b").named("second");

        // when & then
        assertThatThrownBy(() -> builder.build(List.of(first, second), List.of()))
            .isInstanceOf(DuplicateKindException.class)
            .hasMessageContaining("[CHR-001]")
            .hasMessageContaining("first")
            .hasMessageContaining("second")
            .satisfies(e -> assertThat(((DuplicateKindException) e).getKind()).isEqualTo(HOST));
    }

    @Test
    void build_한_initializer가_같은_Kind를_두번_선언해도_DuplicateKindException() {
        // given
        Initializer twice = Initializer.builder("twice")
            .produces(HOST, HOST)
            .body(args -> List.of("a", "b"))
            .build();

        // when & then
        assertThatThrownBy(() -> builder.build(List.of(twice), List.of()))
            .isInstanceOf(DuplicateKindException.class);
    }

    @Test
    void build_ambient_토큰과_같은_Kind를_선언하면_DuplicateKindException() {
        // given
        registry.registerResolved(CancellationToken.KIND, CancellationToken.root());
        Initializer token = Initializer.of(CancellationToken.KIND, CancellationToken::root);

        // when & then
        assertThatThrownBy(() -> builder.build(List.of(token), List.of()))
            .isInstanceOf(DuplicateKindException.class)
            .satisfies(e -> assertThat(((DuplicateKindException) e).getErrorCode())
                .isEqualTo(ErrorCode.DUPLICATE_KIND));
    }

    @Test
    void build_collector는_capability를_만족하는_다른_컴포넌트를_의존성으로_가짐() {
        // given
        Kind<Runnable> first = Kind.of(Runnable.class, "first");
        Kind<Runnable> second = Kind.of(Runnable.class, "second");
        Kind<Runnable> composite = Kind.of(Runnable.class, "composite");
        registry.registerResolved(CancellationToken.KIND, CancellationToken.root());

        Initializer collector = Initializer.builder("composite")
            .produces(composite)
            .collects(Runnable.class)
            .body(args -> List.of((Runnable) () -> args.collected(Runnable.class).forEach(Runnable::run)))
            .build();

        // when
        builder.build(List.of(
            collector,
            Initializer.of(first, () -> () -> { }),
            Initializer.of(HOST, () -> "localhost"),
            Initializer.of(second, () -> () -> { })
        ), List.of());

        // then
        ComponentRecord record = registry.find(composite).orElseThrow();
        assertThat(record.constructor().requirements()).containsExactly(first, second);
    }
}
