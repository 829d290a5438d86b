package com.ryuqq.chariot.core.graph;

import com.ryuqq.chariot.core.cancel.CancellationToken;
import com.ryuqq.chariot.core.capability.Runner;
import com.ryuqq.chariot.core.capability.Shutdowner;
import com.ryuqq.chariot.core.exception.ConstructorFailureException;
import com.ryuqq.chariot.core.exception.CycleDetectedException;
import com.ryuqq.chariot.core.exception.MissingDependencyException;
import com.ryuqq.chariot.core.model.Initializer;
import com.ryuqq.chariot.core.model.Kind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DependencyResolver 테스트.
 *
 * @author Chariot Team
 * @since 1.0.0
 */
class DependencyResolverTest {

    private static final Kind<Config> CONFIG = Kind.of(Config.class);
    private static final Kind<Database> DATABASE = Kind.of(Database.class);
    private static final Kind<Server> SERVER = Kind.of(Server.class);
    private static final Kind<IOException> FAILURE = Kind.of(IOException.class);

    private Registry registry;
    private Capabilities capabilities;
    private List<String> constructed;

    @BeforeEach
    void setUp() {
        registry = new Registry();
        capabilities = new Capabilities();
        constructed = new ArrayList<>();
    }

    private void resolve(Initializer... initializers) {
        new GraphBuilder(registry).build(List.of(initializers), List.of());
        new DependencyResolver(registry, capabilities).resolveAll();
    }

    // ============================================================
    // 1. 생성 순서
    // ============================================================

    @Test
    void resolveAll_선언_순서와_무관하게_의존성을_먼저_생성함() {
        // when
        resolve(
            Initializer.of(DATABASE, SERVER, db -> record("server", new Server(db))),
            Initializer.of(CONFIG, DATABASE, config -> record("database", new Database(config))),
            Initializer.of(CONFIG, () -> record("config", new Config()))
        );

        // then
        assertThat(constructed).containsExactly("config", "database", "server");
        assertThat(registry.valueOf(SERVER)).hasValueSatisfying(
            server -> assertThat(server.database).isSameAs(registry.valueOf(DATABASE).orElseThrow()));
    }

    @Test
    void resolveAll_공유_의존성은_한_번만_생성됨() {
        // when
        resolve(
            Initializer.of(CONFIG, () -> record("config", new Config())),
            Initializer.of(CONFIG, DATABASE, config -> record("database", new Database(config))),
            Initializer.of(CONFIG, DATABASE, SERVER, (config, db) -> record("server", new Server(db)))
        );

        // then
        assertThat(constructed).containsExactly("config", "database", "server");
    }

    @Test
    void resolveAll_다중_산출물_constructor는_한_번만_호출됨() {
        // given
        Kind<String> left = Kind.of(String.class, "left");
        Kind<String> right = Kind.of(String.class, "right");

        // when
        resolve(Initializer.builder("split")
            .produces(left, right)
            .body(args -> {
                constructed.add("split");
                return List.of("L", "R");
            })
            .build());

        // then
        assertThat(constructed).containsExactly("split");
        assertThat(registry.valueOf(left)).contains("L");
        assertThat(registry.valueOf(right)).contains("R");
    }

    @Test
    void resolveAll_ambient_토큰을_주입받음() {
        // given
        CancellationToken token = CancellationToken.root();
        registry.registerResolved(CancellationToken.KIND, token);
        Kind<CancellationToken> seen = Kind.of(CancellationToken.class, "seen");

        // when
        resolve(Initializer.of(CancellationToken.KIND, seen, injected -> injected));

        // then
        assertThat(registry.valueOf(seen)).containsSame(token);
    }

    // ============================================================
    // 2. 그래프 오류
    // ============================================================

    @Test
    void resolveAll_등록되지_않은_의존성이면_MissingDependencyException() {
        // when & then
        assertThatThrownBy(() -> resolve(
            Initializer.of(CONFIG, DATABASE, Database::new).named("database loader")))
            .isInstanceOf(MissingDependencyException.class)
            .hasMessageContaining("[CHR-002]")
            .hasMessageContaining("database loader")
            .satisfies(e -> assertThat(((MissingDependencyException) e).getKind()).isEqualTo(CONFIG));
        assertThat(constructed).isEmpty();
    }

    @Test
    void resolveAll_순환_의존성이면_경로를_포함한_CycleDetectedException() {
        // when & then
        assertThatThrownBy(() -> resolve(
            Initializer.of(SERVER, CONFIG, server -> new Config()),
            Initializer.of(CONFIG, DATABASE, Database::new),
            Initializer.of(DATABASE, SERVER, Server::new)))
            .isInstanceOf(CycleDetectedException.class)
            .hasMessageContaining("[CHR-003]")
            .satisfies(e -> assertThat(((CycleDetectedException) e).getCycle())
                .containsExactly(CONFIG, SERVER, DATABASE, CONFIG));
    }

    @Test
    void resolveAll_자기_자신에_의존하면_CycleDetectedException() {
        // when & then
        assertThatThrownBy(() -> resolve(Initializer.of(CONFIG, CONFIG, config -> config)))
            .isInstanceOf(CycleDetectedException.class)
            .satisfies(e -> assertThat(((CycleDetectedException) e).getCycle()).containsExactly(CONFIG, CONFIG));
    }

    // ============================================================
    // 3. constructor 실패
    // ============================================================

    @Test
    void resolveAll_constructor_예외는_원인을_보존한_ConstructorFailureException() {
        // given
        IOException cause = new IOException("disk unavailable");

        // when & then
        assertThatThrownBy(() -> resolve(Initializer.of(CONFIG, () -> {
            throw cause;
        }).named("config loader")))
            .isInstanceOf(ConstructorFailureException.class)
            .hasMessageContaining("[CHR-004]")
            .hasCause(cause)
            .satisfies(e -> assertThat(((ConstructorFailureException) e).getInitializer())
                .isEqualTo("config loader"));
    }

    @Test
    void resolveAll_failure_slot에_값이_있으면_ConstructorFailureException() {
        // given
        IOException cause = new IOException("invalid config");

        // when & then
        assertThatThrownBy(() -> resolve(Initializer.builder("config loader")
            .produces(CONFIG, FAILURE)
            .body(args -> Arrays.asList(null, cause))
            .build()))
            .isInstanceOf(ConstructorFailureException.class)
            .hasCauseReference(cause);
    }

    @Test
    void resolveAll_failure_slot이_null이면_정상_생성됨() {
        // when
        resolve(Initializer.builder("config loader")
            .produces(CONFIG, FAILURE)
            .body(args -> Arrays.asList(new Config(), null))
            .build());

        // then
        assertThat(registry.valueOf(CONFIG)).isPresent();
        assertThat(registry.contains(FAILURE)).isFalse();
    }

    @Test
    void resolveAll_null_산출물은_ConstructorFailureException() {
        assertThatThrownBy(() -> resolve(Initializer.of(CONFIG, () -> null)))
            .isInstanceOf(ConstructorFailureException.class)
            .hasMessageContaining("returned null");
    }

    @Test
    void resolveAll_산출물_개수가_다르면_ConstructorFailureException() {
        assertThatThrownBy(() -> resolve(Initializer.builder("short")
            .produces(CONFIG, DATABASE)
            .body(args -> List.of(new Config()))
            .build()))
            .isInstanceOf(ConstructorFailureException.class)
            .hasMessageContaining("returned 1 values, expected 2");
    }

    @Test
    void resolveAll_실패_이후의_constructor는_호출되지_않음() {
        // when & then
        assertThatThrownBy(() -> resolve(
            Initializer.of(CONFIG, () -> {
                throw new IllegalStateException("boom");
            }),
            Initializer.of(DATABASE, () -> record("database", new Database(null)))))
            .isInstanceOf(ConstructorFailureException.class);
        assertThat(constructed).isEmpty();
    }

    // ============================================================
    // 4. capability 수집
    // ============================================================

    @Test
    void resolveAll_Runner와_Shutdowner를_생성_완료_순서대로_수집함() {
        // given
        Kind<Worker> worker = Kind.of(Worker.class);
        Kind<Pool> pool = Kind.of(Pool.class);

        // when
        resolve(
            Initializer.of(pool, worker, Worker::new),
            Initializer.of(pool, Pool::new)
        );

        // then
        Pool createdPool = registry.valueOf(pool).orElseThrow();
        Worker createdWorker = registry.valueOf(worker).orElseThrow();
        assertThat(capabilities.shutdowners()).containsExactly(createdPool, createdWorker);
        assertThat(capabilities.runners()).containsExactly(createdWorker);
    }

    @Test
    void resolveAll_같은_인스턴스는_여러_Kind로_등록되어도_한_번만_수집됨() {
        // given
        Pool shared = new Pool();
        Kind<Pool> primary = Kind.of(Pool.class, "primary");
        Kind<Shutdowner> alias = Kind.of(Shutdowner.class, "alias");

        // when
        resolve(Initializer.builder("shared")
            .produces(primary, alias)
            .body(args -> List.of(shared, shared))
            .build());

        // then
        assertThat(capabilities.shutdowners()).containsExactly(shared);
    }

    @Test
    void resolveAll_collector는_capability_컴포넌트를_먼저_생성하여_전달받음() {
        // given
        Kind<Runner> first = Kind.of(Runner.class, "first");
        Kind<Runner> second = Kind.of(Runner.class, "second");
        Kind<Integer> count = Kind.of(Integer.class, "count");
        Runner a = token -> { };
        Runner b = token -> { };

        // when
        resolve(
            Initializer.builder("counter")
                .produces(count)
                .collects(Runner.class)
                .body(args -> List.of(args.collected(Runner.class).size()))
                .build(),
            Initializer.component(first, a),
            Initializer.component(second, b)
        );

        // then
        assertThat(registry.valueOf(count)).contains(2);
        assertThat(capabilities.runners()).containsExactly(a, b);
    }

    private <T> T record(String name, T value) {
        constructed.add(name);
        return value;
    }

    static final class Config {
    }

    static final class Database {
        final Config config;

        Database(Config config) {
            this.config = config;
        }
    }

    static final class Server {
        final Database database;

        Server(Database database) {
            this.database = database;
        }
    }

    static final class Pool implements Shutdowner {
        @Override
        public void shutdown(CancellationToken token) {
        }
    }

    static final class Worker implements Runner, Shutdowner {
        final Pool pool;

        Worker(Pool pool) {
            this.pool = pool;
        }

        @Override
        public void run(CancellationToken token) {
        }

        @Override
        public void shutdown(CancellationToken token) {
        }
    }
}
