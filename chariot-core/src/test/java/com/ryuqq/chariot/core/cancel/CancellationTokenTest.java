package com.ryuqq.chariot.core.cancel;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CancellationToken 테스트.
 *
 * <p>전파 규칙, 최초 사유 유지, 마감 시각, listener 동작을 검증합니다.</p>
 *
 * @author Chariot Team
 * @since 1.0.0
 */
class CancellationTokenTest {

    @Test
    void cancel_최초_사유가_유지됨() {
        // given
        CancellationToken token = CancellationToken.root();

        // when
        boolean first = token.cancel(Cancelled.of("first"));
        boolean second = token.cancel(Cancelled.of("second"));

        // then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(token.isCancelled()).isTrue();
        assertThat(token.reason()).contains(Cancelled.of("first"));
    }

    @Test
    void derive_부모_취소가_자식에게_전파됨() {
        // given
        CancellationToken parent = CancellationToken.root();
        CancellationToken child = parent.derive();

        // when
        parent.cancel(new Interrupted("INT"));

        // then
        assertThat(child.isCancelled()).isTrue();
        assertThat(child.reason()).contains(new Interrupted("INT"));
    }

    @Test
    void derive_자식_취소는_부모에게_전파되지_않음() {
        // given
        CancellationToken parent = CancellationToken.root();
        CancellationToken child = parent.derive();

        // when
        child.cancel();

        // then
        assertThat(child.isCancelled()).isTrue();
        assertThat(parent.isCancelled()).isFalse();
    }

    @Test
    void derive_이미_취소된_부모에서_파생하면_즉시_취소됨() {
        // given
        CancellationToken parent = CancellationToken.root();
        parent.cancel(Cancelled.of("gone"));

        // when
        CancellationToken child = parent.derive();

        // then
        assertThat(child.reason()).contains(Cancelled.of("gone"));
    }

    @Test
    @DisplayName("linked 토큰은 어느 부모가 취소되어도 취소된다")
    void linked_anyParentCancelsChild() {
        // given
        CancellationToken a = CancellationToken.root();
        CancellationToken b = CancellationToken.root();
        CancellationToken linked = CancellationToken.linked(a, b);

        // when
        b.cancel(Cancelled.of("b stopped"));

        // then
        assertThat(linked.isCancelled()).isTrue();
        assertThat(linked.reason()).contains(Cancelled.of("b stopped"));
        assertThat(a.isCancelled()).isFalse();
    }

    @Test
    void linked_부모가_없으면_예외() {
        assertThatThrownBy(() -> CancellationToken.linked())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withTimeout_마감_시각에_DeadlineExceeded로_취소됨() throws InterruptedException {
        // given
        CancellationToken root = CancellationToken.root();

        // when
        CancellationToken timed = root.withTimeout(Duration.ofMillis(20));
        boolean cancelled = timed.await(Duration.ofSeconds(5));

        // then
        assertThat(cancelled).isTrue();
        assertThat(timed.reason()).hasValueSatisfying(reason -> assertThat(reason.isDeadlineExceeded()).isTrue());
        assertThat(root.isCancelled()).isFalse();
    }

    @Test
    void withDeadline_부모의_더_이른_마감이_유지됨() {
        // given
        Instant early = Instant.now().plusSeconds(60);
        Instant late = early.plusSeconds(60);
        CancellationToken parent = CancellationToken.root().withDeadline(early);

        // when
        CancellationToken child = parent.withDeadline(late);

        // then
        assertThat(child.deadline()).contains(early);
        assertThat(child.derive().deadline()).contains(early);
    }

    @Test
    void withTimeout_음수면_예외() {
        assertThatThrownBy(() -> CancellationToken.root().withTimeout(Duration.ofMillis(-1)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("negative");
    }

    @Test
    void onCancel_취소시_한_번만_호출됨() {
        // given
        CancellationToken token = CancellationToken.root();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        // when
        token.cancel();
        token.cancel();

        // then
        assertThat(calls).hasValue(1);
    }

    @Test
    void onCancel_이미_취소된_경우_즉시_호출됨() {
        // given
        CancellationToken token = CancellationToken.root();
        token.cancel();
        AtomicInteger calls = new AtomicInteger();

        // when
        token.onCancel(calls::incrementAndGet);

        // then
        assertThat(calls).hasValue(1);
    }

    @Test
    void onCancel_등록_해제시_호출되지_않음() {
        // given
        CancellationToken token = CancellationToken.root();
        AtomicInteger calls = new AtomicInteger();
        CancellationToken.Registration registration = token.onCancel(calls::incrementAndGet);

        // when
        registration.close();
        token.cancel();

        // then
        assertThat(calls).hasValue(0);
    }

    @Test
    void onCancel_listener_예외가_다른_listener를_막지_않음() {
        // given
        CancellationToken token = CancellationToken.root();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(() -> {
            throw new IllegalStateException("listener boom");
        });
        token.onCancel(calls::incrementAndGet);

        // when
        token.cancel();

        // then
        assertThat(calls).hasValue(1);
    }

    @Test
    void throwIfCancelled_취소된_경우_사유와_함께_예외() {
        // given
        CancellationToken token = CancellationToken.root();
        token.throwIfCancelled();
        token.cancel(Cancelled.of("stop"));

        // when & then
        assertThatThrownBy(token::throwIfCancelled)
            .isInstanceOfSatisfying(CancelledException.class,
                e -> assertThat(e.getReason()).isEqualTo(Cancelled.of("stop")))
            .hasMessage("cancelled: stop");
    }

    @Test
    void await_취소되지_않으면_시간_초과로_false() throws InterruptedException {
        assertThat(CancellationToken.root().await(Duration.ofMillis(10))).isFalse();
    }

    @Test
    void cancel_마감_타이머가_스케줄러에서_즉시_제거됨() {
        // given
        int before = CancellationToken.pendingDeadlines();
        CancellationToken root = CancellationToken.root();
        List<CancellationToken> tokens = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            tokens.add(root.withTimeout(Duration.ofHours(1)));
        }

        // when
        tokens.forEach(CancellationToken::cancel);

        // then
        assertThat(tokens).allMatch(CancellationToken::isCancelled);
        assertThat(CancellationToken.pendingDeadlines()).isLessThanOrEqualTo(before);
    }
}
