package com.ryuqq.sortedfeed.application.feed;

import com.ryuqq.sortedfeed.application.retry.BackoffCalculator;
import com.ryuqq.sortedfeed.application.retry.RetryPolicy;
import com.ryuqq.sortedfeed.core.event.PublishEvent;
import com.ryuqq.sortedfeed.core.event.RetractEvent;
import com.ryuqq.sortedfeed.core.model.Content;
import com.ryuqq.sortedfeed.core.model.FeedId;
import com.ryuqq.sortedfeed.core.model.FeedKeys;
import com.ryuqq.sortedfeed.core.model.FeedName;
import com.ryuqq.sortedfeed.core.model.Position;
import com.ryuqq.sortedfeed.core.outcome.Committed;
import com.ryuqq.sortedfeed.core.outcome.Contended;
import com.ryuqq.sortedfeed.core.outcome.FeedOutcome;
import com.ryuqq.sortedfeed.core.outcome.Missing;
import com.ryuqq.sortedfeed.core.spi.FeedStore;
import com.ryuqq.sortedfeed.core.spi.FeedStoreException;
import com.ryuqq.sortedfeed.core.spi.FeedTransaction;
import com.ryuqq.sortedfeed.core.spi.NotificationSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 낙관적 동시성 제어 기반 {@link SortedFeed} 구현체.
 *
 * <p>두 가지 프로토콜로 변경을 커밋합니다.</p>
 *
 * <p><strong>무조건 쓰기 (publish / append / prepend):</strong></p>
 * <ol>
 *   <li>id 발급</li>
 *   <li>순서 리스트 끝(또는 앞)에 id 추가</li>
 *   <li>publish 카운터 증가</li>
 *   <li>아이템 맵에 본문 기록</li>
 *   <li>publish 알림 적재 (커밋과 함께 발송)</li>
 * </ol>
 *
 * <p><strong>Check-then-act (publishBefore / publishAfter / edit / retract):</strong></p>
 * <pre>
 * START ─(삽입이면 id 발급)─► WATCH ─► CHECK ──(없음)──► Missing
 *                              ▲          │
 *                              │        BUILD
 *                              │          │
 *                        backoff ◄─(충돌)─ COMMIT ─(성공, 알림 발송)─► Committed
 *                              │
 *                    (한도 소진) └─► Contended
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>프로세스 내 락을 사용하지 않음: 직렬화는 전적으로 저장소의 watch/commit에 위임</li>
 *   <li>주입된 협력 객체 외에 상태가 없으므로 여러 스레드에서 공유 가능</li>
 *   <li>알림은 트랜잭션에 적재되어 커밋 성공 시에만 정확히 한 번 발송 (중단된 시도, Missing에는 발송 안 함)</li>
 *   <li>알림 발송 순서는 저장소가 보장하는 커밋 순서를 따름 ({@link FeedTransaction#commit(NotificationSink)})</li>
 * </ul>
 *
 * <p><strong>id 공백:</strong> 삽입은 기준 아이템 확인 전에 id를 발급하므로,
 * 기준 아이템이 없으면 그 id는 버려지고 카운터는 되돌리지 않습니다.</p>
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
public final class OptimisticSortedFeed implements SortedFeed {

    private static final Logger log = LoggerFactory.getLogger(OptimisticSortedFeed.class);

    private final FeedStore store;
    private final NotificationSink sink;
    private final FeedKeys keys;
    private final RetryPolicy retryPolicy;
    private final BackoffCalculator backoff;

    /**
     * 생성자 (기본 키 명명 규칙, 기본 재시도 정책).
     *
     * @param store 저장소
     * @param sink 알림 채널
     * @param feed 피드 이름
     * @throws IllegalArgumentException 인자 중 null이 있는 경우
     */
    public OptimisticSortedFeed(FeedStore store, NotificationSink sink, FeedName feed) {
        this(store, sink, FeedKeys.of(feed), RetryPolicy.unbounded());
    }

    /**
     * 생성자.
     *
     * @param store 저장소
     * @param sink 알림 채널
     * @param keys 피드 키
     * @param retryPolicy 충돌 재시도 정책
     * @throws IllegalArgumentException 인자 중 null이 있는 경우
     */
    public OptimisticSortedFeed(FeedStore store, NotificationSink sink, FeedKeys keys, RetryPolicy retryPolicy) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        if (keys == null) {
            throw new IllegalArgumentException("keys cannot be null");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        this.store = store;
        this.sink = sink;
        this.keys = keys;
        this.retryPolicy = retryPolicy;
        this.backoff = new BackoffCalculator(retryPolicy);
    }

    @Override
    public FeedId publish(Content content) {
        return push(content, false);
    }

    @Override
    public FeedId prepend(Content content) {
        return push(content, true);
    }

    @Override
    public FeedOutcome publishBefore(FeedId anchor, Content content) {
        return insert(anchor, content, Position.BEFORE);
    }

    @Override
    public FeedOutcome publishAfter(FeedId anchor, Content content) {
        return insert(anchor, content, Position.AFTER);
    }

    @Override
    public FeedOutcome edit(FeedId id, Content content) {
        requireId(id, "id");
        requireContent(content);

        return checkThenAct("edit", id, id, tx -> {
            tx.put(id, content)
                .incrementPublishCount()
                .publish(new PublishEvent(keys.feed(), id, content));
        });
    }

    @Override
    public FeedOutcome retract(FeedId id) {
        requireId(id, "id");

        return checkThenAct("retract", id, id, tx -> {
            tx.remove(id)
                .delete(id)
                .publish(new RetractEvent(keys.feed(), id));
        });
    }

    @Override
    public List<FeedId> getIds() {
        return store.getIds(keys);
    }

    @Override
    public Optional<Content> getItem(FeedId id) {
        requireId(id, "id");
        return store.getItem(keys, id);
    }

    @Override
    public Map<FeedId, Content> getItems() {
        return store.getItems(keys);
    }

    @Override
    public long size() {
        return store.size(keys);
    }

    @Override
    public FeedKeys keys() {
        return keys;
    }

    /**
     * 재시도 정책 조회.
     *
     * @return 재시도 정책
     */
    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    /**
     * 무조건 쓰기 프로토콜.
     *
     * @param content 본문
     * @param head true면 맨 앞, false면 맨 끝
     * @return 새로 발급된 id
     */
    private FeedId push(Content content, boolean head) {
        requireContent(content);

        // 1. id 발급
        FeedId id = store.nextId(keys);

        // 2. 순서 + 카운터 + 본문 + 알림을 하나의 트랜잭션으로 커밋
        try (FeedTransaction tx = store.begin(keys)) {
            if (head) {
                tx.appendHead(id);
            } else {
                tx.appendTail(id);
            }
            tx.incrementPublishCount()
                .put(id, content)
                .publish(new PublishEvent(keys.feed(), id, content));

            if (!tx.commit(sink)) {
                throw new FeedStoreException("Unconditional transaction was aborted for " + keys.feed());
            }
        }

        log.debug("Committed {} on {} as {}", head ? "prepend" : "publish", keys.feed(), id);
        return id;
    }

    /**
     * 상대 위치 삽입.
     *
     * <p>id는 기준 아이템 확인 전에 발급됩니다 (실패 시 버려짐).</p>
     */
    private FeedOutcome insert(FeedId anchor, Content content, Position position) {
        requireId(anchor, "anchor");
        requireContent(content);
        if (position == null) {
            throw new IllegalArgumentException("position cannot be null");
        }

        FeedId id = store.nextId(keys);

        return checkThenAct("insert " + position, anchor, id, tx -> {
            tx.insertRelative(id, anchor, position)
                .put(id, content)
                .publish(new PublishEvent(keys.feed(), id, content));
        });
    }

    /**
     * Check-then-act 루프.
     *
     * @param operation 로그용 작업 이름
     * @param reference 존재해야 하는 아이템 id (기준 또는 대상)
     * @param resultId 커밋 시 결과로 반환할 id
     * @param mutation 트랜잭션에 쓰기와 커밋 시 발송할 이벤트를 적재
     * @return Committed, Missing, 또는 Contended
     */
    private FeedOutcome checkThenAct(String operation, FeedId reference, FeedId resultId, Mutation mutation) {
        int attempts = 0;

        while (true) {
            attempts++;

            boolean committed;

            // WATCH → CHECK → BUILD → COMMIT
            try (FeedTransaction tx = store.watch(keys)) {
                if (!tx.contains(reference)) {
                    log.debug("Skipped {} on {}: {} does not exist", operation, keys.feed(), reference);
                    return new Missing(reference);
                }
                mutation.build(tx);
                committed = tx.commit(sink);
            }

            if (committed) {
                log.debug("Committed {} on {} as {} after {} attempt(s)", operation, keys.feed(), resultId, attempts);
                return new Committed(resultId, attempts);
            }

            if (retryPolicy.isExhausted(attempts)) {
                log.warn("Gave up {} on {} for {} after {} conflicting attempt(s)",
                    operation, keys.feed(), reference, attempts);
                return new Contended(reference, attempts);
            }

            long delayMs = backoff.calculate(attempts);
            log.debug("Conflict on {} during {} (attempt {}), retrying in {}ms", keys.feed(), operation, attempts, delayMs);
            sleep(delayMs);
        }
    }

    private static void requireId(FeedId id, String name) {
        if (id == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }

    private static void requireContent(Content content) {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
    }

    /**
     * 백오프 대기.
     *
     * <p>InterruptedException 발생 시 현재 스레드의 인터럽트 플래그를 복원하고
     * FeedStoreException으로 래핑하여 던집니다.</p>
     *
     * @param millis 대기 시간 (밀리초, 0이면 즉시 반환)
     */
    private void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FeedStoreException("Retry backoff interrupted on " + keys.feed(), e);
        }
    }

    /**
     * 감시 중인 트랜잭션에 쓰기와 알림 이벤트를 적재.
     */
    @FunctionalInterface
    private interface Mutation {
        void build(FeedTransaction tx);
    }
}
