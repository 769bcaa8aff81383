package com.ryuqq.sortedfeed.testkit.contract;

import com.ryuqq.sortedfeed.core.event.FeedEvent;
import com.ryuqq.sortedfeed.core.event.PublishEvent;
import com.ryuqq.sortedfeed.core.event.RetractEvent;
import com.ryuqq.sortedfeed.core.model.Content;
import com.ryuqq.sortedfeed.core.model.FeedId;
import com.ryuqq.sortedfeed.core.model.FeedKeys;
import com.ryuqq.sortedfeed.core.model.FeedName;
import com.ryuqq.sortedfeed.core.model.Position;
import com.ryuqq.sortedfeed.core.spi.FeedStore;
import com.ryuqq.sortedfeed.core.spi.FeedTransaction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract Test for the {@link FeedStore} / {@link FeedTransaction} SPI.
 *
 * <p>Every store adapter extends this class and supplies {@link #createStore()}.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Id allocation: strictly increasing, per feed</li>
 *   <li>Queued writes apply on commit, nothing applies on close</li>
 *   <li>Watched transaction aborts when another committer touches the items</li>
 *   <li>Queued events reach the sink only when the commit applies, after the writes</li>
 *   <li>Relative insert and remove act on the first occurrence</li>
 *   <li>Reads: ordered ids, ascending item map, size, publish counter</li>
 * </ul>
 *
 * <p>Each test runs against a freshly named feed, so stores backed by a shared server do
 * not need to be flushed between tests.</p>
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
public abstract class AbstractFeedStoreContractTest {

    protected FeedStore store;
    protected FeedKeys keys;

    /**
     * Creates the store under test.
     *
     * @return store instance
     */
    protected abstract FeedStore createStore();

    @BeforeEach
    void setUpStore() {
        store = createStore();
        keys = newKeys();
    }

    /**
     * Creates keys for a feed that no other test uses.
     *
     * @return fresh feed keys
     */
    protected static FeedKeys newKeys() {
        return FeedKeys.of(FeedName.of("contract-" + UUID.randomUUID()));
    }

    // ============================================================
    // Id allocation
    // ============================================================

    @Test
    void testNextId_OnFreshFeed_StartsAtOneAndIncreases() {
        FeedId first = store.nextId(keys);
        FeedId second = store.nextId(keys);
        FeedId third = store.nextId(keys);

        assertThat(first).isEqualTo(FeedId.of(1));
        assertThat(second).isEqualTo(FeedId.of(2));
        assertThat(third).isEqualTo(FeedId.of(3));
    }

    @Test
    void testNextId_CountersAreIndependentPerFeed() {
        FeedKeys other = newKeys();

        store.nextId(keys);
        store.nextId(keys);

        assertThat(store.nextId(other)).isEqualTo(FeedId.of(1));
        assertThat(store.nextId(keys)).isEqualTo(FeedId.of(3));
    }

    @Test
    void testNextId_UnusedIdsAreNotReissued() {
        FeedId discarded = store.nextId(keys);

        FeedId next = store.nextId(keys);

        assertThat(next).isGreaterThan(discarded);
        assertThat(store.getIds(keys)).isEmpty();
    }

    // ============================================================
    // Unwatched transactions
    // ============================================================

    @Test
    void testBegin_Commit_AppliesAllQueuedWrites() {
        try (FeedTransaction tx = store.begin(keys)) {
            tx.appendTail(FeedId.of(1))
                .put(FeedId.of(1), Content.of("one"))
                .appendTail(FeedId.of(2))
                .put(FeedId.of(2), Content.of("two"))
                .appendHead(FeedId.of(3))
                .put(FeedId.of(3), Content.of("three"))
                .incrementPublishCount();

            assertThat(tx.commit()).isTrue();
        }

        assertThat(store.getIds(keys)).containsExactly(FeedId.of(3), FeedId.of(1), FeedId.of(2));
        assertThat(store.getItem(keys, FeedId.of(2))).contains(Content.of("two"));
        assertThat(store.size(keys)).isEqualTo(3);
        assertThat(store.publishCount(keys)).isEqualTo(1);
    }

    @Test
    void testBegin_WritesAreInvisibleBeforeCommit() {
        try (FeedTransaction tx = store.begin(keys)) {
            tx.appendTail(FeedId.of(1)).put(FeedId.of(1), Content.of("one"));

            assertThat(store.getIds(keys)).isEmpty();
            assertThat(store.getItem(keys, FeedId.of(1))).isEmpty();

            tx.commit();
        }

        assertThat(store.getIds(keys)).containsExactly(FeedId.of(1));
    }

    @Test
    void testClose_WithoutCommit_DiscardsQueuedWrites() {
        try (FeedTransaction tx = store.begin(keys)) {
            tx.appendTail(FeedId.of(1))
                .put(FeedId.of(1), Content.of("one"))
                .incrementPublishCount();
        }

        assertThat(store.getIds(keys)).isEmpty();
        assertThat(store.size(keys)).isZero();
        assertThat(store.publishCount(keys)).isZero();
    }

    @Test
    void testCommit_Twice_ThrowsIllegalState() {
        try (FeedTransaction tx = store.begin(keys)) {
            tx.appendTail(FeedId.of(1));
            tx.commit();

            assertThatThrownBy(tx::commit).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> tx.appendTail(FeedId.of(2))).isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    void testTransaction_NullArguments_ThrowIllegalArgument() {
        try (FeedTransaction tx = store.begin(keys)) {
            assertThatThrownBy(() -> tx.appendTail(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cannot be null");
            assertThatThrownBy(() -> tx.put(FeedId.of(1), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cannot be null");
            assertThatThrownBy(() -> tx.insertRelative(FeedId.of(2), FeedId.of(1), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cannot be null");
        }
    }

    // ============================================================
    // Watched transactions
    // ============================================================

    @Test
    void testWatch_NoInterference_CommitSucceeds() {
        seed(1, "one");

        try (FeedTransaction tx = store.watch(keys)) {
            assertThat(tx.contains(FeedId.of(1))).isTrue();
            assertThat(tx.contains(FeedId.of(2))).isFalse();

            tx.put(FeedId.of(1), Content.of("edited"));
            assertThat(tx.commit()).isTrue();
        }

        assertThat(store.getItem(keys, FeedId.of(1))).contains(Content.of("edited"));
    }

    @Test
    void testWatch_ItemsChangedByAnotherCommitter_CommitAbortsAndAppliesNothing() {
        seed(1, "one");

        try (FeedTransaction watched = store.watch(keys)) {
            assertThat(watched.contains(FeedId.of(1))).isTrue();

            // competing writer commits first
            try (FeedTransaction competing = store.begin(keys)) {
                competing.put(FeedId.of(1), Content.of("theirs")).commit();
            }

            watched.remove(FeedId.of(1))
                .delete(FeedId.of(1))
                .incrementPublishCount();
            assertThat(watched.commit()).isFalse();
        }

        assertThat(store.getIds(keys)).containsExactly(FeedId.of(1));
        assertThat(store.getItem(keys, FeedId.of(1))).contains(Content.of("theirs"));
        assertThat(store.publishCount(keys)).isZero();
    }

    @Test
    void testWatch_RewriteWithSameContent_StillAborts() {
        seed(1, "one");

        try (FeedTransaction watched = store.watch(keys)) {
            try (FeedTransaction competing = store.begin(keys)) {
                competing.put(FeedId.of(1), Content.of("one")).commit();
            }

            watched.put(FeedId.of(1), Content.of("mine"));
            assertThat(watched.commit()).isFalse();
        }

        assertThat(store.getItem(keys, FeedId.of(1))).contains(Content.of("one"));
    }

    @Test
    void testWatch_OtherFeedChanged_CommitSucceeds() {
        FeedKeys other = newKeys();
        seed(1, "one");

        try (FeedTransaction watched = store.watch(keys)) {
            try (FeedTransaction competing = store.begin(other)) {
                competing.appendTail(FeedId.of(1)).put(FeedId.of(1), Content.of("elsewhere")).commit();
            }

            watched.put(FeedId.of(1), Content.of("mine"));
            assertThat(watched.commit()).isTrue();
        }

        assertThat(store.getItem(keys, FeedId.of(1))).contains(Content.of("mine"));
    }

    @Test
    void testWatch_ClosedWithoutCommit_NextWatchStartsClean() {
        seed(1, "one");

        try (FeedTransaction abandoned = store.watch(keys)) {
            abandoned.contains(FeedId.of(1));
        }
        seed(2, "two");

        try (FeedTransaction tx = store.watch(keys)) {
            tx.put(FeedId.of(2), Content.of("edited"));
            assertThat(tx.commit()).isTrue();
        }

        assertThat(store.getItem(keys, FeedId.of(2))).contains(Content.of("edited"));
    }

    // ============================================================
    // Queued notifications
    // ============================================================

    @Test
    void testCommitWithSink_EmitsQueuedEventsInOrderOnceWritesAreVisible() {
        seed(1, "one");
        PublishEvent published = new PublishEvent(keys.feed(), FeedId.of(2), Content.of("two"));
        RetractEvent retracted = new RetractEvent(keys.feed(), FeedId.of(1));
        List<FeedEvent> emitted = new CopyOnWriteArrayList<>();
        List<Optional<Content>> visibleAtEmit = new CopyOnWriteArrayList<>();

        try (FeedTransaction tx = store.watch(keys)) {
            assertThat(tx.contains(FeedId.of(1))).isTrue();
            tx.appendTail(FeedId.of(2))
                .put(FeedId.of(2), Content.of("two"))
                .publish(published)
                .remove(FeedId.of(1))
                .delete(FeedId.of(1))
                .publish(retracted);

            assertThat(emitted).isEmpty();
            assertThat(tx.commit(event -> {
                visibleAtEmit.add(store.getItem(keys, FeedId.of(2)));
                emitted.add(event);
            })).isTrue();
        }

        assertThat(emitted).containsExactly(published, retracted);
        assertThat(visibleAtEmit).containsOnly(Optional.of(Content.of("two")));
    }

    @Test
    void testCommitWithSink_AbortedWatch_EmitsNothing() {
        seed(1, "one");
        RecordingNotificationSink sink = new RecordingNotificationSink();

        try (FeedTransaction watched = store.watch(keys)) {
            try (FeedTransaction competing = store.begin(keys)) {
                competing.put(FeedId.of(1), Content.of("theirs")).commit();
            }

            watched.put(FeedId.of(1), Content.of("mine"))
                .publish(new PublishEvent(keys.feed(), FeedId.of(1), Content.of("mine")));
            assertThat(watched.commit(sink)).isFalse();
        }

        assertThat(sink.events()).isEmpty();
    }

    @Test
    void testClose_WithoutCommit_DropsQueuedEvents() {
        RecordingNotificationSink sink = new RecordingNotificationSink();

        FeedTransaction tx = store.begin(keys);
        tx.appendTail(FeedId.of(1))
            .put(FeedId.of(1), Content.of("one"))
            .publish(new PublishEvent(keys.feed(), FeedId.of(1), Content.of("one")));
        tx.close();

        assertThatThrownBy(() -> tx.commit(sink)).isInstanceOf(IllegalStateException.class);
        assertThat(sink.events()).isEmpty();
        assertThat(store.getIds(keys)).isEmpty();
    }

    @Test
    void testCommitWithoutSink_QueuedEvent_ThrowsIllegalState() {
        try (FeedTransaction tx = store.begin(keys)) {
            tx.appendTail(FeedId.of(1))
                .publish(new RetractEvent(keys.feed(), FeedId.of(1)));

            assertThatThrownBy(tx::commit).isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    void testCommitWithSink_NullSink_ThrowsIllegalArgument() {
        try (FeedTransaction tx = store.begin(keys)) {
            assertThatThrownBy(() -> tx.commit(null)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> tx.publish(null)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    // ============================================================
    // Positional writes
    // ============================================================

    @Test
    void testInsertRelative_BeforeAndAfter() {
        seed(1, "one");
        seed(2, "two");

        try (FeedTransaction tx = store.begin(keys)) {
            tx.insertRelative(FeedId.of(3), FeedId.of(2), Position.BEFORE)
                .insertRelative(FeedId.of(4), FeedId.of(1), Position.AFTER)
                .commit();
        }

        assertThat(store.getIds(keys))
            .containsExactly(FeedId.of(1), FeedId.of(4), FeedId.of(3), FeedId.of(2));
    }

    @Test
    void testInsertRelative_DuplicateAnchor_UsesFirstOccurrence() {
        try (FeedTransaction tx = store.begin(keys)) {
            tx.appendTail(FeedId.of(1))
                .appendTail(FeedId.of(2))
                .appendTail(FeedId.of(1))
                .commit();
        }

        try (FeedTransaction tx = store.begin(keys)) {
            tx.insertRelative(FeedId.of(9), FeedId.of(1), Position.AFTER).commit();
        }

        assertThat(store.getIds(keys))
            .containsExactly(FeedId.of(1), FeedId.of(9), FeedId.of(2), FeedId.of(1));
    }

    @Test
    void testInsertRelative_AnchorAbsentFromOrder_LeavesOrderUnchanged() {
        seed(1, "one");

        try (FeedTransaction tx = store.begin(keys)) {
            tx.insertRelative(FeedId.of(5), FeedId.of(42), Position.BEFORE).commit();
        }

        assertThat(store.getIds(keys)).containsExactly(FeedId.of(1));
    }

    @Test
    void testRemove_RemovesFirstOccurrenceOnly() {
        try (FeedTransaction tx = store.begin(keys)) {
            tx.appendTail(FeedId.of(1))
                .appendTail(FeedId.of(2))
                .appendTail(FeedId.of(1))
                .commit();
        }

        try (FeedTransaction tx = store.begin(keys)) {
            tx.remove(FeedId.of(1)).commit();
        }

        assertThat(store.getIds(keys)).containsExactly(FeedId.of(2), FeedId.of(1));
    }

    @Test
    void testDelete_AbsentItem_IsNoOp() {
        seed(1, "one");

        try (FeedTransaction tx = store.begin(keys)) {
            tx.delete(FeedId.of(7)).remove(FeedId.of(7));
            assertThat(tx.commit()).isTrue();
        }

        assertThat(store.getIds(keys)).containsExactly(FeedId.of(1));
        assertThat(store.size(keys)).isEqualTo(1);
    }

    // ============================================================
    // Reads
    // ============================================================

    @Test
    void testReads_OnUnknownFeed_AreEmpty() {
        assertThat(store.getIds(keys)).isEmpty();
        assertThat(store.getItems(keys)).isEmpty();
        assertThat(store.getItem(keys, FeedId.of(1))).isEmpty();
        assertThat(store.size(keys)).isZero();
        assertThat(store.publishCount(keys)).isZero();
    }

    @Test
    void testGetItems_OrderedByIdNotByPosition() {
        try (FeedTransaction tx = store.begin(keys)) {
            tx.appendTail(FeedId.of(10)).put(FeedId.of(10), Content.of("ten"))
                .appendTail(FeedId.of(2)).put(FeedId.of(2), Content.of("two"))
                .appendHead(FeedId.of(7)).put(FeedId.of(7), Content.of("seven"))
                .commit();
        }

        assertThat(store.getItems(keys).keySet())
            .containsExactly(FeedId.of(2), FeedId.of(7), FeedId.of(10));
        assertThat(store.getItems(keys)).containsEntry(FeedId.of(7), Content.of("seven"));
    }

    @Test
    void testContent_EmptyAndSeparatorCharacters_AreStoredVerbatim() {
        Content tricky = Content.of("a\0b\nc");

        try (FeedTransaction tx = store.begin(keys)) {
            tx.appendTail(FeedId.of(1)).put(FeedId.of(1), Content.empty())
                .appendTail(FeedId.of(2)).put(FeedId.of(2), tricky)
                .commit();
        }

        assertThat(store.getItem(keys, FeedId.of(1))).contains(Content.empty());
        assertThat(store.getItem(keys, FeedId.of(2))).contains(tricky);
    }

    @Test
    void testGetIds_ReturnsSnapshot() {
        seed(1, "one");
        List<FeedId> snapshot = store.getIds(keys);

        seed(2, "two");

        assertThat(snapshot).containsExactly(FeedId.of(1));
    }

    /**
     * Appends an item through an unwatched transaction.
     */
    protected void seed(long id, String content) {
        try (FeedTransaction tx = store.begin(keys)) {
            tx.appendTail(FeedId.of(id))
                .put(FeedId.of(id), Content.of(content))
                .commit();
        }
    }
}
