package com.ryuqq.sortedfeed.adapter.inmemory.store;

import com.ryuqq.sortedfeed.core.model.Content;
import com.ryuqq.sortedfeed.core.model.FeedId;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable per-feed state held by {@link InMemoryFeedStore}.
 *
 * <p>Every access must hold this object's monitor. {@code itemsVersion} increases on each
 * modification of the items map and is what a watching transaction compares on commit.</p>
 */
final class FeedState {

    final List<FeedId> order = new ArrayList<>();
    final Map<FeedId, Content> items = new HashMap<>();
    long idCounter;
    long publishCounter;
    long itemsVersion;

    void putItem(FeedId id, Content content) {
        items.put(id, content);
        itemsVersion++;
    }

    void deleteItem(FeedId id) {
        if (items.remove(id) != null) {
            itemsVersion++;
        }
    }

    void insertRelative(FeedId id, FeedId anchor, boolean before) {
        int index = order.indexOf(anchor);
        if (index < 0) {
            return;
        }
        order.add(before ? index : index + 1, id);
    }
}
