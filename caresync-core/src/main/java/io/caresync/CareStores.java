package io.caresync;

import io.caresync.spi.AlertDedupStore;
import io.caresync.spi.ScheduleStore;
import io.caresync.spi.SyncLinkStore;
import io.caresync.spi.WatchSubscriptionStore;

import java.util.Objects;

/**
 * The four persistence stores the scheduler needs, usually backed by one database.
 */
public record CareStores(
    ScheduleStore scheduleStore,
    SyncLinkStore syncLinkStore,
    WatchSubscriptionStore subscriptionStore,
    AlertDedupStore dedupStore
) {
  public CareStores {
    Objects.requireNonNull(scheduleStore, "scheduleStore");
    Objects.requireNonNull(syncLinkStore, "syncLinkStore");
    Objects.requireNonNull(subscriptionStore, "subscriptionStore");
    Objects.requireNonNull(dedupStore, "dedupStore");
  }
}
