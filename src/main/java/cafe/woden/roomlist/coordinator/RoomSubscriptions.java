package cafe.woden.roomlist.coordinator;

import cafe.woden.roomlist.model.Room;
import cafe.woden.roomlist.model.RoomEvent;
import cafe.woden.roomlist.model.RoomRef;
import cafe.woden.roomlist.source.RoomSource;
import cafe.woden.roomlist.source.SourceEvent;
import io.reactivex.rxjava3.disposables.Disposable;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Live event subscriptions held by the room list, keyed by room ref and by source id.
 *
 * <p>Subscribing a room or source again replaces (and disposes) its previous subscription.
 */
final class RoomSubscriptions {
  private static final Logger log = LoggerFactory.getLogger(RoomSubscriptions.class);

  private final Map<RoomRef, Disposable> byRoom = new HashMap<>();
  private final Map<String, Disposable> bySource = new HashMap<>();

  void subscribeRoom(Room room, Consumer<RoomEvent> handler) {
    Objects.requireNonNull(room, "room");
    Objects.requireNonNull(handler, "handler");
    RoomRef ref = room.ref();
    Disposable d =
        room.events()
            .subscribe(
                handler::accept,
                err -> log.error("[roomlist] Room event handling failed for {}", ref, err));
    Disposable previous = byRoom.put(ref, d);
    if (previous != null) previous.dispose();
  }

  void unsubscribeRoom(RoomRef ref) {
    Disposable d = byRoom.remove(ref);
    if (d != null) d.dispose();
  }

  /** @return the number of room subscriptions dropped */
  int unsubscribeRoomsOf(String sourceId) {
    int dropped = 0;
    for (Iterator<Map.Entry<RoomRef, Disposable>> it = byRoom.entrySet().iterator();
        it.hasNext(); ) {
      Map.Entry<RoomRef, Disposable> e = it.next();
      if (!e.getKey().sourceId().equals(sourceId)) continue;
      e.getValue().dispose();
      it.remove();
      dropped++;
    }
    return dropped;
  }

  void subscribeSource(RoomSource source, Consumer<SourceEvent> handler) {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(handler, "handler");
    String sid = source.id();
    Disposable d =
        source
            .events()
            .subscribe(
                handler::accept,
                err -> log.error("[roomlist] Source event handling failed for '{}'", sid, err));
    Disposable previous = bySource.put(sid, d);
    if (previous != null) previous.dispose();
  }

  void unsubscribeSource(String sourceId) {
    Disposable d = bySource.remove(sourceId);
    if (d != null) d.dispose();
  }

  boolean isRoomSubscribed(RoomRef ref) {
    Disposable d = byRoom.get(ref);
    return d != null && !d.isDisposed();
  }

  boolean isSourceSubscribed(String sourceId) {
    Disposable d = bySource.get(sourceId);
    return d != null && !d.isDisposed();
  }

  int roomSubscriptionCount() {
    return byRoom.size();
  }

  void dispose() {
    byRoom.values().forEach(Disposable::dispose);
    byRoom.clear();
    bySource.values().forEach(Disposable::dispose);
    bySource.clear();
  }
}
