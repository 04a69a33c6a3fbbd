package cafe.woden.roomlist.api;

import cafe.woden.roomlist.model.RoomAspect;
import io.reactivex.rxjava3.subscribers.TestSubscriber;
import java.util.Set;
import org.junit.jupiter.api.Test;

class RoomListChangeStreamTest {

  @Test
  void republishesEveryCallbackInOrder() {
    RoomListChangeStream stream = new RoomListChangeStream();
    TestSubscriber<RoomListChange> changes = stream.changes().test();

    stream.groupInserted(0);
    stream.roomInserted(0, 0);
    stream.roomMoved(0, 0, 2);
    stream.dataChanged(0, 2, Set.of(RoomAspect.UNREAD));
    stream.roomRemoved(0, 2);
    stream.groupRemoved(0);
    stream.fullReset();

    changes.assertValues(
        new RoomListChange.GroupInserted(0),
        new RoomListChange.RoomInserted(0, 0),
        new RoomListChange.RoomMoved(0, 0, 2),
        new RoomListChange.DataChanged(0, 2, Set.of(RoomAspect.UNREAD)),
        new RoomListChange.RoomRemoved(0, 2),
        new RoomListChange.GroupRemoved(0),
        new RoomListChange.FullReset());
  }

  @Test
  void lateSubscribersOnlySeeNewChanges() {
    RoomListChangeStream stream = new RoomListChangeStream();
    stream.fullReset();

    TestSubscriber<RoomListChange> changes = stream.changes().test();
    stream.groupInserted(1);

    changes.assertValue(new RoomListChange.GroupInserted(1));
  }
}
