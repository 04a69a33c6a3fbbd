package cafe.woden.roomlist.api;

import cafe.woden.roomlist.model.RoomAspect;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import java.util.Set;

/** Republishes listener callbacks as a hot {@link Flowable} of {@link RoomListChange}s. */
public final class RoomListChangeStream implements RoomListListener {

  private final FlowableProcessor<RoomListChange> changes =
      PublishProcessor.<RoomListChange>create().toSerialized();

  public Flowable<RoomListChange> changes() {
    return changes.onBackpressureBuffer();
  }

  @Override
  public void groupInserted(int groupPosition) {
    changes.onNext(new RoomListChange.GroupInserted(groupPosition));
  }

  @Override
  public void roomInserted(int groupPosition, int roomPosition) {
    changes.onNext(new RoomListChange.RoomInserted(groupPosition, roomPosition));
  }

  @Override
  public void roomRemoved(int groupPosition, int roomPosition) {
    changes.onNext(new RoomListChange.RoomRemoved(groupPosition, roomPosition));
  }

  @Override
  public void groupRemoved(int groupPosition) {
    changes.onNext(new RoomListChange.GroupRemoved(groupPosition));
  }

  @Override
  public void roomMoved(int groupPosition, int oldRoomPosition, int newRoomPosition) {
    changes.onNext(new RoomListChange.RoomMoved(groupPosition, oldRoomPosition, newRoomPosition));
  }

  @Override
  public void dataChanged(int groupPosition, int roomPosition, Set<RoomAspect> aspects) {
    changes.onNext(new RoomListChange.DataChanged(groupPosition, roomPosition, aspects));
  }

  @Override
  public void fullReset() {
    changes.onNext(new RoomListChange.FullReset());
  }
}
