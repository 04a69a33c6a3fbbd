package cafe.woden.roomlist.model;

import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Mutable {@link Room} held entirely in memory.
 *
 * <p>Every mutator emits the matching {@link RoomEvent}s on the calling thread. Tag mutations are
 * bracketed by {@link RoomEvent.TagsAboutToChange} / {@link RoomEvent.TagsChanged}.
 */
public class InMemoryRoom implements Room {

  private final RoomRef ref;
  private final LinkedHashMap<String, TagOrder> tags = new LinkedHashMap<>();
  private final FlowableProcessor<RoomEvent> events =
      PublishProcessor.<RoomEvent>create().toSerialized();

  private volatile String displayName;
  private volatile boolean directChat;
  private volatile JoinState joinState = JoinState.JOIN;
  private volatile int unreadCount = -1;
  private volatile boolean unreadCountIsLowerBound;

  public InMemoryRoom(String sourceId, String roomId) {
    this(new RoomRef(sourceId, roomId));
  }

  public InMemoryRoom(RoomRef ref) {
    this.ref = Objects.requireNonNull(ref, "ref");
    this.displayName = ref.roomId();
  }

  @Override
  public RoomRef ref() {
    return ref;
  }

  @Override
  public String displayName() {
    return displayName;
  }

  @Override
  public boolean isDirectChat() {
    return directChat;
  }

  @Override
  public JoinState joinState() {
    return joinState;
  }

  @Override
  public synchronized Map<String, TagOrder> tags() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(tags));
  }

  @Override
  public int unreadCount() {
    return unreadCount;
  }

  @Override
  public boolean unreadCountIsLowerBound() {
    return unreadCountIsLowerBound;
  }

  @Override
  public Flowable<RoomEvent> events() {
    return events;
  }

  public InMemoryRoom addTag(String name) {
    return addTag(name, TagOrder.omitted());
  }

  public InMemoryRoom addTag(String name, double order) {
    return addTag(name, TagOrder.of(order));
  }

  public InMemoryRoom addTag(String name, TagOrder order) {
    String key = requireTagName(name);
    TagOrder o = order == null ? TagOrder.omitted() : order;
    mutateTags(t -> t.put(key, o));
    return this;
  }

  @Override
  public void removeTag(String name) {
    String key = Objects.toString(name, "").trim();
    synchronized (this) {
      if (!tags.containsKey(key)) return;
    }
    mutateTags(t -> t.remove(key));
  }

  /** Replaces the whole tag map in one change. */
  public InMemoryRoom setTags(Map<String, TagOrder> next) {
    LinkedHashMap<String, TagOrder> copy = new LinkedHashMap<>();
    if (next != null) {
      next.forEach((k, v) -> copy.put(requireTagName(k), v == null ? TagOrder.omitted() : v));
    }
    mutateTags(
        t -> {
          t.clear();
          t.putAll(copy);
        });
    return this;
  }

  /**
   * Flips the direct-chat flag.
   *
   * <p>Direct-chat status takes part in grouping, so this goes through the tag-change pair.
   */
  public InMemoryRoom setDirectChat(boolean directChat) {
    if (this.directChat == directChat) return this;
    events.onNext(new RoomEvent.TagsAboutToChange(ref));
    this.directChat = directChat;
    events.onNext(new RoomEvent.TagsChanged(ref));
    return this;
  }

  public InMemoryRoom setDisplayName(String displayName) {
    String next = Objects.toString(displayName, "").trim();
    if (next.isEmpty()) next = ref.roomId();
    if (next.equals(this.displayName)) return this;
    this.displayName = next;
    events.onNext(new RoomEvent.DisplayAttributeChanged(ref, Set.of(RoomAspect.DISPLAY_NAME)));
    return this;
  }

  public InMemoryRoom setJoinState(JoinState joinState) {
    JoinState next = joinState == null ? JoinState.JOIN : joinState;
    if (next == this.joinState) return this;
    this.joinState = next;
    events.onNext(new RoomEvent.DisplayAttributeChanged(ref, Set.of()));
    return this;
  }

  public InMemoryRoom setUnread(int count, boolean lowerBound) {
    this.unreadCount = Math.max(-1, count);
    this.unreadCountIsLowerBound = lowerBound;
    events.onNext(new RoomEvent.DisplayAttributeChanged(ref, Set.of(RoomAspect.UNREAD)));
    return this;
  }

  public InMemoryRoom avatarChanged() {
    events.onNext(new RoomEvent.DisplayAttributeChanged(ref, Set.of(RoomAspect.AVATAR)));
    return this;
  }

  private void mutateTags(Consumer<Map<String, TagOrder>> mutation) {
    events.onNext(new RoomEvent.TagsAboutToChange(ref));
    synchronized (this) {
      mutation.accept(tags);
    }
    events.onNext(new RoomEvent.TagsChanged(ref));
  }

  private static String requireTagName(String name) {
    String key = Objects.toString(name, "").trim();
    if (key.isEmpty()) throw new IllegalArgumentException("tag name must not be blank");
    return key;
  }

  @Override
  public String toString() {
    return "InMemoryRoom{" + ref.sourceId() + ":" + ref.roomId() + " '" + displayName + "'}";
  }
}
