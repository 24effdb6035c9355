package eventbus.dispatch;

import eventbus.Callback;
import eventbus.EventCallback;

import java.util.List;
import java.util.Objects;

/**
 * Dispatches every emission on the caller's thread.
 *
 * <p>Groups run in ascending priority order and callbacks within a group in registration
 * order. {@link #emit} returns once every callback has returned or failed and been
 * reported. Emitting from inside a callback dispatches the nested event depth-first.
 *
 * <pre>{@code
 * EventBus bus = EventBus.builder().build();
 * bus.on("saved", args -> System.out.println("saved " + args[0]));
 * bus.emit("saved", 42);
 * }</pre>
 */
public final class EventBus extends AbstractEventBus {

  private EventBus(Builder builder) {
    super(builder);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Dispatches {@link #ANY_EVENT} and then {@code event} to the registered callbacks.
   *
   * @throws DispatchInterruptedException if a callback was interrupted
   */
  @Override
  public void emit(String event, Object... args) {
    Objects.requireNonNull(event, "event");
    Object[] values = copyArgs(args);
    metrics.incrementEmitted();
    dispatch(ANY_EVENT, metaArgs(event, values));
    dispatch(event, values);
  }

  private void dispatch(String event, Object[] args) {
    List<List<Callback>> groups = getCallbacks(event);
    if (groups.isEmpty()) {
      return;
    }
    List<Object> argList = argList(args);
    for (List<Callback> group : groups) {
      for (Callback callback : group) {
        invoke(event, (EventCallback) callback, args, argList);
      }
    }
  }

  public static final class Builder extends AbstractBuilder<Builder> {
    private Builder() {}

    public EventBus build() {
      return new EventBus(this);
    }
  }
}
