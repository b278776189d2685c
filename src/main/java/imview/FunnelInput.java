package imview;

import com.google.common.base.MoreObjects;

/**
 * What the {@link EventFunnel} reads from its inbox: a raw watch event, a finished job,
 * or the marker the {@link WatchBridge} leaves when its source has closed.
 */
final class FunnelInput {

  enum Kind {
    WATCH, OPERATION, WATCH_CLOSED
  }

  private static final FunnelInput WATCH_CLOSED = new FunnelInput(Kind.WATCH_CLOSED, null, null);
  private final Kind kind;
  private final RawEvent rawEvent;
  private final OperationResult operationResult;

  private FunnelInput(Kind kind, RawEvent rawEvent, OperationResult operationResult) {
    this.kind = kind;
    this.rawEvent = rawEvent;
    this.operationResult = operationResult;
  }

  static FunnelInput watch(RawEvent event) {
    return new FunnelInput(Kind.WATCH, event, null);
  }

  static FunnelInput operation(OperationResult result) {
    return new FunnelInput(Kind.OPERATION, null, result);
  }

  static FunnelInput watchClosed() {
    return WATCH_CLOSED;
  }

  Kind getKind() {
    return kind;
  }

  RawEvent getRawEvent() {
    return rawEvent;
  }

  OperationResult getOperationResult() {
    return operationResult;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).omitNullValues().add("kind", kind).add("raw", rawEvent).add("op", operationResult).toString();
  }

}
