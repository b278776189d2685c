package imview;

import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * The single item type on the consumer channel: either a {@link FileEvent} or an {@link OperationResult}.
 */
public final class OutputEvent {

  public enum Kind {
    FILE, OPERATION
  }

  private final Kind kind;
  private final FileEvent fileEvent;
  private final OperationResult operationResult;

  private OutputEvent(Kind kind, FileEvent fileEvent, OperationResult operationResult) {
    this.kind = kind;
    this.fileEvent = fileEvent;
    this.operationResult = operationResult;
  }

  public static OutputEvent of(FileEvent fileEvent) {
    return new OutputEvent(Kind.FILE, Objects.requireNonNull(fileEvent), null);
  }

  public static OutputEvent of(OperationResult operationResult) {
    return new OutputEvent(Kind.OPERATION, null, Objects.requireNonNull(operationResult));
  }

  public Kind getKind() {
    return kind;
  }

  /** @return the file event, or {@code null} if this is an {@link Kind#OPERATION} */
  public FileEvent getFileEvent() {
    return fileEvent;
  }

  /** @return the operation result, or {@code null} if this is a {@link Kind#FILE} */
  public OperationResult getOperationResult() {
    return operationResult;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("kind", kind).add("event", kind == Kind.FILE ? fileEvent : operationResult).toString();
  }

}
