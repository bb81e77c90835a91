package io.intellixity.sqlkit.proto;

import com.google.protobuf.Message;
import io.intellixity.sqlkit.error.MappingNotImplementedException;

import java.nio.file.Path;
import java.util.Map;

/**
 * Converts records of one type to and from a paired protocol buffer message.
 * <p>
 * Implementations override {@link #populate(Object, Message.Builder)} and {@link #fromMessage(Message)}.
 * A mapping that leaves either one out fails with {@link MappingNotImplementedException} on first use rather
 * than producing empty messages.
 *
 * Examples:
 * <pre>
 * User user = USERS.fromFields(USER_MAPPING.fromMessage(proto));
 * session.getOrCreate(USERS, USER_MAPPING.fromSerializedFile(path));
 * </pre>
 *
 * @param <R> record type
 * @param <M> paired message type
 */
public interface MessageMapping<R, M extends Message> {

  /** Default instance of the paired message type. */
  M prototype();

  /** Set the fields of {@code builder} from the values of {@code record}. */
  default void populate(R record, Message.Builder builder) {
    throw new MappingNotImplementedException(getClass(), "populate");
  }

  /** Serialize a record to a new message. */
  default M toMessage(R record) {
    Message.Builder builder = prototype().newBuilderForType();
    populate(record, builder);
    @SuppressWarnings("unchecked")
    M out = (M) builder.build();
    return out;
  }

  /**
   * Constructor arguments (column name to value) for a record holding the values of {@code message}.
   * Feed the result to {@code RecordType.fromFields} or {@code Session.getOrCreate}.
   */
  default Map<String, Object> fromMessage(M message) {
    throw new MappingNotImplementedException(getClass(), "fromMessage");
  }

  /**
   * Constructor arguments read from a serialized message file.
   *
   * @throws io.intellixity.sqlkit.error.DeserializationException if the file is missing or malformed
   */
  default Map<String, Object> fromSerializedFile(Path path) {
    return fromMessage(MessageFiles.read(path, prototype()));
  }
}
