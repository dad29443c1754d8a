package io.eventcore.repository;

/**
 * Converts aggregate state to and from the text stored in a snapshot.
 *
 * <p>Implementations should throw {@link io.eventcore.SerializationException} for input
 * they cannot read; the repository then ignores the snapshot and replays the full stream.
 *
 * @param <S> the aggregate state type
 */
public interface StateSerializer<S> {

  String serialize(S state);

  S deserialize(String data);
}
