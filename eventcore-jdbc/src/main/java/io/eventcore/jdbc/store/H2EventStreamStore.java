package io.eventcore.jdbc.store;

import io.eventcore.util.JsonCodec;

import java.util.List;

/**
 * H2 event stream store. Uses the standard SQL of the base class unchanged.
 */
public final class H2EventStreamStore extends AbstractJdbcEventStreamStore {

  public H2EventStreamStore() {
    super();
  }

  public H2EventStreamStore(String eventTable, String snapshotTable) {
    super(eventTable, snapshotTable);
  }

  public H2EventStreamStore(String eventTable, String snapshotTable, JsonCodec jsonCodec) {
    super(eventTable, snapshotTable, jsonCodec);
  }

  @Override
  public AbstractJdbcEventStreamStore withJsonCodec(JsonCodec jsonCodec) {
    return new H2EventStreamStore(eventTable(), snapshotTable(), jsonCodec);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
