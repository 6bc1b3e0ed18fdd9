package ember.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import ember.db.Keyspace;
import ember.db.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * On-disk shape of a snapshot: both keyspace maps plus the time the copy was taken.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SnapshotDocument {
    public long savedAt;
    public Map<String, Value> store = new LinkedHashMap<>();
    public Map<String, Long> expirationTimes = new LinkedHashMap<>();

    public SnapshotDocument() {
        // Default constructor for Jackson
    }

    public static SnapshotDocument of(Keyspace keyspace, long savedAt) {
        SnapshotDocument doc = new SnapshotDocument();
        doc.savedAt = savedAt;
        doc.store = keyspace.copyEntries();
        doc.expirationTimes = keyspace.copyExpirations();
        return doc;
    }
}
