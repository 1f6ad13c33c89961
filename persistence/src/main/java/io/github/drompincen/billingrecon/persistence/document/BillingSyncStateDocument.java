package io.github.drompincen.billingrecon.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Single-row record of the most recent batch reconciliation.
 */
@Document(collection = "billing_sync_state")
public class BillingSyncStateDocument {

    public static final String DEFAULT_ID = "default";

    @Id
    private String id = DEFAULT_ID;
    private Instant lastSyncAt;
    private String lastSyncStatus;
    private int processed;
    private int errors;
    private int total;

    public BillingSyncStateDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public Instant getLastSyncAt() { return lastSyncAt; }
    public void setLastSyncAt(Instant lastSyncAt) { this.lastSyncAt = lastSyncAt; }

    public String getLastSyncStatus() { return lastSyncStatus; }
    public void setLastSyncStatus(String lastSyncStatus) { this.lastSyncStatus = lastSyncStatus; }

    public int getProcessed() { return processed; }
    public void setProcessed(int processed) { this.processed = processed; }

    public int getErrors() { return errors; }
    public void setErrors(int errors) { this.errors = errors; }

    public int getTotal() { return total; }
    public void setTotal(int total) { this.total = total; }
}
