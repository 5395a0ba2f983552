package dev.maplecms.entity;

/**
 * Marker interface for entities that track their persistence state
 * via a {@code newRecord} flag. Entities carry pre-assigned Snowflake ids,
 * so {@link org.springframework.data.domain.Persistable#isNew()} cannot be
 * derived from a null id and is driven by this flag instead.
 *
 * @see dev.maplecms.config.PersistableEntityCallback
 */
public interface NewRecordAware {
    void setNewRecord(boolean newRecord);
}
