package dev.maplecms.config;

import dev.maplecms.entity.NewRecordAware;
import org.reactivestreams.Publisher;
import org.springframework.data.r2dbc.mapping.event.AfterConvertCallback;
import org.springframework.data.relational.core.sql.SqlIdentifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Marks every entity read from the database as persisted, so a later
 * {@code save()} issues an UPDATE even though its Snowflake id was assigned up front.
 */
@Component
public class PersistableEntityCallback implements AfterConvertCallback<Object> {

    @Override
    public Publisher<Object> onAfterConvert(Object entity, SqlIdentifier table) {
        if (entity instanceof NewRecordAware) {
            ((NewRecordAware) entity).setNewRecord(false);
        }
        return Mono.just(entity);
    }
}
