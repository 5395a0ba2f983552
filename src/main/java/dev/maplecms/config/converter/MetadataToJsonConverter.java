package dev.maplecms.config.converter;

import dev.maplecms.entity.Metadata;
import io.r2dbc.postgresql.codec.Json;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.WritingConverter;

/**
 * Writes {@link Metadata} into the PostgreSQL {@code meta_json} JSONB column.
 */
@WritingConverter
public class MetadataToJsonConverter implements Converter<Metadata, Json> {

    @Override
    public Json convert(Metadata source) {
        return Json.of(source.toJson());
    }
}
