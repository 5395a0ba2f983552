package dev.maplecms.config.converter;

import dev.maplecms.entity.Metadata;
import io.r2dbc.postgresql.codec.Json;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;

/**
 * Reads the PostgreSQL {@code meta_json} JSONB column.
 */
@ReadingConverter
public class JsonToMetadataConverter implements Converter<Json, Metadata> {

    @Override
    public Metadata convert(Json source) {
        return Metadata.fromJson(source.asString());
    }
}
