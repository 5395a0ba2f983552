package dev.maplecms.config.converter;

import dev.maplecms.entity.Metadata;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.WritingConverter;

// H2 keeps meta_json as plain VARCHAR
@WritingConverter
public class MetadataToStringConverter implements Converter<Metadata, String> {

    @Override
    public String convert(Metadata source) {
        return source.toJson();
    }
}
