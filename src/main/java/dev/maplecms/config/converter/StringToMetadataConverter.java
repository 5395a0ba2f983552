package dev.maplecms.config.converter;

import dev.maplecms.entity.Metadata;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;

@ReadingConverter
public class StringToMetadataConverter implements Converter<String, Metadata> {

    @Override
    public Metadata convert(String source) {
        return Metadata.fromJson(source);
    }
}
