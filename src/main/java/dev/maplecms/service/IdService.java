package dev.maplecms.service;

import dev.maplecms.util.SnowflakeId;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Hands out primary keys. Every entity id is minted here before the first save.
 */
@Service
@RequiredArgsConstructor
public class IdService {

    private final SnowflakeId snowflakeId;

    public long nextId() {
        return snowflakeId.nextId();
    }
}
