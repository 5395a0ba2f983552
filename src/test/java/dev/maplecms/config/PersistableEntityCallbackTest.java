package dev.maplecms.config;

import dev.maplecms.entity.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.data.relational.core.sql.SqlIdentifier;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class PersistableEntityCallbackTest {

    private final PersistableEntityCallback callback = new PersistableEntityCallback();

    @Test
    void shouldMarkLoadedEntityAsPersisted() {
        Tag tag = Tag.builder().id(5L).name("java").slug("java").build();
        assertThat(tag.isNew()).isTrue();

        StepVerifier.create(Mono.from(callback.onAfterConvert(tag, SqlIdentifier.unquoted("tags"))))
                .expectNext(tag)
                .verifyComplete();

        assertThat(tag.isNew()).isFalse();
    }

    @Test
    void shouldPassThroughOtherObjects() {
        StepVerifier.create(Mono.from(callback.onAfterConvert("row", SqlIdentifier.unquoted("x"))))
                .expectNext("row")
                .verifyComplete();
    }
}
