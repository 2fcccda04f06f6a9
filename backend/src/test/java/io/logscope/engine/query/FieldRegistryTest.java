package io.logscope.engine.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class FieldRegistryTest {

    @Test
    void defaultsCoverEveryQueryableColumn() {
        assertThat(FieldRegistry.defaults().fields())
                .extracting(FieldDefinition::name)
                .containsExactly("level", "message", "source", "type", "agent_id", "file_path", "timestamp",
                        "http_status", "http_method", "uri", "fields", "labels");
    }

    @Test
    void operatorSetsFollowFieldKind() {
        FieldRegistry registry = FieldRegistry.defaults();

        assertThat(registry.lookup("timestamp")).get()
                .satisfies(f -> assertThat(f.operators()).containsExactlyInAnyOrder(">=", "<=", ">", "<"));
        assertThat(registry.lookup("message")).get()
                .satisfies(f -> assertThat(f.allows("matches")).isTrue())
                .satisfies(f -> assertThat(f.allows("in")).isFalse());
        assertThat(registry.lookup("labels")).get()
                .satisfies(f -> assertThat(f.isJson()).isTrue());
    }

    @Test
    void unknownNamesAreAbsent() {
        assertThat(FieldRegistry.defaults().lookup("hostname")).isEmpty();
    }

    @Test
    void rejectsDuplicateDefinitions() {
        FieldDefinition level = new FieldDefinition("level", "level", FieldType.STRING, Set.of("=="));

        assertThatThrownBy(() -> new FieldRegistry(List.of(level, level)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
