package io.taskgateway.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RequestShapeAdapter")
class RequestShapeAdapterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    @DisplayName("read-only fields are removed, caller-settable ones kept")
    void stripsReadOnlyFields() throws Exception {
        ObjectNode body = (ObjectNode) MAPPER.readTree("""
                {"title":"Write report","user_id":"u","tags":["a"],"parent_id":null,
                 "completion_percentage":10,"is_deleted":false,"service_ids":[],
                 "last_claimed_date":"2024-05-01"}
                """);

        ObjectNode stripped = RequestShapeAdapter.stripReadOnlyFields(body);

        assertThat(stripped.fieldNames()).toIterable()
                .containsExactly("title", "user_id", "tags", "parent_id", "service_ids");
        assertThat(body.has("is_deleted")).isTrue();
    }

    @Test
    void readOnlyFieldsAreBackFilledOnResponses() {
        assertThat(ResponseShapeAdapter.BACKFILL_DEFAULTS.keySet())
                .containsAll(RequestShapeAdapter.READ_ONLY_FIELDS);
    }

    @Test
    void nullBodyYieldsEmptyObject() {
        assertThat(RequestShapeAdapter.stripReadOnlyFields(null).isEmpty()).isTrue();
    }
}
