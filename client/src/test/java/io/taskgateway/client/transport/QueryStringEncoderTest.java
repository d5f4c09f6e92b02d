package io.taskgateway.client.transport;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

class QueryStringEncoderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void scalarsInFieldOrder() {
        ObjectNode query = MAPPER.createObjectNode().put("status", "pending").put("limit", 20).put("done", false);

        assertThat(QueryStringEncoder.encode(query)).isEqualTo("status=pending&limit=20&done=false");
    }

    @Test
    void arraysRepeatAndNullsAreSkipped() {
        ObjectNode query = MAPPER.createObjectNode();
        query.putArray("tag").add("work").add("home");
        query.putNull("parent_id");

        assertThat(QueryStringEncoder.encode(query)).isEqualTo("tag=work&tag=home");
    }

    @Test
    void reservedCharactersAreEncoded() {
        ObjectNode query = MAPPER.createObjectNode().put("q", "a&b=c d/é");

        assertThat(QueryStringEncoder.encode(query)).isEqualTo("q=a%26b%3Dc%20d%2F%C3%A9");
    }

    @Test
    void nestedObjectsAreSentAsJson() {
        ObjectNode query = MAPPER.createObjectNode();
        query.putObject("filter").put("a", 1);

        assertThat(QueryStringEncoder.encode(query)).isEqualTo("filter=%7B%22a%22%3A1%7D");
    }

    @Test
    void emptyAndNull() {
        assertThat(QueryStringEncoder.encode(null)).isEmpty();
        assertThat(QueryStringEncoder.encode(MAPPER.createObjectNode())).isEmpty();
    }
}
