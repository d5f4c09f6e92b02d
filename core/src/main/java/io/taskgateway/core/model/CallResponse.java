package io.taskgateway.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * The normalized {@code {code, success, message, data}} envelope. This is the
 * only shape route handlers ever receive.
 *
 * <p>
 * {@code success} is derived from {@code code}: it is {@code true} exactly
 * when the code lies in {@code 200..299}.
 */
public final class CallResponse {

    private final int code;
    private final boolean success;
    private final String message;
    private final JsonNode data;

    private CallResponse(int code, String message, JsonNode data) {
        this.code = code;
        this.success = isSuccessCode(code);
        this.message = Objects.requireNonNullElse(message, success ? "success" : "error");
        this.data = data == null || data.isMissingNode() ? null : data;
    }

    /** Creates an envelope; {@code success} follows from {@code code}. */
    public static CallResponse of(int code, String message, JsonNode data) {
        return new CallResponse(code, message, data);
    }

    /** Creates a 200 envelope with message {@code success}. */
    public static CallResponse ok(JsonNode data) {
        return new CallResponse(200, "success", data);
    }

    /** Creates a failure envelope with no data. */
    public static CallResponse failure(int code, String message) {
        return new CallResponse(code, message, null);
    }

    /** The success set of envelope codes. */
    public static boolean isSuccessCode(int code) {
        return code >= 200 && code <= 299;
    }

    public int code() {
        return code;
    }

    public boolean success() {
        return success;
    }

    public String message() {
        return message;
    }

    /** Returns the payload, or {@code null} when there is none. */
    public JsonNode data() {
        return data;
    }

    /** Renders the envelope as a JSON object. */
    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("code", code);
        node.put("success", success);
        node.put("message", message);
        if (data == null) {
            node.putNull("data");
        } else {
            node.set("data", data);
        }
        return node;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CallResponse)) {
            return false;
        }
        CallResponse that = (CallResponse) o;
        return code == that.code && message.equals(that.message) && Objects.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, message, data);
    }

    @Override
    public String toString() {
        return "CallResponse[code=" + code + ", success=" + success + ", message=" + message + "]";
    }
}
