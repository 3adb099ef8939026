package blitz.engine.service.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;

/**
 * JSON encoding of protocol messages, one tagged value per frame.
 */
@Component
public class ProtocolCodec {
    private final ObjectMapper objectMapper;

    public ProtocolCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    public String encode(Object message) throws JsonProcessingException {
        return objectMapper.writeValueAsString(message);
    }

    public <T> T decode(String payload, Class<T> type) throws JsonProcessingException {
        return objectMapper.readValue(payload, type);
    }
}
