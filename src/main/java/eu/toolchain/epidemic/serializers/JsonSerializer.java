package eu.toolchain.epidemic.serializers;

import java.io.IOException;

import lombok.RequiredArgsConstructor;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

@RequiredArgsConstructor
public class JsonSerializer<T> implements Serializer<T> {
    private final ObjectMapper mapper;
    private final JavaType type;

    @Override
    public byte[] serialize(final T data) throws IOException {
        return mapper.writeValueAsBytes(data);
    }

    @Override
    public T deserialize(final byte[] data) throws IOException {
        return mapper.readValue(data, type);
    }
}
