package eu.toolchain.epidemic.serializers;

import java.io.IOException;

public interface Serializer<T> {
    public byte[] serialize(T data) throws IOException;

    public T deserialize(byte[] data) throws IOException;
}
