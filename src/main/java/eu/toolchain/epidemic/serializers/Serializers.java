package eu.toolchain.epidemic.serializers;

import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;

import eu.toolchain.epidemic.gossip.GossipMessage;
import eu.toolchain.epidemic.transport.Address;

public class Serializers {
    private final ObjectMapper mapper = ObjectMappers.create();

    public Serializer<GossipMessage> gossip() {
        return new JsonSerializer<GossipMessage>(mapper, mapper.constructType(GossipMessage.class));
    }

    public Serializer<List<Address>> peers() {
        return new JsonSerializer<List<Address>>(mapper,
                mapper.getTypeFactory().constructCollectionType(List.class, Address.class));
    }
}
