package eu.toolchain.epidemic.topology;

import lombok.Data;

@Data
public class Position {
    private final double x;
    private final double y;

    public Position translate(final double dx, final double dy) {
        return new Position(x + dx, y + dy);
    }
}
