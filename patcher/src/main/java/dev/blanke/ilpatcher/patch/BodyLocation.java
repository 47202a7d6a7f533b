package dev.blanke.ilpatcher.patch;

import java.util.Objects;

/**
 * @param fileOffset The file offset of the first byte of the method body, i.e. of its header.
 *
 * @param header The parsed header of the body.
 */
public record BodyLocation(int fileOffset, BodyHeader header) {

    public BodyLocation {
        Objects.requireNonNull(header);
    }
}
