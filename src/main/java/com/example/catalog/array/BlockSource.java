package com.example.catalog.array;

import reactor.core.publisher.Mono;

/**
 * Where the blocks of one array come from. Implementations must tolerate concurrent fetches of
 * different blocks.
 */
public interface BlockSource {

    /**
     * Stable name of the array this source serves, used in logs and errors.
     */
    String key();

    /**
     * Raw row-major, little-endian bytes of the block at {@code blockIndex}, sized
     * {@code dtype.itemSize() * product(blockShape)}.
     */
    Mono<byte[]> fetch(int[] blockIndex, int[] blockShape);
}
