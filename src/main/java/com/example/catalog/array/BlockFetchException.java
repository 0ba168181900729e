package com.example.catalog.array;

import com.example.catalog.CatalogException;

import java.util.Arrays;
import java.util.List;

/**
 * A block could not be fetched; the read that needed it produced nothing.
 */
public class BlockFetchException extends CatalogException {
    private final String arrayKey;
    private final List<Integer> blockIndex;

    public BlockFetchException(String arrayKey, int[] blockIndex, String message) {
        super(describe(arrayKey, blockIndex) + ": " + message);
        this.arrayKey = arrayKey;
        this.blockIndex = Arrays.stream(blockIndex).boxed().toList();
    }

    public BlockFetchException(String arrayKey, int[] blockIndex, Throwable cause) {
        super(describe(arrayKey, blockIndex) + ": " + cause.getMessage(), cause);
        this.arrayKey = arrayKey;
        this.blockIndex = Arrays.stream(blockIndex).boxed().toList();
    }

    public String arrayKey() {
        return arrayKey;
    }

    public List<Integer> blockIndex() {
        return blockIndex;
    }

    private static String describe(String arrayKey, int[] blockIndex) {
        return "failed to fetch block " + Arrays.toString(blockIndex) + " of " + arrayKey;
    }
}
