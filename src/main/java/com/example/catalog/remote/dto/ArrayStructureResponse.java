package com.example.catalog.remote.dto;

import com.example.catalog.array.ArrayStructure;
import com.example.catalog.array.DataType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ArrayStructureResponse(
        List<Integer> shape,
        List<List<Integer>> chunks,
        String dtype
) {
    public ArrayStructure toStructure() {
        return new ArrayStructure(shape, chunks, DataType.parse(dtype));
    }
}
