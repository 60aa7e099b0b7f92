package com.farmerworking.filters.in.java.data.structure.filter;

import com.farmerworking.filters.in.java.api.WritableFilter;
import com.farmerworking.filters.in.java.data.structure.iblt.InvertibleBloomFilter;

public class InvertibleBloomWritableFilterTest extends WritableFilterTest {
    @Override
    protected WritableFilter<String> getImpl() {
        return new InvertibleBloomFilter(1000, 3);
    }
}
