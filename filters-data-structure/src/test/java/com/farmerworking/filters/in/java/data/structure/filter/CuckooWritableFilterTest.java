package com.farmerworking.filters.in.java.data.structure.filter;

import com.farmerworking.filters.in.java.api.WritableFilter;
import com.farmerworking.filters.in.java.data.structure.cuckoo.CuckooFilter;

public class CuckooWritableFilterTest extends WritableFilterTest {
    @Override
    protected WritableFilter<String> getImpl() {
        return CuckooFilter.create(1000, 0.01);
    }
}
