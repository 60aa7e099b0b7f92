package com.farmerworking.filters.in.java.api;

import com.farmerworking.filters.in.java.api.impl.LogImpl;
import com.farmerworking.filters.in.java.common.Hash;
import com.farmerworking.filters.in.java.common.IDoubleHashing;
import com.farmerworking.filters.in.java.common.IHash;
import org.junit.Test;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

public class OptionsTest {
    @Test
    public void testDefaults() {
        Options options = new Options();
        assertEquals(Options.DEFAULT_SEED, options.getSeed());
        assertTrue(options.getHash() instanceof Hash);
        assertEquals(0, options.getDistinctIndexAttempts());
        assertEquals(100, options.getDistinctIndexReseeds());
        assertTrue(options.getInfoLog() instanceof LogImpl);
    }

    @Test
    public void testCopy() throws IllegalAccessException {
        Options src = new Options();

        src.setSeed(42L);
        src.setHash(mock(IHash.class));
        src.setDistinctIndexAttempts(7);
        src.setDistinctIndexReseeds(3);
        src.setInfoLog(new LogImpl("copy"));

        Options dst = new Options(src);
        for (Field field : Options.class.getDeclaredFields()) {
            if (Modifier.isStatic(field.getModifiers())) {
                continue;
            }
            field.setAccessible(true);
            assertEquals(field.getName(), field.get(src), field.get(dst));
        }

        // later changes to the source do not leak into the copy
        src.setSeed(43L);
        assertEquals(42L, dst.getSeed());
    }

    @Test
    public void testNewDoubleHashingUsesConfiguredHash() {
        IHash hash = mock(IHash.class);
        when(hash.hash64(any(byte[].class), anyLong())).thenReturn(0L);

        Options options = new Options();
        options.setHash(hash);
        IDoubleHashing hashing = options.newDoubleHashing();
        assertSame(hash, hashing.getHash());

        hashing.hashTwice(new byte[]{1}, 10L);
        verify(hash).hash64(any(byte[].class), eq(11L));
        verify(hash).hash64(any(byte[].class), eq(12L));
    }

    @Test
    public void testLogToNullLogger() {
        Options.Logger.log((Options.Logger) null, "nothing happens");

        Options.Logger logger = mock(Options.Logger.class);
        Options.Logger.log(logger, "hello %s", "world");
        verify(logger).log("hello %s", "world");
    }

    @Test
    public void testLogImpl() {
        LogImpl log = new LogImpl("test");
        log.log("no args");
        log.log("with args", "a", "b");
    }
}
