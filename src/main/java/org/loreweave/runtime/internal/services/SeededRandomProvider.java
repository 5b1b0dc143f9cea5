package org.loreweave.runtime.internal.services;

import org.apache.commons.math3.random.AbstractWell;
import org.apache.commons.math3.random.RandomAdaptor;
import org.apache.commons.math3.random.Well19937c;
import org.loreweave.runtime.spi.IRandomProvider;

import java.lang.reflect.Field;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Random;

/**
 * The world's random stream: a {@link Well19937c} generator from Commons Math behind {@link IRandomProvider}.
 * <p>
 * Snapshots copy the generator's internal pool and position, so a restored provider continues with the
 * very next draw. Each engine unit gets its own child stream whose seed depends only on the world seed,
 * the unit's scope name and its index, never on how many draws other units made.
 * </p>
 */
public final class SeededRandomProvider implements IRandomProvider {

    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private static final Field POOL = wellField("v");
    private static final Field POSITION = wellField("index");

    private final long seed;
    private final Well19937c rng;
    private final Random javaView;

    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.rng = new Well19937c(seed);
        this.javaView = new RandomAdaptor(rng);
    }

    public long getSeed() {
        return seed;
    }

    @Override
    public int nextInt(int bound) {
        return rng.nextInt(bound);
    }

    @Override
    public double nextDouble() {
        return rng.nextDouble();
    }

    /**
     * A {@link Random} view sharing this provider's stream, for collection shuffles.
     */
    @Override
    public Random asJavaRandom() {
        return javaView;
    }

    @Override
    public IRandomProvider deriveFor(String scope, long key) {
        return new SeededRandomProvider(childSeed(seed, scope, key));
    }

    /**
     * Seed of the child stream for {@code (scope, key)}.
     */
    static long childSeed(long parent, String scope, long key) {
        long h = avalanche(parent);
        h = avalanche(h ^ avalanche(fnv1a(scope)));
        return avalanche(h ^ avalanche(key));
    }

    private static long fnv1a(String text) {
        if (text == null) return 0L;
        long h = FNV_OFFSET;
        for (byte b : text.getBytes(StandardCharsets.UTF_8)) {
            h = (h ^ (b & 0xFF)) * FNV_PRIME;
        }
        return h;
    }

    // SplitMix64 finaliser
    private static long avalanche(long z) {
        z = (z ^ (z >>> 33)) * 0xff51afd7ed558ccdL;
        z = (z ^ (z >>> 33)) * 0xc4ceb9fe1a85ec53L;
        return z ^ (z >>> 33);
    }

    /**
     * Layout: position as one int, then the pool words in order.
     */
    @Override
    public byte[] saveState() {
        int[] pool = pool();
        ByteBuffer buffer = ByteBuffer.allocate(Integer.BYTES * (pool.length + 1));
        buffer.putInt(position());
        for (int word : pool) {
            buffer.putInt(word);
        }
        return buffer.array();
    }

    /**
     * @throws IllegalArgumentException if the snapshot is null or was not taken from a generator of this type
     */
    @Override
    public void loadState(byte[] state) {
        if (state == null) {
            throw new IllegalArgumentException("RNG state cannot be null");
        }
        int[] pool = pool();
        if (state.length != Integer.BYTES * (pool.length + 1)) {
            throw new IllegalArgumentException("RNG state has unexpected length " + state.length);
        }
        ByteBuffer buffer = ByteBuffer.wrap(state);
        int position = buffer.getInt();
        for (int i = 0; i < pool.length; i++) {
            pool[i] = buffer.getInt();
        }
        try {
            POSITION.setInt(rng, position);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot restore generator position", e);
        }
    }

    private int[] pool() {
        try {
            return (int[]) POOL.get(rng);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot read generator pool", e);
        }
    }

    private int position() {
        try {
            return POSITION.getInt(rng);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot read generator position", e);
        }
    }

    private static Field wellField(String name) {
        try {
            Field field = AbstractWell.class.getDeclaredField(name);
            field.setAccessible(true);
            return field;
        } catch (NoSuchFieldException e) {
            throw new ExceptionInInitializerError(e);
        }
    }
}
