package romantools;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Lazily built {@link SyllableConverter}s, one per (source, target) method pair.
 */
public final class ConverterCache {

    public interface Provider {
        RomanizationData get();
    }

    private final Provider provider;
    private final CrumbObserver observer;
    private final int capacity;

    private final ConcurrentMap<PairKey, SyllableConverter> converters = new ConcurrentHashMap<>();

    public ConverterCache(Provider provider, CrumbObserver observer) {
        this(provider, observer, BoundedCache.DEFAULT_CAPACITY);
    }

    public ConverterCache(Provider provider, CrumbObserver observer, int capacity) {
        this.provider = Objects.requireNonNull(provider);
        this.observer = observer == null ? CrumbObserver.NOOP : observer;
        this.capacity = capacity;
    }

    public SyllableConverter get(RomanizationMethod from, RomanizationMethod to) {
        return converters.computeIfAbsent(new PairKey(from, to), k -> build(from, to));
    }

    private SyllableConverter build(RomanizationMethod from, RomanizationMethod to) {
        ConversionTable table = provider.get().conversionTable(from, to);
        return new SyllableConverter(table, new BoundedCache<>(capacity), observer);
    }

    static final class PairKey {
        final RomanizationMethod from;
        final RomanizationMethod to;
        private final int hash;

        PairKey(RomanizationMethod from, RomanizationMethod to) {
            this.from = from;
            this.to = to;
            this.hash = (from.ordinal() * 397) ^ to.ordinal();
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof PairKey)) return false;
            PairKey k = (PairKey) o;
            return k.from == from && k.to == to;
        }

        @Override
        public int hashCode() {
            return hash;
        }

        @Override
        public String toString() {
            return from.asStr() + "_" + to.asStr();
        }
    }
}
