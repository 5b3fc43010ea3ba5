package com.pharmos.graphql.analytics;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * One bucket of a group-by count.
 */
public class CountByKey {

    private final String key;
    private final long count;

    public CountByKey(String key, long count) {
        this.key = key;
        this.count = count;
    }

    /**
     * Group {@code items} by {@code classifier}, skipping null keys.
     *
     * @return buckets ordered by count descending, then key
     */
    public static <T> List<CountByKey> count(List<T> items, Function<T, ?> classifier) {
        Map<String, Long> counts = new TreeMap<>();
        for (T item : items) {
            Object key = classifier.apply(item);
            if (key != null) {
                counts.merge(key.toString(), 1L, Long::sum);
            }
        }
        List<CountByKey> buckets = new ArrayList<>();
        counts.forEach((key, count) -> buckets.add(new CountByKey(key, count)));
        buckets.sort(Comparator.comparingLong(CountByKey::getCount).reversed()
            .thenComparing(CountByKey::getKey));
        return buckets;
    }

    public String getKey() {
        return key;
    }

    public long getCount() {
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CountByKey)) {
            return false;
        }
        CountByKey that = (CountByKey) o;
        return count == that.count && Objects.equals(key, that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, count);
    }

    @Override
    public String toString() {
        return key + "=" + count;
    }
}
