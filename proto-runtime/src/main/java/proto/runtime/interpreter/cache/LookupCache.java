package proto.runtime.interpreter.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import proto.runtime.ProtoObject;

import java.util.HashMap;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * 基于 Caffeine 的槽查找缓存
 *
 * <p>按接收者缓存"槽名 → 持有者"的解析结果（未找到也会缓存）。
 * 键为弱引用并按引用相等比较，接收者不可达后条目随之回收。</p>
 *
 * <p>每个条目记录写入时的形状纪元；对象图的任何结构变更都会推进纪元，
 * 旧条目在下次访问时视为未命中。缓存只保存持有者，槽值仍在每次分发时重新求值。</p>
 *
 * <p>不是线程安全的，与解释器一样只在单线程中使用。</p>
 */
public final class LookupCache {

    private final Cache<ProtoObject, Map<String, Entry>> cache;
    private final long maximumSize;
    private long hitCount;
    private long missCount;

    /**
     * @param maximumSize 最多缓存的接收者个数
     */
    public LookupCache(long maximumSize) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive");
        }
        this.maximumSize = maximumSize;
        this.cache = Caffeine.newBuilder()
                .weakKeys()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
    }

    /**
     * 返回缓存的持有者；条目缺失或过期时调用 {@code search} 并写回。
     *
     * @return 持有者，未找到则返回 null
     */
    public ProtoObject resolve(ProtoObject receiver, String name,
                               BiFunction<ProtoObject, String, ProtoObject> search) {
        long epoch = ProtoObject.currentEpoch();
        Map<String, Entry> entries = cache.get(receiver, k -> new HashMap<>());
        Entry entry = entries.get(name);
        if (entry != null && entry.epoch == epoch) {
            hitCount++;
            return entry.holder;
        }
        missCount++;
        ProtoObject holder = search.apply(receiver, name);
        entries.put(name, new Entry(holder, epoch));
        return holder;
    }

    public long size() {
        return cache.estimatedSize();
    }

    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();
        hitCount = 0;
        missCount = 0;
    }

    public LookupCacheStats getStats() {
        return new LookupCacheStats(hitCount, missCount,
                cache.stats().evictionCount(), cache.estimatedSize(), maximumSize);
    }

    private static final class Entry {
        final ProtoObject holder;
        final long epoch;

        Entry(ProtoObject holder, long epoch) {
            this.holder = holder;
            this.epoch = epoch;
        }
    }
}
