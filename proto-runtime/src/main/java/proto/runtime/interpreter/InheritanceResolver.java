package proto.runtime.interpreter;

import proto.runtime.ProtoObject;
import proto.runtime.interpreter.cache.LookupCache;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 继承解析器：定位持有指定槽的对象。
 *
 * <p>先查接收者自身的槽，未命中时按层序广度优先搜索父对象图。
 * 父对象按标记顺序入队，因此直接父对象总是优先于祖父对象，
 * 同层兄弟中先标记的优先。已访问集合按引用相等判重，保证环和菱形结构下终止。</p>
 */
final class InheritanceResolver {

    private static final Logger LOG = Logger.getLogger(InheritanceResolver.class.getName());

    /** 可为 null，表示不缓存 */
    private final LookupCache cache;

    InheritanceResolver(LookupCache cache) {
        this.cache = cache;
    }

    LookupCache getCache() {
        return cache;
    }

    /**
     * 定位持有 {@code name} 槽的对象。
     *
     * @return 接收者本身、某个祖先，或 null（未找到）
     */
    ProtoObject locate(ProtoObject receiver, String name) {
        if (receiver.hasSlot(name)) {
            return receiver;
        }
        if (cache != null) {
            return cache.resolve(receiver, name, this::searchAncestors);
        }
        return searchAncestors(receiver, name);
    }

    /**
     * 广度优先搜索祖先。接收者自身不计入已访问集合。
     */
    ProtoObject searchAncestors(ProtoObject receiver, String name) {
        Set<ProtoObject> visited = Collections.newSetFromMap(new IdentityHashMap<ProtoObject, Boolean>());
        Deque<ProtoObject> queue = new ArrayDeque<>();
        enqueueParents(receiver, queue);

        while (!queue.isEmpty()) {
            ProtoObject current = queue.poll();
            if (!visited.add(current)) {
                continue;
            }
            if (current.hasSlot(name)) {
                if (LOG.isLoggable(Level.FINER)) {
                    LOG.finer("槽 '" + name + "' 在第 " + visited.size() + " 个祖先处命中");
                }
                return current;
            }
            enqueueParents(current, queue);
        }

        if (LOG.isLoggable(Level.FINER)) {
            LOG.finer("槽 '" + name + "' 未找到，共访问 " + visited.size() + " 个祖先");
        }
        return null;
    }

    /** 按标记顺序追加父槽引用的对象，缺失的引用直接跳过 */
    private static void enqueueParents(ProtoObject obj, Deque<ProtoObject> queue) {
        for (String parentName : obj.getParents()) {
            ProtoObject parent = obj.getSlot(parentName);
            if (parent != null) {
                queue.addLast(parent);
            }
        }
    }
}
