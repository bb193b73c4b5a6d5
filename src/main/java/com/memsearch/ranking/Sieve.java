package com.memsearch.ranking;

import com.memsearch.config.Constants;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * 有界 Top-K 筛选器：从任意长的 (分数, 对象) 流中保留分数最高的 K 个，不保留其余对象。
 *
 * <p>内部是容量为 K 的小顶堆，堆顶为当前保留集合中的最低分。新分数只有严格大于堆顶时才会替换堆顶，
 * 与边界分数相同的候选不会挤掉已保留的对象；相同分数之间的取舍是任意的，不保证跨运行的插入顺序。</p>
 *
 * <p>非线程安全。多个生产者需要外部同步，或各自使用独立实例后再合并。</p>
 *
 * @param <T> 候选对象类型
 */
public final class Sieve<T> {
    private static final Comparator<ScoredItem<?>> BY_SCORE = Comparator.comparingDouble(ScoredItem::score);

    private final int capacity;
    private final PriorityQueue<ScoredItem<T>> heap;

    /**
     * @param capacity 保留数量上限，至少为1
     * @throws IllegalArgumentException capacity 小于1时抛出
     */
    public Sieve(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Sieve容量必须为正数: " + capacity);
        }
        this.capacity = capacity;
        this.heap = new PriorityQueue<>(Math.min(capacity, Constants.SIEVE_INITIAL_HEAP_CAPACITY), BY_SCORE);
    }

    /**
     * 提交一个候选。未满时直接保留；已满时仅当分数严格大于当前最低分才替换最低分。
     * 复杂度 O(log K)。
     */
    public void sift(double score, T item) {
        if (heap.size() < capacity) {
            heap.add(new ScoredItem<>(score, item));
            return;
        }
        if (score > heap.peek().score()) {
            heap.poll();
            heap.add(new ScoredItem<>(score, item));
        }
    }

    /**
     * 取出保留的候选，按分数降序排列，分数相同者顺序不定。复杂度 O(K log K)。
     *
     * <p>该操作会清空内部状态，不是幂等的：第二次调用返回空列表。</p>
     */
    public List<ScoredItem<T>> winners() {
        List<ScoredItem<T>> winners = new ArrayList<>(heap.size());
        while (!heap.isEmpty()) {
            winners.add(heap.poll());
        }
        winners.sort(BY_SCORE.reversed());
        return winners;
    }

    /**
     * 当前保留的候选数量。
     */
    public int size() {
        return heap.size();
    }

    public int capacity() {
        return capacity;
    }
}
