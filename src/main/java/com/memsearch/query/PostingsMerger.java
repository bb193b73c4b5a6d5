package com.memsearch.query;

import com.memsearch.index.Posting;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * 倒排列表的布尔合并：AND 求交，OR 求并。
 *
 * <p>输入迭代器必须按文档ID严格递增；输出同样严格递增，因此可以继续链式合并。
 * 两个输入命中同一文档时，输出倒排项的词频为双方词频之和。</p>
 */
public class PostingsMerger {

    /**
     * 惰性求交，双指针归并，复杂度 O(n1 + n2)。任一侧耗尽即结束。
     */
    public Iterator<Posting> intersection(Iterator<Posting> p1, Iterator<Posting> p2) {
        Objects.requireNonNull(p1, "p1");
        Objects.requireNonNull(p2, "p2");
        return new MergingIterator(p1, p2) {
            @Override
            Posting computeNext() {
                while (leftHead != null && rightHead != null) {
                    int leftId = leftHead.documentId();
                    int rightId = rightHead.documentId();
                    if (leftId == rightId) {
                        Posting merged = combine(leftHead, rightHead);
                        leftHead = pull(left);
                        rightHead = pull(right);
                        return merged;
                    }
                    // 较小的一侧不可能再与另一侧后面的文档匹配
                    if (leftId < rightId) {
                        leftHead = pull(left);
                    } else {
                        rightHead = pull(right);
                    }
                }
                return null;
            }
        };
    }

    /**
     * 惰性求并，双指针归并，复杂度 O(n1 + n2)。一侧耗尽后原样输出另一侧剩余部分。
     */
    public Iterator<Posting> union(Iterator<Posting> p1, Iterator<Posting> p2) {
        Objects.requireNonNull(p1, "p1");
        Objects.requireNonNull(p2, "p2");
        return new MergingIterator(p1, p2) {
            @Override
            Posting computeNext() {
                if (leftHead == null && rightHead == null) {
                    return null;
                }
                if (rightHead == null || (leftHead != null && leftHead.documentId() < rightHead.documentId())) {
                    Posting emitted = leftHead;
                    leftHead = pull(left);
                    return emitted;
                }
                if (leftHead == null || rightHead.documentId() < leftHead.documentId()) {
                    Posting emitted = rightHead;
                    rightHead = pull(right);
                    return emitted;
                }
                Posting merged = combine(leftHead, rightHead);
                leftHead = pull(left);
                rightHead = pull(right);
                return merged;
            }
        };
    }

    /**
     * 从左到右依次求交。空列表返回空迭代器。
     */
    public Iterator<Posting> intersection(List<Iterator<Posting>> postings) {
        if (postings.isEmpty()) {
            return Collections.emptyIterator();
        }
        Iterator<Posting> result = postings.get(0);
        for (int index = 1; index < postings.size(); index++) {
            result = intersection(result, postings.get(index));
        }
        return result;
    }

    /**
     * 从左到右依次求并。空列表返回空迭代器。
     */
    public Iterator<Posting> union(List<Iterator<Posting>> postings) {
        if (postings.isEmpty()) {
            return Collections.emptyIterator();
        }
        Iterator<Posting> result = postings.get(0);
        for (int index = 1; index < postings.size(); index++) {
            result = union(result, postings.get(index));
        }
        return result;
    }

    private static Posting combine(Posting left, Posting right) {
        return new Posting(left.documentId(), Math.addExact(left.termFrequency(), right.termFrequency()));
    }

    /**
     * 持有两侧当前头元素的拉取式迭代器，头元素在首次访问时才读取。
     */
    private abstract static class MergingIterator implements Iterator<Posting> {
        protected final Iterator<Posting> left;
        protected final Iterator<Posting> right;
        protected Posting leftHead;
        protected Posting rightHead;
        private boolean primed;
        private Posting nextPosting;

        MergingIterator(Iterator<Posting> left, Iterator<Posting> right) {
            this.left = left;
            this.right = right;
        }

        /**
         * 计算下一条输出，没有更多输出时返回 null。
         */
        abstract Posting computeNext();

        static Posting pull(Iterator<Posting> iterator) {
            return iterator.hasNext() ? iterator.next() : null;
        }

        @Override
        public boolean hasNext() {
            if (!primed) {
                leftHead = pull(left);
                rightHead = pull(right);
                primed = true;
            }
            if (nextPosting == null) {
                nextPosting = computeNext();
            }
            return nextPosting != null;
        }

        @Override
        public Posting next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Posting posting = nextPosting;
            nextPosting = null;
            return posting;
        }
    }
}
