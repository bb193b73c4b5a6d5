package com.memsearch.index;

import com.memsearch.config.Constants;
import com.memsearch.document.Corpus;
import com.memsearch.document.Document;
import com.memsearch.text.Normalizer;
import com.memsearch.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 内存倒排索引，适用于小规模语料。
 *
 * <p>构造时一次性建好词典与倒排列表，之后不再修改，并发查询无需加锁。
 * 每条倒排列表按文档ID严格递增：文档按ID升序处理，每个 (词项, 文档) 至多追加一条倒排项。</p>
 */
public final class InMemoryInvertedIndex implements InvertedIndex {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryInvertedIndex.class);

    private final Corpus corpus;
    private final Normalizer normalizer;
    private final Tokenizer tokenizer;
    private final List<String> fields;
    private final TermDictionary dictionary = new TermDictionary();
    private final List<PostingList> postingLists;
    private final int documentCount;
    private final long postingCount;

    /**
     * 单线程构建索引。
     */
    public InMemoryInvertedIndex(Corpus corpus, Collection<String> fields, Normalizer normalizer, Tokenizer tokenizer) {
        this(corpus, fields, normalizer, tokenizer, Constants.DEFAULT_INDEX_THREADS);
    }

    /**
     * 按文档ID区间并行统计词频后顺序合并，线程数不大于1时退化为单线程构建。
     */
    public InMemoryInvertedIndex(Corpus corpus, Collection<String> fields, Normalizer normalizer, Tokenizer tokenizer,
                                 int indexThreads) {
        this.corpus = Objects.requireNonNull(corpus, "corpus");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        Objects.requireNonNull(fields, "fields");
        this.fields = List.copyOf(fields);
        // 之后追加到语料中的文档不属于本索引
        this.documentCount = corpus.size();

        long startNanos = System.nanoTime();
        List<PostingListBuilder> builders = new ArrayList<>();
        if (indexThreads <= 1 || documentCount < 2 * Constants.MIN_DOCS_PER_PARTITION) {
            for (int documentId = 0; documentId < documentCount; documentId++) {
                Document document = corpus.getDocument(documentId);
                appendPostings(builders, document.documentId(), countTerms(document));
            }
        } else {
            buildInParallel(builders, indexThreads);
        }

        List<PostingList> lists = new ArrayList<>(builders.size());
        long totalPostings = 0;
        for (PostingListBuilder builder : builders) {
            totalPostings += builder.size();
            lists.add(builder.build());
        }
        this.postingLists = Collections.unmodifiableList(lists);
        this.postingCount = totalPostings;

        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        logger.info("索引构建完成: 文档数={}, 词项数={}, 倒排项数={}, 用时={}ms",
            documentCount, dictionary.size(), postingCount, elapsedMs);
    }

    @Override
    public List<String> getTerms(String buffer) {
        if (buffer == null) {
            return List.of();
        }
        List<String> tokens = tokenizer.strings(normalizer.canonicalize(buffer));
        List<String> terms = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            terms.add(normalizer.normalize(token));
        }
        return terms;
    }

    @Override
    public Iterator<Posting> getPostingsIterator(String term) {
        return getPostingList(term).iterator();
    }

    // 由倒排列表长度推导；倒排不常驻内存时应把文档频率存入词典
    @Override
    public int getDocumentFrequency(String term) {
        return getPostingList(term).size();
    }

    /**
     * 返回词项的完整倒排列表，未登录词返回空列表。
     */
    public PostingList getPostingList(String term) {
        if (term == null) {
            return PostingList.EMPTY;
        }
        int termId = dictionary.getTermId(term);
        return termId == TermDictionary.NOT_FOUND ? PostingList.EMPTY : postingLists.get(termId);
    }

    /**
     * 按词项ID升序返回全部词项。
     */
    public List<String> terms() {
        List<String> terms = new ArrayList<>(dictionary.size());
        for (Map.Entry<String, Integer> entry : dictionary) {
            terms.add(entry.getKey());
        }
        return terms;
    }

    @Override
    public Tokenizer getTokenizer() {
        return tokenizer;
    }

    @Override
    public Normalizer getNormalizer() {
        return normalizer;
    }

    public Corpus getCorpus() {
        return corpus;
    }

    public List<String> getFields() {
        return fields;
    }

    public IndexStatus getStatus() {
        return new IndexStatus(documentCount, dictionary.size(), postingCount);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("{");
        for (Map.Entry<String, Integer> entry : dictionary) {
            if (entry.getValue() > 0) {
                builder.append(", ");
            }
            builder.append(entry.getKey()).append('=').append(postingLists.get(entry.getValue()));
        }
        return builder.append('}').toString();
    }

    /**
     * 统计单个文档所有索引字段中的词频，保留首次出现顺序。
     */
    private Map<String, Integer> countTerms(Document document) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String field : fields) {
            for (String term : getTerms(document.getField(field, ""))) {
                counts.merge(term, 1, Integer::sum);
            }
        }
        return counts;
    }

    private void appendPostings(List<PostingListBuilder> builders, int documentId, Map<String, Integer> counts) {
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            int termId = dictionary.addIfAbsent(entry.getKey());
            if (termId == builders.size()) {
                builders.add(new PostingListBuilder());
            }
            builders.get(termId).append(documentId, entry.getValue());
        }
    }

    /**
     * 工作线程只做分词计数，词典与倒排的追加在调用线程按区间顺序完成，
     * 因此词项ID与倒排顺序和单线程构建完全一致。
     */
    private void buildInParallel(List<PostingListBuilder> builders, int indexThreads) {
        int partitionSize = Math.max(Constants.MIN_DOCS_PER_PARTITION,
            (documentCount + indexThreads - 1) / indexThreads);
        ExecutorService executor = Executors.newFixedThreadPool(indexThreads);
        try {
            List<Future<List<Map<String, Integer>>>> futures = new ArrayList<>();
            for (int rangeStart = 0; rangeStart < documentCount; rangeStart += partitionSize) {
                int from = rangeStart;
                int to = Math.min(documentCount, rangeStart + partitionSize);
                futures.add(executor.submit(() -> countRange(from, to)));
            }

            int documentId = 0;
            for (Future<List<Map<String, Integer>>> future : futures) {
                for (Map<String, Integer> counts : awaitRange(future)) {
                    appendPostings(builders, corpus.getDocument(documentId).documentId(), counts);
                    documentId++;
                }
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private List<Map<String, Integer>> countRange(int from, int to) {
        logger.debug("统计文档区间 [{}, {})", from, to);
        List<Map<String, Integer>> rangeCounts = new ArrayList<>(to - from);
        for (int documentId = from; documentId < to; documentId++) {
            rangeCounts.add(countTerms(corpus.getDocument(documentId)));
        }
        return rangeCounts;
    }

    private List<Map<String, Integer>> awaitRange(Future<List<Map<String, Integer>>> future) {
        try {
            return future.get();
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("索引构建被中断", exception);
        } catch (ExecutionException exception) {
            Throwable cause = exception.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException("索引构建失败", cause);
        }
    }
}
