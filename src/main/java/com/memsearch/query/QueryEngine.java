package com.memsearch.query;

import com.memsearch.config.EngineConfig;
import com.memsearch.document.Corpus;
import com.memsearch.index.InvertedIndex;
import com.memsearch.index.Posting;
import com.memsearch.ranking.ScoredItem;
import com.memsearch.ranking.Sieve;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * 布尔检索引擎：解析查询，按 AST 自底向上合并倒排，再用 {@link Sieve} 选出得分最高的文档。
 *
 * <p>得分为合并后倒排项的词频，即查询词在文档中命中次数之和。</p>
 */
public class QueryEngine {
    private static final Logger logger = LoggerFactory.getLogger(QueryEngine.class);

    private final InvertedIndex index;
    private final Corpus corpus;
    private final QueryParser parser;
    private final PostingsMerger merger = new PostingsMerger();

    /**
     * 使用默认配置构造查询引擎。
     */
    public QueryEngine(InvertedIndex index, Corpus corpus) {
        this(index, corpus, EngineConfig.defaults());
    }

    /**
     * 使用 EngineConfig 注入默认布尔操作符构造查询引擎。查询按索引的分词器与规范化器分析。
     */
    public QueryEngine(InvertedIndex index, Corpus corpus, EngineConfig config) {
        this.index = Objects.requireNonNull(index, "index");
        this.corpus = Objects.requireNonNull(corpus, "corpus");
        QueryLexer lexer = new QueryLexer(index.getTokenizer(), index.getNormalizer());
        this.parser = new QueryParser(lexer, config.getDefaultOperator());
    }

    /**
     * 执行查询并返回得分最高的 limit 条结果，totalMatches 为全部命中文档数。
     *
     * @throws QueryParseException 查询语法错误时抛出
     */
    public SearchResult search(String queryString, int limit) {
        long startNanos = System.nanoTime();
        Iterator<Posting> postings = evaluate(parser.parse(queryString));

        Sieve<Integer> sieve = limit > 0 ? new Sieve<>(limit) : null;
        int totalMatches = 0;
        while (postings.hasNext()) {
            Posting posting = postings.next();
            totalMatches++;
            if (sieve != null) {
                sieve.sift(posting.termFrequency(), posting.documentId());
            }
        }

        List<SearchHit> hits = new ArrayList<>();
        if (sieve != null) {
            for (ScoredItem<Integer> winner : sieve.winners()) {
                int documentId = winner.item();
                hits.add(new SearchHit(documentId, winner.score(), corpus.getDocument(documentId)));
            }
        }

        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        logger.debug("查询 \"{}\" 命中 {} 条，返回 {} 条，用时 {}ms", queryString, totalMatches, hits.size(), elapsedMs);
        return new SearchResult(queryString, hits, totalMatches, elapsedMs);
    }

    /**
     * 执行不排序的布尔检索，返回按升序排列的全部命中文档ID。
     */
    public List<Integer> match(String queryString) {
        List<Integer> documentIds = new ArrayList<>();
        Iterator<Posting> postings = evaluate(parser.parse(queryString));
        while (postings.hasNext()) {
            documentIds.add(postings.next().documentId());
        }
        return documentIds;
    }

    /**
     * 将 AST 展开为惰性倒排迭代器。
     */
    public Iterator<Posting> evaluate(QueryNode node) {
        if (node instanceof QueryNode.TermQuery termQuery) {
            return index.getPostingsIterator(termQuery.text());
        }
        if (node instanceof QueryNode.BooleanQuery booleanQuery) {
            Iterator<Posting> left = evaluate(booleanQuery.left());
            Iterator<Posting> right = evaluate(booleanQuery.right());
            return booleanQuery.op() == QueryNode.BoolOp.AND
                ? merger.intersection(left, right)
                : merger.union(left, right);
        }
        throw new IllegalArgumentException("不支持的查询节点: " + node);
    }
}
