package com.memsearch;

import com.memsearch.document.Document;
import com.memsearch.document.InMemoryCorpus;
import com.memsearch.index.InMemoryInvertedIndex;
import com.memsearch.index.Posting;
import com.memsearch.query.PostingsMerger;
import com.memsearch.query.QueryEngine;
import com.memsearch.ranking.Sieve;
import com.memsearch.text.LowercaseNormalizer;
import com.memsearch.text.WordTokenizer;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.Iterator;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * 索引构建、倒排合并与 Top-K 筛选的性能基准
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class SearchBenchmark {

    private static final String[] VOCABULARY = {
        "java", "python", "programming", "search", "index", "document", "file", "content",
        "data", "performance", "benchmark", "test", "example", "quick", "brown", "fox"
    };

    @Param({"1", "4"})
    int indexThreads;

    InMemoryCorpus corpus;
    InMemoryInvertedIndex index;
    QueryEngine queryEngine;
    PostingsMerger merger;
    double[] scores;

    @Setup
    public void setup() {
        Random random = new Random(7);
        corpus = new InMemoryCorpus();
        // 一万篇短文档，词频服从粗略的长尾分布
        for (int i = 0; i < 10_000; i++) {
            StringBuilder body = new StringBuilder("document").append(i);
            for (int word = 0; word < 40; word++) {
                int rank = Math.min(VOCABULARY.length - 1, (int) Math.abs(random.nextGaussian() * 4));
                body.append(' ').append(VOCABULARY[rank]);
            }
            corpus.addDocument(Document.of(i, "body", body.toString()));
        }
        index = new InMemoryInvertedIndex(corpus, List.of("body"), new LowercaseNormalizer(), new WordTokenizer(),
            indexThreads);
        queryEngine = new QueryEngine(index, corpus);
        merger = new PostingsMerger();

        scores = new double[100_000];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = random.nextDouble();
        }
    }

    @Benchmark
    public InMemoryInvertedIndex buildIndex() {
        return new InMemoryInvertedIndex(corpus, List.of("body"), new LowercaseNormalizer(), new WordTokenizer(),
            indexThreads);
    }

    @Benchmark
    public void intersection(Blackhole blackhole) {
        drain(merger.intersection(index.getPostingsIterator("java"), index.getPostingsIterator("search")), blackhole);
    }

    @Benchmark
    public void union(Blackhole blackhole) {
        drain(merger.union(index.getPostingsIterator("benchmark"), index.getPostingsIterator("fox")), blackhole);
    }

    @Benchmark
    public int rankedQuery() {
        return queryEngine.search("(java OR python) AND search", 10).totalMatches();
    }

    @Benchmark
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public int sieveTop10() {
        Sieve<Integer> sieve = new Sieve<>(10);
        for (int i = 0; i < scores.length; i++) {
            sieve.sift(scores[i], i);
        }
        return sieve.winners().size();
    }

    private void drain(Iterator<Posting> postings, Blackhole blackhole) {
        while (postings.hasNext()) {
            blackhole.consume(postings.next());
        }
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(SearchBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
