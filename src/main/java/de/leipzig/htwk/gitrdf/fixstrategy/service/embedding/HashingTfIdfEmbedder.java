package de.leipzig.htwk.gitrdf.fixstrategy.service.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

import de.leipzig.htwk.gitrdf.fixstrategy.model.Issue;
import de.leipzig.htwk.gitrdf.fixstrategy.model.embedding.EmbeddingKind;
import de.leipzig.htwk.gitrdf.fixstrategy.model.embedding.EmbeddingVector;
import de.leipzig.htwk.gitrdf.fixstrategy.model.embedding.SparseVector;
import lombok.extern.slf4j.Slf4j;

/**
 * Statistical fallback embedder: hashed bag of terms in a fixed feature space.
 *
 * Terms (lower-cased unigrams and adjacent bigrams) are hashed into {@code width} buckets
 * with {@link String#hashCode()}, which the language fixes, so vectors from different calls and
 * different processes share one index space and stay comparable by cosine. Term frequency is
 * sublinear ({@code 1 + ln(tf)}), stop words are dropped, bigrams count half, and the result is
 * L2-normalised. Nothing is fitted per call.
 *
 * Issues are embedded from their field values only. The message carries full weight, the file
 * name half, and the type and stage tags a small fixed weight: every candidate in a lookup
 * already shares them, so they would otherwise lift unrelated findings over the similarity floor.
 */
@Slf4j
public class HashingTfIdfEmbedder implements IssueEmbedder {

    public static final int DEFAULT_WIDTH = SparseVector.MAX_WIDTH;

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^a-z0-9_]+");
    private static final double BIGRAM_WEIGHT = 0.5;

    static final double MESSAGE_WEIGHT = 1.0;
    static final double FILE_NAME_WEIGHT = 0.5;
    static final double TAG_WEIGHT = 0.2;

    private static final Set<String> STOP_WORDS = Set.of(
        "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "has", "have",
        "in", "is", "it", "its", "of", "on", "or", "that", "the", "this", "to", "was",
        "were", "will", "with");

    private final int width;

    public HashingTfIdfEmbedder() {
        this(DEFAULT_WIDTH);
    }

    public HashingTfIdfEmbedder(int width) {
        if (width <= 0 || width > SparseVector.MAX_WIDTH) {
            throw new IllegalArgumentException("Fallback width must be in 1.." + SparseVector.MAX_WIDTH);
        }
        this.width = width;
        log.info("Statistical fallback embedder active (hashed terms, {} buckets)", width);
    }

    @Override
    public EmbeddingVector embed(Issue issue) {
        if (issue == null) {
            throw new IllegalArgumentException("Issue cannot be null");
        }

        Map<Integer, Double> buckets = new TreeMap<>();
        addTerms(buckets, IssueFeatureTextBuilder.messageText(issue), MESSAGE_WEIGHT);
        String fileName = IssueFeatureTextBuilder.fileName(issue.filePath());
        if (fileName != null) {
            addTerms(buckets, fileName, FILE_NAME_WEIGHT);
        }
        addTerms(buckets, issue.type().getValue(), TAG_WEIGHT);
        addTerms(buckets, issue.stage(), TAG_WEIGHT);

        return toNormalisedVector(buckets);
    }

    @Override
    public EmbeddingVector embedText(String text) {
        if (text == null || text.isBlank()) {
            return SparseVector.empty(width);
        }

        Map<Integer, Double> buckets = new TreeMap<>();
        addTerms(buckets, text, 1.0);
        return toNormalisedVector(buckets);
    }

    @Override
    public boolean isNeuralAvailable() {
        return false;
    }

    @Override
    public EmbeddingKind kind() {
        return EmbeddingKind.SPARSE;
    }

    @Override
    public int dimensions() {
        return width;
    }

    int bucketOf(String term) {
        return Math.floorMod(term.hashCode(), width);
    }

    private void addTerms(Map<Integer, Double> buckets, String text, double fieldWeight) {
        if (text == null || text.isBlank()) {
            return;
        }
        for (Map.Entry<String, Integer> term : countTerms(tokenize(text)).entrySet()) {
            double termWeight = term.getKey().indexOf(' ') >= 0 ? BIGRAM_WEIGHT : 1.0;
            double tf = 1.0 + Math.log(term.getValue());
            buckets.merge(bucketOf(term.getKey()), tf * termWeight * fieldWeight, Double::sum);
        }
    }

    static List<String> tokenize(String text) {
        String[] raw = TOKEN_SPLIT.split(text.toLowerCase(Locale.ROOT));
        List<String> unigrams = new ArrayList<>();
        for (String token : raw) {
            if (token.length() >= 2 && !STOP_WORDS.contains(token)) {
                unigrams.add(token);
            }
        }

        List<String> terms = new ArrayList<>(unigrams);
        for (int i = 1; i < unigrams.size(); i++) {
            terms.add(unigrams.get(i - 1) + " " + unigrams.get(i));
        }
        return terms;
    }

    private static Map<String, Integer> countTerms(List<String> terms) {
        Map<String, Integer> counts = new TreeMap<>();
        for (String term : terms) {
            counts.merge(term, 1, Integer::sum);
        }
        return counts;
    }

    private SparseVector toNormalisedVector(Map<Integer, Double> buckets) {
        double sumOfSquares = 0.0;
        for (double value : buckets.values()) {
            sumOfSquares += value * value;
        }
        if (sumOfSquares == 0.0) {
            return SparseVector.empty(width);
        }

        double norm = Math.sqrt(sumOfSquares);
        int[] indices = new int[buckets.size()];
        float[] values = new float[buckets.size()];
        int position = 0;
        for (Map.Entry<Integer, Double> bucket : buckets.entrySet()) {
            indices[position] = bucket.getKey();
            values[position] = (float) (bucket.getValue() / norm);
            position++;
        }
        return new SparseVector(width, indices, values);
    }
}
