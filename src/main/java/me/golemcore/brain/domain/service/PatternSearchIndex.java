package me.golemcore.brain.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.brain.domain.model.Pattern;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * In-memory BM25 index over pattern title, body and tags.
 *
 * <p>
 * Title occurrences count {@code titleWeight} times. A document matching the
 * boolean structure of the query scores the sum of BM25 contributions of its
 * positive leaves (terms, prefix expansions, phrases) plus {@code tagBoost} for
 * every tag a positive leaf names exactly. Negated clauses filter but never
 * score. The index is immutable; rebuild it when patterns change.
 */
public final class PatternSearchIndex {

    static final double K1 = 1.2;
    static final double B = 0.75;

    private final Map<String, Document> documents = new LinkedHashMap<>();
    private final Map<String, Integer> documentFrequency = new HashMap<>();
    private final TreeSet<String> vocabulary = new TreeSet<>();
    private final double averageLength;
    private final double tagBoost;

    private PatternSearchIndex(double titleWeight, double tagBoost, List<Pattern> patterns) {
        this.tagBoost = tagBoost;
        double totalLength = 0.0;
        for (Pattern pattern : patterns) {
            Document document = new Document(pattern, titleWeight);
            documents.put(pattern.getId(), document);
            totalLength += document.length;
            for (String term : document.weightedFrequency.keySet()) {
                documentFrequency.merge(term, 1, Integer::sum);
                vocabulary.add(term);
            }
        }
        this.averageLength = documents.isEmpty() ? 1.0 : Math.max(1.0, totalLength / documents.size());
    }

    public static PatternSearchIndex build(List<Pattern> patterns, double titleWeight, double tagBoost) {
        return new PatternSearchIndex(titleWeight, tagBoost, patterns);
    }

    public int size() {
        return documents.size();
    }

    /**
     * Scores of every document matching the query, by pattern id.
     */
    public Map<String, Double> search(PatternQueryParser.Node query) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (Document document : documents.values()) {
            if (matches(query, document)) {
                scores.put(document.id, score(query, document));
            }
        }
        return scores;
    }

    // ==================== Boolean matching ====================

    private boolean matches(PatternQueryParser.Node node, Document document) {
        if (node instanceof PatternQueryParser.Term term) {
            return document.weightedFrequency.containsKey(term.text());
        }
        if (node instanceof PatternQueryParser.Prefix prefix) {
            return !document.termsWithPrefix(prefix.stem()).isEmpty();
        }
        if (node instanceof PatternQueryParser.Phrase phrase) {
            return document.containsPhrase(phrase.terms());
        }
        if (node instanceof PatternQueryParser.And and) {
            return and.clauses().stream().allMatch(clause -> matches(clause, document));
        }
        if (node instanceof PatternQueryParser.Or or) {
            return or.clauses().stream().anyMatch(clause -> matches(clause, document));
        }
        if (node instanceof PatternQueryParser.Not not) {
            return !matches(not.clause(), document);
        }
        throw new IllegalArgumentException("Unknown query node " + node);
    }

    // ==================== Scoring ====================

    private double score(PatternQueryParser.Node node, Document document) {
        if (node instanceof PatternQueryParser.Term term) {
            return bm25(term.text(), document) + (document.tags.contains(term.text()) ? tagBoost : 0.0);
        }
        if (node instanceof PatternQueryParser.Prefix prefix) {
            double total = 0.0;
            for (String term : document.termsWithPrefix(prefix.stem())) {
                total += bm25(term, document);
            }
            for (String tag : document.tags) {
                if (tag.equals(prefix.stem())) {
                    total += tagBoost;
                }
            }
            return total;
        }
        if (node instanceof PatternQueryParser.Phrase phrase) {
            if (!document.containsPhrase(phrase.terms())) {
                return 0.0;
            }
            double total = 0.0;
            for (String term : phrase.terms()) {
                total += bm25(term, document);
            }
            String joined = String.join(" ", phrase.terms());
            return total + (document.tags.contains(joined) ? tagBoost : 0.0);
        }
        if (node instanceof PatternQueryParser.And and) {
            return and.clauses().stream().mapToDouble(clause -> score(clause, document)).sum();
        }
        if (node instanceof PatternQueryParser.Or or) {
            return or.clauses().stream()
                    .filter(clause -> matches(clause, document))
                    .mapToDouble(clause -> score(clause, document))
                    .sum();
        }
        return 0.0;
    }

    private double bm25(String term, Document document) {
        double tf = document.weightedFrequency.getOrDefault(term, 0.0);
        if (tf <= 0.0) {
            return 0.0;
        }
        int n = documentFrequency.getOrDefault(term, 0);
        int total = documents.size();
        double idf = Math.log(1.0 + (total - n + 0.5) / (n + 0.5));
        double norm = K1 * (1.0 - B + B * document.length / averageLength);
        return idf * (tf * (K1 + 1.0)) / (tf + norm);
    }

    private final class Document {

        private final String id;
        private final List<List<String>> fields = new ArrayList<>();
        private final Map<String, Double> weightedFrequency = new HashMap<>();
        private final Set<String> tags;
        private final double length;

        Document(Pattern pattern, double titleWeight) {
            this.id = pattern.getId();
            List<String> titleTerms = PatternQueryParser.terms(pattern.getTitle());
            List<String> bodyTerms = PatternQueryParser.terms(pattern.getBody());
            List<String> tagTerms = new ArrayList<>();
            this.tags = new TreeSet<>();
            if (pattern.getTags() != null) {
                for (String tag : pattern.getTags()) {
                    tags.add(tag);
                    List<String> split = PatternQueryParser.terms(tag);
                    tagTerms.addAll(split);
                    fields.add(split);
                }
            }
            fields.add(titleTerms);
            fields.add(bodyTerms);

            for (String term : titleTerms) {
                weightedFrequency.merge(term, titleWeight, Double::sum);
            }
            for (String term : bodyTerms) {
                weightedFrequency.merge(term, 1.0, Double::sum);
            }
            for (String term : tagTerms) {
                weightedFrequency.merge(term, 1.0, Double::sum);
            }
            this.length = titleTerms.size() * titleWeight + bodyTerms.size() + tagTerms.size();
        }

        Set<String> termsWithPrefix(String stem) {
            Set<String> matched = new TreeSet<>();
            for (String candidate : vocabulary.tailSet(stem, true)) {
                if (!candidate.startsWith(stem)) {
                    break;
                }
                if (weightedFrequency.containsKey(candidate)) {
                    matched.add(candidate);
                }
            }
            return matched;
        }

        boolean containsPhrase(List<String> phrase) {
            for (List<String> field : fields) {
                for (int start = 0; start + phrase.size() <= field.size(); start++) {
                    if (field.subList(start, start + phrase.size()).equals(phrase)) {
                        return true;
                    }
                }
            }
            return false;
        }
    }
}
