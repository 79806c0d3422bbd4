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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses pattern search queries.
 *
 * <p>
 * Grammar, lowest precedence first:
 *
 * <pre>
 * query   := or
 * or      := and ("OR" and)*
 * and     := not (["AND"] not)*      adjacent clauses are ANDed
 * not     := "NOT" not | primary
 * primary := term | term* | "quoted phrase" | "(" query ")"
 * </pre>
 *
 * Operators are recognized only in upper case; lower-case {@code and} is a
 * plain term. Terms are lower-cased and split the same way indexed text is.
 */
public final class PatternQueryParser {

    private PatternQueryParser() {
    }

    /**
     * Node of a parsed query.
     */
    public interface Node {
    }

    public record Term(String text) implements Node {
    }

    public record Prefix(String stem) implements Node {
    }

    public record Phrase(List<String> terms) implements Node {
    }

    public record And(List<Node> clauses) implements Node {
    }

    public record Or(List<Node> clauses) implements Node {
    }

    public record Not(Node clause) implements Node {
    }

    /**
     * Malformed query: unbalanced parentheses, unterminated quote, dangling
     * operator or no terms at all.
     */
    public static class QueryParseException extends IllegalArgumentException {

        private static final long serialVersionUID = 1L;

        public QueryParseException(String message) {
            super(message);
        }
    }

    public static Node parse(String query) {
        if (query == null || query.isBlank()) {
            throw new QueryParseException("Query is empty");
        }
        Parser parser = new Parser(lex(query));
        Node node = parser.parseOr();
        if (!parser.atEnd()) {
            throw new QueryParseException("Unexpected '" + parser.peek().text() + "'");
        }
        return node;
    }

    /**
     * Lower-case and split text into index terms.
     */
    public static List<String> terms(String text) {
        List<String> terms = new ArrayList<>();
        if (text == null) {
            return terms;
        }
        for (String raw : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}_]+")) {
            if (!raw.isEmpty()) {
                terms.add(raw);
            }
        }
        return terms;
    }

    // ==================== Lexer ====================

    private enum TokenType {
        WORD, PHRASE, LPAREN, RPAREN, AND, OR, NOT
    }

    private record Token(TokenType type, String text) {
    }

    private static List<Token> lex(String query) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int length = query.length();
        while (i < length) {
            char c = query.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(') {
                tokens.add(new Token(TokenType.LPAREN, "("));
                i++;
            } else if (c == ')') {
                tokens.add(new Token(TokenType.RPAREN, ")"));
                i++;
            } else if (c == '"') {
                int close = query.indexOf('"', i + 1);
                if (close < 0) {
                    throw new QueryParseException("Unterminated phrase starting at position " + i);
                }
                tokens.add(new Token(TokenType.PHRASE, query.substring(i + 1, close)));
                i = close + 1;
            } else {
                int start = i;
                while (i < length && !Character.isWhitespace(query.charAt(i)) && "()\"".indexOf(query.charAt(i)) < 0) {
                    i++;
                }
                String word = query.substring(start, i);
                switch (word) {
                    case "AND" -> tokens.add(new Token(TokenType.AND, word));
                    case "OR" -> tokens.add(new Token(TokenType.OR, word));
                    case "NOT" -> tokens.add(new Token(TokenType.NOT, word));
                    default -> tokens.add(new Token(TokenType.WORD, word));
                }
            }
        }
        return tokens;
    }

    // ==================== Recursive descent ====================

    private static final class Parser {

        private final List<Token> tokens;
        private int position;

        Parser(List<Token> tokens) {
            this.tokens = tokens;
        }

        boolean atEnd() {
            return position >= tokens.size();
        }

        Token peek() {
            return tokens.get(position);
        }

        Node parseOr() {
            List<Node> clauses = new ArrayList<>();
            clauses.add(parseAnd());
            while (!atEnd() && peek().type() == TokenType.OR) {
                position++;
                clauses.add(parseAnd());
            }
            return clauses.size() == 1 ? clauses.get(0) : new Or(clauses);
        }

        Node parseAnd() {
            List<Node> clauses = new ArrayList<>();
            clauses.add(parseNot());
            while (!atEnd()) {
                TokenType type = peek().type();
                if (type == TokenType.AND) {
                    position++;
                    clauses.add(parseNot());
                } else if (type == TokenType.OR || type == TokenType.RPAREN) {
                    break;
                } else {
                    clauses.add(parseNot());
                }
            }
            return clauses.size() == 1 ? clauses.get(0) : new And(clauses);
        }

        Node parseNot() {
            if (atEnd()) {
                throw new QueryParseException("Query ends with an operator");
            }
            if (peek().type() == TokenType.NOT) {
                position++;
                return new Not(parseNot());
            }
            return parsePrimary();
        }

        Node parsePrimary() {
            Token token = tokens.get(position++);
            switch (token.type()) {
                case LPAREN -> {
                    if (atEnd()) {
                        throw new QueryParseException("Unbalanced '('");
                    }
                    Node inner = parseOr();
                    if (atEnd() || peek().type() != TokenType.RPAREN) {
                        throw new QueryParseException("Unbalanced '('");
                    }
                    position++;
                    return inner;
                }
                case PHRASE -> {
                    List<String> words = terms(token.text());
                    if (words.isEmpty()) {
                        throw new QueryParseException("Empty phrase");
                    }
                    return words.size() == 1 ? new Term(words.get(0)) : new Phrase(words);
                }
                case WORD -> {
                    return word(token.text());
                }
                case RPAREN -> throw new QueryParseException("Unbalanced ')'");
                default -> throw new QueryParseException("Operator " + token.text() + " without operand");
            }
        }

        private Node word(String raw) {
            boolean prefix = raw.endsWith("*");
            List<String> words = terms(prefix ? raw.substring(0, raw.length() - 1) : raw);
            if (words.isEmpty()) {
                throw new QueryParseException("'" + raw + "' contains no searchable characters");
            }
            if (prefix) {
                // "foo-bar*" searches foo AND bar*
                List<Node> parts = new ArrayList<>();
                for (int i = 0; i < words.size() - 1; i++) {
                    parts.add(new Term(words.get(i)));
                }
                parts.add(new Prefix(words.get(words.size() - 1)));
                return parts.size() == 1 ? parts.get(0) : new And(parts);
            }
            if (words.size() == 1) {
                return new Term(words.get(0));
            }
            return new Phrase(words);
        }
    }
}
