package io.github.hotbrkm.smtpsinkhole.smtp.policy.parse;

import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.Attribute;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.AttributeVocabulary;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.RuleAction;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.SmtpPhase;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.model.WithOption;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.rule.AllExpr;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.rule.AndExpr;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.rule.AttributeExpr;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.rule.AttributeTarget;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.rule.DblExpr;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.rule.DnsblExpr;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.rule.MatchExpr;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.rule.MatchTarget;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.rule.NotExpr;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.rule.OrExpr;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.rule.Rule;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.rule.RuleClause;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.rule.RuleExpr;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.rule.RuleKeywords;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.rule.Ruleset;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.rule.SourceExpr;
import io.github.hotbrkm.smtpsinkhole.smtp.policy.rule.TlsExpr;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses rule text into a {@link Ruleset}.
 * <p>
 * Grammar, one rule per logical line:
 * <pre>
 * rule    := [PHASE] ACTION clause { ';' clause }  |  'include' FILE
 * clause  := term { term } [ 'with' option { option } ]
 * term    := unary { 'or' unary }
 * unary   := 'not' unary | '(' term { term } ')' | matcher
 * </pre>
 * Juxtaposed terms are ANDed; {@code or} binds tighter and groups to the left.
 * A run of {@code not}s is reduced to one or none. Parentheses nest at most
 * {@value #MAX_NESTING} deep. Any error rejects the whole input.
 * </p>
 *
 * @author hotbrkm
 * @since 1.0.0
 */
public final class RuleParser {

    static final int MAX_NESTING = 64;

    private final String source;
    private final Path directory;
    private final Deque<Path> includeStack;
    private final List<RuleToken> tokens;
    private int pos;
    private int nesting;

    private RuleParser(String source, Path directory, Deque<Path> includeStack, List<RuleToken> tokens) {
        this.source = source;
        this.directory = directory;
        this.includeStack = includeStack;
        this.tokens = tokens;
    }

    /**
     * Parses inline rule text. Includes are resolved against the working directory.
     */
    public static Ruleset parse(String source, String text) throws RuleParseException {
        List<Rule> rules = new ArrayList<>();
        parseInto(source, text, Paths.get("").toAbsolutePath(), new ArrayDeque<>(), rules);
        return Ruleset.of(rules);
    }

    /**
     * Parses rule files in priority order. Includes are resolved against the including file's directory.
     */
    public static Ruleset parseFiles(List<Path> files) throws RuleParseException {
        List<Rule> rules = new ArrayList<>();
        for (Path file : files) {
            parseFile(file, 0, file.toString(), new ArrayDeque<>(), rules);
        }
        return Ruleset.of(rules);
    }

    private static void parseFile(Path file, int line, String referrer, Deque<Path> includeStack,
                                  List<Rule> rules) throws RuleParseException {
        Path normalized = file.toAbsolutePath().normalize();
        if (includeStack.contains(normalized)) {
            throw new RuleParseException(referrer, line, "include cycle through " + file);
        }
        String text;
        try {
            text = Files.readString(normalized, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuleParseException(referrer, line, "cannot read rules file " + file + ": " + e.getMessage(), e);
        }
        includeStack.push(normalized);
        Path parent = normalized.getParent();
        parseInto(file.toString(), text, parent == null ? Paths.get("").toAbsolutePath() : parent, includeStack, rules);
        includeStack.pop();
    }

    private static void parseInto(String source, String text, Path directory, Deque<Path> includeStack,
                                  List<Rule> rules) throws RuleParseException {
        List<RuleToken> tokens = new RuleLexer(source, text).tokenize();
        new RuleParser(source, directory, includeStack, tokens).parseRules(rules);
    }

    private void parseRules(List<Rule> rules) throws RuleParseException {
        while (true) {
            skipNewlines();
            if (peek().type() == RuleToken.Type.EOF) {
                return;
            }
            if (peek().isWord(RuleKeywords.INCLUDE)) {
                parseInclude(rules);
            } else {
                rules.add(parseRule());
            }
            expectEndOfRule();
        }
    }

    private void parseInclude(List<Rule> rules) throws RuleParseException {
        RuleToken keyword = next();
        RuleToken file = next();
        if (file.type() != RuleToken.Type.WORD && file.type() != RuleToken.Type.STRING) {
            throw error(file, "include needs a file name");
        }
        parseFile(directory.resolve(file.text()), keyword.line(), source, includeStack, rules);
    }

    private Rule parseRule() throws RuleParseException {
        RuleToken first = peek();
        SmtpPhase phase = SmtpPhase.ANY;
        if (first.type() == RuleToken.Type.WORD && first.text().startsWith("@")) {
            next();
            phase = SmtpPhase.fromKeyword(first.text());
            if (phase == null) {
                throw error(first, "unknown phase " + first.describe());
            }
        }

        RuleToken actionToken = next();
        RuleAction action = actionToken.type() == RuleToken.Type.WORD ? RuleAction.fromKeyword(actionToken.text()) : null;
        if (action == null) {
            throw error(actionToken, "expected an action, got " + actionToken.describe());
        }

        List<RuleClause> clauses = new ArrayList<>();
        clauses.add(parseClause());
        while (peek().type() == RuleToken.Type.SEMICOLON) {
            next();
            skipNewlines();
            clauses.add(parseClause());
        }

        SmtpPhase requires = SmtpPhase.CONNECT;
        boolean hasOptions = false;
        for (RuleClause clause : clauses) {
            requires = SmtpPhase.later(requires, clause.expression().requires());
            hasOptions |= !clause.withOptions().isEmpty();
        }
        if (phase != SmtpPhase.ANY && phase.compareTo(requires) < 0) {
            throw error(first, "rule needs data from " + requires + " so it cannot be checked at " + phase);
        }
        if (action == RuleAction.SET_WITH && !hasOptions) {
            throw error(first, "set-with rule has no with options");
        }
        return new Rule(clauses, action, requires, phase);
    }

    private RuleClause parseClause() throws RuleParseException {
        RuleToken start = peek();
        List<RuleExpr> terms = new ArrayList<>();
        while (!atClauseEnd()) {
            terms.add(parseOr());
        }
        if (terms.isEmpty()) {
            throw error(start, "missing match expression before " + start.describe());
        }
        RuleExpr expression = terms.size() == 1 ? terms.get(0) : new AndExpr(terms);
        Map<String, String> options = Map.of();
        if (peek().isWord(RuleKeywords.WITH)) {
            next();
            options = parseWithOptions();
        }
        return new RuleClause(expression, options);
    }

    private Map<String, String> parseWithOptions() throws RuleParseException {
        Map<String, String> options = new LinkedHashMap<>();
        while (peek().type() == RuleToken.Type.WORD && WithOption.fromKeyword(peek().text()) != null) {
            RuleToken name = next();
            WithOption option = WithOption.fromKeyword(name.text());
            String value = "";
            if (option.takesValue()) {
                RuleToken valueToken = next();
                if (valueToken.type() != RuleToken.Type.WORD && valueToken.type() != RuleToken.Type.STRING) {
                    throw error(valueToken, "with option " + option.keyword() + " needs a value");
                }
                value = valueToken.text();
                if (option == WithOption.TLS_OPT && !value.equals("off") && !value.equals("no-client")) {
                    throw error(valueToken, "tls-opt must be off or no-client");
                }
            }
            options.put(option.keyword(), value);
        }
        if (options.isEmpty()) {
            throw error(peek(), "expected a with option, got " + peek().describe());
        }
        return options;
    }

    private RuleExpr parseOr() throws RuleParseException {
        RuleExpr left = parseUnary();
        while (peek().isWord(RuleKeywords.OR)) {
            next();
            left = new OrExpr(left, parseUnary());
        }
        return left;
    }

    private RuleExpr parseUnary() throws RuleParseException {
        boolean negated = false;
        while (peek().isWord(RuleKeywords.NOT)) {
            next();
            negated = !negated;
        }
        RuleExpr operand = parseOperand();
        return negated ? new NotExpr(operand) : operand;
    }

    private RuleExpr parseOperand() throws RuleParseException {
        RuleToken token = next();
        if (token.type() == RuleToken.Type.LPAREN) {
            if (++nesting > MAX_NESTING) {
                throw error(token, "parentheses nested more than " + MAX_NESTING + " deep");
            }
            List<RuleExpr> terms = new ArrayList<>();
            while (peek().type() != RuleToken.Type.RPAREN) {
                if (atClauseEnd()) {
                    throw error(peek(), "unbalanced parentheses: expected ')', got " + peek().describe());
                }
                terms.add(parseOr());
            }
            next();
            nesting--;
            if (terms.isEmpty()) {
                throw error(token, "empty parentheses");
            }
            return terms.size() == 1 ? terms.get(0) : new AndExpr(terms);
        }
        if (token.type() == RuleToken.Type.STRING) {
            throw error(token, "a quoted string cannot be a match operator");
        }
        if (token.type() != RuleToken.Type.WORD) {
            throw error(token, "expected a match operator, got " + token.describe());
        }
        return parseMatcher(token);
    }

    private RuleExpr parseMatcher(RuleToken operator) throws RuleParseException {
        String word = operator.text();
        if (word.equals("all")) {
            return new AllExpr();
        }
        if (word.equals("tls")) {
            RuleToken state = next();
            if (state.isWord("on") || state.isWord("off")) {
                return new TlsExpr(state.text().equals("on"));
            }
            throw error(state, "tls needs on or off, got " + state.describe());
        }
        if (word.equals("dnsbl")) {
            return new DnsblExpr(argument(operator));
        }
        if (word.equals("dbl")) {
            Set<Attribute> sources = attributes(operator, AttributeVocabulary.DBL_SOURCE);
            return new DblExpr(sources, argument(operator));
        }
        if (word.equals("source")) {
            return new SourceExpr(argument(operator));
        }
        MatchTarget matchTarget = MatchTarget.fromKeyword(word);
        if (matchTarget != null) {
            return new MatchExpr(matchTarget, argument(operator));
        }
        AttributeTarget attributeTarget = AttributeTarget.fromKeyword(word);
        if (attributeTarget != null) {
            return new AttributeExpr(attributeTarget, attributes(operator, attributeTarget.vocabulary()));
        }
        throw error(operator, "unknown match operator " + operator.describe());
    }

    private String argument(RuleToken operator) throws RuleParseException {
        RuleToken token = next();
        if (token.type() == RuleToken.Type.STRING
                || (token.type() == RuleToken.Type.WORD && !RuleKeywords.isReserved(token.text()))) {
            return token.text();
        }
        throw error(token, operator.text() + " needs an argument, got " + token.describe());
    }

    private Set<Attribute> attributes(RuleToken operator, AttributeVocabulary vocabulary) throws RuleParseException {
        RuleToken token = next();
        if (token.type() != RuleToken.Type.WORD) {
            throw error(token, operator.text() + " needs an attribute list, got " + token.describe());
        }
        try {
            return vocabulary.parse(token.text());
        } catch (IllegalArgumentException e) {
            throw error(token, operator.text() + ": " + e.getMessage());
        }
    }

    private boolean atClauseEnd() {
        RuleToken token = peek();
        return switch (token.type()) {
            case SEMICOLON, NEWLINE, EOF, RPAREN -> true;
            case WORD -> token.text().equals(RuleKeywords.WITH);
            default -> false;
        };
    }

    private void expectEndOfRule() throws RuleParseException {
        RuleToken token = peek();
        if (token.type() != RuleToken.Type.NEWLINE && token.type() != RuleToken.Type.EOF) {
            throw error(token, "unexpected " + token.describe());
        }
    }

    private void skipNewlines() {
        while (peek().type() == RuleToken.Type.NEWLINE) {
            pos++;
        }
    }

    private RuleToken peek() {
        return tokens.get(pos);
    }

    private RuleToken next() {
        RuleToken token = tokens.get(pos);
        if (token.type() != RuleToken.Type.EOF) {
            pos++;
        }
        return token;
    }

    private RuleParseException error(RuleToken token, String reason) {
        return new RuleParseException(source, token.line(), reason);
    }
}
