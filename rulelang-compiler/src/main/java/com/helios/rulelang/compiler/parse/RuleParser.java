/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.compiler.parse;

import com.helios.rulelang.api.ast.ASTNode;
import com.helios.rulelang.api.ast.AllOf;
import com.helios.rulelang.api.ast.AnyOf;
import com.helios.rulelang.api.ast.ApplicableIf;
import com.helios.rulelang.api.ast.Bracket;
import com.helios.rulelang.api.ast.Ceiling;
import com.helios.rulelang.api.ast.CircularReferenceResolution;
import com.helios.rulelang.api.ast.Constant;
import com.helios.rulelang.api.ast.Deduction;
import com.helios.rulelang.api.ast.DefaultValue;
import com.helios.rulelang.api.ast.Duration;
import com.helios.rulelang.api.ast.Floor;
import com.helios.rulelang.api.ast.Grid;
import com.helios.rulelang.api.ast.Inversion;
import com.helios.rulelang.api.ast.Maximum;
import com.helios.rulelang.api.ast.Minimum;
import com.helios.rulelang.api.ast.NodeKind;
import com.helios.rulelang.api.ast.NodeMeta;
import com.helios.rulelang.api.ast.NotApplicableIf;
import com.helios.rulelang.api.ast.OneOf;
import com.helios.rulelang.api.ast.Product;
import com.helios.rulelang.api.ast.ProgressiveRate;
import com.helios.rulelang.api.ast.RateScale;
import com.helios.rulelang.api.ast.Recomputation;
import com.helios.rulelang.api.ast.Reference;
import com.helios.rulelang.api.ast.ReplacementRule;
import com.helios.rulelang.api.ast.Rounding;
import com.helios.rulelang.api.ast.RuleNode;
import com.helios.rulelang.api.ast.SituationLookup;
import com.helios.rulelang.api.ast.SourceMapInfo;
import com.helios.rulelang.api.ast.Sum;
import com.helios.rulelang.api.ast.Synchronization;
import com.helios.rulelang.api.ast.UnitAnnotation;
import com.helios.rulelang.api.ast.Variations;
import com.helios.rulelang.api.exceptions.RuleSyntaxException;
import com.helios.rulelang.api.raw.RawObject;
import com.helios.rulelang.api.raw.RawScalar;
import com.helios.rulelang.api.raw.RawSequence;
import com.helios.rulelang.api.raw.RawValue;
import com.helios.rulelang.compiler.CompileContext;
import com.helios.rulelang.compiler.DottedNames;
import com.helios.rulelang.compiler.mechanism.ComponentsExpander;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Builds the AST of one rule.
 *
 * <p>A rule body is an object of rule-level keys. Its expression, under {@code value} or
 * {@code formula}, is wrapped by the rule-level gates, innermost first:
 * {@code default}, the situation lookup of a {@code question}, {@code not applicable if},
 * then {@code applicable if}.
 *
 * <p>An expression is a scalar, a formula string, an object carrying a {@code value} and
 * chained mechanisms, an object naming an anonymous nested rule, or an object with exactly
 * one mechanism key. Anonymous nested rules are returned alongside the parsed rule so the
 * caller can register them.
 *
 * <p>Malformed input raises {@link RuleSyntaxException} naming the rule being parsed.
 */
public final class RuleParser {

    static final String TITLE = "title";
    static final String DESCRIPTION = "description";
    static final String NOTE = "note";
    static final String ACRONYM = "acronym";
    static final String QUESTION = "question";
    static final String VALUE = "value";
    static final String FORMULA = "formula";
    static final String NAME = "name";
    static final String REPLACES = "replaces";

    private static final Set<String> DESCRIPTIVE_KEYS = Set.of(TITLE, DESCRIPTION, NOTE);

    /**
     * Chained mechanisms of a value object, in application order.
     */
    private static final List<String> CHAINED_KEYS = List.of(
            NodeKind.DEDUCTION.keyword(),
            NodeKind.UNIT.keyword(),
            NodeKind.ROUNDING.keyword(),
            NodeKind.CEILING.keyword(),
            NodeKind.FLOOR.keyword(),
            NodeKind.DEFAULT_VALUE.keyword(),
            NodeKind.CIRCULAR_REFERENCE_RESOLUTION.keyword(),
            NodeKind.NOT_APPLICABLE_IF.keyword(),
            NodeKind.APPLICABLE_IF.keyword());

    @FunctionalInterface
    private interface MechanismParser {
        ASTNode parse(RawValue argument, Scope scope);
    }

    private final Map<String, MechanismParser> mechanisms = new LinkedHashMap<>();
    private final ComponentsExpander componentsExpander = new ComponentsExpander();

    public RuleParser() {
        mechanisms.put(NodeKind.SUM.keyword(), this::parseSum);
        mechanisms.put(NodeKind.PRODUCT.keyword(), this::parseProduct);
        mechanisms.put(NodeKind.RATE_SCALE.keyword(),
                (argument, scope) -> parseScale(NodeKind.RATE_SCALE, "rate", argument, scope));
        mechanisms.put(NodeKind.PROGRESSIVE_RATE.keyword(),
                (argument, scope) -> parseScale(NodeKind.PROGRESSIVE_RATE, "rate", argument, scope));
        mechanisms.put(NodeKind.GRID.keyword(),
                (argument, scope) -> parseScale(NodeKind.GRID, "amount", argument, scope));
        mechanisms.put(NodeKind.DURATION.keyword(), this::parseDuration);
        mechanisms.put(NodeKind.MAXIMUM.keyword(),
                (argument, scope) -> new Maximum(parseList(NodeKind.MAXIMUM, argument, scope), scope.meta));
        mechanisms.put(NodeKind.MINIMUM.keyword(),
                (argument, scope) -> new Minimum(parseList(NodeKind.MINIMUM, argument, scope), scope.meta));
        mechanisms.put(NodeKind.ALL_OF.keyword(),
                (argument, scope) -> new AllOf(parseList(NodeKind.ALL_OF, argument, scope), scope.meta));
        mechanisms.put(NodeKind.ANY_OF.keyword(),
                (argument, scope) -> new AnyOf(parseList(NodeKind.ANY_OF, argument, scope), scope.meta));
        mechanisms.put(NodeKind.ONE_OF.keyword(), this::parseOneOf);
        mechanisms.put(NodeKind.INVERSION.keyword(), this::parseInversion);
        mechanisms.put(NodeKind.RECOMPUTATION.keyword(), this::parseRecomputation);
        mechanisms.put(NodeKind.SYNCHRONIZATION.keyword(), this::parseSynchronization);
        mechanisms.put(NodeKind.VARIATIONS.keyword(), this::parseVariations);
    }

    /**
     * Parses a rule body.
     *
     * @param dottedName fully-qualified name of the rule
     * @param body       desugared rule body
     * @param context    compile context supplying the unit-label hook
     * @return the rule followed by every anonymous rule nested in it
     */
    public List<RuleNode> parse(String dottedName, RawObject body, CompileContext context) {
        List<RuleNode> discovered = new ArrayList<>();
        parseRule(DottedNames.normalize(dottedName), body, context.unitKey(), discovered);
        return discovered;
    }

    private void parseRule(String dottedName, RawObject body, UnaryOperator<String> unitKey,
                           List<RuleNode> discovered) {
        Scope scope = new Scope(dottedName, unitKey, discovered);
        // reserve the position before nested rules are appended
        int position = discovered.size();
        discovered.add(null);

        for (String key : body.keys()) {
            if (mechanisms.containsKey(key)) {
                throw scope.error("mechanism '" + key + "' must be written under '" + VALUE + "'");
            }
        }

        ASTNode value = null;
        RawValue expression = body.has(VALUE) ? body.get(VALUE) : body.get(FORMULA);
        if (expression != null) {
            value = parseExpression(expression, scope);
        }
        if (body.has(NodeKind.DEFAULT_VALUE.keyword())) {
            value = new DefaultValue(orNone(value, scope),
                    parseExpression(body.get(NodeKind.DEFAULT_VALUE.keyword()), scope), scope.meta);
        }
        if (body.has(QUESTION)) {
            value = new SituationLookup(dottedName, orNone(value, scope), scope.meta);
        }
        if (body.has(NodeKind.NOT_APPLICABLE_IF.keyword())) {
            value = new NotApplicableIf(parseExpression(body.get(NodeKind.NOT_APPLICABLE_IF.keyword()), scope),
                    orNone(value, scope), scope.meta);
        }
        if (body.has(NodeKind.APPLICABLE_IF.keyword())) {
            value = new ApplicableIf(parseExpression(body.get(NodeKind.APPLICABLE_IF.keyword()), scope),
                    orNone(value, scope), scope.meta);
        }

        List<ReplacementRule> replacements = body.has(REPLACES)
                ? parseReplacements(body.get(REPLACES), scope)
                : List.of();

        discovered.set(position, new RuleNode(dottedName, titleOf(dottedName, body), body,
                orNone(value, scope), replacements, scope.meta));
    }

    private static String titleOf(String dottedName, RawObject body) {
        if (body.get(TITLE) instanceof RawScalar title && !title.isNull()) {
            return title.asText();
        }
        return DottedNames.lastSegment(dottedName);
    }

    // ---------------------------------------------------------------- expressions

    ASTNode parseExpression(RawValue raw, Scope scope) {
        if (raw instanceof RawScalar scalar) {
            return parseScalar(scalar, scope);
        }
        if (raw instanceof RawSequence) {
            throw scope.error("a list cannot be used where an expression is expected");
        }
        RawObject object = (RawObject) raw;
        if (object.has(NAME)) {
            return parseAnonymousRule(object, scope);
        }
        if (object.has(VALUE) || object.has(FORMULA)) {
            return parseChainedMechanisms(object, scope);
        }
        if (object.size() != 1) {
            throw scope.error("expected exactly one mechanism, got " + object.keys());
        }
        String key = object.keys().iterator().next();
        MechanismParser parser = mechanisms.get(key);
        if (parser == null) {
            throw scope.error("unknown mechanism '" + key + "'");
        }
        RawValue argument = object.get(key);
        if (argument instanceof RawObject arguments && arguments.has(ComponentsExpander.COMPONENTS)) {
            return parseComponents(key, arguments, scope);
        }
        return parser.parse(argument, scope);
    }

    private ASTNode parseScalar(RawScalar scalar, Scope scope) {
        if (scalar.isNull()) {
            return Constant.none(scope.meta);
        }
        if (scalar.isBoolean()) {
            return Constant.bool((Boolean) scalar.value(), scope.meta);
        }
        if (scalar.isNumber()) {
            return Constant.number(((Number) scalar.value()).doubleValue(), scope.meta);
        }
        try {
            return new FormulaParser(scalar.asText(), scope.meta, scope.unitKey).parse();
        } catch (FormulaSyntaxException e) {
            throw new RuleSyntaxException(scope.ruleName,
                    "Rule " + scope.ruleName + ": " + e.getMessage(), e);
        }
    }

    private ASTNode parseAnonymousRule(RawObject object, Scope scope) {
        if (!(object.get(NAME) instanceof RawScalar nameScalar) || !nameScalar.isString()) {
            throw scope.error("'" + NAME + "' must be a string");
        }
        String name = DottedNames.normalize(nameScalar.asText());
        if (name.isEmpty()) {
            throw scope.error("'" + NAME + "' must not be empty");
        }
        String nestedName = DottedNames.join(scope.ruleName, name);
        parseRule(nestedName, object.without(NAME), scope.unitKey, scope.discovered);
        return Reference.to(name, scope.meta);
    }

    private ASTNode parseChainedMechanisms(RawObject object, Scope scope) {
        for (String key : object.keys()) {
            if (!key.equals(VALUE) && !key.equals(FORMULA) && !DESCRIPTIVE_KEYS.contains(key)
                    && !CHAINED_KEYS.contains(key)) {
                throw scope.error("'" + key + "' cannot be combined with '" + VALUE + "'");
            }
        }
        ASTNode node = parseExpression(object.has(VALUE) ? object.get(VALUE) : object.get(FORMULA), scope);
        for (String key : CHAINED_KEYS) {
            RawValue argument = object.get(key);
            if (argument != null) {
                node = applyChained(key, argument, node, scope);
            }
        }
        return node;
    }

    private ASTNode applyChained(String key, RawValue argument, ASTNode node, Scope scope) {
        NodeMeta meta = scope.meta;
        switch (key) {
            case "deduction":
                return new Deduction(node, parseExpression(argument, scope), meta);
            case "unit":
                return new UnitAnnotation(scope.unitKey.apply(requireText(key, argument, scope)), node, meta);
            case "round":
                if (argument instanceof RawScalar flag && flag.isBoolean()) {
                    return Boolean.TRUE.equals(flag.value())
                            ? new Rounding(node, Constant.number(0, meta), meta)
                            : node;
                }
                return new Rounding(node, parseExpression(argument, scope), meta);
            case "ceiling":
                return new Ceiling(node, parseExpression(argument, scope), meta);
            case "floor":
                return new Floor(node, parseExpression(argument, scope), meta);
            case "default":
                return new DefaultValue(node, parseExpression(argument, scope), meta);
            case "resolve circular reference":
                if (argument instanceof RawScalar flag && Boolean.FALSE.equals(flag.value())) {
                    return node;
                }
                return new CircularReferenceResolution(node, meta);
            case "not applicable if":
                return new NotApplicableIf(parseExpression(argument, scope), node, meta);
            case "applicable if":
                return new ApplicableIf(parseExpression(argument, scope), node, meta);
            default:
                throw new IllegalArgumentException("Not a chained mechanism: " + key);
        }
    }

    private ASTNode parseComponents(String mechanismKey, RawObject arguments, Scope scope) {
        RawObject expanded = componentsExpander.expand(mechanismKey, arguments, scope.ruleName);
        ASTNode sum = parseExpression(expanded, scope);
        Map<String, Object> sourceArguments = new LinkedHashMap<>();
        sourceArguments.put("mechanism", mechanismKey);
        sourceArguments.put(ComponentsExpander.COMPONENTS, arguments.get(ComponentsExpander.COMPONENTS).toPlainObject());
        return sum.withMeta(sum.meta().withSourceMap(
                new SourceMapInfo(ComponentsExpander.MECHANISM_NAME, sourceArguments)));
    }

    // ---------------------------------------------------------------- mechanisms

    private ASTNode parseSum(RawValue argument, Scope scope) {
        return new Sum(parseList(NodeKind.SUM, argument, scope), scope.meta);
    }

    private ASTNode parseProduct(RawValue argument, Scope scope) {
        RawObject arguments = requireObject(NodeKind.PRODUCT, argument, scope, Set.of("base", "rate", "factor", "cap"));
        if (arguments.isEmpty()) {
            throw scope.error("'" + NodeKind.PRODUCT.keyword() + "' needs at least one of base, rate, factor, cap");
        }
        return new Product(
                optional(arguments, "base", scope),
                optional(arguments, "rate", scope),
                optional(arguments, "factor", scope),
                optional(arguments, "cap", scope),
                scope.meta);
    }

    private ASTNode parseScale(NodeKind kind, String bracketValueKey, RawValue argument, Scope scope) {
        RawObject arguments = requireObject(kind, argument, scope, Set.of("base", "multiplier", "brackets"));
        ASTNode base = required(kind, arguments, "base", scope);
        ASTNode multiplier = optional(arguments, "multiplier", scope);
        if (!(arguments.get("brackets") instanceof RawSequence rawBrackets) || rawBrackets.size() == 0) {
            throw scope.error("'" + kind.keyword() + "' needs a non-empty list of brackets");
        }
        List<Bracket> brackets = new ArrayList<>(rawBrackets.size());
        for (RawValue element : rawBrackets.elements()) {
            if (!(element instanceof RawObject bracket)) {
                throw scope.error("every bracket of '" + kind.keyword() + "' must be an object");
            }
            for (String key : bracket.keys()) {
                if (!key.equals(bracketValueKey) && !key.equals("ceiling")) {
                    throw scope.error("unexpected key '" + key + "' in a bracket of '" + kind.keyword() + "'");
                }
            }
            brackets.add(new Bracket(required(kind, bracket, bracketValueKey, scope),
                    optional(bracket, "ceiling", scope)));
        }
        switch (kind) {
            case RATE_SCALE:
                return new RateScale(base, multiplier, brackets, scope.meta);
            case PROGRESSIVE_RATE:
                return new ProgressiveRate(base, multiplier, brackets, scope.meta);
            case GRID:
                return new Grid(base, multiplier, brackets, scope.meta);
            default:
                throw new IllegalArgumentException("Not a scale mechanism: " + kind);
        }
    }

    private ASTNode parseDuration(RawValue argument, Scope scope) {
        RawObject arguments = requireObject(NodeKind.DURATION, argument, scope, Set.of("from", "to"));
        return new Duration(required(NodeKind.DURATION, arguments, "from", scope),
                optional(arguments, "to", scope), scope.meta);
    }

    private ASTNode parseOneOf(RawValue argument, Scope scope) {
        if (argument instanceof RawSequence) {
            return new OneOf(parseList(NodeKind.ONE_OF, argument, scope), false, scope.meta);
        }
        RawObject arguments = requireObject(NodeKind.ONE_OF, argument, scope, Set.of("possibilities", "choice required"));
        boolean choiceRequired = false;
        if (arguments.get("choice required") instanceof RawScalar flag) {
            if (!flag.isBoolean()) {
                throw scope.error("'choice required' must be a boolean");
            }
            choiceRequired = (Boolean) flag.value();
        }
        return new OneOf(parseList(NodeKind.ONE_OF, arguments.get("possibilities"), scope), choiceRequired, scope.meta);
    }

    private ASTNode parseInversion(RawValue argument, Scope scope) {
        RawObject arguments = requireObject(NodeKind.INVERSION, argument, scope, Set.of("with"));
        return new Inversion(parseList(NodeKind.INVERSION, arguments.get("with"), scope), scope.meta);
    }

    private ASTNode parseRecomputation(RawValue argument, Scope scope) {
        if (argument instanceof RawScalar target && target.isString()) {
            return new Recomputation(Reference.to(DottedNames.normalize(target.asText()), scope.meta),
                    List.of(), scope.meta);
        }
        RawObject arguments = requireObject(NodeKind.RECOMPUTATION, argument, scope, Set.of("rule", "with"));
        Reference target;
        if (arguments.has("rule")) {
            target = Reference.to(DottedNames.normalize(requireText("rule", arguments.get("rule"), scope)), scope.meta);
        } else {
            target = Reference.nonDependency(scope.ruleName, scope.meta);
        }

        List<Recomputation.Amendment> amendments = new ArrayList<>();
        RawValue with = arguments.get("with");
        if (with != null) {
            if (!(with instanceof RawObject overrides)) {
                throw scope.error("'with' of '" + NodeKind.RECOMPUTATION.keyword() + "' must map rule names to values");
            }
            for (Map.Entry<String, RawValue> entry : overrides.entries().entrySet()) {
                Reference name = Reference.nonDependency(DottedNames.normalize(entry.getKey()), scope.meta);
                amendments.add(new Recomputation.Amendment(name, parseExpression(entry.getValue(), scope)));
            }
        }
        return new Recomputation(target, amendments, scope.meta);
    }

    private ASTNode parseSynchronization(RawValue argument, Scope scope) {
        RawObject arguments = requireObject(NodeKind.SYNCHRONIZATION, argument, scope, Set.of("data", "path"));
        ASTNode data = required(NodeKind.SYNCHRONIZATION, arguments, "data", scope);
        return new Synchronization(data, requireText("path", arguments.get("path"), scope), scope.meta);
    }

    private ASTNode parseVariations(RawValue argument, Scope scope) {
        if (!(argument instanceof RawSequence sequence) || sequence.size() == 0) {
            throw scope.error("'" + NodeKind.VARIATIONS.keyword() + "' must be a non-empty list");
        }
        List<Variations.Branch> branches = new ArrayList<>(sequence.size());
        for (int i = 0; i < sequence.size(); i++) {
            if (!(sequence.get(i) instanceof RawObject branch)) {
                throw scope.error("every branch of '" + NodeKind.VARIATIONS.keyword() + "' must be an object");
            }
            if (branch.has("else")) {
                if (branch.size() != 1 || i != sequence.size() - 1) {
                    throw scope.error("'else' must be alone in the last branch of '" + NodeKind.VARIATIONS.keyword() + "'");
                }
                branches.add(new Variations.Branch(Constant.bool(true, scope.meta),
                        parseExpression(branch.get("else"), scope)));
            } else {
                if (!branch.has("if") || !branch.has("then") || branch.size() != 2) {
                    throw scope.error("every branch of '" + NodeKind.VARIATIONS.keyword() + "' needs exactly 'if' and 'then'");
                }
                branches.add(new Variations.Branch(parseExpression(branch.get("if"), scope),
                        parseExpression(branch.get("then"), scope)));
            }
        }
        return new Variations(branches, scope.meta);
    }

    // ---------------------------------------------------------------- replacements

    private List<ReplacementRule> parseReplacements(RawValue raw, Scope scope) {
        List<RawValue> declarations = raw instanceof RawSequence sequence
                ? sequence.elements()
                : Collections.singletonList(raw);
        List<ReplacementRule> replacements = new ArrayList<>(declarations.size());
        for (RawValue declaration : declarations) {
            replacements.add(parseReplacement(declaration, scope));
        }
        return replacements;
    }

    private ReplacementRule parseReplacement(RawValue declaration, Scope scope) {
        String replaced;
        List<Reference> whiteList = List.of();
        List<Reference> blackList = List.of();
        if (declaration instanceof RawScalar scalar && scalar.isString()) {
            replaced = scalar.asText();
        } else if (declaration instanceof RawObject object) {
            for (String key : object.keys()) {
                if (!key.equals("references to") && !key.equals("in") && !key.equals("except in")) {
                    throw scope.error("unexpected key '" + key + "' in '" + REPLACES + "'");
                }
            }
            replaced = requireText("references to", object.get("references to"), scope);
            whiteList = parseNameList("in", object.get("in"), scope);
            blackList = parseNameList("except in", object.get("except in"), scope);
        } else {
            throw scope.error("'" + REPLACES + "' expects rule names or objects with 'references to'");
        }
        return new ReplacementRule(
                Reference.nonDependency(scope.ruleName, scope.meta),
                Reference.nonDependency(DottedNames.normalize(replaced), scope.meta),
                Reference.nonDependency(scope.ruleName, scope.meta),
                whiteList,
                blackList,
                scope.meta);
    }

    private List<Reference> parseNameList(String key, RawValue raw, Scope scope) {
        if (raw == null) {
            return List.of();
        }
        List<RawValue> names = raw instanceof RawSequence sequence
                ? sequence.elements()
                : Collections.singletonList(raw);
        List<Reference> references = new ArrayList<>(names.size());
        for (RawValue name : names) {
            references.add(Reference.nonDependency(DottedNames.normalize(requireText(key, name, scope)), scope.meta));
        }
        return references;
    }

    // ---------------------------------------------------------------- helpers

    private List<ASTNode> parseList(NodeKind kind, RawValue raw, Scope scope) {
        if (!(raw instanceof RawSequence sequence)) {
            throw scope.error("'" + kind.keyword() + "' expects a list");
        }
        List<ASTNode> nodes = new ArrayList<>(sequence.size());
        for (RawValue element : sequence.elements()) {
            nodes.add(parseExpression(element, scope));
        }
        return nodes;
    }

    private RawObject requireObject(NodeKind kind, RawValue raw, Scope scope, Set<String> allowedKeys) {
        if (!(raw instanceof RawObject object)) {
            throw scope.error("'" + kind.keyword() + "' expects an object with " + allowedKeys);
        }
        for (String key : object.keys()) {
            if (!allowedKeys.contains(key)) {
                throw scope.error("unexpected argument '" + key + "' for '" + kind.keyword() + "'");
            }
        }
        return object;
    }

    private ASTNode required(NodeKind kind, RawObject arguments, String key, Scope scope) {
        RawValue raw = arguments.get(key);
        if (raw == null) {
            throw scope.error("'" + kind.keyword() + "' is missing its '" + key + "' argument");
        }
        return parseExpression(raw, scope);
    }

    private ASTNode optional(RawObject arguments, String key, Scope scope) {
        RawValue raw = arguments.get(key);
        return raw == null ? null : parseExpression(raw, scope);
    }

    private static String requireText(String key, RawValue raw, Scope scope) {
        if (raw instanceof RawScalar scalar && scalar.isString() && !scalar.asText().isBlank()) {
            return scalar.asText();
        }
        throw scope.error("'" + key + "' must be a non-empty string");
    }

    private static ASTNode orNone(ASTNode value, Scope scope) {
        return value == null ? Constant.none(scope.meta) : value;
    }

    /**
     * Per-rule parsing state.
     */
    static final class Scope {
        final String ruleName;
        final NodeMeta meta;
        final UnaryOperator<String> unitKey;
        final List<RuleNode> discovered;

        Scope(String ruleName, UnaryOperator<String> unitKey, List<RuleNode> discovered) {
            this.ruleName = ruleName;
            this.meta = NodeMeta.of(ruleName);
            this.unitKey = unitKey;
            this.discovered = discovered;
        }

        RuleSyntaxException error(String message) {
            return new RuleSyntaxException(ruleName, "Rule " + ruleName + ": " + message);
        }
    }
}
