package io.uvlanalyzer.core.parser;

import io.uvlanalyzer.core.error.MalformedModelException;
import io.uvlanalyzer.core.model.Constraint;
import io.uvlanalyzer.core.model.Expression;
import io.uvlanalyzer.core.model.Feature;
import io.uvlanalyzer.core.model.FeatureModel;
import io.uvlanalyzer.core.model.FeatureTree;
import io.uvlanalyzer.core.model.Group;
import io.uvlanalyzer.core.model.GroupKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses UVL model text into a {@link FeatureModel}.
 *
 * <p>
 * The feature tree is indentation-delimited: a feature may only contain group keywords
 * ({@code mandatory}, {@code optional}, {@code or}, {@code alternative} or a cardinality
 * {@code [n..m]}) one level deeper, and a group may only contain features. Sibling lines must
 * share the same indentation; a tab counts as four columns. Group cardinalities are normalised
 * into a keyword {@link GroupKind} where their semantics coincide and kept as
 * {@link GroupKind#CARDINALITY} otherwise.
 *
 * <p>
 * Every structural problem raises {@link MalformedModelException} with the offending line; the
 * parser never repairs input.
 *
 * <p>
 * Thread-safe: instances are stateless, all parse state is local to {@link #parse(String)}.
 */
public final class UvlParser {

    private static final Logger LOG = LoggerFactory.getLogger(UvlParser.class);

    private static final int TAB_WIDTH = 4;

    private static final Set<String> TYPE_KEYWORDS = Set.of("Boolean", "Integer", "Real", "String");

    private static final Set<String> SECTION_KEYWORDS = Set.of("namespace", "include", "imports", "features", "constraints");

    /** {@code [n]}, {@code [n..m]} or {@code [n..*]}. */
    private static final Pattern CARDINALITY = Pattern.compile("\\[\\s*(\\d+)\\s*(?:\\.\\.\\s*(\\d+|\\*)\\s*)?]");

    private enum Section {
        NONE,
        INCLUDE,
        FEATURES,
        CONSTRAINTS
    }

    /**
     * Parses model text.
     *
     * @param text UVL model text
     * @return the parsed model
     * @throws MalformedModelException if the text is not a well-formed feature model
     * @throws io.uvlanalyzer.core.error.ConstraintSyntaxException if a constraint cannot be
     *         parsed
     */
    public FeatureModel parse(String text) {
        if (text == null || text.isBlank()) {
            throw new MalformedModelException("Model text is empty", 0);
        }
        String[] lines = stripComments(text).split("\\R", -1);
        ParseState state = new ParseState();

        for (int index = 0; index < lines.length; index++) {
            String raw = lines[index];
            if (raw.isBlank()) {
                continue;
            }
            int lineNumber = index + 1;
            int indent = indentation(raw);
            String content = raw.strip();

            if (indent == 0) {
                if (state.pendingConstraint != null) {
                    throw new MalformedModelException("Unbalanced parentheses in constraint", state.pendingLine);
                }
                state.section = openSection(content, lineNumber, state);
                continue;
            }

            switch (state.section) {
                case NONE -> throw new MalformedModelException(
                        "Indented line outside of any section: '" + content + "'", lineNumber);
                case INCLUDE -> LOG.debug("Skipping include declaration at line {}: {}", lineNumber, content);
                case FEATURES -> parseTreeLine(content, indent, lineNumber, state);
                case CONSTRAINTS -> parseConstraintLine(content, lineNumber, state);
            }
        }

        if (state.pendingConstraint != null) {
            throw new MalformedModelException("Unbalanced parentheses in constraint", state.pendingLine);
        }
        if (!state.sawFeatures) {
            throw new MalformedModelException("Model has no 'features' section", 0);
        }
        if (state.root == null) {
            throw new MalformedModelException("Model has no root feature", state.featuresLine);
        }

        FeatureTree tree = buildTree(state.root);
        List<Constraint> constraints = resolveConstraints(state.rawConstraints, tree);
        FeatureModel model = new FeatureModel(state.namespace, tree, constraints);
        LOG.debug(
                "Parsed model: root={}, features={}, constraints={}",
                tree.root().name(),
                tree.size(),
                constraints.size());
        return model;
    }

    // --- Sections ---

    private static Section openSection(String content, int line, ParseState state) {
        String keyword = firstWord(content);
        if (!SECTION_KEYWORDS.contains(keyword)) {
            throw new MalformedModelException("Unexpected '" + content + "' at top level", line);
        }
        switch (keyword) {
            case "namespace" -> {
                String name = content.substring(keyword.length()).strip();
                if (name.isEmpty()) {
                    throw new MalformedModelException("'namespace' requires a name", line);
                }
                state.namespace = name;
                return Section.NONE;
            }
            case "include" -> {
                requireBare(content, keyword, line);
                return Section.INCLUDE;
            }
            case "imports" -> throw new MalformedModelException("'imports' sections are not supported", line);
            case "features" -> {
                requireBare(content, keyword, line);
                if (state.sawFeatures) {
                    throw new MalformedModelException("Duplicate 'features' section", line);
                }
                state.sawFeatures = true;
                state.featuresLine = line;
                return Section.FEATURES;
            }
            default -> {
                requireBare(content, keyword, line);
                if (!state.sawFeatures) {
                    throw new MalformedModelException("'constraints' section must follow the 'features' section", line);
                }
                return Section.CONSTRAINTS;
            }
        }
    }

    private static void requireBare(String content, String keyword, int line) {
        if (!content.equals(keyword)) {
            throw new MalformedModelException("Unexpected text after '" + keyword + "'", line);
        }
    }

    // --- Feature tree ---

    private void parseTreeLine(String content, int indent, int line, ParseState state) {
        Deque<Frame> stack = state.stack;
        while (!stack.isEmpty() && stack.peek().indent >= indent) {
            stack.pop();
        }

        Optional<GroupHeader> header = parseGroupHeader(content, line);
        Frame parent = stack.peek();

        if (parent == null) {
            if (header.isPresent()) {
                throw new MalformedModelException(
                        "Group '" + content + "' has no parent feature", line);
            }
            if (state.root != null) {
                throw new MalformedModelException(
                        "Model has more than one root feature ('" + state.root.name + "' and '" + content + "')",
                        line);
            }
            if (state.rootIndent >= 0 && state.rootIndent != indent) {
                throw new MalformedModelException("Inconsistent indentation", line);
            }
            DraftFeature root = parseFeatureDeclaration(content, line, null, null, state);
            state.root = root;
            state.rootIndent = indent;
            stack.push(new Frame(indent, root, null));
            return;
        }

        checkSiblingIndentation(parent, indent, line);

        if (parent.feature != null) {
            if (header.isEmpty()) {
                throw new MalformedModelException(
                        "Feature '" + content + "' must be declared inside a group of '" + parent.feature.name
                                + "' (expected mandatory, optional, or, alternative or a cardinality)",
                        line);
            }
            DraftGroup group = new DraftGroup(header.get(), line);
            parent.feature.groups.add(group);
            stack.push(new Frame(indent, null, group));
        } else {
            if (header.isPresent()) {
                throw new MalformedModelException(
                        "Group '" + content + "' cannot directly contain another group", line);
            }
            DraftGroup group = parent.group;
            DraftFeature owner = findOwner(stack, group);
            DraftFeature child = parseFeatureDeclaration(content, line, owner, group, state);
            group.children.add(child);
            stack.push(new Frame(indent, child, null));
        }
    }

    private static void checkSiblingIndentation(Frame parent, int indent, int line) {
        if (parent.childIndent < 0) {
            parent.childIndent = indent;
        } else if (parent.childIndent != indent) {
            throw new MalformedModelException(
                    "Inconsistent indentation: expected " + parent.childIndent + " columns but found " + indent, line);
        }
    }

    private static DraftFeature findOwner(Deque<Frame> stack, DraftGroup group) {
        boolean passedGroup = false;
        for (Frame frame : stack) {
            if (frame.group == group) {
                passedGroup = true;
            } else if (passedGroup && frame.feature != null) {
                return frame.feature;
            }
        }
        throw new IllegalStateException("group without owning feature");
    }

    private static Optional<GroupHeader> parseGroupHeader(String content, int line) {
        Optional<GroupKind> kind = GroupKind.fromKeyword(content);
        if (kind.isPresent()) {
            return Optional.of(new GroupHeader(kind.get(), -1, -1));
        }
        String word = firstWord(content);
        if (GroupKind.fromKeyword(word).isPresent()) {
            throw new MalformedModelException("Unexpected text after group keyword '" + word + "'", line);
        }
        if (content.startsWith("[")) {
            Matcher matcher = CARDINALITY.matcher(content);
            if (!matcher.matches()) {
                throw new MalformedModelException("Malformed group cardinality '" + content + "'", line);
            }
            int lower = Integer.parseInt(matcher.group(1));
            String upperText = matcher.group(2);
            int upper;
            if (upperText == null) {
                upper = lower;
            } else if ("*".equals(upperText)) {
                upper = Integer.MAX_VALUE;
            } else {
                upper = Integer.parseInt(upperText);
            }
            if (upper < lower) {
                throw new MalformedModelException("Group cardinality upper bound below lower bound: " + content, line);
            }
            return Optional.of(new GroupHeader(null, lower, upper));
        }
        return Optional.empty();
    }

    private DraftFeature parseFeatureDeclaration(
            String content, int line, DraftFeature parent, DraftGroup group, ParseState state) {
        int position = 0;
        String type = null;
        String first = firstWord(content);
        if (TYPE_KEYWORDS.contains(first) && content.length() > first.length()) {
            type = first;
            position = skipWhitespace(content, first.length());
        }

        String name;
        if (content.charAt(position) == '"') {
            int end = content.indexOf('"', position + 1);
            if (end < 0) {
                throw new MalformedModelException("Unterminated quoted feature name", line);
            }
            if (end == position + 1) {
                throw new MalformedModelException("Empty feature name", line);
            }
            name = content.substring(position, end + 1);
            position = end + 1;
        } else {
            int start = position;
            while (position < content.length() && ConstraintLexer.isIdentifierChar(content.charAt(position))) {
                position++;
            }
            if (position == start) {
                throw new MalformedModelException(
                        "Expected a feature name but found '" + content.substring(start) + "'", line);
            }
            name = content.substring(start, position);
        }
        if (SECTION_KEYWORDS.contains(name) || "cardinality".equals(name)) {
            throw new MalformedModelException("'" + name + "' is a reserved word and cannot name a feature", line);
        }

        Map<String, String> attributes = new LinkedHashMap<>();
        position = skipWhitespace(content, position);
        if (content.startsWith("cardinality", position)) {
            position = skipWhitespace(content, position + "cardinality".length());
            Matcher matcher = CARDINALITY.matcher(content);
            matcher.region(position, content.length());
            if (!matcher.lookingAt()) {
                throw new MalformedModelException("Malformed feature cardinality for '" + name + "'", line);
            }
            attributes.put("cardinality", matcher.group().replaceAll("\\s", ""));
            position = skipWhitespace(content, matcher.end());
        }
        if (position < content.length() && content.charAt(position) == '{') {
            int end = matchingBrace(content, position, line);
            attributes.putAll(parseAttributes(content.substring(position + 1, end), line));
            position = skipWhitespace(content, end + 1);
        }
        if (position < content.length()) {
            throw new MalformedModelException(
                    "Unexpected text after feature '" + name + "': '" + content.substring(position) + "'", line);
        }

        DraftFeature existing = state.byName.get(name);
        if (existing != null) {
            throw new MalformedModelException(
                    "Duplicate feature name '" + name + "' (first declared at line " + existing.line + ")", line);
        }
        DraftFeature feature = new DraftFeature(name, parent, group, attributes, type, line);
        state.byName.put(name, feature);
        return feature;
    }

    private static int matchingBrace(String content, int open, int line) {
        int depth = 0;
        boolean quoted = false;
        for (int i = open; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == '"' || c == '\'') {
                quoted = !quoted;
            } else if (!quoted && c == '{') {
                depth++;
            } else if (!quoted && c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        throw new MalformedModelException("Unbalanced '{' in attribute block", line);
    }

    private static Map<String, String> parseAttributes(String body, int line) {
        Map<String, String> attributes = new LinkedHashMap<>();
        int depth = 0;
        boolean quoted = false;
        StringBuilder current = new StringBuilder();
        for (int i = 0; i <= body.length(); i++) {
            char c = i < body.length() ? body.charAt(i) : ',';
            if (c == '"' || c == '\'') {
                quoted = !quoted;
            } else if (!quoted && (c == '{' || c == '[')) {
                depth++;
            } else if (!quoted && (c == '}' || c == ']')) {
                depth--;
            }
            if (c == ',' && depth == 0 && !quoted) {
                String entry = current.toString().strip();
                if (!entry.isEmpty()) {
                    String key = firstWord(entry);
                    attributes.put(key, entry.substring(key.length()).strip());
                }
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        if (quoted || depth != 0) {
            throw new MalformedModelException("Unbalanced attribute block", line);
        }
        return attributes;
    }

    // --- Constraints ---

    private static void parseConstraintLine(String content, int line, ParseState state) {
        String text = state.pendingConstraint != null ? state.pendingConstraint + " " + content : content;
        int startLine = state.pendingConstraint != null ? state.pendingLine : line;
        if (parenthesisBalance(text) > 0) {
            state.pendingConstraint = text;
            state.pendingLine = startLine;
            return;
        }
        state.pendingConstraint = null;
        Expression expression = ConstraintParser.parse(text, startLine);
        state.rawConstraints.add(new Constraint(expression, text, startLine));
    }

    private static int parenthesisBalance(String text) {
        int balance = 0;
        boolean quoted = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (!quoted && c == '(') {
                balance++;
            } else if (!quoted && c == ')') {
                balance--;
            }
        }
        return balance;
    }

    private static List<Constraint> resolveConstraints(List<Constraint> raw, FeatureTree tree) {
        List<Constraint> resolved = new ArrayList<>(raw.size());
        for (Constraint constraint : raw) {
            Expression expression = resolve(constraint.expression(), tree, constraint.line());
            resolved.add(new Constraint(expression, constraint.source(), constraint.line()));
        }
        return resolved;
    }

    /** Rewrites literal names to the tree's verbatim names, rejecting undefined references. */
    private static Expression resolve(Expression expression, FeatureTree tree, int line) {
        if (expression instanceof Expression.Literal literal) {
            return new Expression.Literal(resolveName(literal.name(), tree, line));
        }
        if (expression instanceof Expression.Not not) {
            return new Expression.Not(resolve(not.operand(), tree, line));
        }
        if (expression instanceof Expression.And and) {
            return new Expression.And(
                    and.operands().stream().map(e -> resolve(e, tree, line)).toList());
        }
        if (expression instanceof Expression.Or or) {
            return new Expression.Or(
                    or.operands().stream().map(e -> resolve(e, tree, line)).toList());
        }
        if (expression instanceof Expression.Implies implies) {
            return new Expression.Implies(resolve(implies.left(), tree, line), resolve(implies.right(), tree, line));
        }
        if (expression instanceof Expression.Equivalent equivalent) {
            return new Expression.Equivalent(
                    resolve(equivalent.left(), tree, line), resolve(equivalent.right(), tree, line));
        }
        return expression;
    }

    private static String resolveName(String name, FeatureTree tree, int line) {
        if (tree.contains(name)) {
            return name;
        }
        boolean quoted = name.length() >= 2 && name.startsWith("\"") && name.endsWith("\"");
        String alternative = quoted ? name.substring(1, name.length() - 1) : '"' + name + '"';
        if (tree.contains(alternative)) {
            return alternative;
        }
        throw new MalformedModelException("Constraint references undefined feature '" + name + "'", line);
    }

    // --- Tree assembly ---

    private static FeatureTree buildTree(DraftFeature root) {
        List<Feature> features = new ArrayList<>();
        Deque<DraftFeature> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            DraftFeature draft = pending.pop();
            List<Group> groups = new ArrayList<>();
            for (DraftGroup group : draft.groups) {
                if (group.children.isEmpty()) {
                    throw new MalformedModelException(
                            "Group '" + group.header.describe() + "' of feature '" + draft.name + "' has no children",
                            group.line);
                }
                groups.add(group.header.toGroup(
                        group.children.stream().map(child -> child.name).toList(), group.line));
            }
            GroupKind declaredIn = draft.group != null
                    ? draft.group.header.normalise(draft.group.children.size(), draft.group.line)
                    : null;
            String parentName = draft.parent != null ? draft.parent.name : null;
            features.add(new Feature(draft.name, parentName, declaredIn, groups, draft.attributes, draft.type, draft.line));

            // push in reverse so that pre-order follows declaration order
            List<DraftFeature> children = new ArrayList<>();
            draft.groups.forEach(group -> children.addAll(group.children));
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return new FeatureTree(features);
    }

    // --- Text helpers ---

    /** Removes {@code //} and {@code /* *}{@code /} comments outside quotes, keeping line breaks. */
    static String stripComments(String text) {
        StringBuilder out = new StringBuilder(text.length());
        boolean quoted = false;
        boolean block = false;
        boolean lineComment = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            char next = i + 1 < text.length() ? text.charAt(i + 1) : '\0';
            if (lineComment) {
                if (c == '\n' || c == '\r') {
                    lineComment = false;
                    out.append(c);
                }
            } else if (block) {
                if (c == '*' && next == '/') {
                    block = false;
                    i++;
                } else if (c == '\n' || c == '\r') {
                    out.append(c);
                }
            } else if (!quoted && c == '/' && next == '/') {
                lineComment = true;
                i++;
            } else if (!quoted && c == '/' && next == '*') {
                block = true;
                i++;
            } else {
                if (c == '"') {
                    quoted = !quoted;
                } else if (c == '\n' || c == '\r') {
                    quoted = false;
                }
                out.append(c);
            }
        }
        return out.toString();
    }

    private static int indentation(String line) {
        int columns = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == ' ') {
                columns++;
            } else if (c == '\t') {
                columns += TAB_WIDTH;
            } else {
                break;
            }
        }
        return columns;
    }

    private static String firstWord(String content) {
        int end = 0;
        while (end < content.length() && !Character.isWhitespace(content.charAt(end))) {
            end++;
        }
        return content.substring(0, end);
    }

    private static int skipWhitespace(String content, int position) {
        while (position < content.length() && Character.isWhitespace(content.charAt(position))) {
            position++;
        }
        return position;
    }

    // --- Parse state ---

    private static final class ParseState {
        private Section section = Section.NONE;
        private String namespace;
        private boolean sawFeatures;
        private int featuresLine;
        private DraftFeature root;
        private int rootIndent = -1;
        private final Deque<Frame> stack = new ArrayDeque<>();
        private final Map<String, DraftFeature> byName = new HashMap<>();
        private final List<Constraint> rawConstraints = new ArrayList<>();
        private String pendingConstraint;
        private int pendingLine;
    }

    /** One open line of the tree: either a feature or a group, never both. */
    private static final class Frame {
        private final int indent;
        private final DraftFeature feature;
        private final DraftGroup group;
        private int childIndent = -1;

        private Frame(int indent, DraftFeature feature, DraftGroup group) {
            this.indent = indent;
            this.feature = feature;
            this.group = group;
        }
    }

    private static final class DraftFeature {
        private final String name;
        private final DraftFeature parent;
        private final DraftGroup group;
        private final Map<String, String> attributes;
        private final String type;
        private final int line;
        private final List<DraftGroup> groups = new ArrayList<>();

        private DraftFeature(
                String name,
                DraftFeature parent,
                DraftGroup group,
                Map<String, String> attributes,
                String type,
                int line) {
            this.name = name;
            this.parent = parent;
            this.group = group;
            this.attributes = attributes;
            this.type = type;
            this.line = line;
        }
    }

    private static final class DraftGroup {
        private final GroupHeader header;
        private final int line;
        private final List<DraftFeature> children = new ArrayList<>();

        private DraftGroup(GroupHeader header, int line) {
            this.header = header;
            this.line = line;
        }
    }

    /**
     * A group keyword or a cardinality. Cardinalities are mapped onto the keyword group kind with
     * the same semantics once the number of children is known; an upper bound beyond the child
     * count is clamped to it.
     */
    private record GroupHeader(GroupKind kind, int lower, int upper) {

        Group toGroup(List<String> children, int line) {
            GroupKind normalised = normalise(children.size(), line);
            if (normalised == GroupKind.CARDINALITY) {
                return new Group(normalised, children, lower, Math.min(upper, children.size()));
            }
            return new Group(normalised, children);
        }

        GroupKind normalise(int childCount, int line) {
            if (kind != null) {
                return kind;
            }
            if (lower > childCount) {
                throw new MalformedModelException(
                        "Group cardinality " + describe() + " needs more than its " + childCount + " children", line);
            }
            boolean upToAll = upper >= childCount;
            if (lower == 1 && upper == 1) {
                return GroupKind.ALTERNATIVE;
            }
            if (lower == childCount) {
                return GroupKind.MANDATORY;
            }
            if (lower == 1 && upToAll) {
                return GroupKind.OR;
            }
            if (lower == 0 && upToAll) {
                return GroupKind.OPTIONAL;
            }
            return GroupKind.CARDINALITY;
        }

        String describe() {
            if (kind != null) {
                return kind.keyword();
            }
            String upperText = upper == Integer.MAX_VALUE ? "*" : Integer.toString(upper);
            return "[" + lower + ".." + upperText + "]";
        }
    }
}
