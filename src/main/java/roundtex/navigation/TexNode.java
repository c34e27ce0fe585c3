// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.navigation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import roundtex.tree.BracketGroup;
import roundtex.tree.CapabilityViolationCondition;
import roundtex.tree.Serializer;
import roundtex.tree.TexArgs;
import roundtex.tree.TexCommand;
import roundtex.tree.TexElement;
import roundtex.tree.TexEnvironment;
import roundtex.tree.TexExpression;
import roundtex.tree.TexGroup;
import roundtex.tree.TexMathEnvironment;
import roundtex.tree.TexNamedEnvironment;
import roundtex.tree.TexRoot;
import roundtex.tree.TexText;
import roundtex.util.UnreachableCodeReachedError;
import roundtex.util.annotation.Nullable;
import roundtex.util.condition.ConditionContext;

/**
 * A navigation and mutation view of one tree element.
 * <p>
 * Nodes are transient wrappers: two nodes are equal iff they wrap the same element, and creating a node costs
 * nothing. All state lives in the tree.
 * <p>
 * Navigation sees through argument groups: {@link #parent()} of an element inside an argument is the command or
 * environment owning the argument, and the contents of arguments come before the own contents in
 * {@link #all()}, {@link #contents()}, {@link #children()} and {@link #descendants()}.
 */
public final class TexNode {
    private TexNode(final TexElement element) {
        this.element = element;
    }

    /**
     * Returns a view of the given element.
     */
    public static TexNode of(final TexElement element) {
        return new TexNode(element);
    }

    public TexElement element() {
        return element;
    }

    public boolean isText() {
        return element instanceof TexText;
    }

    /**
     * Returns the name of the wrapped expression, or {@code null} for text.
     */
    public @Nullable String name() {
        return (element instanceof final TexExpression expression) ? expression.name() : null;
    }

    /**
     * Renames the wrapped expression.
     * <p>
     * Signals a {@link CapabilityViolationCondition} for text, and for expressions whose kind fixes their name.
     */
    public void setName(final String newName) {
        requireExpression("be renamed").setName(newName);
    }

    /**
     * Returns the text a reader would consider this node's value: the contents of the first brace argument of a
     * command that has one, the contents of any other expression, or the text of a text leaf.
     */
    public String string() {
        if (element instanceof final TexText text) {
            return text.text();
        }
        final var expression = (TexExpression) element;
        final var argument = firstBraceArgument(expression);
        return Serializer.contentsToSource((argument != null) ? argument : expression);
    }

    /**
     * Replaces the value returned by {@link #string()}.
     * <p>
     * The new value is parsed, except for opaque bodies (math, verbatim-like environments) which take it verbatim.
     */
    public void setString(final String newString) {
        if (element instanceof final TexText text) {
            text.setText(newString);
            return;
        }
        final var expression = (TexExpression) element;
        final var argument = firstBraceArgument(expression);
        final TexExpression target = (argument != null) ? argument : expression;
        if (!target.acceptsContent()) {
            throw ConditionContext.error(new CapabilityViolationCondition(target, "hold contents"));
        }
        final List<TexElement> newContents;
        if (isOpaque(target)) {
            newContents = newString.isEmpty() ? List.of() : List.of(new TexText(newString));
        } else {
            newContents = Fragments.parseElements(newString);
        }
        target.clearContents();
        for (final var newElement : newContents) {
            target.appendContent(newElement);
        }
    }

    /**
     * Returns the argument list of the wrapped expression.
     * <p>
     * Signals a {@link CapabilityViolationCondition} for text.
     */
    public TexArgs arguments() {
        return requireExpression("have arguments").arguments();
    }

    public int position() {
        return element.position();
    }

    /**
     * Returns the command or environment this node belongs to, or {@code null} for a root or a detached element.
     */
    public @Nullable TexNode parent() {
        var parent = element.parent();
        if (parent instanceof final TexGroup group && group.isArgument()) {
            parent = group.parent();
        }
        return (parent == null) ? null : new TexNode(parent);
    }

    /**
     * Returns the expressions among {@link #all()}.
     */
    public List<TexNode> children() {
        return wrap(childElements().stream().filter(child -> child instanceof TexExpression));
    }

    /**
     * Returns {@link #all()} without whitespace-only text.
     */
    public List<TexNode> contents() {
        return wrap(childElements().stream()
            .filter(child -> !(child instanceof final TexText text && text.isWhitespace())));
    }

    /**
     * Returns a snapshot of the contents of every argument followed by the own contents, whitespace included.
     */
    public List<TexNode> all() {
        return wrap(childElements().stream());
    }

    /**
     * Returns the element at the given index of {@link #all()}.
     */
    public TexNode get(final int index) {
        return new TexNode(childElements().get(index));
    }

    /**
     * Returns all elements below this node in pre-order, text leaves included.
     * <p>
     * The stream is lazy, and each level is a snapshot taken when the traversal reaches it.
     */
    public Stream<TexNode> descendants() {
        return childElements().stream()
            .flatMap(child -> {
                final var node = new TexNode(child);
                return Stream.concat(Stream.of(node), node.descendants());
            });
    }

    /**
     * Returns the text of every text leaf at or below this node, in document order, comments excluded.
     */
    public List<String> text() {
        return textLeaves().map(TexText::text).collect(Collectors.toList());
    }

    /**
     * Returns every match of the regular expression inside the text leaves at or below this node.
     * <p>
     * Matches do not span text leaves.
     */
    public List<TextMatch> searchRegex(final Pattern pattern) {
        final var matches = new ArrayList<TextMatch>();
        textLeaves().forEach(text -> {
            final var matcher = pattern.matcher(text.text());
            while (matcher.find()) {
                matches.add(new TextMatch(matcher.group(), text.position() + matcher.start()));
            }
        });
        return matches;
    }

    public List<TextMatch> searchRegex(final String regex) {
        return searchRegex(Pattern.compile(regex));
    }

    /**
     * Returns the first expression below this node with the given name, or {@code null}.
     *
     * @see #findAll(String, Map)
     */
    public @Nullable TexNode find(final @Nullable String name) {
        return find(name, Map.of());
    }

    public @Nullable TexNode find(final @Nullable String name, final Map<String, String> attributes) {
        return findAll(name, attributes).findFirst().orElse(null);
    }

    public Stream<TexNode> findAll(final @Nullable String name) {
        return findAll(name, Map.of());
    }

    /**
     * Returns the expressions below this node matching the name and every attribute, in pre-order.
     * <p>
     * A {@code null} name matches any expression. A name starting with an escape is matched against the beginning of
     * the node's source instead, so {@code \ref{intro}} finds that exact reference and {@code \ref} does not find
     * {@code \refs}. Attribute keys are those of {@link #attribute(String)}.
     */
    public Stream<TexNode> findAll(final @Nullable String name, final Map<String, String> attributes) {
        return descendants().filter(node -> node.matches(name, attributes));
    }

    public long count(final @Nullable String name) {
        return findAll(name).count();
    }

    public long count(final @Nullable String name, final Map<String, String> attributes) {
        return findAll(name, attributes).count();
    }

    /**
     * Returns an attribute used by searches, or {@code null} if this node does not have it.
     * <p>
     * Keys: {@code name}, {@code string}, {@code source}, {@code begin}, {@code end} (environments only), and
     * {@code args} (the source of the argument list).
     */
    public @Nullable String attribute(final String key) {
        return switch (key) {
            case "name" -> name();
            case "string" -> string();
            case "source" -> element.toSource();
            case "begin" -> (element instanceof final TexEnvironment environment) ? environment.begin() : null;
            case "end" -> (element instanceof final TexEnvironment environment) ? environment.end() : null;
            case "args" -> (element instanceof final TexExpression expression)
                ? expression.arguments().all().stream().map(TexElement::toSource).collect(Collectors.joining())
                : null;
            default -> null;
        };
    }

    /**
     * Appends children to the own contents.
     *
     * @see #insert(int, Object...)
     */
    public void append(final Object... children) {
        insert(requireContainer().contents().size(), children);
    }

    /**
     * Inserts children into the own contents, starting at the given index.
     * <p>
     * Children may be nodes, elements, or source strings, which are parsed. A child that is already attached
     * somewhere is copied, and a document root contributes copies of its contents. Signals a
     * {@link CapabilityViolationCondition} unless this node is an environment, a group, or an item.
     */
    public void insert(final int index, final Object... children) {
        final var container = requireContainer();
        var at = index;
        for (final var newElement : toElements(children)) {
            container.insertContent(at, newElement);
            at += 1;
        }
    }

    /**
     * Removes this node from wherever its parent stores it.
     * <p>
     * Signals a {@link DetachedElementCondition} if there is no parent.
     */
    public void delete() {
        final var parent = requireParent();
        if (!parent.removeChild(element)) {
            throw new UnreachableCodeReachedError("Element not found in its own parent");
        }
    }

    /**
     * Replaces this node in its parent with the given nodes, elements or source strings, in order.
     * <p>
     * An argument group can only be replaced by groups; strings are then parsed with
     * {@link Fragments#parseArgument(String)}. Signals a {@link DetachedElementCondition} if there is no parent.
     */
    public void replaceWith(final Object... replacements) {
        final var parent = requireParent();
        if (element instanceof final TexGroup group && group.isArgument()) {
            replaceArgument(parent.arguments(), group, replacements);
            return;
        }
        final var index = parent.indexOfContent(element);
        if (index < 0) {
            throw ConditionContext.error(new CapabilityViolationCondition(element,
                "be replaced, argument separators can only be deleted"));
        }
        final var newElements = toElements(replacements);
        parent.removeContent(index);
        var at = index;
        for (final var newElement : newElements) {
            parent.insertContent(at, newElement);
            at += 1;
        }
    }

    private static void replaceArgument(final TexArgs arguments, final TexGroup group, final Object[] replacements) {
        final var index = arguments.indexOf(group);
        final var newArguments = new ArrayList<TexGroup>(replacements.length);
        for (final var replacement : replacements) {
            newArguments.add(toArgument(replacement));
        }
        if (newArguments.isEmpty()) {
            arguments.remove(index);
            return;
        }
        arguments.set(index, newArguments.get(0));
        for (int i = 1; i < newArguments.size(); i += 1) {
            arguments.insert(index + i, newArguments.get(i));
        }
    }

    private List<TexElement> childElements() {
        return (element instanceof final TexExpression expression) ? expression.allContents() : List.of();
    }

    private Stream<TexText> textLeaves() {
        final var self = Stream.of(this);
        return Stream.concat(self, descendants())
            .map(TexNode::element)
            .filter(candidate -> candidate instanceof final TexText text && !text.isComment())
            .map(TexText.class::cast);
    }

    private boolean matches(final @Nullable String name, final Map<String, String> attributes) {
        if (!(element instanceof TexExpression)) {
            return false;
        }
        if (name != null && !matchesName(name)) {
            return false;
        }
        for (final var entry : attributes.entrySet()) {
            if (!entry.getValue().equals(attribute(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    private boolean matchesName(final String name) {
        if (!name.startsWith("\\")) {
            return name.equals(name());
        }
        final var source = element.toSource();
        if (!source.startsWith(name)) {
            return false;
        }
        // "\ref" must not match "\refs{...}".
        return source.length() == name.length()
            || !Character.isLetter(name.charAt(name.length() - 1))
            || !Character.isLetter(source.charAt(name.length()));
    }

    private TexExpression requireExpression(final String capability) {
        if (element instanceof final TexExpression expression) {
            return expression;
        }
        throw ConditionContext.error(new CapabilityViolationCondition(element, capability));
    }

    private TexExpression requireContainer() {
        final var expression = requireExpression("hold contents");
        if (!expression.acceptsContent()) {
            throw ConditionContext.error(new CapabilityViolationCondition(expression, "hold contents"));
        }
        return expression;
    }

    private TexExpression requireParent() {
        final var parent = element.parent();
        if (parent == null) {
            throw ConditionContext.error(new DetachedElementCondition(element));
        }
        return parent;
    }

    private static @Nullable TexGroup firstBraceArgument(final TexExpression expression) {
        if (!(expression instanceof TexCommand)) {
            return null;
        }
        for (final var argument : expression.arguments()) {
            if (!(argument instanceof BracketGroup)) {
                return argument;
            }
        }
        return null;
    }

    private static boolean isOpaque(final TexExpression expression) {
        return expression instanceof TexMathEnvironment
            || (expression instanceof final TexNamedEnvironment environment && environment.isOpaque());
    }

    /**
     * Converts all children before any of them is attached, so a child that fails to parse leaves the tree as it was.
     */
    private static List<TexElement> toElements(final Object[] children) {
        final var result = new ArrayList<TexElement>();
        for (final var child : children) {
            result.addAll(toElements(child));
        }
        return result;
    }

    private static List<TexElement> toElements(final Object child) {
        if (child instanceof final TexNode node) {
            return toElements(node.element);
        }
        if (child instanceof final TexRoot root) {
            return root.contents().stream().map(TexElement::copy).collect(Collectors.toList());
        }
        if (child instanceof final TexElement childElement) {
            return List.of((childElement.parent() == null) ? childElement : childElement.copy());
        }
        if (child instanceof final CharSequence source) {
            return Fragments.parseElements(source.toString());
        }
        throw new IllegalArgumentException("Cannot convert " + child.getClass().getName() + " to LaTeX elements");
    }

    private static TexGroup toArgument(final Object replacement) {
        if (replacement instanceof final TexNode node) {
            return toArgument(node.element);
        }
        if (replacement instanceof final TexGroup group) {
            return (group.parent() == null) ? group : group.copy();
        }
        if (replacement instanceof final TexElement other) {
            throw ConditionContext.error(new MalformedArgumentCondition(other.toSource()));
        }
        if (replacement instanceof final CharSequence source) {
            return Fragments.parseArgument(source.toString());
        }
        throw new IllegalArgumentException("Cannot convert " + replacement.getClass().getName() + " to an argument");
    }

    private static List<TexNode> wrap(final Stream<TexElement> elements) {
        return elements.map(TexNode::new).collect(Collectors.toList());
    }

    @Override
    public boolean equals(final @Nullable Object other) {
        return other instanceof final TexNode node && node.element == element;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(element);
    }

    @Override
    public String toString() {
        return element.toSource();
    }

    private final TexElement element;
}
