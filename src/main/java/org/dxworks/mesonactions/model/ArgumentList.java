package org.dxworks.mesonactions.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Arguments of a function or method call. Positional arguments are plain expressions, keyword
 * arguments are {@link KeywordItem}s. The location covers the arguments only, not the parentheses;
 * an empty list has an empty location right after the opening parenthesis.
 */
public class ArgumentList extends Node {
    private final List<Node> args;

    public ArgumentList(Location location, List<Node> args) {
        super(location);
        this.args = adoptAll(args);
    }

    public List<Node> getArgs() {
        return args;
    }

    public List<Node> getPositionalArgs() {
        List<Node> positional = new ArrayList<>();
        for (Node arg : args) {
            if (!(arg instanceof KeywordItem)) {
                positional.add(arg);
            }
        }
        return positional;
    }

    public List<KeywordItem> getKeywordArgs() {
        List<KeywordItem> keywords = new ArrayList<>();
        for (Node arg : args) {
            if (arg instanceof KeywordItem keywordItem) {
                keywords.add(keywordItem);
            }
        }
        return keywords;
    }

    public Optional<Node> getKwarg(String name) {
        for (KeywordItem keywordItem : getKeywordArgs()) {
            if (keywordItem.getName().equals(name)) {
                return Optional.of(keywordItem.getValue());
            }
        }
        return Optional.empty();
    }

    @Override
    public void accept(CodeVisitor visitor) {
        visitor.visitArgumentList(this);
    }

    @Override
    public void visitChildren(CodeVisitor visitor) {
        visitAll(args, visitor);
    }
}
