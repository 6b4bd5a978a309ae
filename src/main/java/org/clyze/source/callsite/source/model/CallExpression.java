package org.clyze.source.callsite.source.model;

import java.util.List;
import java.util.Map;

/** The parts of a call node: callee name, positional and keyword arguments. */
public class CallExpression {
    public final SyntaxNode node;
    /** The method name, or the instantiated type for constructor calls. */
    public final String name;
    public final List<SyntaxNode> arguments;
    /** Named arguments (Groovy only), in source order. */
    public final Map<String, SyntaxNode> keywordArguments;

    public CallExpression(SyntaxNode node, String name, List<SyntaxNode> arguments,
                          Map<String, SyntaxNode> keywordArguments) {
        this.node = node;
        this.name = name;
        this.arguments = arguments;
        this.keywordArguments = keywordArguments;
    }

    @Override
    public String toString() {
        return name + "(" + arguments.size() + " args, keywords=" + keywordArguments.keySet() + ")";
    }
}
