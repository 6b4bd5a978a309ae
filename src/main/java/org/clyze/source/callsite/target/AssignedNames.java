package org.clyze.source.callsite.target;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.clyze.source.callsite.source.model.SyntaxNode;

/** The names a binding construct binds, and the construct itself. */
public class AssignedNames {
    public final List<String> names;
    public final SyntaxNode binding;

    public AssignedNames(List<String> names, SyntaxNode binding) {
        this.names = ImmutableList.copyOf(names);
        this.binding = binding;
    }

    @Override
    public String toString() {
        return names + " bound by " + binding;
    }
}
