package org.pragmatica.highlight.rule;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import org.pragmatica.highlight.error.RuleCompilationException;
import org.pragmatica.highlight.error.RuleError;

import java.util.List;

/**
 * Parser for dotted rule paths.
 *
 * <p>A path lists node names from the outermost ancestor to the triggering node, separated by
 * {@code .}. Each segment is {@code name} or {@code field:name}, optionally followed by {@code +}
 * to make the descriptor repeatable:
 * <pre>
 * class_definition.block.expression_statement.string
 * function_definition.name:identifier
 * call.attribute+.identifier
 * </pre>
 * The punctuation nodes {@code :} and {@code +} are written as themselves, so {@code type_parameter.:}
 * and {@code binary_operator.+} are valid paths. A node named {@code .} cannot be expressed.
 */
public final class RulePath {
    private static final Splitter SEGMENTS = Splitter.on('.');

    private RulePath() {}

    /**
     * Parse a path into descriptors, outermost first.
     *
     * @throws RuleCompilationException with {@link RuleError.MalformedPath} if the path is malformed
     */
    public static List<NodeDescriptor> parse(String path) {
        if (path.isEmpty()) {
            throw malformed(path, "path is empty");
        }
        var descriptors = ImmutableList.<NodeDescriptor>builder();
        for (var segment : SEGMENTS.split(path)) {
            descriptors.add(parseSegment(path, segment));
        }
        return descriptors.build();
    }

    private static NodeDescriptor parseSegment(String path, String segment) {
        if (segment.isEmpty()) {
            throw malformed(path, "empty segment");
        }
        var repeatable = segment.length() > 1 && segment.endsWith("+");
        var body = repeatable ? segment.substring(0, segment.length() - 1) : segment;

        var colon = body.indexOf(':');
        if (colon < 0 || body.equals(":")) {
            return descriptor(body, repeatable);
        }
        var field = body.substring(0, colon);
        var name = body.substring(colon + 1);
        if (field.isEmpty()) {
            throw malformed(path, "empty field in '" + segment + "'");
        }
        if (name.isEmpty()) {
            throw malformed(path, "empty node name in '" + segment + "'");
        }
        if (name.indexOf(':') >= 0 && !name.equals(":")) {
            throw malformed(path, "more than one ':' in '" + segment + "'");
        }
        var descriptor = NodeDescriptor.of(field, name);
        return repeatable ? descriptor.repeated() : descriptor;
    }

    private static NodeDescriptor descriptor(String name, boolean repeatable) {
        var descriptor = NodeDescriptor.of(name);
        return repeatable ? descriptor.repeated() : descriptor;
    }

    private static RuleCompilationException malformed(String path, String reason) {
        return new RuleCompilationException(new RuleError.MalformedPath(path, reason));
    }
}
