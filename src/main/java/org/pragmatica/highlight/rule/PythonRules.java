package org.pragmatica.highlight.rule;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

/**
 * Built-in rules for the tree-sitter Python grammar.
 *
 * <p>Class, function and method names are keyed on the {@code name} field. A field-qualified entry
 * for a node shadows the plain entry for the same node name, so names that appear under a field
 * must be qualified in every chain that should reach them.
 */
public final class PythonRules {
    private static final String CLASS_DEF = "class_definition";
    private static final String CLASS_BLOCK = CLASS_DEF + ".block";
    private static final String FUNC_DEF = "function_definition";
    private static final String PARAMS = FUNC_DEF + ".parameters";
    private static final String TYPED_PARAM = PARAMS + ".typed_parameter";
    private static final String IMPORT_FROM = "import_from_statement";
    private static final String STRING_STATEMENT = "expression_statement.string";

    private static final Map<String, String> TABLE = ImmutableMap.<String, String>builder()
        // Simple elements
        .put("and", "Keyword")
        .put("as", "Keyword")
        .put("assert", "Keyword")
        .put("async", "Keyword")
        .put("attribute", "Attribute")
        .put("await", "Keyword")
        .put("break", "Keyword")
        .put("class", "Keyword")
        .put("comment", "Comment")
        .put("continue", "Keyword")
        .put("decorator", "Decorator")
        .put("def", "Keyword")
        .put("del", "Keyword")
        .put("elif", "Keyword")
        .put("else", "Keyword")
        .put("ERROR", "Error")
        .put("except", "Keyword")
        .put("false", "Boolean")
        .put("finally", "Keyword")
        .put("float", "Float")
        .put("for", "Keyword")
        .put("from", "Keyword")
        .put("global", "Keyword")
        .put("identifier", "Identifier")
        .put("if", "Keyword")
        .put("import", "Keyword")
        .put("in", "Keyword")
        .put("integer", "Number")
        .put("interpolation", "Interpolation")
        .put("is", "Keyword")
        .put("lambda", "Keyword")
        .put("None", "Keyword")
        .put("none", "None")
        .put("nonlocal", "Keyword")
        .put("not", "Keyword")
        .put("operator", "Operator")
        .put("operators", "Operator")
        .put("or", "Keyword")
        .put("pass", "Keyword")
        .put("raise", "Keyword")
        .put("return", "Return")
        .put("string", "String")
        .put("true", "Boolean")
        .put("try", "Keyword")
        .put("while", "Keyword")
        .put("with", "Keyword")
        .put("yield", "Keyword")

        // Docstrings for modules, classes and functions
        .put("module." + STRING_STATEMENT, "DocString")
        .put(FUNC_DEF + ".block." + STRING_STATEMENT, "DocString")
        .put(CLASS_BLOCK + "." + STRING_STATEMENT, "DocString")

        // Classes
        .put(CLASS_DEF + ".class", "Class")
        .put(CLASS_DEF + ".name:identifier", "ClassName")

        // Imports
        .put("import_statement.import", "Import")
        .put("import_statement.dotted_name", "ImportedName")
        .put(IMPORT_FROM + ".import", "Import")
        .put(IMPORT_FROM + ".from", "Import")
        .put(IMPORT_FROM + ".dotted_name", "ImportedName")
        .put(IMPORT_FROM + ".aliased_import.as", "Import")
        .put(IMPORT_FROM + ".aliased_import.dotted_name", "ImportedName")
        .put(IMPORT_FROM + ".aliased_import.identifier", "ImportedAliasedName")

        // Functions and methods
        .put(FUNC_DEF + ".def", "Function")
        .put(FUNC_DEF + ".name:identifier", "FunctionName")
        .put(FUNC_DEF + ".identifier", "Identifier")
        .put(PARAMS + ".identifier", "Parameter")
        .put(TYPED_PARAM + ".identifier", "Parameter")
        .put(CLASS_BLOCK + "." + FUNC_DEF + ".def", "Method")
        .put(CLASS_BLOCK + "." + FUNC_DEF + ".name:identifier", "MethodName")

        // Calls
        .put("call.identifier", "CalledFunction")
        .put("call.attribute+.identifier", "CalledMethod")
        .put("argument_list.identifier", "Argument")

        // Type annotations
        .put("type_parameter.[", "TypeBracket")
        .put("type_parameter.]", "TypeBracket")
        .put("type.identifier", "Type")
        .build();

    private static final List<Rule> RULES = TABLE.entrySet()
                                                 .stream()
                                                 .map(entry -> Rule.parse(entry.getKey(), entry.getValue()))
                                                 .collect(ImmutableList.toImmutableList());

    private PythonRules() {}

    public static List<Rule> rules() {
        return RULES;
    }
}
