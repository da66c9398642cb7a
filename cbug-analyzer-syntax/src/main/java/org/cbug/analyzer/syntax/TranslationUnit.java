package org.cbug.analyzer.syntax;

import org.cbug.analyzer.syntax.statement.VariableDeclaration;

import java.util.*;

/**
 * The syntax view of one C source file: the headers it includes, its global variables, its function
 * definitions in source order, the functions it declares (prototypes and definitions) and every symbol.
 */
public record TranslationUnit(String file,
                              Set<String> includes,
                              List<VariableDeclaration> globals,
                              List<FunctionDefinition> functions,
                              Map<String, CType> declaredFunctions,
                              SymbolTable symbolTable) {

    public TranslationUnit {
        includes = Collections.unmodifiableSet(new LinkedHashSet<>(includes));
        globals = List.copyOf(globals);
        functions = List.copyOf(functions);
        declaredFunctions = Collections.unmodifiableMap(new LinkedHashMap<>(declaredFunctions));
    }

    public Optional<FunctionDefinition> findFunction(String name) {
        return functions.stream().filter(f -> f.name().equals(name)).findFirst();
    }

    public FunctionDefinition function(String name) {
        return findFunction(name).orElseThrow(() -> new NoSuchElementException("No function " + name + " in " + file));
    }

    public boolean declares(String functionName) {
        return declaredFunctions.containsKey(functionName);
    }

    public boolean includes(String header) {
        return includes.contains(header);
    }
}
