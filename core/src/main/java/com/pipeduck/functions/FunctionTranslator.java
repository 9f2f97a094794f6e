package com.pipeduck.functions;

/**
 * Renders a function call whose host engine form is not a plain renamed call.
 */
@FunctionalInterface
public interface FunctionTranslator {

    /**
     * @param args the rendered SQL of each argument
     * @return the rendered call
     */
    String translate(String... args);
}
