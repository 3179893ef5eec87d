package com.csvstruct.functions;

/**
 * Usage metadata for a registered function.
 *
 * @param name the function name
 * @param className the implementing expression class
 * @param usage a one-line description of the call forms
 * @param arguments argument descriptions
 * @param examples example calls with their results
 * @param since the release the function first appeared in
 * @param group the documentation group
 */
public record ExpressionInfo(
    String name,
    String className,
    String usage,
    String arguments,
    String examples,
    String since,
    String group) {
}
