package com.codeflow.core.model;

/**
 * Classification of a single statement.
 */
public enum StatementKind {
    /** Reads a value from the user ({@code scanf}, {@code input()}, {@code Scanner.nextInt()}) */
    INPUT,

    /** Writes to the console ({@code printf}, {@code print()}, {@code System.out.println}) */
    OUTPUT,

    /** Declares one or more variables */
    DECLARATION,

    /** Assigns to an existing variable */
    ASSIGNMENT,

    /** Leaves the program early */
    RETURN,

    /** Anything else */
    GENERIC
}
