package de.example.py2cs.codemodel;

/** A custom attribute argument; {@code name} is null for a positional one. */
public record CodeAttributeArgument(String name, CodeExpression value) {
}
