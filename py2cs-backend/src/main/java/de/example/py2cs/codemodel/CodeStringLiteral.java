package de.example.py2cs.codemodel;

/**
 * Python string source text as written between the quotes, escapes included.
 * {@code raw} marks an r-prefixed literal, {@code longForm} a triple-quoted one.
 */
public record CodeStringLiteral(String text, boolean raw, boolean longForm) {
}
