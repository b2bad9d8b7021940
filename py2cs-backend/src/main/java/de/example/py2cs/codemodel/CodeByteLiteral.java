package de.example.py2cs.codemodel;

/** Python bytes source text as written between the quotes, escapes included. */
public record CodeByteLiteral(String text) {
}
