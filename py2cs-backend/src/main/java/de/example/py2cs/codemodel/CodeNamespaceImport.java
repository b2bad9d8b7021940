package de.example.py2cs.codemodel;

/** A using directive; {@code alias} is null unless it is an alias directive. */
public record CodeNamespaceImport(String alias, String namespace) {
}
