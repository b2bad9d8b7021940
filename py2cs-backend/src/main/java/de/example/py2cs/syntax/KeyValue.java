package de.example.py2cs.syntax;

public record KeyValue(Exp key, Exp value) {
  public KeyValue {
    Nodes.require(key, "KeyValue", "key");
    Nodes.require(value, "KeyValue", "value");
  }

}
