package de.example.py2cs.translate;

import de.example.py2cs.syntax.Decorated;
import de.example.py2cs.syntax.Decorator;

/** Getter and optional setter of one synthesized property. */
public final class PropertyDefinition {
  private final String name;
  private Decorated getter;
  private Decorator getterDecoration;
  private Decorated setter;
  private Decorator setterDecoration;
  private boolean translated;

  public PropertyDefinition(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public Decorated getGetter() {
    return getter;
  }

  public Decorator getGetterDecoration() {
    return getterDecoration;
  }

  void setGetter(Decorated getter, Decorator decoration) {
    this.getter = getter;
    this.getterDecoration = decoration;
  }

  public Decorated getSetter() {
    return setter;
  }

  public Decorator getSetterDecoration() {
    return setterDecoration;
  }

  void setSetter(Decorated setter, Decorator decoration) {
    this.setter = setter;
    this.setterDecoration = decoration;
  }

  public boolean isTranslated() {
    return translated;
  }

  void markTranslated() {
    translated = true;
  }
}
