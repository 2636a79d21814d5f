package com.ldgv.script.parser;

/** Usage annotation on binders. Carried through the AST, not enforced at run time. */
public enum Multiplicity {
    ONE,
    MANY
}
