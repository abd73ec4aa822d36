package com.viffx.Slr.Symbols;

public enum SymbolType {
    EPSILON,
    ID,   // any identifier
    NUM,  // a series of digits ex: 1234
    TYPE, // a type name ex: int
    KEY,  // a keyword ex: while
    SYM,  // punctuation ex: ==
    STR,  // a quoted string literal
    EOF,  // End Of File
}
