package com.cfgwrite.syntax;

/**
 * 词法 token 分类。序列化时仅作为不透明标签原样保留。
 */
public enum TokenType {
    OBRACE,
    CBRACE,
    OBRACK,
    CBRACK,
    OPAREN,
    CPAREN,

    EQUAL,
    COMMA,
    DOT,
    COLON,
    QUESTION,
    ELLIPSIS,
    FAT_ARROW,

    PLUS,
    MINUS,
    STAR,
    SLASH,
    PERCENT,
    BANG,
    AND,
    OR,
    EQUAL_OP,
    NOT_EQUAL,
    LESS_THAN,
    LESS_THAN_EQ,
    GREATER_THAN,
    GREATER_THAN_EQ,

    IDENT,
    NUMBER_LIT,
    QUOTED_LIT,

    COMMENT,
    NEWLINE,
    TABS,

    INVALID,
    EOF
}
