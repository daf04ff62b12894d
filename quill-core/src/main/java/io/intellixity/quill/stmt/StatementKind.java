package io.intellixity.quill.stmt;

public enum StatementKind { SELECT, INSERT, UPDATE, DELETE }
