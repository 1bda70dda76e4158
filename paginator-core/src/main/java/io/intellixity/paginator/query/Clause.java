package io.intellixity.paginator.query;

public enum Clause { AND, OR }
