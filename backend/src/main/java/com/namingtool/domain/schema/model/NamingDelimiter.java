package com.namingtool.domain.schema.model;

public record NamingDelimiter(String name, char delimiter, boolean enabled, int sortOrder) {}
