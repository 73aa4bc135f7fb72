package com.namingtool.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
