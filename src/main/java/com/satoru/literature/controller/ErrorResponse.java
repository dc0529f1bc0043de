package com.satoru.literature.controller;

public record ErrorResponse(String message, int status, long timestamp) {}
