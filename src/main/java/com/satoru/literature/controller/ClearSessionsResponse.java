package com.satoru.literature.controller;

public record ClearSessionsResponse(int deleted) {}
