package com.satoru.literature.controller;

import java.util.List;

public record SpellingResponse(String query, List<String> suggestions) {}
