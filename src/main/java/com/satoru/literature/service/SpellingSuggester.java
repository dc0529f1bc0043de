package com.satoru.literature.service;

import java.util.List;

public interface SpellingSuggester {
    List<String> suggest(String query);
}
