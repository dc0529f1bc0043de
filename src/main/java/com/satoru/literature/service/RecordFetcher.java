package com.satoru.literature.service;

import com.satoru.literature.model.ContinuationTokenPair;
import com.satoru.literature.model.FetchResult;

import java.time.Duration;
import java.util.List;

public interface RecordFetcher {
    FetchResult fetch(ContinuationTokenPair tokens, int pageSize, int offset);
    FetchResult fetch(ContinuationTokenPair tokens, int pageSize, int offset, int knownTotal);
    FetchResult fetch(ContinuationTokenPair tokens, int pageSize, int offset, int knownTotal, Duration deadline);
    FetchResult fetchByIds(List<String> ids);
    FetchResult fetchByIds(List<String> ids, Duration deadline);
}
