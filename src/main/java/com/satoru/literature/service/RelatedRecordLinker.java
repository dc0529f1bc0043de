package com.satoru.literature.service;

import com.satoru.literature.model.FetchResult;

import java.time.Duration;

public interface RelatedRecordLinker {
    FetchResult related(String pmid, int maxResults);
    FetchResult related(String pmid, int maxResults, Duration deadline);
}
