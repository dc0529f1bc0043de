package com.satoru.literature.service;

import com.satoru.literature.model.SubmitResult;

import java.time.Duration;

public interface QuerySubmitter {
    SubmitResult submit(String query, int pageSize, int offset, String sort);
    SubmitResult submit(String query, int pageSize, int offset, String sort, Duration deadline);
}
