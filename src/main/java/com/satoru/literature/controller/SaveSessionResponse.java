package com.satoru.literature.controller;

import java.util.UUID;

public record SaveSessionResponse(UUID id) {}
